package com.mccmaze.maze.structure;

/**
 * Cardinal direction of travel between two orthogonally adjacent grid cells.
 *
 * Rows grow southward, so NORTH decreases the y coordinate.
 */
public enum PathDirection {
    NORTH(0, -1),
    EAST(1, 0),
    SOUTH(0, 1),
    WEST(-1, 0);

    private final int deltaX;
    private final int deltaY;

    PathDirection(int deltaX, int deltaY) {
        this.deltaX = deltaX;
        this.deltaY = deltaY;
    }

    public int getDeltaX() { return deltaX; }
    public int getDeltaY() { return deltaY; }

    public PathDirection opposite() {
        switch (this) {
            case NORTH: return SOUTH;
            case SOUTH: return NORTH;
            case EAST: return WEST;
            default: return EAST;
        }
    }

    /**
     * A vertical move crosses a horizontal boundary (a south wall flag).
     */
    public boolean isVertical() {
        return this == NORTH || this == SOUTH;
    }

    public boolean isOrthogonalTo(PathDirection other) {
        return isVertical() != other.isVertical();
    }

    /**
     * Direction of the single step from one cell to an adjacent one.
     *
     * @throws MazeGenerationException if the cells are not orthogonal neighbors
     */
    public static PathDirection between(GridPoint from, GridPoint to) {
        int dx = to.getX() - from.getX();
        int dy = to.getY() - from.getY();
        for (PathDirection direction : values()) {
            if (direction.deltaX == dx && direction.deltaY == dy) {
                return direction;
            }
        }
        throw new MazeGenerationException("Cells " + from + " and " + to + " are not adjacent");
    }
}
