package com.mccmaze.maze.structure;

/**
 * The single perimeter boundary cleared to let a navigator into an enclosed
 * room. {@code distanceToPath} is the number of perpendicular steps from the
 * room edge to the nearest solution path cell, or {@link Integer#MAX_VALUE}
 * if none lies in that direction.
 */
public final class RoomOpening {

    private final GridPoint cell;
    private final PathDirection direction;
    private final int distanceToPath;

    public RoomOpening(GridPoint cell, PathDirection direction, int distanceToPath) {
        this.cell = cell;
        this.direction = direction;
        this.distanceToPath = distanceToPath;
    }

    public GridPoint getCell() { return cell; }
    public PathDirection getDirection() { return direction; }
    public int getDistanceToPath() { return distanceToPath; }

    /**
     * The cell outside the room that the opening leads into.
     */
    public GridPoint getNeighbor() {
        return cell.step(direction);
    }

    @Override
    public String toString() {
        return "RoomOpening[" + cell + " " + direction + ", distance=" + distanceToPath + "]";
    }
}
