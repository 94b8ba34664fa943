package com.mccmaze.maze.structure;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The unscaled width x height matrix of grid cells that room subdivision
 * mutates in place.
 *
 * Boundaries are addressed from either side: a query for the NORTH boundary
 * of (x, y) resolves to the south flag of (x, y - 1), and WEST resolves to
 * the east flag of (x - 1, y).
 */
public class MazeGrid {

    private final int width;
    private final int height;
    private final GridCell[][] cells;

    /**
     * Create an empty grid with no walls.
     *
     * @param width Number of columns
     * @param height Number of rows
     */
    public MazeGrid(int width, int height) {
        if (width < 1 || height < 1) {
            throw new MazeGenerationException(
                    String.format("Maze grid dimensions must be positive: %dx%d", width, height));
        }
        this.width = width;
        this.height = height;
        this.cells = new GridCell[height][width];

        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                cells[row][col] = new GridCell(col, row);
            }
        }
    }

    private MazeGrid(MazeGrid copyFrom) {
        this.width = copyFrom.width;
        this.height = copyFrom.height;
        this.cells = new GridCell[height][width];

        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                cells[row][col] = new GridCell(copyFrom.cells[row][col]);
            }
        }
    }

    /**
     * Deep copy of the grid.
     */
    public MazeGrid copy() {
        return new MazeGrid(this);
    }

    /**
     * Rebuild a flag grid from internal (non-border) wall segments in scaled
     * coordinates.
     *
     * @param width Unscaled grid width
     * @param height Unscaled grid height
     * @param scaleMultiplier Scale the walls were produced with
     * @param internalWalls Merged wall segments, excluding the border
     * @return A grid whose south/east flags reproduce the given walls
     */
    public static MazeGrid fromWalls(int width, int height, int scaleMultiplier, List<MazeWall> internalWalls) {
        MazeGrid grid = new MazeGrid(width, height);

        for (MazeWall wall : internalWalls) {
            int startX = Math.min(wall.getStart().getX(), wall.getEnd().getX());
            int endX = Math.max(wall.getStart().getX(), wall.getEnd().getX());
            int startY = Math.min(wall.getStart().getY(), wall.getEnd().getY());
            int endY = Math.max(wall.getStart().getY(), wall.getEnd().getY());

            if (wall.isHorizontal()) {
                int row = startY / scaleMultiplier - 1;
                for (int col = startX / scaleMultiplier; col < endX / scaleMultiplier; col++) {
                    grid.requireCell(col, row, wall).setSouthWall(true);
                }
            } else {
                int col = startX / scaleMultiplier - 1;
                for (int row = startY / scaleMultiplier; row < endY / scaleMultiplier; row++) {
                    grid.requireCell(col, row, wall).setEastWall(true);
                }
            }
        }

        return grid;
    }

    private GridCell requireCell(int x, int y, MazeWall wall) {
        if (!contains(x, y)) {
            throw new MazeGenerationException(wall + " lies outside the " + width + "x" + height + " grid");
        }
        return cells[y][x];
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public boolean contains(GridPoint point) {
        return contains(point.getX(), point.getY());
    }

    public GridCell getCell(int x, int y) {
        if (!contains(x, y)) {
            throw new MazeGenerationException(
                    String.format("Cell (%d,%d) is outside the %dx%d grid", x, y, width, height));
        }
        return cells[y][x];
    }

    public GridCell getCell(GridPoint point) {
        return getCell(point.getX(), point.getY());
    }

    /**
     * Whether a navigator standing on (x, y) can step in the given direction.
     */
    public boolean isOpen(int x, int y, PathDirection direction) {
        switch (direction) {
            case NORTH:
                return y > 0 && !cells[y - 1][x].hasSouthWall();
            case SOUTH:
                return y < height - 1 && !cells[y][x].hasSouthWall();
            case WEST:
                return x > 0 && !cells[y][x - 1].hasEastWall();
            default:
                return x < width - 1 && !cells[y][x].hasEastWall();
        }
    }

    public boolean isOpen(GridPoint point, PathDirection direction) {
        return isOpen(point.getX(), point.getY(), direction);
    }

    /**
     * All directions that can be stepped in from the given cell, in cardinal
     * enumeration order.
     */
    public Set<PathDirection> openDirections(GridPoint point) {
        Set<PathDirection> open = EnumSet.noneOf(PathDirection.class);
        for (PathDirection direction : PathDirection.values()) {
            if (isOpen(point, direction)) {
                open.add(direction);
            }
        }
        return open;
    }

    /**
     * Whether the boundary on the given side of (x, y) lies inside the grid
     * rather than on the maze border.
     */
    public boolean hasNeighbor(int x, int y, PathDirection direction) {
        return contains(x + direction.getDeltaX(), y + direction.getDeltaY());
    }

    /**
     * Claim the boundary on the given side of (x, y) unless a room already
     * claimed it.
     *
     * @return true if the boundary was written
     */
    public boolean claimBoundary(int x, int y, PathDirection direction, boolean wall) {
        GridCell owner = boundaryOwner(x, y, direction);
        return direction.isVertical() ? owner.claimSouthBoundary(wall) : owner.claimEastBoundary(wall);
    }

    /**
     * Open the boundary on the given side of (x, y), overriding any earlier
     * claim. Used for room entry openings.
     */
    public void openBoundary(int x, int y, PathDirection direction) {
        GridCell owner = boundaryOwner(x, y, direction);
        if (direction.isVertical()) {
            owner.setSouthWall(false);
            owner.claimSouthBoundary(false);
        } else {
            owner.setEastWall(false);
            owner.claimEastBoundary(false);
        }
    }

    public boolean isBoundaryProcessed(int x, int y, PathDirection direction) {
        GridCell owner = boundaryOwner(x, y, direction);
        return direction.isVertical() ? owner.isHorizontalBoundaryProcessed() : owner.isVerticalBoundaryProcessed();
    }

    private GridCell boundaryOwner(int x, int y, PathDirection direction) {
        if (!hasNeighbor(x, y, direction)) {
            throw new MazeGenerationException(String.format(
                    "The %s boundary of (%d,%d) is part of the maze border", direction, x, y));
        }
        switch (direction) {
            case NORTH: return cells[y - 1][x];
            case WEST: return cells[y][x - 1];
            default: return cells[y][x];
        }
    }

    /**
     * Lay an externally supplied solution path onto the grid.
     *
     * The path must be a simple orthogonal walk from the top-left cell to the
     * bottom-right cell. Consecutive path cells are joined by open, claimed
     * boundaries; adjacent path cells that are not consecutive are walled off
     * so that the path has no shortcuts. Cells where the path turns, and both
     * ends, are marked as waypoints.
     *
     * @param path Ordered cells of the solution path
     */
    public void layPath(List<GridPoint> path) {
        validatePath(path);

        int[][] pathIndex = new int[height][width];
        for (int[] row : pathIndex) {
            Arrays.fill(row, -1);
        }
        for (int i = 0; i < path.size(); i++) {
            pathIndex[path.get(i).getY()][path.get(i).getX()] = i;
        }

        for (int i = 0; i < path.size(); i++) {
            GridPoint point = path.get(i);
            GridCell cell = getCell(point);

            PathDirection outgoing = i < path.size() - 1 ? PathDirection.between(point, path.get(i + 1)) : null;
            PathDirection incoming = i > 0 ? PathDirection.between(path.get(i - 1), point) : null;

            if (outgoing != null) {
                cell.setPathOrientation(PathOrientation.of(outgoing));
                claimBoundary(point.getX(), point.getY(), outgoing, false);
            } else if (incoming != null) {
                cell.setPathOrientation(PathOrientation.of(incoming));
            } else {
                // Single-cell maze
                cell.setPathOrientation(PathOrientation.HORIZONTAL);
            }

            cell.setWayPoint(incoming == null || outgoing == null || incoming != outgoing);

            for (PathDirection direction : PathDirection.values()) {
                if (!hasNeighbor(point.getX(), point.getY(), direction)) {
                    continue;
                }
                GridPoint neighbor = point.step(direction);
                int neighborIndex = pathIndex[neighbor.getY()][neighbor.getX()];
                if (neighborIndex >= 0 && Math.abs(neighborIndex - i) > 1) {
                    claimBoundary(point.getX(), point.getY(), direction, true);
                }
            }
        }
    }

    private void validatePath(List<GridPoint> path) {
        if (path == null || path.isEmpty()) {
            throw new MazeGenerationException("Solution path is empty");
        }
        if (!path.get(0).equals(new GridPoint(0, 0))) {
            throw new MazeGenerationException("Solution path must start at (0,0) but starts at " + path.get(0));
        }
        GridPoint target = new GridPoint(width - 1, height - 1);
        if (!path.get(path.size() - 1).equals(target)) {
            throw new MazeGenerationException("Solution path must end at " + target
                    + " but ends at " + path.get(path.size() - 1));
        }

        boolean[][] seen = new boolean[height][width];
        GridPoint previous = null;
        for (GridPoint point : path) {
            if (!contains(point)) {
                throw new MazeGenerationException("Solution path cell " + point + " is outside the grid");
            }
            if (seen[point.getY()][point.getX()]) {
                throw new MazeGenerationException("Solution path revisits " + point);
            }
            if (previous != null && !previous.isAdjacentTo(point)) {
                throw new MazeGenerationException("Solution path jumps from " + previous + " to " + point);
            }
            seen[point.getY()][point.getX()] = true;
            previous = point;
        }
    }

    /**
     * Reset path orientation and juncture markers on every cell.
     */
    public void clearPathAnnotations() {
        for (GridCell[] row : cells) {
            for (GridCell cell : row) {
                cell.clearPathAnnotations();
            }
        }
    }

    /**
     * Cells currently marked as lying on the solution path.
     */
    public List<GridPoint> getPathCells() {
        List<GridPoint> pathCells = new ArrayList<>();
        for (GridCell[] row : cells) {
            for (GridCell cell : row) {
                if (cell.isOnPath()) {
                    pathCells.add(cell.getLocation());
                }
            }
        }
        return pathCells;
    }

    /**
     * Total number of south and east wall flags on the grid.
     */
    public int countWallFlags() {
        int count = 0;
        for (GridCell[] row : cells) {
            for (GridCell cell : row) {
                if (cell.hasSouthWall()) count++;
                if (cell.hasEastWall()) count++;
            }
        }
        return count;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    public int getCellCount() {
        return width * height;
    }

    /**
     * Row-major index of a cell, used by the search arrays.
     */
    public int indexOf(int x, int y) {
        return y * width + x;
    }

    public GridPoint pointAt(int index) {
        return new GridPoint(index % width, index / width);
    }
}
