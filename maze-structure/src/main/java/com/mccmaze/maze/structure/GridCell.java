package com.mccmaze.maze.structure;

/**
 * A single cell of the unscaled maze grid.
 *
 * A cell owns only its south and east boundaries; the north and west
 * boundaries are the south/east walls of the neighboring cells. Once a room
 * claims a boundary its processed flag is set and later claims leave it alone.
 * Path orientation, juncture and waypoint markers are written only by path
 * passes, never by room subdivision.
 */
public class GridCell {

    private final int x;
    private final int y;

    private boolean southWall;
    private boolean eastWall;

    private boolean horizontalBoundaryProcessed;
    private boolean verticalBoundaryProcessed;

    private PathOrientation pathOrientation = PathOrientation.NONE;
    private boolean juncture;
    private boolean wayPoint;

    public GridCell(int x, int y) {
        this.x = x;
        this.y = y;
    }

    /**
     * Copy constructor; duplicates walls, claims and path markers.
     */
    public GridCell(GridCell copyFrom) {
        this(copyFrom.x, copyFrom.y);
        this.southWall = copyFrom.southWall;
        this.eastWall = copyFrom.eastWall;
        this.horizontalBoundaryProcessed = copyFrom.horizontalBoundaryProcessed;
        this.verticalBoundaryProcessed = copyFrom.verticalBoundaryProcessed;
        this.pathOrientation = copyFrom.pathOrientation;
        this.juncture = copyFrom.juncture;
        this.wayPoint = copyFrom.wayPoint;
    }

    /**
     * Set the south boundary unless it has already been claimed.
     *
     * @return true if the boundary was written
     */
    public boolean claimSouthBoundary(boolean wall) {
        if (horizontalBoundaryProcessed) {
            return false;
        }
        southWall = wall;
        horizontalBoundaryProcessed = true;
        return true;
    }

    /**
     * Set the east boundary unless it has already been claimed.
     *
     * @return true if the boundary was written
     */
    public boolean claimEastBoundary(boolean wall) {
        if (verticalBoundaryProcessed) {
            return false;
        }
        eastWall = wall;
        verticalBoundaryProcessed = true;
        return true;
    }

    /**
     * Clear path orientation and the juncture marker. Walls are untouched.
     */
    public void clearPathAnnotations() {
        pathOrientation = PathOrientation.NONE;
        juncture = false;
    }

    public boolean isOnPath() {
        return pathOrientation != PathOrientation.NONE;
    }

    public GridPoint getLocation() {
        return new GridPoint(x, y);
    }

    // Getters and setters
    public int getX() { return x; }
    public int getY() { return y; }

    public boolean hasSouthWall() { return southWall; }
    public void setSouthWall(boolean southWall) { this.southWall = southWall; }

    public boolean hasEastWall() { return eastWall; }
    public void setEastWall(boolean eastWall) { this.eastWall = eastWall; }

    public boolean isHorizontalBoundaryProcessed() { return horizontalBoundaryProcessed; }
    public boolean isVerticalBoundaryProcessed() { return verticalBoundaryProcessed; }

    public PathOrientation getPathOrientation() { return pathOrientation; }
    public void setPathOrientation(PathOrientation pathOrientation) { this.pathOrientation = pathOrientation; }

    public boolean isJuncture() { return juncture; }
    public void setJuncture(boolean juncture) { this.juncture = juncture; }

    public boolean isWayPoint() { return wayPoint; }
    public void setWayPoint(boolean wayPoint) { this.wayPoint = wayPoint; }

    @Override
    public String toString() {
        return String.format("GridCell[(%d,%d), south=%b, east=%b, path=%s]",
                x, y, southWall, eastWall, pathOrientation);
    }
}
