package com.mccmaze.maze.structure;

/**
 * Orientation of the solution path through a grid cell.
 */
public enum PathOrientation {
    NONE,
    HORIZONTAL,
    VERTICAL;

    public static PathOrientation of(PathDirection direction) {
        return direction.isVertical() ? VERTICAL : HORIZONTAL;
    }
}
