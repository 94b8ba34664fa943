package com.mccmaze.maze.structure;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Represents an integer point, either a cell position on the unscaled maze grid
 * or a coordinate in the scaled maze space.
 *
 * Points are immutable and compared by value.
 */
public final class GridPoint {

    @JsonProperty("x")
    private final int x;

    @JsonProperty("y")
    private final int y;

    /**
     * Create a new GridPoint at the specified coordinates.
     *
     * @param x X coordinate of the point
     * @param y Y coordinate of the point
     */
    @JsonCreator
    public GridPoint(@JsonProperty("x") int x, @JsonProperty("y") int y) {
        this.x = x;
        this.y = y;
    }

    /**
     * Manhattan (city block) distance to another point.
     *
     * @param other The point to measure against
     * @return Sum of the absolute coordinate differences
     */
    public int manhattanDistance(GridPoint other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    /**
     * Get the neighboring point one step in the given direction.
     */
    public GridPoint step(PathDirection direction) {
        return new GridPoint(x + direction.getDeltaX(), y + direction.getDeltaY());
    }

    /**
     * Check whether the given point is one orthogonal step away from this one.
     */
    public boolean isAdjacentTo(GridPoint other) {
        return manhattanDistance(other) == 1;
    }

    // Getters
    public int getX() { return x; }
    public int getY() { return y; }

    @Override
    public String toString() {
        return String.format("(%d,%d)", x, y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        GridPoint gridPoint = (GridPoint) o;
        return x == gridPoint.x && y == gridPoint.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }
}
