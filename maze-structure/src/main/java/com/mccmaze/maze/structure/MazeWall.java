package com.mccmaze.maze.structure;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An axis-aligned wall segment in scaled maze coordinates.
 */
public final class MazeWall {

    @JsonProperty("start")
    private final GridPoint start;

    @JsonProperty("end")
    private final GridPoint end;

    @JsonCreator
    public MazeWall(@JsonProperty("start") GridPoint start, @JsonProperty("end") GridPoint end) {
        if (start.getX() != end.getX() && start.getY() != end.getY()) {
            throw new MazeGenerationException("Wall from " + start + " to " + end + " is not axis-aligned");
        }
        this.start = start;
        this.end = end;
    }

    public MazeWall(int xStart, int yStart, int xEnd, int yEnd) {
        this(new GridPoint(xStart, yStart), new GridPoint(xEnd, yEnd));
    }

    public GridPoint getStart() { return start; }
    public GridPoint getEnd() { return end; }

    @JsonIgnore
    public boolean isHorizontal() {
        return start.getY() == end.getY();
    }

    @JsonIgnore
    public int getLength() {
        return start.manhattanDistance(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        MazeWall wall = (MazeWall) o;
        return start.equals(wall.start) && end.equals(wall.end);
    }

    @Override
    public int hashCode() {
        return 31 * start.hashCode() + end.hashCode();
    }

    @Override
    public String toString() {
        return "MazeWall[" + start + " -> " + end + "]";
    }
}
