package com.mccmaze.maze.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of bisecting a room: the plan that was applied and the two child
 * rooms. A child is null when one of its dimensions fell below the minimum
 * subdividable size.
 */
public final class RoomDivision {

    private final DivisionPlan plan;
    private final MazeRoom firstChild;
    private final MazeRoom secondChild;

    public RoomDivision(DivisionPlan plan, MazeRoom firstChild, MazeRoom secondChild) {
        this.plan = plan;
        this.firstChild = firstChild;
        this.secondChild = secondChild;
    }

    public DivisionPlan getPlan() { return plan; }

    /**
     * North (horizontal wall) or west (vertical wall) child, or null.
     */
    public MazeRoom getFirstChild() { return firstChild; }

    /**
     * South (horizontal wall) or east (vertical wall) child, or null.
     */
    public MazeRoom getSecondChild() { return secondChild; }

    /**
     * The children that can still be subdivided, first child first.
     */
    public List<MazeRoom> getSubdividableChildren() {
        List<MazeRoom> children = new ArrayList<>(2);
        if (firstChild != null) {
            children.add(firstChild);
        }
        if (secondChild != null) {
            children.add(secondChild);
        }
        return Collections.unmodifiableList(children);
    }
}
