package com.mccmaze.maze.structure;

/**
 * Where a room's dividing wall and its single passage go, expressed as
 * offsets from the room origin.
 *
 * For a horizontal wall the wall offset selects the row whose south boundary
 * becomes the wall and the passage offset selects a column; for a vertical
 * wall the roles are swapped.
 */
public final class DivisionPlan {

    private final MazeRoom room;
    private final boolean horizontal;
    private final int wallOffset;
    private final int passageOffset;

    public DivisionPlan(MazeRoom room, boolean horizontal, int wallOffset, int passageOffset) {
        this.room = room;
        this.horizontal = horizontal;
        this.wallOffset = wallOffset;
        this.passageOffset = passageOffset;
    }

    /**
     * The cell on the north/west side of the wall whose boundary is left open.
     */
    public GridPoint getPassageCell() {
        if (horizontal) {
            return new GridPoint(room.getX() + passageOffset, room.getY() + wallOffset);
        }
        return new GridPoint(room.getX() + wallOffset, room.getY() + passageOffset);
    }

    public MazeRoom getRoom() { return room; }
    public boolean isHorizontal() { return horizontal; }
    public int getWallOffset() { return wallOffset; }
    public int getPassageOffset() { return passageOffset; }

    @Override
    public String toString() {
        return String.format("DivisionPlan[%s, %s, wall=%d, passage=%d]",
                room, horizontal ? "horizontal" : "vertical", wallOffset, passageOffset);
    }
}
