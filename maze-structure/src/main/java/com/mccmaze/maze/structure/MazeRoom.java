package com.mccmaze.maze.structure;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * A rectangular region of the maze grid that can be split in two by a wall
 * carrying exactly one passage.
 *
 * Rooms are plain values; all mutation goes to the {@link MazeGrid} passed in.
 */
public final class MazeRoom {

    public static final int MINIMUM_WIDTH = 2;
    public static final int MINIMUM_HEIGHT = 2;

    /**
     * Upper bound applied to a normalized wall position so a wall can never
     * land on the far edge of its room.
     */
    public static final double MAX_UNSCALED_POSITION = 0.999999;

    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public MazeRoom(int x, int y, int width, int height) {
        if (width < 1 || height < 1) {
            throw new MazeGenerationException(
                    String.format("Room at (%d,%d) has non-positive dimensions %dx%d", x, y, width, height));
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /**
     * Whether both dimensions allow an internal wall.
     */
    public boolean isSubdividable() {
        return width >= MINIMUM_WIDTH && height >= MINIMUM_HEIGHT;
    }

    /**
     * Pick the wall orientation. Elongated rooms are always cut across their
     * longer axis; square rooms use the supplied default.
     *
     * @param defaultHorizontal Orientation bit for square rooms
     * @return true for a horizontal wall
     */
    public boolean determineHorizontal(boolean defaultHorizontal) {
        if (width < height) {
            return true;
        }
        if (height < width) {
            return false;
        }
        return defaultHorizontal;
    }

    /**
     * Compute the wall and passage offsets for a division without touching
     * the grid.
     *
     * @param unscaledWallPosition Normalized wall position in [0, 1]
     * @param unscaledPassagePosition Normalized passage position in [0, 1]
     * @param horizontal Wall orientation
     * @return The resulting plan
     */
    public DivisionPlan planDivision(double unscaledWallPosition, double unscaledPassagePosition, boolean horizontal) {
        if (!isSubdividable()) {
            throw new MazeGenerationException(this + " is below the minimum subdividable size");
        }
        checkPosition("wall", unscaledWallPosition);
        checkPosition("passage", unscaledPassagePosition);

        double wallPosition = Math.min(unscaledWallPosition, MAX_UNSCALED_POSITION);

        int span = horizontal ? height : width;
        int minimum = horizontal ? MINIMUM_HEIGHT : MINIMUM_WIDTH;
        // Truncated, not rounded: rounding would let positions near 1 land on the far edge.
        // The +1 keeps every interior line reachable, so offsets can differ from (span - 2) * pos.
        int wallOffset = (int) ((span - minimum + 1) * wallPosition);
        wallOffset = Math.max(0, Math.min(span - 2, wallOffset));

        int wallLength = horizontal ? width : height;
        int passageOffset = Math.min(wallLength - 1, (int) (wallLength * unscaledPassagePosition));

        return new DivisionPlan(this, horizontal, wallOffset, passageOffset);
    }

    private static void checkPosition(String name, double position) {
        if (Double.isNaN(position) || position < 0.0 || position > 1.0) {
            throw new MazeGenerationException("Unscaled " + name + " position " + position + " is outside [0, 1]");
        }
    }

    /**
     * Bisect the room on the grid.
     *
     * @return The applied plan and the subdividable children
     */
    public RoomDivision divide(MazeGrid grid, double unscaledWallPosition, double unscaledPassagePosition,
                               boolean horizontal) {
        return divide(grid, planDivision(unscaledWallPosition, unscaledPassagePosition, horizontal));
    }

    /**
     * Write the wall described by the plan and split the room along it.
     */
    public RoomDivision divide(MazeGrid grid, DivisionPlan plan) {
        GridPoint passage = plan.getPassageCell();
        int offset = plan.getWallOffset();

        if (plan.isHorizontal()) {
            int row = y + offset;
            for (int col = x; col < x + width; col++) {
                grid.claimBoundary(col, row, PathDirection.SOUTH, col != passage.getX());
            }
            return new RoomDivision(plan,
                    childOrNull(x, y, width, offset + 1),
                    childOrNull(x, y + offset + 1, width, height - offset - 1));
        }

        int col = x + offset;
        for (int row = y; row < y + height; row++) {
            grid.claimBoundary(col, row, PathDirection.EAST, row != passage.getY());
        }
        return new RoomDivision(plan,
                childOrNull(x, y, offset + 1, height),
                childOrNull(x + offset + 1, y, width - offset - 1, height));
    }

    private static MazeRoom childOrNull(int x, int y, int width, int height) {
        if (width < MINIMUM_WIDTH || height < MINIMUM_HEIGHT) {
            return null;
        }
        return new MazeRoom(x, y, width, height);
    }

    /**
     * Wall off every perimeter boundary of the room that lies inside the maze
     * and has not been claimed already.
     */
    public void traceEnclosure(MazeGrid grid) {
        for (int col = x; col < x + width; col++) {
            if (y > 0) {
                grid.claimBoundary(col, y, PathDirection.NORTH, true);
            }
            if (y + height < grid.getHeight()) {
                grid.claimBoundary(col, y + height - 1, PathDirection.SOUTH, true);
            }
        }
        for (int row = y; row < y + height; row++) {
            if (x > 0) {
                grid.claimBoundary(x, row, PathDirection.WEST, true);
            }
            if (x + width < grid.getWidth()) {
                grid.claimBoundary(x + width - 1, row, PathDirection.EAST, true);
            }
        }
    }

    /**
     * Enclose the room and clear a single entry boundary.
     *
     * @param grid Grid being built
     * @param firstWall Plan of the room's first dividing wall, or null if the
     *                  room will not be bisected
     * @param canOpenInto Whether a cell outside the room may receive the entry
     * @return The opening that was cleared
     */
    public RoomOpening markBoundaries(MazeGrid grid, DivisionPlan firstWall, Predicate<GridPoint> canOpenInto) {
        RoomOpening opening = findOpening(grid, firstWall, canOpenInto);
        if (opening == null) {
            throw new MazeGenerationException(this + " has no perimeter cell that can be opened");
        }
        traceEnclosure(grid);
        grid.openBoundary(opening.getCell().getX(), opening.getCell().getY(), opening.getDirection());
        return opening;
    }

    /**
     * Choose the entry boundary nearest the solution path without mutating
     * the grid.
     *
     * With a first wall the candidates are the two edge cells in line with
     * its passage; otherwise, or if neither of those may be opened, every
     * perimeter cell is a candidate in the order north, south, west, east.
     * The closest candidate wins and ties go to the earlier one.
     *
     * @return The chosen opening, or null if no candidate may be opened
     */
    public RoomOpening findOpening(MazeGrid grid, DivisionPlan firstWall, Predicate<GridPoint> canOpenInto) {
        RoomOpening opening = null;
        if (firstWall != null) {
            opening = nearestToPath(grid, alignedCandidates(firstWall), canOpenInto);
        }
        if (opening == null) {
            opening = nearestToPath(grid, perimeterCandidates(), canOpenInto);
        }
        return opening;
    }

    private List<RoomOpening> alignedCandidates(DivisionPlan plan) {
        List<RoomOpening> candidates = new ArrayList<>(2);
        if (plan.isHorizontal()) {
            int col = x + plan.getPassageOffset();
            candidates.add(new RoomOpening(new GridPoint(col, y), PathDirection.NORTH, 0));
            candidates.add(new RoomOpening(new GridPoint(col, y + height - 1), PathDirection.SOUTH, 0));
        } else {
            int row = y + plan.getPassageOffset();
            candidates.add(new RoomOpening(new GridPoint(x, row), PathDirection.WEST, 0));
            candidates.add(new RoomOpening(new GridPoint(x + width - 1, row), PathDirection.EAST, 0));
        }
        return candidates;
    }

    private List<RoomOpening> perimeterCandidates() {
        List<RoomOpening> candidates = new ArrayList<>();
        for (int col = x; col < x + width; col++) {
            candidates.add(new RoomOpening(new GridPoint(col, y), PathDirection.NORTH, 0));
        }
        for (int col = x; col < x + width; col++) {
            candidates.add(new RoomOpening(new GridPoint(col, y + height - 1), PathDirection.SOUTH, 0));
        }
        for (int row = y; row < y + height; row++) {
            candidates.add(new RoomOpening(new GridPoint(x, row), PathDirection.WEST, 0));
        }
        for (int row = y; row < y + height; row++) {
            candidates.add(new RoomOpening(new GridPoint(x + width - 1, row), PathDirection.EAST, 0));
        }
        return candidates;
    }

    private static RoomOpening nearestToPath(MazeGrid grid, List<RoomOpening> candidates,
                                             Predicate<GridPoint> canOpenInto) {
        RoomOpening best = null;
        for (RoomOpening candidate : candidates) {
            GridPoint cell = candidate.getCell();
            if (!grid.hasNeighbor(cell.getX(), cell.getY(), candidate.getDirection())
                    || !canOpenInto.test(candidate.getNeighbor())) {
                continue;
            }
            int distance = distanceToPath(grid, cell, candidate.getDirection());
            if (best == null || distance < best.getDistanceToPath()) {
                best = new RoomOpening(cell, candidate.getDirection(), distance);
            }
        }
        return best;
    }

    /**
     * Steps from the cell to the first path cell found scanning outward in
     * the given direction, or {@link Integer#MAX_VALUE} if the border comes
     * first.
     */
    static int distanceToPath(MazeGrid grid, GridPoint from, PathDirection direction) {
        GridPoint current = from.step(direction);
        int steps = 1;
        while (grid.contains(current)) {
            if (grid.getCell(current).isOnPath()) {
                return steps;
            }
            current = current.step(direction);
            steps++;
        }
        return Integer.MAX_VALUE;
    }

    // Getters
    public int getX() { return x; }
    public int getY() { return y; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        MazeRoom room = (MazeRoom) o;
        return x == room.x && y == room.y && width == room.width && height == room.height;
    }

    @Override
    public int hashCode() {
        int result = x;
        result = 31 * result + y;
        result = 31 * result + width;
        result = 31 * result + height;
        return result;
    }

    @Override
    public String toString() {
        return String.format("MazeRoom[(%d,%d) %dx%d]", x, y, width, height);
    }
}
