package com.mccmaze.maze.generation;

import com.mccmaze.maze.structure.DivisionPlan;
import com.mccmaze.maze.structure.GridPoint;
import com.mccmaze.maze.structure.MazeGenerationException;
import com.mccmaze.maze.structure.MazeGrid;
import com.mccmaze.maze.structure.MazeRoom;
import com.mccmaze.maze.structure.MazeStructure;
import com.mccmaze.maze.structure.RoomDivision;
import com.mccmaze.maze.structure.RoomOpening;
import com.mccmaze.maze.util.LoggingUtil;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Turns maze blueprints into finished maze structures.
 *
 * Two construction modes are supported. The standard mode applies the
 * commands in order against a worklist of pending rooms that starts with the
 * whole grid. The path-first mode lays a given solution path, encloses the
 * rectangles left around it and partitions each one completely.
 */
public class MazeStructureBuilder {

    private final int scaleMultiplier;

    public MazeStructureBuilder(int scaleMultiplier) {
        if (scaleMultiplier < 1) {
            throw new MazeGenerationException("Scale multiplier must be positive: " + scaleMultiplier);
        }
        this.scaleMultiplier = scaleMultiplier;
    }

    /**
     * Build a finished maze from a blueprint, choosing the construction mode
     * from whether the blueprint carries a solution path.
     */
    public MazeStructure build(MazeBlueprint blueprint) {
        UnscaledMazeGrid unscaled = blueprint.isPathFirst() ? buildAroundPath(blueprint) : decodeUnscaled(blueprint);
        MazeStructure structure = new MazeStructure(blueprint.getGenomeId(), unscaled.getGrid(),
                scaleMultiplier, unscaled.getNumPartitions());

        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug(String.format("Built maze %d: %d partitions, %d walls, distance %d, maxTimesteps %d",
                    blueprint.getGenomeId(), structure.getNumPartitions(), structure.getWalls().size(),
                    structure.getUnscaledDistance(), structure.getMaxTimesteps()));
        }
        return structure;
    }

    /**
     * Build every blueprint in order.
     */
    public List<MazeStructure> buildAll(List<MazeBlueprint> blueprints) {
        List<MazeStructure> structures = new ArrayList<>(blueprints.size());
        for (MazeBlueprint blueprint : blueprints) {
            structures.add(build(blueprint));
        }
        return structures;
    }

    /**
     * Decode a blueprint in standard mode without scaling it.
     */
    public static UnscaledMazeGrid decodeUnscaled(MazeBlueprint blueprint) {
        return decodeUnscaled(blueprint.getWidth(), blueprint.getHeight(), blueprint.getCommands());
    }

    /**
     * Apply each command once to the pending room it selects. Decoding stops
     * early when no room can be divided any further.
     *
     * @param width Grid width in cells
     * @param height Grid height in cells
     * @param commands Ordered subdivision commands
     * @return The grid, the number of walls placed and the rooms still divisible
     */
    public static UnscaledMazeGrid decodeUnscaled(int width, int height, List<SubdivisionCommand> commands) {
        MazeGrid grid = new MazeGrid(width, height);
        List<MazeRoom> pending = new ArrayList<>();
        MazeRoom whole = new MazeRoom(0, 0, width, height);
        if (whole.isSubdividable()) {
            pending.add(whole);
        }

        int numPartitions = 0;
        for (SubdivisionCommand command : commands) {
            if (pending.isEmpty()) {
                break;
            }
            MazeRoom room = pending.remove(Math.floorMod(command.getRoomIndex(), pending.size()));
            subdivide(grid, room, command, pending);
            numPartitions++;
        }

        return new UnscaledMazeGrid(grid, numPartitions, pending);
    }

    /**
     * Build a maze around the blueprint's solution path without scaling it.
     *
     * Sub-mazes are processed outward from the path: a sub-maze is only
     * enclosed once one of its perimeter cells borders an already connected
     * cell, and its single opening leads into that connected region.
     */
    public static UnscaledMazeGrid buildAroundPath(MazeBlueprint blueprint) {
        MazeGrid grid = new MazeGrid(blueprint.getWidth(), blueprint.getHeight());
        grid.layPath(blueprint.getSolutionPath());

        List<MazeRoom> submazes = SubmazeExtractor.extractSubmazes(grid);
        Map<MazeRoom, List<SubdivisionCommand>> commandMap = distributeCommands(submazes, blueprint.getCommands());

        boolean[][] connected = new boolean[grid.getHeight()][grid.getWidth()];
        for (GridPoint point : grid.getPathCells()) {
            connected[point.getY()][point.getX()] = true;
        }
        Predicate<GridPoint> canOpenInto = point -> connected[point.getY()][point.getX()];

        Deque<MazeRoom> queue = new ArrayDeque<>(submazes);
        List<MazeRoom> undivided = new ArrayList<>();
        int numPartitions = 0;
        int stalled = 0;

        while (!queue.isEmpty()) {
            MazeRoom room = queue.poll();
            List<SubdivisionCommand> roomCommands = commandMap.getOrDefault(room, Collections.emptyList());
            DivisionPlan firstWall = roomCommands.isEmpty() ? null : planFor(room, roomCommands.get(0));

            if (room.findOpening(grid, firstWall, canOpenInto) == null) {
                queue.add(room);
                if (++stalled >= queue.size()) {
                    throw new MazeGenerationException(queue.size() + " sub-mazes cannot be connected to the solution path");
                }
                continue;
            }
            stalled = 0;

            RoomOpening opening = room.markBoundaries(grid, firstWall, canOpenInto);
            for (int row = room.getY(); row < room.getY() + room.getHeight(); row++) {
                for (int col = room.getX(); col < room.getX() + room.getWidth(); col++) {
                    connected[row][col] = true;
                }
            }
            LoggingUtil.debug("Opened " + room + " at " + opening);

            if (roomCommands.isEmpty()) {
                if (room.isSubdividable()) {
                    undivided.add(room);
                }
            } else {
                numPartitions += partitionFully(grid, room, roomCommands);
            }
        }

        return new UnscaledMazeGrid(grid, numPartitions, undivided);
    }

    /**
     * Hand out commands round-robin among the sub-mazes that can take an
     * internal wall, keeping each sub-maze's commands in blueprint order.
     */
    static Map<MazeRoom, List<SubdivisionCommand>> distributeCommands(List<MazeRoom> submazes,
                                                                      List<SubdivisionCommand> commands) {
        Map<MazeRoom, List<SubdivisionCommand>> commandMap = new LinkedHashMap<>();
        List<MazeRoom> divisible = new ArrayList<>();
        for (MazeRoom submaze : submazes) {
            if (submaze.isSubdividable()) {
                divisible.add(submaze);
                commandMap.put(submaze, new ArrayList<>());
            }
        }
        if (divisible.isEmpty()) {
            return commandMap;
        }

        for (int i = 0; i < commands.size(); i++) {
            commandMap.get(divisible.get(i % divisible.size())).add(commands.get(i));
        }
        commandMap.values().removeIf(List::isEmpty);
        return commandMap;
    }

    /**
     * Divide a room until no piece can be divided further, cycling through
     * its commands.
     *
     * @return Number of walls placed
     */
    static int partitionFully(MazeGrid grid, MazeRoom room, List<SubdivisionCommand> commands) {
        if (commands.isEmpty() || !room.isSubdividable()) {
            return 0;
        }

        Deque<MazeRoom> pending = new ArrayDeque<>();
        pending.add(room);
        int applied = 0;

        while (!pending.isEmpty()) {
            SubdivisionCommand command = commands.get(applied % commands.size());
            List<MazeRoom> children = new ArrayList<>(2);
            subdivide(grid, pending.poll(), command, children);
            pending.addAll(children);
            applied++;
        }

        return applied;
    }

    /**
     * Apply one command to a room and append its divisible children.
     */
    static RoomDivision subdivide(MazeGrid grid, MazeRoom room, SubdivisionCommand command, List<MazeRoom> pending) {
        RoomDivision division = room.divide(grid, planFor(room, command));
        pending.addAll(division.getSubdividableChildren());
        return division;
    }

    private static DivisionPlan planFor(MazeRoom room, SubdivisionCommand command) {
        return room.planDivision(command.getUnscaledWallPosition(), command.getUnscaledPassagePosition(),
                room.determineHorizontal(command.isOrientationSeed()));
    }

    public int getScaleMultiplier() {
        return scaleMultiplier;
    }
}
