package com.mccmaze.maze.structure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Breadth-first search over the unscaled grid from the top-left cell to the
 * bottom-right cell, honoring wall flags.
 *
 * Depths are counted in moves and predecessors are kept in an index array so
 * the solution path can be rebuilt without a node object per cell.
 */
public final class ShortestPathSearch {

    private final MazeGrid grid;
    private final int[] parent;
    private final int[] depth;
    private final int targetIndex;

    private ShortestPathSearch(MazeGrid grid) {
        this.grid = grid;
        this.parent = new int[grid.getCellCount()];
        this.depth = new int[grid.getCellCount()];
        this.targetIndex = grid.indexOf(grid.getWidth() - 1, grid.getHeight() - 1);
    }

    /**
     * Run the search on a finished grid.
     *
     * @throws MazeGenerationException if the target cannot be reached
     */
    public static ShortestPathSearch search(MazeGrid grid) {
        ShortestPathSearch search = new ShortestPathSearch(grid);
        if (!search.run(true)) {
            throw new MazeGenerationException(String.format(
                    "Target cell (%d,%d) is unreachable from (0,0)", grid.getWidth() - 1, grid.getHeight() - 1));
        }
        return search;
    }

    /**
     * Number of cells reachable from the top-left cell.
     */
    public static int countReachableCells(MazeGrid grid) {
        ShortestPathSearch search = new ShortestPathSearch(grid);
        search.run(false);
        int reachable = 0;
        for (int index = 0; index < search.depth.length; index++) {
            if (search.depth[index] >= 0) {
                reachable++;
            }
        }
        return reachable;
    }

    /**
     * Step budget for a navigator: twice the scale multiplier for every two
     * cells of path length, which keeps it an even multiple of the scale.
     */
    public static int computeMaxTimesteps(int unscaledDistance, int scaleMultiplier) {
        return 2 * scaleMultiplier * (unscaledDistance / 2);
    }

    private boolean run(boolean stopAtTarget) {
        Arrays.fill(parent, -1);
        Arrays.fill(depth, -1);

        Deque<Integer> queue = new ArrayDeque<>();
        depth[0] = 0;
        queue.add(0);

        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (stopAtTarget && current == targetIndex) {
                return true;
            }

            GridPoint point = grid.pointAt(current);
            for (PathDirection direction : PathDirection.values()) {
                if (!grid.isOpen(point, direction)) {
                    continue;
                }
                int next = grid.indexOf(point.getX() + direction.getDeltaX(), point.getY() + direction.getDeltaY());
                if (depth[next] < 0) {
                    depth[next] = depth[current] + 1;
                    parent[next] = current;
                    queue.add(next);
                }
            }
        }

        return depth[targetIndex] >= 0;
    }

    /**
     * Length of the shortest path in moves.
     */
    public int getDistance() {
        return depth[targetIndex];
    }

    /**
     * Cells of the shortest path from start to target, both inclusive.
     */
    public List<GridPoint> getSolutionPath() {
        List<GridPoint> path = new ArrayList<>(depth[targetIndex] + 1);
        for (int index = targetIndex; index >= 0; index = parent[index]) {
            path.add(grid.pointAt(index));
        }
        Collections.reverse(path);
        return path;
    }

    public MazeGrid getGrid() {
        return grid;
    }
}
