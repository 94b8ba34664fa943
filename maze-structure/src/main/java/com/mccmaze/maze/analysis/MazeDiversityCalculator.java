package com.mccmaze.maze.analysis;

import com.mccmaze.maze.structure.GridPoint;
import com.mccmaze.maze.structure.MazeStructure;
import com.mccmaze.maze.structure.ShortestPathSearch;

import java.util.List;

/**
 * Scores how far apart the solution paths of two mazes run.
 *
 * Both paths are walked in lockstep, one cell per step. A path that reaches
 * its target early stays on its final cell while the other keeps moving. The
 * score is the summed Manhattan distance between the two current cells
 * divided by the number of steps taken.
 */
public final class MazeDiversityCalculator {

    private MazeDiversityCalculator() {
    }

    public static double computeDiversity(MazeStructure first, MazeStructure second) {
        return computeDiversity(ShortestPathSearch.search(first.getGrid()).getSolutionPath(),
                ShortestPathSearch.search(second.getGrid()).getSolutionPath());
    }

    /**
     * @param firstPath Ordered cells of the first solution path
     * @param secondPath Ordered cells of the second solution path
     * @return Mean per-step distance, or 0 when neither path has a move
     */
    public static double computeDiversity(List<GridPoint> firstPath, List<GridPoint> secondPath) {
        if (firstPath.isEmpty() || secondPath.isEmpty()) {
            return 0.0;
        }

        int steps = Math.max(firstPath.size(), secondPath.size()) - 1;
        if (steps == 0) {
            return 0.0;
        }

        long totalDistance = 0;
        for (int step = 1; step <= steps; step++) {
            GridPoint firstCell = firstPath.get(Math.min(step, firstPath.size() - 1));
            GridPoint secondCell = secondPath.get(Math.min(step, secondPath.size() - 1));
            totalDistance += firstCell.manhattanDistance(secondCell);
        }

        return (double) totalDistance / steps;
    }
}
