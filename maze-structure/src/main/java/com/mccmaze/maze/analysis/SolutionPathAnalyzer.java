package com.mccmaze.maze.analysis;

import com.mccmaze.maze.structure.GridCell;
import com.mccmaze.maze.structure.GridPoint;
import com.mccmaze.maze.structure.MazeGrid;
import com.mccmaze.maze.structure.MazeStructure;
import com.mccmaze.maze.structure.PathDirection;
import com.mccmaze.maze.structure.PathOrientation;
import com.mccmaze.maze.structure.ShortestPathSearch;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Walks a maze's solution path, annotates it on the grid and counts the
 * junctures and deceptive turns a navigator meets along the way.
 *
 * A path cell is a juncture when, ignoring the side it was entered from, more
 * than one direction is open. A juncture is deceptive when one of its
 * offshoots (open directions other than the next path step) runs
 * perpendicular to the direction of travel. The target cell is never
 * counted. Annotation mutates the maze's grid, so a maze must only be
 * analyzed by one thread at a time.
 */
public final class SolutionPathAnalyzer {

    private SolutionPathAnalyzer() {
    }

    public static SolutionPathMetrics analyze(MazeStructure maze) {
        MazeGrid grid = maze.getGrid();
        List<GridPoint> path = ShortestPathSearch.search(grid).getSolutionPath();

        annotatePath(grid, path);

        List<GridPoint> junctures = new ArrayList<>();
        int deceptiveTurns = 0;

        for (int i = 0; i < path.size() - 1; i++) {
            GridPoint current = path.get(i);
            PathDirection next = PathDirection.between(current, path.get(i + 1));
            PathDirection travel = i > 0 ? PathDirection.between(path.get(i - 1), current) : next;

            Set<PathDirection> viable = grid.openDirections(current);
            if (i > 0) {
                viable.remove(travel.opposite());
            }
            if (viable.size() <= 1) {
                continue;
            }

            grid.getCell(current).setJuncture(true);
            junctures.add(current);

            if (isDeceptive(viable, next, travel)) {
                deceptiveTurns++;
            }
        }

        return new SolutionPathMetrics(maze.getGenomeId(), path, junctures, deceptiveTurns);
    }

    static boolean isDeceptive(Set<PathDirection> viable, PathDirection next, PathDirection travel) {
        for (PathDirection offshoot : viable) {
            if (offshoot != next && offshoot.isOrthogonalTo(travel)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Clear earlier path markers and mark each path cell with the orientation
     * of the move leaving it; the target takes the orientation of the move
     * entering it.
     */
    public static void annotatePath(MazeGrid grid, List<GridPoint> path) {
        grid.clearPathAnnotations();

        if (path.size() == 1) {
            grid.getCell(path.get(0)).setPathOrientation(PathOrientation.HORIZONTAL);
            return;
        }

        for (int i = 0; i < path.size(); i++) {
            GridCell cell = grid.getCell(path.get(i));
            PathDirection move = i < path.size() - 1
                    ? PathDirection.between(path.get(i), path.get(i + 1))
                    : PathDirection.between(path.get(i - 1), path.get(i));
            cell.setPathOrientation(PathOrientation.of(move));
        }
    }
}
