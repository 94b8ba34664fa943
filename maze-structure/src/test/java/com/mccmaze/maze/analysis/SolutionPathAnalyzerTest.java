package com.mccmaze.maze.analysis;

import com.mccmaze.maze.MazeTestUtils;
import com.mccmaze.maze.generation.MazeBlueprint;
import com.mccmaze.maze.generation.MazeStructureBuilder;
import com.mccmaze.maze.generation.RandomBlueprintGenerator;
import com.mccmaze.maze.structure.GridPoint;
import com.mccmaze.maze.structure.MazeGrid;
import com.mccmaze.maze.structure.MazeStructure;
import com.mccmaze.maze.structure.MazeWall;
import com.mccmaze.maze.structure.PathDirection;
import com.mccmaze.maze.structure.PathOrientation;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SolutionPathAnalyzerTest {

    @Test
    public void testOpenStartIsDeceptiveJuncture() {
        MazeStructure maze = new MazeStructure(1, new MazeGrid(2, 2), 10, 0);

        SolutionPathMetrics metrics = SolutionPathAnalyzer.analyze(maze);

        assertEquals(List.of(new GridPoint(0, 0), new GridPoint(1, 0), new GridPoint(1, 1)), metrics.getSolutionPath());
        assertEquals(2, metrics.getPathLength());
        assertEquals(List.of(new GridPoint(0, 0)), metrics.getJunctures());
        assertEquals(1, metrics.getDeceptiveTurnCount());

        MazeGrid grid = maze.getGrid();
        assertTrue(grid.getCell(0, 0).isJuncture());
        assertEquals(PathOrientation.HORIZONTAL, grid.getCell(0, 0).getPathOrientation());
        assertEquals(PathOrientation.VERTICAL, grid.getCell(1, 0).getPathOrientation());
        assertEquals(PathOrientation.VERTICAL, grid.getCell(1, 1).getPathOrientation());
        assertEquals(PathOrientation.NONE, grid.getCell(0, 1).getPathOrientation());
    }

    @Test
    public void testSerpentineHasNoJunctures() {
        MazeStructure maze = new MazeStructure(2, MazeTestUtils.serpentineGrid(), 10, 4);

        SolutionPathMetrics metrics = SolutionPathAnalyzer.analyze(maze);

        assertEquals(8, metrics.getPathLength());
        assertEquals(0, metrics.getJunctureCount());
        assertEquals(0, metrics.getDeceptiveTurnCount());
    }

    @Test
    public void testStraightOffshootIsNotDeceptive() {
        MazeGrid grid = new MazeGrid(3, 2);
        grid.getCell(0, 0).setSouthWall(true);
        grid.getCell(2, 0).setSouthWall(true);
        grid.getCell(0, 1).setEastWall(true);

        SolutionPathMetrics metrics = SolutionPathAnalyzer.analyze(new MazeStructure(3, grid, 10, 0));

        // At (1,0) the path turns south while the dead end continues east
        assertEquals(List.of(new GridPoint(0, 0), new GridPoint(1, 0), new GridPoint(1, 1), new GridPoint(2, 1)),
                metrics.getSolutionPath());
        assertEquals(List.of(new GridPoint(1, 0)), metrics.getJunctures());
        assertEquals(0, metrics.getDeceptiveTurnCount());
    }

    @Test
    public void testSingleCellMaze() {
        MazeStructure maze = new MazeStructure(4, new MazeGrid(1, 1), 10, 0);

        SolutionPathMetrics metrics = SolutionPathAnalyzer.analyze(maze);

        assertEquals(0, metrics.getPathLength());
        assertEquals(0, metrics.getJunctureCount());
        assertEquals(0, metrics.getDeceptiveTurnCount());
        assertEquals(PathOrientation.HORIZONTAL, maze.getGrid().getCell(0, 0).getPathOrientation());
    }

    @Test
    public void testDeceptiveTurnsAreJunctures() {
        MazeStructureBuilder builder = new MazeStructureBuilder(8);

        for (MazeBlueprint blueprint : new RandomBlueprintGenerator(13L).generatePopulation(15, 8, 8, 20, false)) {
            MazeStructure maze = builder.build(blueprint);
            SolutionPathMetrics metrics = SolutionPathAnalyzer.analyze(maze);

            assertTrue(metrics.getDeceptiveTurnCount() <= metrics.getJunctureCount());
            assertEquals(maze.getUnscaledDistance(), metrics.getPathLength());
            assertFalse(metrics.getJunctures().contains(new GridPoint(7, 7)));
            for (GridPoint juncture : metrics.getJunctures()) {
                assertTrue(maze.getGrid().getCell(juncture).isJuncture());
                assertTrue(maze.getGrid().getCell(juncture).isOnPath());
            }
        }
    }

    @Test
    public void testReanalysisIsStable() {
        MazeBlueprint blueprint = new RandomBlueprintGenerator(21L).generate(5, 6, 6, 8);
        MazeStructure maze = new MazeStructureBuilder(8).build(blueprint);

        SolutionPathMetrics first = SolutionPathAnalyzer.analyze(maze);
        SolutionPathMetrics second = SolutionPathAnalyzer.analyze(maze);

        assertEquals(first.getJunctures(), second.getJunctures());
        assertEquals(first.getDeceptiveTurnCount(), second.getDeceptiveTurnCount());
        assertEquals(first.getSolutionPath().size(), maze.getGrid().getPathCells().size());
    }

    @Test
    public void testDeceptiveOffshootRule() {
        EnumSet<PathDirection> viable = EnumSet.of(PathDirection.EAST, PathDirection.SOUTH);

        assertTrue(SolutionPathAnalyzer.isDeceptive(viable, PathDirection.EAST, PathDirection.EAST));
        assertFalse(SolutionPathAnalyzer.isDeceptive(viable, PathDirection.SOUTH, PathDirection.EAST));
        assertTrue(SolutionPathAnalyzer.isDeceptive(viable, PathDirection.SOUTH, PathDirection.SOUTH));
    }

    @Test
    public void testMetricsConvertToDeceptiveTurnUnit() {
        SolutionPathMetrics metrics = SolutionPathAnalyzer.analyze(new MazeStructure(9, new MazeGrid(2, 2), 10, 0));

        DeceptiveTurnUnit unit = metrics.toDeceptiveTurnUnit();

        assertEquals(9, unit.getGenomeId());
        assertEquals(1, unit.getNumDeceptiveTurns());
    }

    @Test
    public void testAnalysisLeavesWallsUntouched() {
        MazeStructure maze = new MazeStructure(2, MazeTestUtils.serpentineGrid(), 10, 4);
        List<MazeWall> before = List.copyOf(maze.getWalls());

        SolutionPathAnalyzer.analyze(maze);

        assertEquals(before, maze.getWalls());
        assertEquals(before, MazeStructure.extractWalls(maze.getGrid(), 10));
        assertThrows(UnsupportedOperationException.class, () -> maze.getWalls().clear());
    }
}
