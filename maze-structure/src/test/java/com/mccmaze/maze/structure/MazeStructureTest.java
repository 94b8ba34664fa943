package com.mccmaze.maze.structure;

import com.mccmaze.maze.generation.MazeBlueprint;
import com.mccmaze.maze.generation.MazeStructureBuilder;
import com.mccmaze.maze.generation.RandomBlueprintGenerator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MazeStructureTest {

    @Test
    public void testEmptyTwoByTwoMaze() {
        MazeStructure maze = new MazeStructure(1, new MazeGrid(2, 2), 10, 0);

        assertEquals(20, maze.getScaledWidth());
        assertEquals(20, maze.getScaledHeight());
        assertEquals(MazeStructure.BORDER_WALL_COUNT, maze.getWalls().size());
        assertTrue(maze.getInternalWalls().isEmpty());
        assertEquals(new GridPoint(5, 5), maze.getStartLocation());
        assertEquals(new GridPoint(15, 15), maze.getTargetLocation());
        assertEquals(2, maze.getUnscaledDistance());
        assertEquals(20, maze.getMaxTimesteps());
    }

    @Test
    public void testBorderWallsComeFirst() {
        MazeStructure maze = new MazeStructure(1, new MazeGrid(3, 2), 10, 0);

        assertEquals(List.of(
                new MazeWall(0, 0, 30, 0),
                new MazeWall(0, 0, 0, 20),
                new MazeWall(30, 0, 30, 20),
                new MazeWall(0, 20, 30, 20)), maze.getWalls());
    }

    @Test
    public void testDividedRoomProducesMergedWall() {
        MazeGrid grid = new MazeGrid(4, 4);
        new MazeRoom(0, 0, 4, 4).divide(grid, 0.5, 0.0, true);

        MazeStructure maze = new MazeStructure(3, grid, 10, 1);

        assertEquals(List.of(new MazeWall(10, 20, 40, 20)), maze.getInternalWalls());
        assertEquals(3, maze.getGenomeId());
        assertEquals(1, maze.getNumPartitions());
    }

    @Test
    public void testRunsBreakAtGaps() {
        MazeGrid grid = new MazeGrid(4, 3);
        grid.getCell(0, 0).setSouthWall(true);
        grid.getCell(2, 0).setSouthWall(true);
        grid.getCell(3, 0).setSouthWall(true);
        grid.getCell(1, 1).setEastWall(true);
        grid.getCell(1, 2).setEastWall(true);

        List<MazeWall> internal = MazeStructure.extractWalls(grid, 10).subList(MazeStructure.BORDER_WALL_COUNT, 7);

        assertEquals(List.of(
                new MazeWall(0, 10, 10, 10),
                new MazeWall(20, 10, 40, 10),
                new MazeWall(20, 10, 20, 30)), internal);
    }

    @Test
    public void testWallExtractionRoundTrip() {
        RandomBlueprintGenerator generator = new RandomBlueprintGenerator(11L);
        MazeStructureBuilder builder = new MazeStructureBuilder(16);

        for (MazeBlueprint blueprint : generator.generatePopulation(10, 7, 6, 25, false)) {
            MazeStructure maze = builder.build(blueprint);

            MazeGrid rebuilt = MazeGrid.fromWalls(7, 6, 16, maze.getInternalWalls());

            assertEquals(maze.getWalls(), MazeStructure.extractWalls(rebuilt, 16));
            assertEquals(maze.getGrid().countWallFlags(), rebuilt.countWallFlags());
            assertTrue(maze.getInternalWalls().size() <= maze.getGrid().countWallFlags());
        }
    }

    @Test
    public void testMaxTimestepsIsEvenMultipleOfScale() {
        int previous = 0;
        for (int distance = 0; distance <= 30; distance++) {
            int timesteps = ShortestPathSearch.computeMaxTimesteps(distance, 12);
            assertEquals(0, timesteps % 24);
            assertTrue(timesteps >= previous);
            previous = timesteps;
        }
        assertEquals(24, ShortestPathSearch.computeMaxTimesteps(3, 12));
        assertEquals(48, ShortestPathSearch.computeMaxTimesteps(4, 12));
    }

    @Test
    public void testUnreachableTargetIsFatal() {
        MazeGrid grid = new MazeGrid(2, 2);
        grid.getCell(0, 0).setEastWall(true);
        grid.getCell(0, 0).setSouthWall(true);

        assertThrows(MazeGenerationException.class, () -> new MazeStructure(1, grid, 10, 0));
    }

    @Test
    public void testNonPositiveScaleIsRejected() {
        assertThrows(MazeGenerationException.class, () -> new MazeStructure(1, new MazeGrid(2, 2), 0, 0));
    }

    @Test
    public void testSingleCellMaze() {
        MazeStructure maze = new MazeStructure(1, new MazeGrid(1, 1), 10, 0);

        assertEquals(0, maze.getUnscaledDistance());
        assertEquals(0, maze.getMaxTimesteps());
        assertEquals(new GridPoint(5, 5), maze.getTargetLocation());
    }
}
