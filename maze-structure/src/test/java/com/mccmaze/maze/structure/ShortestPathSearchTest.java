package com.mccmaze.maze.structure;

import com.mccmaze.maze.MazeTestUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ShortestPathSearchTest {

    @Test
    public void testOpenGridDistanceIsManhattan() {
        ShortestPathSearch search = ShortestPathSearch.search(new MazeGrid(5, 3));

        assertEquals(6, search.getDistance());

        List<GridPoint> path = search.getSolutionPath();
        assertEquals(7, path.size());
        assertEquals(new GridPoint(0, 0), path.get(0));
        assertEquals(new GridPoint(4, 2), path.get(path.size() - 1));
        for (int i = 1; i < path.size(); i++) {
            assertTrue(path.get(i - 1).isAdjacentTo(path.get(i)));
        }
    }

    @Test
    public void testSerpentineForcesLongPath() {
        MazeGrid grid = MazeTestUtils.serpentineGrid();

        ShortestPathSearch search = ShortestPathSearch.search(grid);

        assertEquals(8, search.getDistance());
        assertEquals(List.of(
                new GridPoint(0, 0), new GridPoint(0, 1), new GridPoint(0, 2),
                new GridPoint(1, 2), new GridPoint(1, 1), new GridPoint(1, 0),
                new GridPoint(2, 0), new GridPoint(2, 1), new GridPoint(2, 2)), search.getSolutionPath());
        assertTrue(MazeTestUtils.isSpanningTree(grid, ShortestPathSearch.countReachableCells(grid)));
    }

    @Test
    public void testReachableCellCount() {
        MazeGrid grid = new MazeGrid(3, 3);
        assertEquals(9, ShortestPathSearch.countReachableCells(grid));

        // Seal off the bottom-right cell
        grid.getCell(1, 2).setEastWall(true);
        grid.getCell(2, 1).setSouthWall(true);
        assertEquals(8, ShortestPathSearch.countReachableCells(grid));
        assertThrows(MazeGenerationException.class, () -> ShortestPathSearch.search(grid));
    }

    @Test
    public void testSingleCellPath() {
        ShortestPathSearch search = ShortestPathSearch.search(new MazeGrid(1, 1));

        assertEquals(0, search.getDistance());
        assertEquals(List.of(new GridPoint(0, 0)), search.getSolutionPath());
    }
}
