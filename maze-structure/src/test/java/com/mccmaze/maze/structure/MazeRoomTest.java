package com.mccmaze.maze.structure;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MazeRoomTest {

    private MazeGrid grid;

    @BeforeEach
    public void setup() {
        grid = new MazeGrid(4, 4);
    }

    @Test
    public void testHorizontalDivisionOfFourByFourRoom() {
        MazeRoom room = new MazeRoom(0, 0, 4, 4);

        RoomDivision division = room.divide(grid, 0.5, 0.0, true);

        assertEquals(1, division.getPlan().getWallOffset());
        assertEquals(0, division.getPlan().getPassageOffset());

        // Wall spans row 1 with the passage in column 0
        assertFalse(grid.getCell(0, 1).hasSouthWall());
        for (int x = 1; x < 4; x++) {
            assertTrue(grid.getCell(x, 1).hasSouthWall(), "column " + x);
        }
        assertEquals(3, grid.countWallFlags());

        assertEquals(new MazeRoom(0, 0, 4, 2), division.getFirstChild());
        assertEquals(new MazeRoom(0, 2, 4, 2), division.getSecondChild());
        assertEquals(4, division.getFirstChild().getHeight() + division.getSecondChild().getHeight());
    }

    @Test
    public void testVerticalDivision() {
        MazeRoom room = new MazeRoom(0, 0, 4, 4);

        RoomDivision division = room.divide(grid, 0.0, 0.5, false);

        // Wall on the east side of column 0, passage in row 2
        assertTrue(grid.getCell(0, 0).hasEastWall());
        assertTrue(grid.getCell(0, 1).hasEastWall());
        assertFalse(grid.getCell(0, 2).hasEastWall());
        assertTrue(grid.getCell(0, 3).hasEastWall());

        assertNull(division.getFirstChild());
        assertEquals(new MazeRoom(1, 0, 3, 4), division.getSecondChild());
        assertEquals(List.of(new MazeRoom(1, 0, 3, 4)), division.getSubdividableChildren());
    }

    @Test
    public void testWallPositionNeverReachesFarEdge() {
        MazeRoom room = new MazeRoom(0, 0, 4, 4);

        DivisionPlan plan = room.planDivision(1.0, 0.0, true);
        assertEquals(2, plan.getWallOffset());

        RoomDivision division = room.divide(grid, plan);
        assertEquals(new MazeRoom(0, 0, 4, 3), division.getFirstChild());
        assertNull(division.getSecondChild());
    }

    @Test
    public void testWallOffsetTruncates() {
        MazeRoom room = new MazeRoom(0, 0, 4, 4);

        assertEquals(1, room.planDivision(0.6, 0.0, true).getWallOffset());
        assertEquals(2, room.planDivision(0.7, 0.0, true).getWallOffset());
        assertEquals(0, room.planDivision(0.3, 0.0, false).getWallOffset());
    }

    @Test
    public void testPassageStaysOnWall() {
        MazeRoom room = new MazeRoom(0, 0, 4, 4);

        assertEquals(3, room.planDivision(0.5, 1.0, true).getPassageOffset());
        assertEquals(new GridPoint(3, 1), room.planDivision(0.5, 1.0, true).getPassageCell());
    }

    @Test
    public void testSmallestRoomSplitsIntoLeaves() {
        MazeRoom room = new MazeRoom(2, 2, 2, 2);

        RoomDivision division = room.divide(grid, 0.7, 0.2, true);

        assertTrue(division.getSubdividableChildren().isEmpty());
        assertTrue(grid.getCell(3, 2).hasSouthWall());
        assertFalse(grid.getCell(2, 2).hasSouthWall());
    }

    @Test
    public void testOrientationSelection() {
        assertTrue(new MazeRoom(0, 0, 2, 4).determineHorizontal(false));
        assertFalse(new MazeRoom(0, 0, 4, 2).determineHorizontal(true));
        assertTrue(new MazeRoom(0, 0, 3, 3).determineHorizontal(true));
        assertFalse(new MazeRoom(0, 0, 3, 3).determineHorizontal(false));
    }

    @Test
    public void testInvalidInputsAreRejected() {
        MazeRoom room = new MazeRoom(0, 0, 4, 4);

        assertThrows(MazeGenerationException.class, () -> room.planDivision(Double.NaN, 0.5, true));
        assertThrows(MazeGenerationException.class, () -> room.planDivision(-0.1, 0.5, true));
        assertThrows(MazeGenerationException.class, () -> room.planDivision(0.5, 1.5, true));
        assertThrows(MazeGenerationException.class, () -> new MazeRoom(0, 0, 0, 3));
        assertThrows(MazeGenerationException.class, () -> new MazeRoom(0, 0, 3, -1));
        assertThrows(MazeGenerationException.class, () -> new MazeRoom(0, 0, 1, 4).planDivision(0.5, 0.5, true));
    }

    @Test
    public void testTraceEnclosureKeepsClaimedBoundaries() {
        grid.claimBoundary(1, 0, PathDirection.SOUTH, false);

        new MazeRoom(1, 1, 2, 2).traceEnclosure(grid);

        assertTrue(grid.isOpen(1, 1, PathDirection.NORTH));
        assertFalse(grid.isOpen(2, 1, PathDirection.NORTH));
        assertFalse(grid.isOpen(1, 1, PathDirection.WEST));
        assertFalse(grid.isOpen(1, 2, PathDirection.WEST));
        assertFalse(grid.isOpen(2, 1, PathDirection.EAST));
        assertFalse(grid.isOpen(2, 2, PathDirection.EAST));
        assertFalse(grid.isOpen(1, 2, PathDirection.SOUTH));
        assertFalse(grid.isOpen(2, 2, PathDirection.SOUTH));

        // Interior boundaries are untouched
        assertTrue(grid.isOpen(1, 1, PathDirection.EAST));
        assertTrue(grid.isOpen(1, 1, PathDirection.SOUTH));
    }

    @Test
    public void testTraceEnclosureSkipsMazeBorder() {
        new MazeRoom(0, 0, 2, 2).traceEnclosure(grid);

        assertEquals(4, grid.countWallFlags());
        assertTrue(grid.getCell(0, 1).hasSouthWall());
        assertTrue(grid.getCell(1, 0).hasEastWall());
    }

    private MazeGrid gridWithCornerPath() {
        MazeGrid pathGrid = new MazeGrid(4, 4);
        pathGrid.layPath(List.of(
                new GridPoint(0, 0), new GridPoint(1, 0), new GridPoint(2, 0), new GridPoint(3, 0),
                new GridPoint(3, 1), new GridPoint(3, 2), new GridPoint(3, 3)));
        return pathGrid;
    }

    @Test
    public void testGenericOpeningPicksFirstNearestCandidate() {
        MazeGrid pathGrid = gridWithCornerPath();
        MazeRoom room = new MazeRoom(0, 1, 3, 3);

        RoomOpening opening = room.findOpening(pathGrid, null, p -> pathGrid.getCell(p).isOnPath());

        assertEquals(new GridPoint(0, 1), opening.getCell());
        assertEquals(PathDirection.NORTH, opening.getDirection());
        assertEquals(1, opening.getDistanceToPath());
    }

    @Test
    public void testAlignedOpeningFollowsFirstWallPassage() {
        MazeGrid pathGrid = gridWithCornerPath();
        MazeRoom room = new MazeRoom(0, 1, 3, 3);

        DivisionPlan horizontal = room.planDivision(0.5, 0.9, true);
        RoomOpening north = room.findOpening(pathGrid, horizontal, p -> pathGrid.getCell(p).isOnPath());
        assertEquals(new GridPoint(2, 1), north.getCell());
        assertEquals(PathDirection.NORTH, north.getDirection());

        DivisionPlan vertical = room.planDivision(0.5, 0.5, false);
        RoomOpening east = room.findOpening(pathGrid, vertical, p -> pathGrid.getCell(p).isOnPath());
        assertEquals(new GridPoint(2, 2), east.getCell());
        assertEquals(PathDirection.EAST, east.getDirection());
    }

    @Test
    public void testAlignedOpeningFallsBackToPerimeter() {
        MazeGrid pathGrid = gridWithCornerPath();
        MazeRoom room = new MazeRoom(0, 1, 3, 3);
        DivisionPlan horizontal = room.planDivision(0.5, 0.9, true);

        RoomOpening opening = room.findOpening(pathGrid, horizontal, p -> p.equals(new GridPoint(0, 0)));

        assertEquals(new GridPoint(0, 1), opening.getCell());
        assertEquals(PathDirection.NORTH, opening.getDirection());
    }

    @Test
    public void testMarkBoundariesOpensSingleEntry() {
        MazeGrid pathGrid = gridWithCornerPath();
        MazeRoom room = new MazeRoom(0, 1, 3, 3);

        RoomOpening opening = room.markBoundaries(pathGrid, null, p -> pathGrid.getCell(p).isOnPath());

        assertTrue(pathGrid.isOpen(opening.getCell(), opening.getDirection()));
        assertFalse(pathGrid.isOpen(1, 1, PathDirection.NORTH));
        assertFalse(pathGrid.isOpen(2, 1, PathDirection.NORTH));
        assertFalse(pathGrid.isOpen(2, 2, PathDirection.EAST));
        assertEquals(new GridPoint(0, 0), opening.getNeighbor());
    }

    @Test
    public void testMarkBoundariesWithoutCandidateFails() {
        MazeRoom room = new MazeRoom(0, 0, 4, 4);

        assertNull(room.findOpening(grid, null, p -> true));
        assertThrows(MazeGenerationException.class, () -> room.markBoundaries(grid, null, p -> true));
    }

    @Test
    public void testDistanceToPathIsInfiniteWithoutPath() {
        assertEquals(Integer.MAX_VALUE, MazeRoom.distanceToPath(grid, new GridPoint(0, 0), PathDirection.EAST));
    }
}
