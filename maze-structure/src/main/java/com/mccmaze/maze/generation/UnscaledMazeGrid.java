package com.mccmaze.maze.generation;

import com.mccmaze.maze.structure.MazeGrid;
import com.mccmaze.maze.structure.MazeRoom;

import java.util.Collections;
import java.util.List;

/**
 * A decoded but unscaled maze: the wall-flag grid, how many dividing walls
 * were applied and the rooms that could still be divided further.
 */
public class UnscaledMazeGrid {

    private final MazeGrid grid;
    private final int numPartitions;
    private final List<MazeRoom> remainingRooms;

    public UnscaledMazeGrid(MazeGrid grid, int numPartitions, List<MazeRoom> remainingRooms) {
        this.grid = grid;
        this.numPartitions = numPartitions;
        this.remainingRooms = Collections.unmodifiableList(remainingRooms);
    }

    public MazeGrid getGrid() { return grid; }
    public int getNumPartitions() { return numPartitions; }
    public List<MazeRoom> getRemainingRooms() { return remainingRooms; }

    /**
     * True once no room can take another wall.
     */
    public boolean isFullyPartitioned() {
        return remainingRooms.isEmpty();
    }
}
