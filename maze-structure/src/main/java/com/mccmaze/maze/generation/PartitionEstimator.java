package com.mccmaze.maze.generation;

import com.mccmaze.maze.structure.MazeGrid;
import com.mccmaze.maze.structure.MazeRoom;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;

/**
 * Estimates how many dividing walls a maze of a given size supports by
 * partitioning it completely with random commands and averaging over samples.
 * Used to bound the wall complexity an evolving maze can reach.
 */
public class PartitionEstimator {

    public static final int DEFAULT_SAMPLES = 2000;

    private final Random random;

    public PartitionEstimator(Random random) {
        this.random = random;
    }

    public PartitionEstimator(long seed) {
        this(new Random(seed));
    }

    /**
     * Average partition count of a fully partitioned, initially empty maze.
     *
     * @param width Grid width in cells
     * @param height Grid height in cells
     * @param samples Number of random mazes to partition
     * @return Truncated average partition count
     */
    public int estimateMaxPartitions(int width, int height, int samples) {
        return estimateMaxPartitions(MazeStructureBuilder.decodeUnscaled(width, height, List.of()), samples);
    }

    /**
     * Average partition count when continuing from a partially decoded
     * blueprint. Exact once the blueprint is a single wall away from being
     * fully partitioned.
     */
    public int estimateMaxPartitions(MazeBlueprint blueprint, int samples) {
        return estimateMaxPartitions(MazeStructureBuilder.decodeUnscaled(blueprint), samples);
    }

    private int estimateMaxPartitions(UnscaledMazeGrid start, int samples) {
        if (samples < 1) {
            throw new IllegalArgumentException("Sample count must be positive: " + samples);
        }

        long total = 0;
        for (int sample = 0; sample < samples; sample++) {
            MazeGrid grid = start.getGrid().copy();
            Deque<MazeRoom> pending = new ArrayDeque<>(start.getRemainingRooms());
            int partitions = start.getNumPartitions();

            while (!pending.isEmpty()) {
                SubdivisionCommand command = new SubdivisionCommand(
                        random.nextDouble(), random.nextDouble(), random.nextBoolean());
                List<MazeRoom> children = new ArrayList<>(2);
                MazeStructureBuilder.subdivide(grid, pending.poll(), command, children);
                pending.addAll(children);
                partitions++;
            }
            total += partitions;
        }

        return (int) (total / samples);
    }
}
