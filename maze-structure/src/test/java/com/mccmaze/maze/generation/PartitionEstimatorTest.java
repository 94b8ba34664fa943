package com.mccmaze.maze.generation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PartitionEstimatorTest {

    private PartitionEstimator estimator;

    @BeforeEach
    public void setup() {
        estimator = new PartitionEstimator(99L);
    }

    @Test
    public void testSmallestMazeTakesOneWall() {
        assertEquals(1, estimator.estimateMaxPartitions(2, 2, 10));
    }

    @Test
    public void testCorridorTakesNoWalls() {
        assertEquals(0, estimator.estimateMaxPartitions(1, 6, 10));
        assertEquals(0, estimator.estimateMaxPartitions(5, 1, 10));
    }

    @Test
    public void testEstimateStaysWithinBounds() {
        int estimate = estimator.estimateMaxPartitions(6, 5, 200);

        assertTrue(estimate >= 1, "estimate " + estimate);
        assertTrue(estimate < 30, "estimate " + estimate);
    }

    @Test
    public void testSameSeedGivesSameEstimate() {
        assertEquals(new PartitionEstimator(4L).estimateMaxPartitions(7, 7, 100),
                new PartitionEstimator(4L).estimateMaxPartitions(7, 7, 100));
    }

    @Test
    public void testContinuesFromBlueprint() {
        // The first wall leaves one 2x2 room, which always takes exactly one more wall
        MazeBlueprint blueprint = new MazeBlueprint(1, 2, 3, List.of(new SubdivisionCommand(0.0, 0.0, true)));

        assertEquals(2, estimator.estimateMaxPartitions(blueprint, 25));
    }

    @Test
    public void testBlueprintWallsAreCounted() {
        MazeBlueprint blueprint = new MazeBlueprint(1, 4, 4, List.of(new SubdivisionCommand(0.5, 0.0, true)));

        assertTrue(estimator.estimateMaxPartitions(blueprint, 50) >= 3);
    }

    @Test
    public void testSampleCountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> estimator.estimateMaxPartitions(3, 3, 0));
    }
}
