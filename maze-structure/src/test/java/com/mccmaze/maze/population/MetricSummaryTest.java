package com.mccmaze.maze.population;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MetricSummaryTest {

    @Test
    public void testStatisticsOfEvenSample() {
        MetricSummary summary = new MetricSummary(List.of(4, 1, 3, 2));

        assertEquals(4, summary.getCount());
        assertEquals(1.0, summary.getMin());
        assertEquals(4.0, summary.getMax());
        assertEquals(2.5, summary.getMean(), 1e-9);
        assertEquals(2.5, summary.getMedian(), 1e-9);
        assertEquals(Math.sqrt(1.25), summary.getStdDev(), 1e-9);
    }

    @Test
    public void testMedianOfOddSample() {
        MetricSummary summary = new MetricSummary(List.of(0.5, 9.0, 2.0));

        assertEquals(2.0, summary.getMedian(), 1e-9);
        assertEquals(3.833333333, summary.getMean(), 1e-6);
    }

    @Test
    public void testEmptySampleIsAllZeros() {
        MetricSummary summary = new MetricSummary(List.<Integer>of());

        assertEquals(0, summary.getCount());
        assertEquals(0.0, summary.getMean());
        assertEquals(0.0, summary.getStdDev());
    }
}
