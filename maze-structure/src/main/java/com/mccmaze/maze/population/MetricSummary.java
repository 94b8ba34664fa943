package com.mccmaze.maze.population;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Summary statistics of one structural measure across a maze population.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MetricSummary {

    @JsonProperty("count")
    private int count;

    @JsonProperty("min")
    private double min;

    @JsonProperty("max")
    private double max;

    @JsonProperty("mean")
    private double mean;

    @JsonProperty("median")
    private double median;

    @JsonProperty("stdDev")
    private double stdDev;

    /**
     * Default constructor for Jackson.
     */
    public MetricSummary() {
    }

    /**
     * Summarize a collection of observations. An empty collection yields all
     * zeros.
     */
    public MetricSummary(Collection<? extends Number> observations) {
        List<Double> values = new ArrayList<>(observations.size());
        for (Number observation : observations) {
            values.add(observation.doubleValue());
        }
        calculateStatistics(values);
    }

    private void calculateStatistics(List<Double> values) {
        count = values.size();
        if (values.isEmpty()) {
            min = max = mean = median = stdDev = 0;
            return;
        }

        values.sort(Double::compareTo);

        min = values.get(0);
        max = values.get(values.size() - 1);
        mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0);

        median = values.size() % 2 == 0 ?
            (values.get(values.size() / 2 - 1) + values.get(values.size() / 2)) / 2.0 :
            values.get(values.size() / 2);

        // Population standard deviation
        double variance = values.stream()
            .mapToDouble(value -> Math.pow(value - mean, 2))
            .average().orElse(0);
        stdDev = Math.sqrt(variance);
    }

    // Getters
    public int getCount() { return count; }
    public double getMin() { return min; }
    public double getMax() { return max; }
    public double getMean() { return mean; }
    public double getMedian() { return median; }
    public double getStdDev() { return stdDev; }

    @Override
    public String toString() {
        return String.format("[n=%d, min=%.2f, max=%.2f, mean=%.2f, median=%.2f, stdDev=%.2f]",
                count, min, max, mean, median, stdDev);
    }
}
