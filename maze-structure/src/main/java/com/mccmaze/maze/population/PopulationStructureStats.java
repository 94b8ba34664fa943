package com.mccmaze.maze.population;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mccmaze.maze.analysis.MazeDiversityScore;
import com.mccmaze.maze.analysis.SolutionPathMetrics;
import com.mccmaze.maze.structure.MazeStructure;

import java.util.ArrayList;
import java.util.List;

/**
 * Population-wide summaries of maze difficulty and diversity.
 */
public class PopulationStructureStats {

    @JsonProperty("populationSize")
    private final int populationSize;

    @JsonProperty("junctures")
    private final MetricSummary junctures;

    @JsonProperty("deceptiveTurns")
    private final MetricSummary deceptiveTurns;

    @JsonProperty("solutionPathLength")
    private final MetricSummary solutionPathLength;

    @JsonProperty("maxTimesteps")
    private final MetricSummary maxTimesteps;

    @JsonProperty("partitions")
    private final MetricSummary partitions;

    @JsonProperty("diversity")
    private final MetricSummary diversity;

    /**
     * @param mazes Mazes in population order
     * @param pathMetrics Path metrics in the same order as the mazes
     * @param diversityScores Aggregate diversity per maze
     */
    public PopulationStructureStats(List<MazeStructure> mazes, List<SolutionPathMetrics> pathMetrics,
                                    List<MazeDiversityScore> diversityScores) {
        List<Integer> junctureCounts = new ArrayList<>();
        List<Integer> deceptiveCounts = new ArrayList<>();
        List<Integer> pathLengths = new ArrayList<>();
        for (SolutionPathMetrics metrics : pathMetrics) {
            junctureCounts.add(metrics.getJunctureCount());
            deceptiveCounts.add(metrics.getDeceptiveTurnCount());
            pathLengths.add(metrics.getPathLength());
        }

        List<Integer> timesteps = new ArrayList<>();
        List<Integer> partitionCounts = new ArrayList<>();
        for (MazeStructure maze : mazes) {
            timesteps.add(maze.getMaxTimesteps());
            partitionCounts.add(maze.getNumPartitions());
        }

        List<Double> averages = new ArrayList<>();
        for (MazeDiversityScore score : diversityScores) {
            averages.add(score.getAverageDiversity());
        }

        this.populationSize = mazes.size();
        this.junctures = new MetricSummary(junctureCounts);
        this.deceptiveTurns = new MetricSummary(deceptiveCounts);
        this.solutionPathLength = new MetricSummary(pathLengths);
        this.maxTimesteps = new MetricSummary(timesteps);
        this.partitions = new MetricSummary(partitionCounts);
        this.diversity = new MetricSummary(averages);
    }

    public int getPopulationSize() { return populationSize; }
    public MetricSummary getJunctures() { return junctures; }
    public MetricSummary getDeceptiveTurns() { return deceptiveTurns; }
    public MetricSummary getSolutionPathLength() { return solutionPathLength; }
    public MetricSummary getMaxTimesteps() { return maxTimesteps; }
    public MetricSummary getPartitions() { return partitions; }
    public MetricSummary getDiversity() { return diversity; }

    @Override
    public String toString() {
        return "PopulationStructureStats[size=" + populationSize +
                ", junctures=" + junctures +
                ", deceptiveTurns=" + deceptiveTurns +
                ", pathLength=" + solutionPathLength +
                ", maxTimesteps=" + maxTimesteps +
                ", partitions=" + partitions +
                ", diversity=" + diversity + "]";
    }
}
