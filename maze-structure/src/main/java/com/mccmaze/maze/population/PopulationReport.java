package com.mccmaze.maze.population;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mccmaze.maze.analysis.DeceptiveTurnUnit;
import com.mccmaze.maze.analysis.MazeDiversityScore;
import com.mccmaze.maze.analysis.MazeDiversityUnit;
import com.mccmaze.maze.analysis.SolutionPathMetrics;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

/**
 * Everything computed for one maze population: per-maze path metrics,
 * deceptive turn units, pairwise and aggregate diversity, and summaries.
 */
public class PopulationReport {

    @JsonProperty("generatedAt")
    private final String generatedAt;

    @JsonProperty("pathMetrics")
    private final List<SolutionPathMetrics> pathMetrics;

    @JsonProperty("deceptiveTurnUnits")
    private final List<DeceptiveTurnUnit> deceptiveTurnUnits;

    @JsonProperty("pairwiseDiversity")
    private final List<MazeDiversityUnit> pairwiseDiversity;

    @JsonProperty("diversityScores")
    private final List<MazeDiversityScore> diversityScores;

    @JsonProperty("statistics")
    private final PopulationStructureStats statistics;

    @JsonProperty("estimatedMaxPartitions")
    private int estimatedMaxPartitions;

    public PopulationReport(List<SolutionPathMetrics> pathMetrics, List<DeceptiveTurnUnit> deceptiveTurnUnits,
                            List<MazeDiversityUnit> pairwiseDiversity, List<MazeDiversityScore> diversityScores,
                            PopulationStructureStats statistics) {
        this.generatedAt = LocalDateTime.now().toString();
        this.pathMetrics = Collections.unmodifiableList(pathMetrics);
        this.deceptiveTurnUnits = Collections.unmodifiableList(deceptiveTurnUnits);
        this.pairwiseDiversity = Collections.unmodifiableList(pairwiseDiversity);
        this.diversityScores = Collections.unmodifiableList(diversityScores);
        this.statistics = statistics;
    }

    public String getGeneratedAt() { return generatedAt; }
    public List<SolutionPathMetrics> getPathMetrics() { return pathMetrics; }
    public List<DeceptiveTurnUnit> getDeceptiveTurnUnits() { return deceptiveTurnUnits; }
    public List<MazeDiversityUnit> getPairwiseDiversity() { return pairwiseDiversity; }
    public List<MazeDiversityScore> getDiversityScores() { return diversityScores; }
    public PopulationStructureStats getStatistics() { return statistics; }

    /**
     * Sampled upper bound on dividing walls for the population's maze size, or 0 if not estimated.
     */
    public int getEstimatedMaxPartitions() { return estimatedMaxPartitions; }
    public void setEstimatedMaxPartitions(int estimatedMaxPartitions) {
        this.estimatedMaxPartitions = estimatedMaxPartitions;
    }
}
