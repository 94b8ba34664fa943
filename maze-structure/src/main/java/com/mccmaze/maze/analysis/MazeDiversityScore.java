package com.mccmaze.maze.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mean diversity of one maze genome against the rest of its population.
 */
public final class MazeDiversityScore {

    @JsonProperty("genomeId")
    private final long genomeId;

    @JsonProperty("averageDiversity")
    private final double averageDiversity;

    @JsonCreator
    public MazeDiversityScore(@JsonProperty("genomeId") long genomeId,
                              @JsonProperty("averageDiversity") double averageDiversity) {
        this.genomeId = genomeId;
        this.averageDiversity = averageDiversity;
    }

    public long getGenomeId() { return genomeId; }
    public double getAverageDiversity() { return averageDiversity; }

    @Override
    public String toString() {
        return String.format("MazeDiversityScore[genome=%d, average=%.4f]", genomeId, averageDiversity);
    }
}
