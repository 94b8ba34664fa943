package com.mccmaze.maze.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Diversity between the solution paths of two maze genomes.
 */
public final class MazeDiversityUnit {

    @JsonProperty("genomeId")
    private final long genomeId;

    @JsonProperty("otherGenomeId")
    private final long otherGenomeId;

    @JsonProperty("diversityScore")
    private final double diversityScore;

    @JsonCreator
    public MazeDiversityUnit(@JsonProperty("genomeId") long genomeId,
                             @JsonProperty("otherGenomeId") long otherGenomeId,
                             @JsonProperty("diversityScore") double diversityScore) {
        this.genomeId = genomeId;
        this.otherGenomeId = otherGenomeId;
        this.diversityScore = diversityScore;
    }

    public long getGenomeId() { return genomeId; }
    public long getOtherGenomeId() { return otherGenomeId; }
    public double getDiversityScore() { return diversityScore; }

    @Override
    public String toString() {
        return String.format("MazeDiversityUnit[%d <-> %d, score=%.4f]", genomeId, otherGenomeId, diversityScore);
    }
}
