package com.mccmaze.maze.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Deceptive turn count for one maze genome, as handed to result writers.
 */
public final class DeceptiveTurnUnit {

    @JsonProperty("genomeId")
    private final long genomeId;

    @JsonProperty("numDeceptiveTurns")
    private final int numDeceptiveTurns;

    @JsonCreator
    public DeceptiveTurnUnit(@JsonProperty("genomeId") long genomeId,
                             @JsonProperty("numDeceptiveTurns") int numDeceptiveTurns) {
        this.genomeId = genomeId;
        this.numDeceptiveTurns = numDeceptiveTurns;
    }

    public long getGenomeId() { return genomeId; }
    public int getNumDeceptiveTurns() { return numDeceptiveTurns; }

    @Override
    public String toString() {
        return "DeceptiveTurnUnit[genome=" + genomeId + ", turns=" + numDeceptiveTurns + "]";
    }
}
