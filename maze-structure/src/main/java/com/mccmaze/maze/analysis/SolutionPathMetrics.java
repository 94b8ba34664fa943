package com.mccmaze.maze.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mccmaze.maze.structure.GridPoint;

import java.util.Collections;
import java.util.List;

/**
 * Structural difficulty measures taken along a maze's solution path.
 */
public class SolutionPathMetrics {

    @JsonProperty("genomeId")
    private final long genomeId;

    @JsonProperty("solutionPath")
    private final List<GridPoint> solutionPath;

    @JsonProperty("junctures")
    private final List<GridPoint> junctures;

    @JsonProperty("deceptiveTurnCount")
    private final int deceptiveTurnCount;

    public SolutionPathMetrics(long genomeId, List<GridPoint> solutionPath, List<GridPoint> junctures,
                               int deceptiveTurnCount) {
        this.genomeId = genomeId;
        this.solutionPath = Collections.unmodifiableList(solutionPath);
        this.junctures = Collections.unmodifiableList(junctures);
        this.deceptiveTurnCount = deceptiveTurnCount;
    }

    public long getGenomeId() { return genomeId; }
    public List<GridPoint> getSolutionPath() { return solutionPath; }
    public List<GridPoint> getJunctures() { return junctures; }
    public int getDeceptiveTurnCount() { return deceptiveTurnCount; }

    /**
     * Number of moves from start to target.
     */
    @JsonProperty("pathLength")
    public int getPathLength() {
        return solutionPath.size() - 1;
    }

    @JsonProperty("junctureCount")
    public int getJunctureCount() {
        return junctures.size();
    }

    public DeceptiveTurnUnit toDeceptiveTurnUnit() {
        return new DeceptiveTurnUnit(genomeId, deceptiveTurnCount);
    }

    @Override
    public String toString() {
        return String.format("SolutionPathMetrics[genome=%d, length=%d, junctures=%d, deceptiveTurns=%d]",
                genomeId, getPathLength(), getJunctureCount(), deceptiveTurnCount);
    }
}
