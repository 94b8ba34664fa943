package com.mccmaze.maze.structure;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A finished maze: the cell grid, its merged wall segments in scaled
 * coordinates, the start and target points and the navigator step budget.
 *
 * Walls and the budget are derived once at construction. The grid returned by
 * {@link #getGrid()} is the live grid, not a copy. Only
 * {@code SolutionPathAnalyzer} may write to it, and only path annotations
 * (solution path and juncture marks); wall flags must not be changed after
 * construction. Analyzing the same maze from two threads at once is not supported.
 */
public class MazeStructure {

    public static final int BORDER_WALL_COUNT = 4;

    @JsonProperty("genomeId")
    private final long genomeId;

    @JsonProperty("scaleMultiplier")
    private final int scaleMultiplier;

    @JsonProperty("scaledWidth")
    private final int scaledWidth;

    @JsonProperty("scaledHeight")
    private final int scaledHeight;

    @JsonProperty("startLocation")
    private final GridPoint startLocation;

    @JsonProperty("targetLocation")
    private final GridPoint targetLocation;

    @JsonProperty("maxTimesteps")
    private final int maxTimesteps;

    @JsonProperty("unscaledDistance")
    private final int unscaledDistance;

    @JsonProperty("numPartitions")
    private final int numPartitions;

    @JsonProperty("walls")
    private final List<MazeWall> walls;

    @JsonIgnore
    private final MazeGrid grid;

    /**
     * Finalize a grid into a maze structure.
     *
     * @param genomeId Identifier of the genome the maze was decoded from
     * @param grid Grid with all wall flags in place
     * @param scaleMultiplier Factor from grid cells to scaled coordinates
     * @param numPartitions Number of dividing walls applied
     * @throws MazeGenerationException if the scale is not positive or the
     *         target cannot be reached
     */
    public MazeStructure(long genomeId, MazeGrid grid, int scaleMultiplier, int numPartitions) {
        if (scaleMultiplier < 1) {
            throw new MazeGenerationException("Scale multiplier must be positive: " + scaleMultiplier);
        }
        this.genomeId = genomeId;
        this.grid = grid;
        this.scaleMultiplier = scaleMultiplier;
        this.numPartitions = numPartitions;
        this.scaledWidth = grid.getWidth() * scaleMultiplier;
        this.scaledHeight = grid.getHeight() * scaleMultiplier;

        int halfScale = scaleMultiplier / 2;
        this.startLocation = new GridPoint(halfScale, halfScale);
        this.targetLocation = new GridPoint(scaledWidth - halfScale, scaledHeight - halfScale);

        this.walls = Collections.unmodifiableList(extractWalls(grid, scaleMultiplier));

        ShortestPathSearch search = ShortestPathSearch.search(grid);
        this.unscaledDistance = search.getDistance();
        this.maxTimesteps = ShortestPathSearch.computeMaxTimesteps(unscaledDistance, scaleMultiplier);
    }

    /**
     * Convert the grid's wall flags into merged segments.
     *
     * The four border walls come first, then horizontal runs of south flags
     * scanned row by row, then vertical runs of east flags scanned column by
     * column. A run ends at the first unflagged cell or at the grid edge.
     *
     * @param grid Source grid
     * @param scaleMultiplier Factor from grid cells to scaled coordinates
     * @return Wall segments in scaled coordinates
     */
    public static List<MazeWall> extractWalls(MazeGrid grid, int scaleMultiplier) {
        int width = grid.getWidth();
        int height = grid.getHeight();
        int scaledWidth = width * scaleMultiplier;
        int scaledHeight = height * scaleMultiplier;

        List<MazeWall> walls = new ArrayList<>();
        walls.add(new MazeWall(0, 0, scaledWidth, 0));
        walls.add(new MazeWall(0, 0, 0, scaledHeight));
        walls.add(new MazeWall(scaledWidth, 0, scaledWidth, scaledHeight));
        walls.add(new MazeWall(0, scaledHeight, scaledWidth, scaledHeight));

        for (int row = 0; row < height; row++) {
            int wallY = (row + 1) * scaleMultiplier;
            int runStart = -1;
            for (int col = 0; col < width; col++) {
                boolean flagged = grid.getCell(col, row).hasSouthWall();
                if (flagged && runStart < 0) {
                    runStart = col;
                } else if (!flagged && runStart >= 0) {
                    walls.add(new MazeWall(runStart * scaleMultiplier, wallY, col * scaleMultiplier, wallY));
                    runStart = -1;
                }
            }
            if (runStart >= 0) {
                walls.add(new MazeWall(runStart * scaleMultiplier, wallY, scaledWidth, wallY));
            }
        }

        for (int col = 0; col < width; col++) {
            int wallX = (col + 1) * scaleMultiplier;
            int runStart = -1;
            for (int row = 0; row < height; row++) {
                boolean flagged = grid.getCell(col, row).hasEastWall();
                if (flagged && runStart < 0) {
                    runStart = row;
                } else if (!flagged && runStart >= 0) {
                    walls.add(new MazeWall(wallX, runStart * scaleMultiplier, wallX, row * scaleMultiplier));
                    runStart = -1;
                }
            }
            if (runStart >= 0) {
                walls.add(new MazeWall(wallX, runStart * scaleMultiplier, wallX, scaledHeight));
            }
        }

        return walls;
    }

    /**
     * Walls excluding the four border segments.
     */
    @JsonIgnore
    public List<MazeWall> getInternalWalls() {
        return walls.subList(BORDER_WALL_COUNT, walls.size());
    }

    // Getters
    public long getGenomeId() { return genomeId; }
    /**
     * The live grid. Callers other than the solution path analyzer must treat it as read-only.
     */
    public MazeGrid getGrid() { return grid; }
    public int getScaleMultiplier() { return scaleMultiplier; }
    public int getScaledWidth() { return scaledWidth; }
    public int getScaledHeight() { return scaledHeight; }
    public GridPoint getStartLocation() { return startLocation; }
    public GridPoint getTargetLocation() { return targetLocation; }
    public int getMaxTimesteps() { return maxTimesteps; }
    public int getUnscaledDistance() { return unscaledDistance; }
    public int getNumPartitions() { return numPartitions; }
    public List<MazeWall> getWalls() { return walls; }

    @JsonIgnore
    public int getUnscaledWidth() { return grid.getWidth(); }

    @JsonIgnore
    public int getUnscaledHeight() { return grid.getHeight(); }

    @Override
    public String toString() {
        return String.format("MazeStructure[genome=%d, %dx%d, walls=%d, maxTimesteps=%d]",
                genomeId, scaledWidth, scaledHeight, walls.size(), maxTimesteps);
    }
}
