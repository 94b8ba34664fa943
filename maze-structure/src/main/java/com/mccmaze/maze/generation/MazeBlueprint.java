package com.mccmaze.maze.generation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mccmaze.maze.structure.GridPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything needed to build one maze: grid dimensions, the ordered
 * subdivision commands and, for path-first mazes, the solution path to build
 * around. This is the decoded form of an externally evolved maze genome.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MazeBlueprint {

    @JsonProperty("genomeId")
    private long genomeId;

    @JsonProperty("width")
    private int width;

    @JsonProperty("height")
    private int height;

    @JsonProperty("commands")
    private List<SubdivisionCommand> commands;

    @JsonProperty("solutionPath")
    private List<GridPoint> solutionPath;

    /**
     * Default constructor for Jackson.
     */
    public MazeBlueprint() {
        this.commands = new ArrayList<>();
    }

    public MazeBlueprint(long genomeId, int width, int height, List<SubdivisionCommand> commands) {
        this.genomeId = genomeId;
        this.width = width;
        this.height = height;
        this.commands = new ArrayList<>(commands);
    }

    public MazeBlueprint(long genomeId, int width, int height, List<SubdivisionCommand> commands,
                         List<GridPoint> solutionPath) {
        this(genomeId, width, height, commands);
        this.solutionPath = solutionPath == null ? null : new ArrayList<>(solutionPath);
    }

    /**
     * Whether the maze is built around a predetermined solution path.
     */
    @JsonIgnore
    public boolean isPathFirst() {
        return solutionPath != null && !solutionPath.isEmpty();
    }

    // Getters and setters
    public long getGenomeId() { return genomeId; }
    public void setGenomeId(long genomeId) { this.genomeId = genomeId; }

    public int getWidth() { return width; }
    public void setWidth(int width) { this.width = width; }

    public int getHeight() { return height; }
    public void setHeight(int height) { this.height = height; }

    public List<SubdivisionCommand> getCommands() { return commands; }
    public void setCommands(List<SubdivisionCommand> commands) { this.commands = commands; }

    public List<GridPoint> getSolutionPath() { return solutionPath; }
    public void setSolutionPath(List<GridPoint> solutionPath) { this.solutionPath = solutionPath; }

    @Override
    public String toString() {
        return String.format("MazeBlueprint[genome=%d, %dx%d, commands=%d, pathFirst=%b]",
                genomeId, width, height, commands.size(), isPathFirst());
    }
}
