package com.mccmaze.maze.configuration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Run configuration for maze generation and population analysis.
 *
 * Covers maze dimensions and scale, the size and source of the maze
 * population, analysis parallelism, output location and logging.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MazeConfiguration {

    @JsonProperty("mazeWidth")
    private int mazeWidth = 10;

    @JsonProperty("mazeHeight")
    private int mazeHeight = 10;

    @JsonProperty("scaleMultiplier")
    private int scaleMultiplier = 32;

    @JsonProperty("populationSize")
    private int populationSize = 20;

    @JsonProperty("subdivisionsPerMaze")
    private int subdivisionsPerMaze = 12;

    @JsonProperty("pathFirst")
    private boolean pathFirst = false;

    @JsonProperty("randomSeed")
    private long randomSeed = 0; // 0 = unseeded

    @JsonProperty("parallelism")
    private int parallelism = 0; // 0 = available processors

    @JsonProperty("partitionSamples")
    private int partitionSamples = 2000;

    @JsonProperty("blueprintFile")
    private String blueprintFile;

    @JsonProperty("outputDirectory")
    private String outputDirectory = "output";

    @JsonProperty("loggingLevel")
    private String loggingLevel = "INFO";

    @JsonProperty("consoleLoggingEnabled")
    private boolean consoleLoggingEnabled = true;

    @JsonProperty("fileLoggingEnabled")
    private boolean fileLoggingEnabled = false;

    @JsonProperty("logFileName")
    private String logFileName = "maze-structure.log";

    /**
     * Default constructor for Jackson.
     */
    public MazeConfiguration() {
    }

    public MazeConfiguration(int mazeWidth, int mazeHeight, int scaleMultiplier) {
        this.mazeWidth = mazeWidth;
        this.mazeHeight = mazeHeight;
        this.scaleMultiplier = scaleMultiplier;
    }

    public boolean hasBlueprintFile() {
        return blueprintFile != null && !blueprintFile.isEmpty();
    }

    // Getters and setters
    public int getMazeWidth() { return mazeWidth; }
    public void setMazeWidth(int mazeWidth) { this.mazeWidth = mazeWidth; }

    public int getMazeHeight() { return mazeHeight; }
    public void setMazeHeight(int mazeHeight) { this.mazeHeight = mazeHeight; }

    public int getScaleMultiplier() { return scaleMultiplier; }
    public void setScaleMultiplier(int scaleMultiplier) { this.scaleMultiplier = scaleMultiplier; }

    public int getPopulationSize() { return populationSize; }
    public void setPopulationSize(int populationSize) { this.populationSize = populationSize; }

    public int getSubdivisionsPerMaze() { return subdivisionsPerMaze; }
    public void setSubdivisionsPerMaze(int subdivisionsPerMaze) { this.subdivisionsPerMaze = subdivisionsPerMaze; }

    public boolean isPathFirst() { return pathFirst; }
    public void setPathFirst(boolean pathFirst) { this.pathFirst = pathFirst; }

    public long getRandomSeed() { return randomSeed; }
    public void setRandomSeed(long randomSeed) { this.randomSeed = randomSeed; }

    public int getParallelism() { return parallelism; }
    public void setParallelism(int parallelism) { this.parallelism = parallelism; }

    public int getPartitionSamples() { return partitionSamples; }
    public void setPartitionSamples(int partitionSamples) { this.partitionSamples = partitionSamples; }

    public String getBlueprintFile() { return blueprintFile; }
    public void setBlueprintFile(String blueprintFile) { this.blueprintFile = blueprintFile; }

    public String getOutputDirectory() { return outputDirectory; }
    public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }

    public String getLoggingLevel() { return loggingLevel; }
    public void setLoggingLevel(String loggingLevel) { this.loggingLevel = loggingLevel; }

    public boolean isConsoleLoggingEnabled() { return consoleLoggingEnabled; }
    public void setConsoleLoggingEnabled(boolean consoleLoggingEnabled) { this.consoleLoggingEnabled = consoleLoggingEnabled; }

    public boolean isFileLoggingEnabled() { return fileLoggingEnabled; }
    public void setFileLoggingEnabled(boolean fileLoggingEnabled) { this.fileLoggingEnabled = fileLoggingEnabled; }

    public String getLogFileName() { return logFileName; }
    public void setLogFileName(String logFileName) { this.logFileName = logFileName; }

    @Override
    public String toString() {
        return String.format("MazeConfiguration[%dx%d, scale=%d, population=%d, subdivisions=%d, pathFirst=%b, seed=%d]",
                mazeWidth, mazeHeight, scaleMultiplier, populationSize, subdivisionsPerMaze, pathFirst, randomSeed);
    }
}
