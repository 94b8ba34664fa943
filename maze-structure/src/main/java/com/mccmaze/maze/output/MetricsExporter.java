package com.mccmaze.maze.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mccmaze.maze.population.PopulationReport;
import com.mccmaze.maze.structure.MazeStructure;
import com.mccmaze.maze.util.LoggingUtil;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Writes maze metrics and structures as JSON for downstream result writers
 * and renderers.
 */
public class MetricsExporter {

    public static final String REPORT_FILE = "population-report.json";
    public static final String DECEPTIVE_TURNS_FILE = "deceptive-turns.json";
    public static final String DIVERSITY_FILE = "maze-diversity.json";
    public static final String STATISTICS_FILE = "structure-stats.json";
    public static final String MAZES_FILE = "maze-structures.json";

    private final ObjectMapper objectMapper;

    /**
     * Create a new MetricsExporter with pretty-printing enabled.
     */
    public MetricsExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Export any object to a JSON file, creating parent directories.
     */
    public void exportToFile(Object data, String filename) throws IOException {
        File file = new File(filename);
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }
        objectMapper.writeValue(file, data);
    }

    /**
     * Export data to a JSON string.
     */
    public String exportToString(Object data) throws IOException {
        return objectMapper.writeValueAsString(data);
    }

    /**
     * Write the full report plus one file per result kind into a directory.
     *
     * @param report Population analysis results
     * @param outputDirectory Target directory
     * @throws IOException If a file cannot be written
     */
    public void exportReport(PopulationReport report, String outputDirectory) throws IOException {
        exportToFile(report, new File(outputDirectory, REPORT_FILE).getPath());
        exportToFile(report.getDeceptiveTurnUnits(), new File(outputDirectory, DECEPTIVE_TURNS_FILE).getPath());
        exportToFile(report.getDiversityScores(), new File(outputDirectory, DIVERSITY_FILE).getPath());
        exportToFile(report.getStatistics(), new File(outputDirectory, STATISTICS_FILE).getPath());
        LoggingUtil.info("Exported population report to " + outputDirectory);
    }

    /**
     * Write wall layouts, start/target points and step budgets for rendering.
     */
    public void exportStructures(List<MazeStructure> mazes, String outputDirectory) throws IOException {
        exportToFile(mazes, new File(outputDirectory, MAZES_FILE).getPath());
        LoggingUtil.info("Exported " + mazes.size() + " maze structures to " + outputDirectory);
    }

    /**
     * Get the ObjectMapper for direct use if needed.
     */
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
