package com.mccmaze.maze;

import com.fasterxml.jackson.databind.JsonNode;
import com.mccmaze.maze.configuration.ConfigurationLoader;
import com.mccmaze.maze.configuration.MazeConfiguration;
import com.mccmaze.maze.output.MetricsExporter;
import com.mccmaze.maze.population.PopulationReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class MazeStructureApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    public void testRunRandomPathFirstPopulation() throws IOException {
        MazeConfiguration config = new ConfigurationLoader().loadFromResource("test-config.json");
        config.setOutputDirectory(tempDir.toString());

        PopulationReport report = MazeStructureApplication.run(config);

        assertEquals(4, report.getPathMetrics().size());
        assertEquals(6, report.getPairwiseDiversity().size());
        for (int i = 0; i < 4; i++) {
            // Staircase paths have no detours
            assertEquals(6 + 5 - 2, report.getPathMetrics().get(i).getPathLength());
        }
        assertTrue(new File(tempDir.toFile(), MetricsExporter.REPORT_FILE).isFile());
        assertTrue(new File(tempDir.toFile(), MetricsExporter.MAZES_FILE).isFile());

        assertTrue(report.getEstimatedMaxPartitions() > 0);
        JsonNode exported = new MetricsExporter().getObjectMapper()
                .readTree(new File(tempDir.toFile(), MetricsExporter.REPORT_FILE));
        assertEquals(report.getEstimatedMaxPartitions(), exported.get("estimatedMaxPartitions").asInt());
    }

    @Test
    public void testRunFromBlueprintFile() throws IOException, URISyntaxException {
        MazeConfiguration config = new MazeConfiguration(4, 4, 10);
        config.setBlueprintFile(Paths.get(getClass().getClassLoader()
                .getResource("test-blueprints.json").toURI()).toString());
        config.setParallelism(2);
        config.setPartitionSamples(20);
        config.setRandomSeed(5);
        config.setOutputDirectory(tempDir.toString());

        PopulationReport report = MazeStructureApplication.run(config);

        assertEquals(2, report.getPathMetrics().size());
        assertEquals(7, report.getPathMetrics().get(0).getGenomeId());
        assertEquals(4, report.getPathMetrics().get(1).getPathLength());
        assertEquals(1, report.getPairwiseDiversity().size());
        assertTrue(new File(tempDir.toFile(), MetricsExporter.STATISTICS_FILE).isFile());
    }
}
