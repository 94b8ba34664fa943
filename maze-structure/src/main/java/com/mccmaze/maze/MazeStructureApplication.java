package com.mccmaze.maze;

import com.mccmaze.maze.configuration.ConfigurationLoader;
import com.mccmaze.maze.configuration.MazeConfiguration;
import com.mccmaze.maze.generation.MazeBlueprint;
import com.mccmaze.maze.generation.MazeStructureBuilder;
import com.mccmaze.maze.generation.PartitionEstimator;
import com.mccmaze.maze.generation.RandomBlueprintGenerator;
import com.mccmaze.maze.output.MetricsExporter;
import com.mccmaze.maze.population.PopulationAnalyzer;
import com.mccmaze.maze.population.PopulationReport;
import com.mccmaze.maze.structure.MazeStructure;
import com.mccmaze.maze.util.LoggingUtil;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Random;

/**
 * Command line entry point: builds a maze population, analyzes its
 * structure and writes the results as JSON.
 *
 * Usage: {@code MazeStructureApplication [config.json]}. Without an argument
 * the bundled default configuration is used.
 */
public class MazeStructureApplication {

    public static void main(String[] args) {
        try {
            MazeConfiguration config = loadConfiguration(args);
            LoggingUtil.initialize(config);
            LoggingUtil.info("Maze structure analysis starting: " + config);

            PopulationReport report = run(config);
            LoggingUtil.info("Analysis completed. Mean deceptive turns: "
                    + String.format("%.2f", report.getStatistics().getDeceptiveTurns().getMean())
                    + ", mean diversity: "
                    + String.format("%.2f", report.getStatistics().getDiversity().getMean()));
            LoggingUtil.info("Results saved to: " + new File(config.getOutputDirectory()).getAbsolutePath());
        } catch (Exception e) {
            LoggingUtil.error("Application error: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Build, analyze and export one population.
     *
     * @param config Validated configuration
     * @return The population report that was exported
     * @throws IOException If blueprints cannot be read or results cannot be written
     */
    public static PopulationReport run(MazeConfiguration config) throws IOException {
        ConfigurationLoader loader = new ConfigurationLoader();
        List<MazeBlueprint> blueprints = loadBlueprints(config, loader);
        LoggingUtil.info("Building " + blueprints.size() + " mazes");

        MazeStructureBuilder builder = new MazeStructureBuilder(config.getScaleMultiplier());
        List<MazeStructure> mazes = builder.buildAll(blueprints);

        Random random = config.getRandomSeed() == 0 ? new Random() : new Random(config.getRandomSeed());
        PartitionEstimator estimator = new PartitionEstimator(random);
        int maxPartitions = estimator.estimateMaxPartitions(config.getMazeWidth(), config.getMazeHeight(),
                config.getPartitionSamples());
        LoggingUtil.info("Estimated max partitions for " + config.getMazeWidth() + "x" + config.getMazeHeight()
                + " mazes: " + maxPartitions);

        PopulationReport report = new PopulationAnalyzer(config.getParallelism()).analyze(mazes);
        report.setEstimatedMaxPartitions(maxPartitions);

        MetricsExporter exporter = new MetricsExporter();
        exporter.exportReport(report, config.getOutputDirectory());
        exporter.exportStructures(mazes, config.getOutputDirectory());
        return report;
    }

    private static MazeConfiguration loadConfiguration(String[] args) throws IOException {
        ConfigurationLoader loader = new ConfigurationLoader();
        if (args.length > 0) {
            return loader.loadFromJSON(args[0]);
        }
        return loader.loadFromResource(ConfigurationLoader.DEFAULT_CONFIGURATION_RESOURCE);
    }

    private static List<MazeBlueprint> loadBlueprints(MazeConfiguration config, ConfigurationLoader loader)
            throws IOException {
        if (config.hasBlueprintFile()) {
            LoggingUtil.info("Loading blueprints from " + config.getBlueprintFile());
            List<MazeBlueprint> blueprints = loader.loadBlueprints(config.getBlueprintFile());
            for (MazeBlueprint blueprint : blueprints) {
                if (blueprint.getWidth() != config.getMazeWidth() || blueprint.getHeight() != config.getMazeHeight()) {
                    LoggingUtil.warn("Blueprint " + blueprint.getGenomeId() + " is " + blueprint.getWidth() + "x"
                            + blueprint.getHeight() + "; partition estimate uses the configured "
                            + config.getMazeWidth() + "x" + config.getMazeHeight());
                }
            }
            return blueprints;
        }

        RandomBlueprintGenerator generator = new RandomBlueprintGenerator(config.getRandomSeed());
        return generator.generatePopulation(config.getPopulationSize(), config.getMazeWidth(),
                config.getMazeHeight(), config.getSubdivisionsPerMaze(), config.isPathFirst());
    }
}
