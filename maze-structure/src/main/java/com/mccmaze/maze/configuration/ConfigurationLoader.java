package com.mccmaze.maze.configuration;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mccmaze.maze.generation.MazeBlueprint;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads and saves maze configurations and blueprint files as JSON.
 */
public class ConfigurationLoader {

    public static final String DEFAULT_CONFIGURATION_RESOURCE = "maze-config.json";

    private final ObjectMapper objectMapper;

    /**
     * Constructor initializes the Jackson ObjectMapper with pretty printing.
     */
    public ConfigurationLoader() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Load a configuration from a JSON file and validate it.
     *
     * @param filename Path to the JSON configuration file
     * @return Validated configuration
     * @throws IOException If the file is missing or cannot be parsed
     * @throws IllegalArgumentException If a setting is out of range
     */
    public MazeConfiguration loadFromJSON(String filename) throws IOException {
        File file = new File(filename);
        if (!file.exists()) {
            throw new IOException("Configuration file not found: " + filename);
        }

        MazeConfiguration config = objectMapper.readValue(file, MazeConfiguration.class);
        validateConfiguration(config);
        return config;
    }

    /**
     * Load a configuration bundled on the classpath.
     */
    public MazeConfiguration loadFromResource(String resourceName) throws IOException {
        try (InputStream in = openResource(resourceName)) {
            MazeConfiguration config = objectMapper.readValue(in, MazeConfiguration.class);
            validateConfiguration(config);
            return config;
        }
    }

    /**
     * Save a configuration to a JSON file, creating parent directories.
     */
    public void saveConfigurationToJSON(MazeConfiguration config, String filename) throws IOException {
        File file = new File(filename);
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }
        objectMapper.writeValue(file, config);
    }

    /**
     * Load a JSON array of maze blueprints from a file.
     */
    public List<MazeBlueprint> loadBlueprints(String filename) throws IOException {
        File file = new File(filename);
        if (!file.exists()) {
            throw new IOException("Blueprint file not found: " + filename);
        }
        return objectMapper.readValue(file, new TypeReference<List<MazeBlueprint>>() { });
    }

    /**
     * Load a JSON array of maze blueprints from the classpath.
     */
    public List<MazeBlueprint> loadBlueprintsFromResource(String resourceName) throws IOException {
        try (InputStream in = openResource(resourceName)) {
            return objectMapper.readValue(in, new TypeReference<List<MazeBlueprint>>() { });
        }
    }

    private InputStream openResource(String resourceName) throws IOException {
        InputStream in = ConfigurationLoader.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            throw new IOException("Resource not found on classpath: " + resourceName);
        }
        return in;
    }

    /**
     * Validate a configuration.
     *
     * @param config Configuration to validate
     * @throws IllegalArgumentException naming the first invalid setting
     */
    public void validateConfiguration(MazeConfiguration config) {
        if (config == null) {
            throw new IllegalArgumentException("Configuration is missing");
        }
        requirePositive("mazeWidth", config.getMazeWidth());
        requirePositive("mazeHeight", config.getMazeHeight());
        requirePositive("scaleMultiplier", config.getScaleMultiplier());
        requirePositive("partitionSamples", config.getPartitionSamples());
        if (config.getPopulationSize() < 0) {
            throw new IllegalArgumentException("populationSize must not be negative: " + config.getPopulationSize());
        }
        if (config.getSubdivisionsPerMaze() < 0) {
            throw new IllegalArgumentException("subdivisionsPerMaze must not be negative: " + config.getSubdivisionsPerMaze());
        }
        if (config.getParallelism() < 0) {
            throw new IllegalArgumentException("parallelism must not be negative: " + config.getParallelism());
        }
        if (config.getOutputDirectory() == null || config.getOutputDirectory().isEmpty()) {
            throw new IllegalArgumentException("outputDirectory must be set");
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
