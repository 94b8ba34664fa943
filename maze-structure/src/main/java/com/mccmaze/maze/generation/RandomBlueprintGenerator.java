package com.mccmaze.maze.generation;

import com.mccmaze.maze.structure.GridPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Produces random blueprints in place of an evolved maze population.
 */
public class RandomBlueprintGenerator {

    private static final int ROOM_INDEX_RANGE = 16;

    private final Random random;

    public RandomBlueprintGenerator(Random random) {
        this.random = random;
    }

    /**
     * @param seed Seed for reproducible output, or 0 for an unseeded generator
     */
    public RandomBlueprintGenerator(long seed) {
        this(seed == 0 ? new Random() : new Random(seed));
    }

    /**
     * A standard-mode blueprint with the given number of random commands.
     */
    public MazeBlueprint generate(long genomeId, int width, int height, int numCommands) {
        return new MazeBlueprint(genomeId, width, height, randomCommands(numCommands));
    }

    /**
     * A path-first blueprint whose solution path is a random east/south
     * staircase from the top-left cell to the bottom-right cell.
     */
    public MazeBlueprint generatePathFirst(long genomeId, int width, int height, int numCommands) {
        return new MazeBlueprint(genomeId, width, height, randomCommands(numCommands), randomPath(width, height));
    }

    /**
     * A population of blueprints with consecutive genome ids starting at 1.
     */
    public List<MazeBlueprint> generatePopulation(int size, int width, int height, int numCommands,
                                                  boolean pathFirst) {
        List<MazeBlueprint> blueprints = new ArrayList<>(size);
        for (int i = 1; i <= size; i++) {
            blueprints.add(pathFirst
                    ? generatePathFirst(i, width, height, numCommands)
                    : generate(i, width, height, numCommands));
        }
        return blueprints;
    }

    private List<SubdivisionCommand> randomCommands(int numCommands) {
        List<SubdivisionCommand> commands = new ArrayList<>(numCommands);
        for (int i = 0; i < numCommands; i++) {
            commands.add(new SubdivisionCommand(random.nextInt(ROOM_INDEX_RANGE),
                    random.nextDouble(), random.nextDouble(), random.nextBoolean()));
        }
        return commands;
    }

    List<GridPoint> randomPath(int width, int height) {
        List<GridPoint> path = new ArrayList<>(width + height - 1);
        int x = 0;
        int y = 0;
        path.add(new GridPoint(x, y));

        while (x < width - 1 || y < height - 1) {
            boolean east = y == height - 1 || (x < width - 1 && random.nextBoolean());
            if (east) {
                x++;
            } else {
                y++;
            }
            path.add(new GridPoint(x, y));
        }
        return path;
    }
}
