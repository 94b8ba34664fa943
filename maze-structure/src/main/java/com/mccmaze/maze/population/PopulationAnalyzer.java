package com.mccmaze.maze.population;

import com.mccmaze.maze.analysis.DeceptiveTurnUnit;
import com.mccmaze.maze.analysis.MazeDiversityCalculator;
import com.mccmaze.maze.analysis.MazeDiversityScore;
import com.mccmaze.maze.analysis.MazeDiversityUnit;
import com.mccmaze.maze.analysis.SolutionPathMetrics;
import com.mccmaze.maze.analysis.SolutionPathAnalyzer;
import com.mccmaze.maze.structure.MazeGenerationException;
import com.mccmaze.maze.structure.MazeStructure;
import com.mccmaze.maze.util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Computes path metrics and diversity for a whole maze population.
 *
 * Work runs in two phases on a fixed thread pool. First every maze is
 * analyzed by exactly one task, which is also the only writer to that maze's
 * grid annotations. Then each unordered pair of mazes is scored once from the
 * solution paths found in the first phase.
 */
public class PopulationAnalyzer {

    private final int parallelism;

    /**
     * @param parallelism Worker thread count, or 0 for one per available processor
     */
    public PopulationAnalyzer(int parallelism) {
        if (parallelism < 0) {
            throw new IllegalArgumentException("Parallelism must not be negative: " + parallelism);
        }
        this.parallelism = parallelism == 0 ? Runtime.getRuntime().availableProcessors() : parallelism;
    }

    public PopulationReport analyze(List<MazeStructure> mazes) {
        LoggingUtil.info("Analyzing population of " + mazes.size() + " mazes on " + parallelism + " threads");

        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            List<Callable<SolutionPathMetrics>> pathTasks = new ArrayList<>(mazes.size());
            for (MazeStructure maze : mazes) {
                pathTasks.add(() -> SolutionPathAnalyzer.analyze(maze));
            }
            List<SolutionPathMetrics> pathMetrics = collect(executor.invokeAll(pathTasks));
            LoggingUtil.info("Solution path analysis complete");

            List<Callable<MazeDiversityUnit>> pairTasks = new ArrayList<>();
            for (int i = 0; i < pathMetrics.size(); i++) {
                for (int j = i + 1; j < pathMetrics.size(); j++) {
                    SolutionPathMetrics first = pathMetrics.get(i);
                    SolutionPathMetrics second = pathMetrics.get(j);
                    pairTasks.add(() -> new MazeDiversityUnit(first.getGenomeId(), second.getGenomeId(),
                            MazeDiversityCalculator.computeDiversity(first.getSolutionPath(), second.getSolutionPath())));
                }
            }
            List<MazeDiversityUnit> pairwise = collect(executor.invokeAll(pairTasks));
            LoggingUtil.info("Scored " + pairwise.size() + " maze pairs");

            List<MazeDiversityScore> scores = aggregateDiversity(pathMetrics, pairwise);
            List<DeceptiveTurnUnit> deceptiveTurnUnits = new ArrayList<>(pathMetrics.size());
            for (SolutionPathMetrics metrics : pathMetrics) {
                deceptiveTurnUnits.add(metrics.toDeceptiveTurnUnit());
            }

            PopulationStructureStats stats = new PopulationStructureStats(mazes, pathMetrics, scores);
            LoggingUtil.info("Population statistics: " + stats);

            return new PopulationReport(pathMetrics, deceptiveTurnUnits, pairwise, scores, stats);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Population analysis was interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Mean pairwise score of each maze against every other maze. A maze with
     * no peers scores 0.
     */
    static List<MazeDiversityScore> aggregateDiversity(List<SolutionPathMetrics> pathMetrics,
                                                       List<MazeDiversityUnit> pairwise) {
        int size = pathMetrics.size();
        double[] totals = new double[size];

        // Pairs were generated in (i, j) order with i < j
        int pairIndex = 0;
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                double score = pairwise.get(pairIndex++).getDiversityScore();
                totals[i] += score;
                totals[j] += score;
            }
        }

        List<MazeDiversityScore> scores = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            double average = size > 1 ? totals[i] / (size - 1) : 0.0;
            scores.add(new MazeDiversityScore(pathMetrics.get(i).getGenomeId(), average));
        }
        return scores;
    }

    private static <T> List<T> collect(List<Future<T>> futures) throws InterruptedException {
        List<T> results = new ArrayList<>(futures.size());
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                LoggingUtil.warn("Maze analysis task failed: " + cause.getMessage(), cause);
                if (cause instanceof MazeGenerationException) {
                    throw (MazeGenerationException) cause;
                }
                throw new IllegalStateException("Maze analysis task failed", cause);
            }
        }
        return results;
    }

    public int getParallelism() {
        return parallelism;
    }
}
