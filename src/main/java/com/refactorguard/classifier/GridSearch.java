package com.refactorguard.classifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

/**
 * Picks hyperparameters by stratified k-fold cross-validated accuracy.
 * Candidates are scored in parallel on a pool no larger than the grid; each
 * candidate works on its own copies of the fold data. Ties go to the
 * candidate listed first.
 */
public class GridSearch<P, M extends ProbabilisticClassifier> {

    private static final Logger log = LoggerFactory.getLogger(GridSearch.class);

    private final ClassifierTrainer<P, M> trainer;
    private final int folds;
    private final int threads;

    public GridSearch(ClassifierTrainer<P, M> trainer, int folds) {
        this(trainer, folds, Runtime.getRuntime().availableProcessors());
    }

    public GridSearch(ClassifierTrainer<P, M> trainer, int folds, int threads) {
        if (folds < 2) {
            throw new IllegalArgumentException("Cross-validation needs at least 2 folds: " + folds);
        }
        this.trainer = trainer;
        this.folds = folds;
        this.threads = Math.max(1, threads);
    }

    public Result<P> search(double[][] x, int[] y, List<P> grid) {
        if (grid.isEmpty()) {
            throw new IllegalArgumentException("Empty parameter grid");
        }
        int[] foldOf = stratifiedFolds(y, folds);
        ExecutorService exec = Executors.newFixedThreadPool(Math.min(grid.size(), threads));
        try {
            List<Future<Double>> futures = new ArrayList<>();
            for (P params : grid) {
                futures.add(exec.submit(() -> crossValidate(x, y, foldOf, params)));
            }
            List<Double> scores = new ArrayList<>();
            for (Future<Double> future : futures) {
                scores.add(await(future));
            }
            int best = 0;
            for (int i = 0; i < grid.size(); i++) {
                log.debug("CV accuracy {} for {}", String.format("%.3f", scores.get(i)), grid.get(i));
                if (scores.get(i) > scores.get(best)) {
                    best = i;
                }
            }
            return new Result<>(grid.get(best), scores.get(best), List.copyOf(scores));
        } finally {
            exec.shutdownNow();
        }
    }

    private double crossValidate(double[][] x, int[] y, int[] foldOf, P params) {
        double total = 0;
        for (int fold = 0; fold < folds; fold++) {
            int current = fold;
            int[] train = IntStream.range(0, y.length).filter(i -> foldOf[i] != current).toArray();
            int[] test = IntStream.range(0, y.length).filter(i -> foldOf[i] == current).toArray();
            M model = trainer.fit(rows(x, train), labels(y, train), params);
            int correct = 0;
            for (int i : test) {
                if (model.predict(x[i]) == y[i]) {
                    correct++;
                }
            }
            total += test.length == 0 ? 0 : (double) correct / test.length;
        }
        return total / folds;
    }

    /**
     * Fold index per row: rows are ordered by class and dealt round-robin, so
     * every fold gets its share of each class.
     */
    static int[] stratifiedFolds(int[] y, int folds) {
        if (y.length < folds) {
            throw new IllegalArgumentException("Cannot split " + y.length + " rows into " + folds + " folds");
        }
        int[] foldOf = new int[y.length];
        Integer[] order = IntStream.range(0, y.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingInt(i -> y[i]));
        for (int position = 0; position < order.length; position++) {
            foldOf[order[position]] = position % folds;
        }
        return foldOf;
    }

    private static double await(Future<Double> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Grid search interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Grid search candidate failed", e.getCause());
        }
    }

    static double[][] rows(double[][] x, int[] indices) {
        double[][] subset = new double[indices.length][];
        for (int i = 0; i < indices.length; i++) {
            subset[i] = x[indices[i]].clone();
        }
        return subset;
    }

    static int[] labels(int[] y, int[] indices) {
        int[] subset = new int[indices.length];
        for (int i = 0; i < indices.length; i++) {
            subset[i] = y[indices[i]];
        }
        return subset;
    }

    /**
     * @param scores mean CV accuracy of every candidate, in grid order
     */
    public record Result<P>(P best, double bestScore, List<Double> scores) {
    }
}
