package com.refactorguard.classifier;

import com.google.common.base.Stopwatch;
import com.refactorguard.classifier.dataset.TrainingExample;
import com.refactorguard.classifier.forest.ForestParameters;
import com.refactorguard.classifier.forest.RandomForest;
import com.refactorguard.classifier.forest.RandomForestTrainer;
import com.refactorguard.features.FeatureExtractor;
import com.refactorguard.features.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Trains a {@link RiskModel} from labelled rewrites: hold out a fifth of the
 * rows, pick forest hyperparameters by 3-fold cross-validation on the rest,
 * refit the winner on the whole training part and score it on the held-out
 * rows. With the same seed and data the result is identical.
 */
public class RiskModelTrainer {

    private static final Logger log = LoggerFactory.getLogger(RiskModelTrainer.class);

    public static final long DEFAULT_SEED = 42;
    public static final double TEST_FRACTION = 0.2;
    public static final int FOLDS = 3;
    /** Smallest dataset that leaves a test row and one training row per fold. */
    public static final int MIN_EXAMPLES = 4;

    private final FeatureExtractor extractor;
    private final RandomForestTrainer forestTrainer;
    private final long seed;
    private final int threads;

    public RiskModelTrainer(FeatureExtractor extractor) {
        this(extractor, DEFAULT_SEED, Runtime.getRuntime().availableProcessors());
    }

    public RiskModelTrainer(FeatureExtractor extractor, long seed, int threads) {
        this.extractor = extractor;
        this.forestTrainer = new RandomForestTrainer();
        this.seed = seed;
        this.threads = threads;
    }

    public TrainingReport train(List<TrainingExample> examples) {
        if (examples.size() < MIN_EXAMPLES) {
            throw new IllegalArgumentException("Need at least " + MIN_EXAMPLES
                    + " training examples, got " + examples.size());
        }
        Stopwatch sw = Stopwatch.createStarted();

        double[][] x = new double[examples.size()][];
        int[] y = new int[examples.size()];
        for (int i = 0; i < examples.size(); i++) {
            TrainingExample example = examples.get(i);
            x[i] = extractor.extract(example.codeBefore(), example.codeAfter()).toArray();
            y[i] = example.errorIntroduced();
        }

        List<Integer> shuffled = new ArrayList<>(IntStream.range(0, x.length).boxed().toList());
        Collections.shuffle(shuffled, new Random(seed));
        int testSize = (int) Math.ceil(TEST_FRACTION * x.length);
        int[] test = shuffled.subList(0, testSize).stream().mapToInt(Integer::intValue).toArray();
        int[] train = shuffled.subList(testSize, x.length).stream().mapToInt(Integer::intValue).toArray();

        double[][] xTrain = GridSearch.rows(x, train);
        int[] yTrain = GridSearch.labels(y, train);

        GridSearch<ForestParameters, RandomForest> search = new GridSearch<>(forestTrainer, FOLDS, threads);
        GridSearch.Result<ForestParameters> best = search.search(xTrain, yTrain, ForestParameters.grid(seed));
        log.info("Best parameters: {} (CV accuracy {})", best.best(), String.format("%.2f", best.bestScore()));

        RandomForest forest = forestTrainer.fit(xTrain, yTrain, best.best());
        int[] actual = GridSearch.labels(y, test);
        int[] predicted = new int[test.length];
        for (int i = 0; i < test.length; i++) {
            predicted[i] = forest.predict(x[test[i]]);
        }
        EvaluationMetrics evaluation = EvaluationMetrics.score(actual, predicted);
        sw.stop();

        log.info("Model Performance: Accuracy={}, Precision={}, Recall={}",
                String.format("%.2f", evaluation.accuracy()),
                String.format("%.2f", evaluation.precision()),
                String.format("%.2f", evaluation.recall()));

        return TrainingReport.builder()
                .model(RiskModel.of(FeatureVector.SCHEMA, best.best(), evaluation, forest))
                .bestParameters(best.best())
                .crossValidationAccuracy(best.bestScore())
                .trainingSize(train.length)
                .elapsed(sw.elapsed())
                .build();
    }
}
