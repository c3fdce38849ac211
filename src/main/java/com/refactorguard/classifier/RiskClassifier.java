package com.refactorguard.classifier;

import com.refactorguard.features.FeatureExtractor;
import com.refactorguard.features.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Estimates how likely a rewrite is to have introduced an error. The model is
 * loaded from {@code modelPath} on first use and then shared read-only.
 */
public class RiskClassifier {

    private static final Logger log = LoggerFactory.getLogger(RiskClassifier.class);

    private final FeatureExtractor extractor;
    private final RiskModelStore store;
    private final Path modelPath;

    private volatile RiskModel model;

    public RiskClassifier(FeatureExtractor extractor, RiskModelStore store, Path modelPath) {
        this.extractor = extractor;
        this.store = store;
        this.modelPath = modelPath;
    }

    /** Uses {@code model} directly; nothing is read from disk. */
    public RiskClassifier(FeatureExtractor extractor, RiskModel model) {
        this(extractor, null, null);
        this.model = model;
    }

    /**
     * @return probability in [0, 1] that {@code after} is broken
     * @throws ModelNotFoundException  when no model is loaded and none is stored
     * @throws SchemaMismatchException when the stored model was trained on other features
     */
    public double riskOf(String before, String after) throws ModelNotFoundException {
        FeatureVector features = extractor.extract(before, after);
        RiskModel resident = model();
        if (!features.keys().equals(resident.featureSchema())) {
            throw new SchemaMismatchException("Model was trained on features " + resident.featureSchema()
                    + " but was given " + features.keys());
        }
        return resident.probabilityOfPositive(features.toArray());
    }

    public RiskModel model() throws ModelNotFoundException {
        RiskModel loaded = model;
        if (loaded == null) {
            synchronized (this) {
                loaded = model;
                if (loaded == null) {
                    loaded = load();
                    model = loaded;
                }
            }
        }
        return loaded;
    }

    private RiskModel load() throws ModelNotFoundException {
        if (store == null) {
            throw new ModelNotFoundException(modelPath);
        }
        try {
            RiskModel loaded = store.load(modelPath);
            log.info("Loaded risk model from {} ({} trees)", modelPath, loaded.forest().trees().size());
            return loaded;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read model " + modelPath, e);
        }
    }
}
