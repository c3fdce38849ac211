package com.refactorguard.classifier;

import com.refactorguard.features.FeatureVector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RiskModelStoreTest {

    private final RiskModelStore store = new RiskModelStore(FeatureVector.SCHEMA);

    @TempDir
    Path dir;

    @Test
    void savedModelLoadsBackAndPredictsTheSame() throws Exception {
        RiskModel model = Models.lengthAfterModel();
        Path path = dir.resolve("models/nested/risk-model.json");

        store.save(model, path);
        RiskModel loaded = store.load(path);

        assertThat(loaded.featureSchema()).isEqualTo(model.featureSchema());
        assertThat(loaded.parameters()).isEqualTo(model.parameters());
        assertThat(loaded.evaluation()).isEqualTo(model.evaluation());
        assertThat(loaded.forest().trees()).hasSameSizeAs(model.forest().trees());
        double[] probe = new double[FeatureVector.SCHEMA.size()];
        assertThat(loaded.probabilityOfPositive(probe)).isEqualTo(model.probabilityOfPositive(probe));
        probe[FeatureVector.SCHEMA.indexOf(FeatureVector.LENGTH_AFTER)] = 4;
        assertThat(loaded.probabilityOfPositive(probe)).isEqualTo(model.probabilityOfPositive(probe));
    }

    @Test
    void missingFileIsReportedWithItsPath() {
        Path path = dir.resolve("absent.json");

        assertThatThrownBy(() -> store.load(path))
                .isInstanceOf(ModelNotFoundException.class)
                .hasMessage("No trained model found at " + path)
                .satisfies(e -> assertThat(((ModelNotFoundException) e).getPath()).isEqualTo(path));
    }

    @Test
    void rejectsModelTrainedOnOtherFeatures() throws Exception {
        RiskModel model = Models.lengthAfterModel();
        List<String> reordered = new ArrayList<>(FeatureVector.SCHEMA);
        Collections.reverse(reordered);
        Path path = dir.resolve("reordered.json");
        store.save(RiskModel.of(reordered, model.parameters(), model.evaluation(), model.forest()), path);

        assertThatThrownBy(() -> store.load(path))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("trained on features");
    }

    @Test
    void rejectsOtherFormatVersion() throws Exception {
        RiskModel model = Models.lengthAfterModel();
        Path path = dir.resolve("future.json");
        store.save(new RiskModel(RiskModel.FORMAT_VERSION + 1, model.featureSchema(),
                model.parameters(), model.evaluation(), model.forest()), path);

        assertThatThrownBy(() -> store.load(path))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("format version");
    }
}
