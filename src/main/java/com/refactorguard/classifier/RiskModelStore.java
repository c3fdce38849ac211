package com.refactorguard.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes {@link RiskModel}s as JSON documents.
 */
public class RiskModelStore {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final List<String> expectedSchema;

    /**
     * @param expectedSchema feature names, in order, a loaded model must have been trained on
     */
    public RiskModelStore(List<String> expectedSchema) {
        this.expectedSchema = List.copyOf(expectedSchema);
    }

    public void save(RiskModel model, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), model);
    }

    /**
     * @throws ModelNotFoundException  when nothing is stored at {@code path}
     * @throws SchemaMismatchException when the stored model does not fit this build
     */
    public RiskModel load(Path path) throws ModelNotFoundException, IOException {
        if (!Files.isRegularFile(path)) {
            throw new ModelNotFoundException(path);
        }
        RiskModel model = mapper.readValue(path.toFile(), RiskModel.class);
        if (model.formatVersion() != RiskModel.FORMAT_VERSION) {
            throw new SchemaMismatchException("Model at " + path + " has format version "
                    + model.formatVersion() + ", expected " + RiskModel.FORMAT_VERSION);
        }
        if (!expectedSchema.equals(model.featureSchema())) {
            throw new SchemaMismatchException("Model at " + path + " was trained on features "
                    + model.featureSchema() + ", expected " + expectedSchema);
        }
        return model;
    }
}
