package com.refactorguard.classifier;

import com.refactorguard.classifier.dataset.TrainingExample;

import java.util.ArrayList;
import java.util.List;

/** Small labelled set: half the rewrites leave the code unparseable. */
final class TrainingExamples {

    private TrainingExamples() {
    }

    static List<TrainingExample> sample(int size) {
        List<TrainingExample> examples = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            String before = "for (int v : items" + i + ") {\n    out.add(v + " + i + ");\n}";
            if (i % 2 == 0) {
                String after = "out = items" + i + ".stream().map(v -> v + " + i + ").collect(Collectors.toList());";
                examples.add(new TrainingExample(before, after, 0));
            } else {
                String after = "out = items" + i + ".stream().map(v -> v + " + i + ".collect(";
                examples.add(new TrainingExample(before, after, 1));
            }
        }
        return examples;
    }
}
