package com.refactorguard.service;

import com.refactorguard.classifier.RiskModelStore;
import com.refactorguard.config.RefactoringConfig;
import com.refactorguard.features.FeatureExtractor;
import com.refactorguard.features.FeatureVector;
import com.refactorguard.parser.SourceParser;
import com.refactorguard.util.SourceFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class RefactoringRunnerTest {

    @TempDir
    Path dir;

    @Test
    void writesEveryFileAndKeepsInputOrder() throws IOException {
        Path src = Files.createDirectories(dir.resolve("src"));
        Path out = dir.resolve("refactored_code");
        Files.writeString(src.resolve("A.java"), """
                class A {
                    void m(boolean p, boolean q) {
                        if (p) {
                            if (q) {
                                go();
                            }
                        }
                    }
                }
                """);
        Files.writeString(src.resolve("B.java"), "class B { }\n");
        Files.writeString(src.resolve("C.java"), "class C { void m( }\n");

        // gate requested but no model stored: everything proceeds unfiltered
        RefactoringConfig config = RefactoringConfig.builder()
                .riskGateEnabled(true)
                .modelPath(dir.resolve("missing.json"))
                .outputDir(out)
                .build();
        RefactoringService service = RefactoringService.create(config, new SourceParser(),
                new FeatureExtractor(), new RiskModelStore(FeatureVector.SCHEMA));

        List<FileOutcome> outcomes = new RefactoringRunner(service, 3).run(SourceFiles.collect(src), out);

        assertThat(outcomes).extracting(FileOutcome::getStatus).containsExactly(
                FileOutcome.Status.REFACTORED, FileOutcome.Status.UNCHANGED, FileOutcome.Status.PARSE_FAILURE);
        assertThat(service.isGateActive()).isFalse();
        assertThat(SourceFiles.read(out.resolve("A.java"))).contains("if (p && q)");
        assertThat(SourceFiles.read(out.resolve("B.java"))).isEqualTo("class B { }\n");
        assertThat(SourceFiles.read(out.resolve("C.java"))).isEqualTo("class C { void m( }\n");
    }

    @Test
    void nothingIsWrittenWithoutOutputDir() throws IOException {
        Path file = Files.writeString(dir.resolve("B.java"), "class B { }\n");
        RefactoringService service = RefactoringService.create(RefactoringConfig.defaults(), new SourceParser(),
                new FeatureExtractor(), new RiskModelStore(FeatureVector.SCHEMA));

        List<FileOutcome> outcomes = new RefactoringRunner(service, 1).run(List.of(file), null);

        assertThat(outcomes).singleElement().extracting(FileOutcome::getName).isEqualTo(file.toString());
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void emptyInputGivesNoOutcomes() throws IOException {
        RefactoringService service = RefactoringService.create(RefactoringConfig.defaults(), new SourceParser(),
                new FeatureExtractor(), new RiskModelStore(FeatureVector.SCHEMA));

        assertThat(new RefactoringRunner(service, 2).run(List.of(), dir)).isEmpty();
    }

    @Test
    void sameNamedFilesInDifferentDirectoriesBothSurvive() throws IOException {
        Path first = Files.createDirectories(dir.resolve("in/a")).resolve("Foo.java");
        Path second = Files.createDirectories(dir.resolve("in/b")).resolve("Foo.java");
        Files.writeString(first, "class Foo { int a; }\n");
        Files.writeString(second, "class Foo { int b; }\n");
        Path out = dir.resolve("out");
        RefactoringService service = RefactoringService.create(RefactoringConfig.defaults(), new SourceParser(),
                new FeatureExtractor(), new RiskModelStore(FeatureVector.SCHEMA));

        new RefactoringRunner(service, 4).run(List.of(first, second), out);

        assertThat(SourceFiles.read(out.resolve("a/Foo.java"))).isEqualTo("class Foo { int a; }\n");
        assertThat(SourceFiles.read(out.resolve("b/Foo.java"))).isEqualTo("class Foo { int b; }\n");
    }

    @Test
    void diffNamesTheRelativeOutputFile() throws IOException {
        Path file = Files.createDirectories(dir.resolve("in/pkg")).resolve("N.java");
        Path other = dir.resolve("in/Other.java");
        Files.writeString(other, "class Other { }\n");
        Files.writeString(file, """
                class N {
                    void m(boolean p, boolean q) {
                        if (p) {
                            if (q) {
                                go();
                            }
                        }
                    }
                }
                """);
        Path out = dir.resolve("out");
        RefactoringService service = RefactoringService.create(RefactoringConfig.defaults(), new SourceParser(),
                new FeatureExtractor(), new RiskModelStore(FeatureVector.SCHEMA));

        List<FileOutcome> outcomes = new RefactoringRunner(service, 2).run(List.of(other, file), out);

        assertThat(outcomes.get(1).getDiff()).contains("+++ " + out.resolve("pkg/N.java"));
    }
}
