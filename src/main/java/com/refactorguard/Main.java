package com.refactorguard;

import com.refactorguard.classifier.ModelNotFoundException;
import com.refactorguard.classifier.RiskClassifier;
import com.refactorguard.classifier.RiskModelStore;
import com.refactorguard.classifier.RiskModelTrainer;
import com.refactorguard.classifier.TrainingReport;
import com.refactorguard.classifier.dataset.TrainingDataset;
import com.refactorguard.config.RefactoringConfig;
import com.refactorguard.config.RefactoringProperties;
import com.refactorguard.detector.DetectorKind;
import com.refactorguard.detector.Issue;
import com.refactorguard.detector.IssueReport;
import com.refactorguard.detector.PatternDetectors;
import com.refactorguard.features.FeatureExtractor;
import com.refactorguard.parser.ParseFailureException;
import com.refactorguard.parser.SourceParser;
import com.refactorguard.service.FileOutcome;
import com.refactorguard.service.RefactoringRunner;
import com.refactorguard.service.RefactoringService;
import com.refactorguard.util.SourceFiles;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point.
 * <pre>
 *   analyze  &lt;path&gt; [--verbose]
 *   refactor &lt;path&gt; [--output=dir] [--use-ml-filter] [--verbose]
 *   train    --data=file.csv [--model=path]
 *   predict  --before=file --after=file [--model=path]
 * </pre>
 * Any {@code refactoring.*} property can also be given as {@code --refactoring.name=value}.
 */
@SpringBootApplication
public class Main implements CommandLineRunner {

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  analyze  <path> [--verbose]",
            "  refactor <path> [--output=dir] [--use-ml-filter] [--verbose]",
            "  train    --data=file.csv [--model=path]",
            "  predict  --before=file --after=file [--model=path]");

    private final RefactoringProperties properties;
    private final SourceParser parser;
    private final FeatureExtractor extractor;
    private final RiskModelStore store;
    private final RiskModelTrainer trainer;

    public Main(RefactoringProperties properties,
                SourceParser parser,
                FeatureExtractor extractor,
                RiskModelStore store,
                RiskModelTrainer trainer) {
        this.properties = properties;
        this.parser = parser;
        this.extractor = extractor;
        this.store = store;
        this.trainer = trainer;
    }

    public static void main(String[] args) {
        SpringApplication.run(Main.class, args);
    }

    @Override
    public void run(String... args) throws Exception {
        ApplicationArguments arguments = new DefaultApplicationArguments(args);
        List<String> positional = arguments.getNonOptionArgs();
        if (positional.isEmpty()) {
            System.out.println(USAGE);
            return;
        }

        RefactoringConfig config = configFor(arguments);
        if (config.isVerbose()) {
            LoggingSystem.get(Main.class.getClassLoader()).setLogLevel("com.refactorguard", LogLevel.DEBUG);
        }

        switch (positional.get(0)) {
            case "analyze" -> analyze(requirePath(positional), config);
            case "refactor" -> refactor(requirePath(positional), config);
            case "train" -> train(requireOption(arguments, "data"), config);
            case "predict" -> predict(requireOption(arguments, "before"), requireOption(arguments, "after"), config);
            default -> throw new IllegalArgumentException("Unknown command '" + positional.get(0) + "'\n" + USAGE);
        }
    }

    private RefactoringConfig configFor(ApplicationArguments arguments) {
        RefactoringConfig.RefactoringConfigBuilder builder = properties.toConfig().toBuilder();
        if (arguments.containsOption("output")) {
            builder.outputDir(Path.of(requireOption(arguments, "output")));
        }
        if (arguments.containsOption("use-ml-filter")) {
            builder.riskGateEnabled(true);
        }
        if (arguments.containsOption("model")) {
            builder.modelPath(Path.of(requireOption(arguments, "model")));
        }
        if (arguments.containsOption("verbose")) {
            builder.verbose(true);
        }
        return builder.build();
    }

    private void analyze(Path input, RefactoringConfig config) throws IOException {
        PatternDetectors detectors = PatternDetectors.standard();
        Map<DetectorKind, Integer> totals = new EnumMap<>(DetectorKind.class);
        for (Path file : SourceFiles.collect(input)) {
            IssueReport report;
            try {
                report = detectors.detect(parser.parse(file.toString(), SourceFiles.read(file)));
            } catch (ParseFailureException e) {
                System.out.println("Syntax error in " + file + ": " + e.getProblems());
                continue;
            }
            if (report.isEmpty()) {
                if (config.isVerbose()) {
                    System.out.println("No issues found in " + file + ".");
                }
                continue;
            }
            System.out.println("Issues in " + file + ":");
            for (Issue issue : report.all()) {
                System.out.println(issue);
                totals.merge(issue.detectorKind(), 1, Integer::sum);
            }
        }
        totals.forEach((kind, count) -> System.out.printf("%s: %d%n", kind, count));
    }

    private void refactor(Path input, RefactoringConfig config) throws IOException {
        RefactoringService service = RefactoringService.create(config, parser, extractor, store);
        RefactoringRunner runner = new RefactoringRunner(service, config.getThreads());
        List<FileOutcome> outcomes = runner.run(SourceFiles.collect(input), config.getOutputDir());

        Map<FileOutcome.Status, Integer> totals = new EnumMap<>(FileOutcome.Status.class);
        for (FileOutcome outcome : outcomes) {
            totals.merge(outcome.getStatus(), 1, Integer::sum);
            if (!config.isVerbose()) {
                continue;
            }
            if (!outcome.getIssues().isEmpty()) {
                System.out.println("Issues in " + outcome.getName() + ":");
                outcome.getIssues().all().forEach(System.out::println);
            }
            if (outcome.isChanged() && !outcome.getDiff().isBlank()) {
                System.out.println("Refactoring Diff:");
                System.out.println(outcome.getDiff());
            }
        }
        System.out.printf("Processed %d files into %s: %s%n", outcomes.size(), config.getOutputDir(), totals);
    }

    private void train(String data, RefactoringConfig config) throws IOException {
        TrainingReport report = trainer.train(TrainingDataset.load(Path.of(data)));
        store.save(report.getModel(), config.getModelPath());
        System.out.println(report);
        System.out.println("Model saved to " + config.getModelPath());
    }

    private void predict(String before, String after, RefactoringConfig config) throws IOException {
        RiskClassifier classifier = new RiskClassifier(extractor, store, config.getModelPath());
        try {
            double risk = classifier.riskOf(SourceFiles.read(Path.of(before)), SourceFiles.read(Path.of(after)));
            System.out.printf("Probability of introducing an error: %.2f%n", risk);
            System.out.println(risk > config.getRiskThreshold() ? "Risky, the refactoring would be skipped."
                    : "Accepted.");
        } catch (ModelNotFoundException e) {
            System.out.println(e.getMessage() + ". Train one first with: train --data=file.csv");
        }
    }

    private static Path requirePath(List<String> positional) {
        if (positional.size() < 2) {
            throw new IllegalArgumentException("Missing input path\n" + USAGE);
        }
        return Path.of(positional.get(1));
    }

    private static String requireOption(ApplicationArguments arguments, String name) {
        List<String> values = arguments.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new IllegalArgumentException("Missing --" + name + "=<value>\n" + USAGE);
        }
        return values.get(values.size() - 1);
    }
}
