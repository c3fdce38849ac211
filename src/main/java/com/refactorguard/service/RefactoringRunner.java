package com.refactorguard.service;

import com.google.common.base.Stopwatch;
import com.refactorguard.util.SourceFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs the service over many files on a fixed pool. Every input file ends up
 * in the output directory, rewritten or as it was, at its path relative to
 * the deepest directory shared by all inputs. Two inputs with the same file
 * name therefore never write the same output file.
 */
public class RefactoringRunner {

    private static final Logger log = LoggerFactory.getLogger(RefactoringRunner.class);

    private final RefactoringService service;
    private final int threads;

    public RefactoringRunner(RefactoringService service, int threads) {
        this.service = service;
        this.threads = Math.max(1, threads);
    }

    /**
     * @param outputDir where results are written, {@code null} to only compute them
     * @return one outcome per file, in input order
     */
    public List<FileOutcome> run(List<Path> files, Path outputDir) throws IOException {
        if (files.isEmpty()) {
            return List.of();
        }
        Stopwatch sw = Stopwatch.createStarted();
        ExecutorService exec = Executors.newFixedThreadPool(Math.min(threads, files.size()));
        try {
            List<Path> targets = SourceFiles.relativeToCommonRoot(files);
            List<Future<FileOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < files.size(); i++) {
                futures.add(exec.submit(task(files.get(i), targets.get(i), outputDir)));
            }
            List<FileOutcome> outcomes = new ArrayList<>();
            for (Future<FileOutcome> future : futures) {
                outcomes.add(await(future));
            }
            log.info("Processed {} files in {} ms", files.size(), sw.elapsed(TimeUnit.MILLISECONDS));
            return outcomes;
        } finally {
            exec.shutdownNow();
        }
    }

    private Callable<FileOutcome> task(Path file, Path target, Path outputDir) {
        return () -> {
            String outputName = (outputDir == null ? target : outputDir.resolve(target)).toString();
            FileOutcome outcome = service.process(file.toString(), SourceFiles.read(file), outputName);
            if (outputDir != null) {
                SourceFiles.writeInto(outputDir, target, outcome.getSource());
            }
            return outcome;
        };
    }

    private static FileOutcome await(Future<FileOutcome> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Processing interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof UncheckedIOException io) {
                throw io.getCause();
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Task failed", cause);
        }
    }
}
