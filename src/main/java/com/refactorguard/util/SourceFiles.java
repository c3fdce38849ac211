package com.refactorguard.util;

import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File system side of a run: finding Java sources and writing results.
 */
public final class SourceFiles {

    public static final String JAVA_SUFFIX = ".java";

    private SourceFiles() {
    }

    /** The file itself, or every {@code .java} file below a directory, sorted. */
    public static List<Path> collect(Path input) throws IOException {
        if (Files.isRegularFile(input)) {
            return List.of(input);
        }
        if (!Files.isDirectory(input)) {
            throw new IOException("The path " + input + " is not a valid file or directory.");
        }
        try (Stream<Path> paths = Files.walk(input)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(JAVA_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public static String read(Path file) throws IOException {
        return FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
    }

    /** Writes {@code content} to {@code outputDir/relative}, creating directories as needed. */
    public static Path writeInto(Path outputDir, Path relative, String content) throws IOException {
        if (relative.isAbsolute()) {
            throw new IllegalArgumentException("Output path must be relative: " + relative);
        }
        Path target = outputDir.resolve(relative).normalize();
        FileUtils.writeStringToFile(target.toFile(), content, StandardCharsets.UTF_8);
        return target;
    }

    /**
     * Paths of {@code files} relative to their deepest common directory. Files
     * from one directory map to their bare names; distinct files never map to
     * the same path.
     */
    public static List<Path> relativeToCommonRoot(List<Path> files) {
        List<Path> absolute = files.stream()
                .map(f -> f.toAbsolutePath().normalize())
                .collect(Collectors.toList());
        Path root = absolute.isEmpty() ? null : absolute.get(0).getParent();
        for (Path file : absolute) {
            while (root != null && !file.startsWith(root)) {
                root = root.getParent();
            }
        }
        Path base = root;
        return absolute.stream()
                .map(f -> base == null ? f.getFileName() : base.relativize(f))
                .collect(Collectors.toList());
    }
}
