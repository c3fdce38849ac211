package com.refactorguard.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceFilesTest {

    @TempDir
    Path dir;

    @Test
    void collectsJavaFilesRecursivelyInOrder() throws IOException {
        Files.createDirectories(dir.resolve("b/c"));
        Files.writeString(dir.resolve("b/c/Z.java"), "class Z {}");
        Files.writeString(dir.resolve("A.java"), "class A {}");
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        assertThat(SourceFiles.collect(dir)).containsExactly(dir.resolve("A.java"), dir.resolve("b/c/Z.java"));
    }

    @Test
    void singleFileIsTakenAsIs() throws IOException {
        Path file = Files.writeString(dir.resolve("Only.txt"), "x");

        assertThat(SourceFiles.collect(file)).containsExactly(file);
    }

    @Test
    void missingPathIsAnError() {
        Path missing = dir.resolve("nope");

        assertThatThrownBy(() -> SourceFiles.collect(missing))
                .isInstanceOf(IOException.class)
                .hasMessage("The path " + missing + " is not a valid file or directory.");
    }

    @Test
    void writesUnderRelativePath() throws IOException {
        Path out = dir.resolve("out");

        Path written = SourceFiles.writeInto(out, Path.of("pkg", "A.java"), "class A {}\n");

        assertThat(written).isEqualTo(out.resolve("pkg/A.java"));
        assertThat(SourceFiles.read(written)).isEqualTo("class A {}\n");
        assertThatThrownBy(() -> SourceFiles.writeInto(out, dir.resolve("B.java"), ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void relativePathsKeepSameNamedFilesApart() {
        List<Path> relative = SourceFiles.relativeToCommonRoot(List.of(
                dir.resolve("a/Foo.java"), dir.resolve("b/Foo.java"), dir.resolve("b/c/Bar.java")));

        assertThat(relative).containsExactly(
                Path.of("a", "Foo.java"), Path.of("b", "Foo.java"), Path.of("b", "c", "Bar.java"));
    }

    @Test
    void filesOfOneDirectoryKeepBareNames() {
        assertThat(SourceFiles.relativeToCommonRoot(List.of(dir.resolve("A.java"), dir.resolve("B.java"))))
                .containsExactly(Path.of("A.java"), Path.of("B.java"));
        assertThat(SourceFiles.relativeToCommonRoot(List.of(dir.resolve("x/Only.java"))))
                .containsExactly(Path.of("Only.java"));
    }
}
