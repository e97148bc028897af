package ai.typegraph.scan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceRootFinderTest {

    @TempDir
    Path tmp;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(tmp.resolve("a/src/main/java/com"));
        Files.createDirectories(tmp.resolve("a/src/test/java"));
        Files.createDirectories(tmp.resolve("b/src/main/java"));
        Files.createDirectories(tmp.resolve("b/target/src/main/java"));
        Files.createDirectories(tmp.resolve(".git/src/main/java"));
    }

    @Test
    void findsMainRootsAndSkipsBuildOutput() throws IOException {
        assertThat(new SourceRootFinder(false).findSourceRoots(tmp)).containsExactly(
                tmp.resolve("a/src/main/java"),
                tmp.resolve("b/src/main/java"));
    }

    @Test
    void includesTestRootsWhenAsked() throws IOException {
        assertThat(new SourceRootFinder(true).findSourceRoots(tmp)).containsExactly(
                tmp.resolve("a/src/main/java"),
                tmp.resolve("a/src/test/java"),
                tmp.resolve("b/src/main/java"));
    }

    @Test
    void plainDirectoryIsItsOwnRoot() throws IOException {
        final Path flat = Files.createDirectories(tmp.resolve("flat/com/acme"));

        assertThat(new SourceRootFinder(false).findSourceRoots(flat)).containsExactly(flat);
    }

    @Test
    void rejectsFiles() throws IOException {
        final Path file = Files.writeString(tmp.resolve("A.java"), "class A {}");

        assertThatThrownBy(() -> new SourceRootFinder(false).findSourceRoots(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Not a directory");
    }
}
