package ai.typegraph.modules;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ModuleResolverTest {

    @TempDir
    Path tmp;

    private ModuleResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ModuleResolver(tmp);
    }

    private Path file(String relative) throws IOException {
        final Path p = tmp.resolve(relative);
        Files.createDirectories(p.getParent());
        return Files.write(p, new byte[] {1});
    }

    @Test
    void jarFileIsUsedAsIs() throws IOException {
        final Path jar = file("lib/a.jar");

        assertThat(resolver.resolveReferences(List.of("lib/a.jar"))).containsExactly(jar);
    }

    @Test
    void libraryFolderExpandsToSortedJars() throws IOException {
        final Path b = file("libs/b.jar");
        final Path a = file("libs/a.jar");
        file("libs/notes.txt");
        file("libs/nested/c.jar");

        assertThat(resolver.resolveReferences(List.of("libs"))).containsExactly(a, b);
    }

    @Test
    void directoryWithClassFilesIsAClassDirectory() throws IOException {
        file("classes/com/acme/A.class");

        assertThat(resolver.resolveReferences(List.of("classes"))).containsExactly(tmp.resolve("classes"));
        assertThat(ModuleResolver.isClassDirectory(tmp.resolve("classes"))).isTrue();
    }

    @Test
    void moduleInfoMarksAClassDirectory() throws IOException {
        file("mod/module-info.class");

        assertThat(ModuleResolver.isClassDirectory(tmp.resolve("mod"))).isTrue();
    }

    @Test
    void missingAndBlankEntriesAreSkipped() throws IOException {
        final Path jar = file("a.jar");

        assertThat(resolver.resolveReferences(Arrays.asList("missing.jar", " ", null, "a.jar"))).containsExactly(jar);
    }

    @Test
    void duplicatesKeepFirstPosition() throws IOException {
        final Path a = file("libs/a.jar");
        final Path b = file("b.jar");

        assertThat(resolver.resolveReferences(List.of("libs/a.jar", "b.jar", "libs", "./b.jar")))
                .containsExactly(a, b);
    }

    @Test
    void absolutePathsIgnoreBaseDirectory() throws IOException {
        final Path jar = file("abs/x.jar");

        assertThat(new ModuleResolver(tmp.resolve("elsewhere")).resolveReferences(List.of(jar.toString())))
                .containsExactly(jar);
    }

    @Test
    void referenceFileSkipsCommentsAndBlankLines() throws IOException {
        final Path refs = Files.writeString(tmp.resolve("refs.txt"), "# deps\n\nlib/a.jar\n  libs  \n#x\n");

        assertThat(ModuleResolver.loadReferenceFile(refs)).containsExactly("lib/a.jar", "libs");
    }
}
