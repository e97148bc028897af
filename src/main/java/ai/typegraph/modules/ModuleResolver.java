package ai.typegraph.modules;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns reference arguments into classpath entries.
 * Strategy:
 * 1) a JAR file is used as is
 * 2) a directory holding class files (or a module-info) is a class directory
 * 3) any other directory is a library folder and expands to its JARs, sorted by name
 * Missing paths are skipped with a warning; duplicates keep their first position.
 */
public final class ModuleResolver {

    private static final Logger log = LoggerFactory.getLogger(ModuleResolver.class);

    private final Path baseDir;

    public ModuleResolver(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
    }

    public List<Path> resolveReferences(List<String> references) throws IOException {
        final Set<Path> out = new LinkedHashSet<>();
        for (String raw : references) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            final Path p = baseDir.resolve(raw.trim()).toAbsolutePath().normalize();
            if (!Files.exists(p)) {
                log.warn("Reference not found, skipped: {}", p);
                continue;
            }
            if (Files.isRegularFile(p)) {
                out.add(p);
            } else if (isClassDirectory(p)) {
                out.add(p);
            } else {
                out.addAll(jarsIn(p));
            }
        }
        return new ArrayList<>(out);
    }

    /**
     * Reads one reference per line; blank lines and {@code #} comments are ignored.
     */
    public static List<String> loadReferenceFile(Path file) throws IOException {
        final List<String> out = new ArrayList<>();
        for (String line : Files.readAllLines(file)) {
            final String s = line.trim();
            if (s.isEmpty() || s.startsWith("#")) {
                continue;
            }
            out.add(s);
        }
        return out;
    }

    static boolean isClassDirectory(Path dir) throws IOException {
        if (Files.isRegularFile(dir.resolve("module-info.class"))) {
            return true;
        }
        try (Stream<Path> s = Files.walk(dir, 8)) {
            return s.anyMatch(p -> p.getFileName() != null && p.getFileName().toString().endsWith(".class"));
        }
    }

    private static List<Path> jarsIn(Path dir) throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".jar"))
                    .sorted()
                    .toList();
        }
    }
}
