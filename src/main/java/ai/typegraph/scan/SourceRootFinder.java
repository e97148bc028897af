package ai.typegraph.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds Java source roots below a directory:
 * - <dir>/.../src/main/java
 * - <dir>/.../src/* /java when test sources are wanted
 * - the directory itself when it holds no such layout
 */
public final class SourceRootFinder {

    private final boolean includeTests;

    public SourceRootFinder(boolean includeTests) {
        this.includeTests = includeTests;
    }

    public List<Path> findSourceRoots(Path dir) throws IOException {
        Objects.requireNonNull(dir, "dir");
        if (!Files.isDirectory(dir)) {
            throw new IOException("Not a directory: " + dir);
        }

        final List<Path> roots = new ArrayList<>();
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                // Skip typical heavy dirs
                final String name = d.getFileName() != null ? d.getFileName().toString() : "";
                if (".git".equals(name) || ".idea".equals(name) || "build".equals(name) || "target".equals(name)
                        || "out".equals(name) || "node_modules".equals(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }

                if (looksLikeJavaSourceRoot(d)) {
                    roots.add(d);
                    return FileVisitResult.SKIP_SUBTREE;
                }

                return FileVisitResult.CONTINUE;
            }
        });

        if (roots.isEmpty()) {
            roots.add(dir);
        }
        roots.sort(null);
        return roots;
    }

    private boolean looksLikeJavaSourceRoot(Path dir) {
        // .../src/main/java or .../src/test/java or .../src/<any>/java
        final int n = dir.getNameCount();
        if (n < 3) return false;
        final String last = dir.getName(n - 1).toString();
        final String mid = dir.getName(n - 2).toString();
        final String src = dir.getName(n - 3).toString();
        if (!"java".equals(last) || !"src".equals(src) || mid.isBlank()) return false;
        return includeTests || "main".equals(mid);
    }
}
