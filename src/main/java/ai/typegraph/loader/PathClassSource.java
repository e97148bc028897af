package ai.typegraph.loader;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Class files under a directory, or inside a JAR opened as a zip file system.
 */
final class PathClassSource implements ClassSource {

    private final Path location;
    private final Path root;
    private final FileSystem zip;
    private final Supplier<AsmModule> module;
    private AsmModule resolvedModule;

    private PathClassSource(Path location, Path root, FileSystem zip, Supplier<AsmModule> module) {
        this.location = location;
        this.root = root;
        this.zip = zip;
        this.module = module;
    }

    /**
     * @param module called at most once, on the first class found here
     * @throws IOException when the location is neither a directory nor a readable JAR
     */
    static PathClassSource open(Path location, Supplier<AsmModule> module) throws IOException {
        Objects.requireNonNull(location, "location");
        if (Files.isDirectory(location)) {
            return new PathClassSource(location, location, null, module);
        }
        if (!Files.isRegularFile(location)) {
            throw new IOException("No such file or directory: " + location);
        }
        final FileSystem zip = FileSystems.newFileSystem(location, (ClassLoader) null);
        return new PathClassSource(location, zip.getPath("/"), zip, module);
    }

    Path location() {
        return location;
    }

    @Override
    public Found find(String internalName) throws IOException {
        final Path file = root.resolve(internalName + ".class");
        if (!Files.isRegularFile(file)) {
            return null;
        }
        return new Found(Files.readAllBytes(file), module());
    }

    @Override
    public List<String> classNames() throws IOException {
        try (Stream<Path> s = Files.walk(root)) {
            return s.filter(Files::isRegularFile)
                    .map(p -> root.relativize(p).toString().replace('\\', '/'))
                    .filter(n -> n.endsWith(".class"))
                    .filter(n -> !n.startsWith("META-INF/"))
                    .map(n -> n.substring(0, n.length() - ".class".length()))
                    .filter(n -> !n.equals("module-info") && !n.endsWith("/module-info"))
                    .filter(n -> !n.equals("package-info") && !n.endsWith("/package-info"))
                    .sorted()
                    .toList();
        }
    }

    AsmModule module() {
        if (resolvedModule == null) {
            resolvedModule = module.get();
        }
        return resolvedModule;
    }

    @Override
    public String toString() {
        return location.toString();
    }

    @Override
    public void close() throws IOException {
        if (zip != null) {
            zip.close();
        }
    }
}
