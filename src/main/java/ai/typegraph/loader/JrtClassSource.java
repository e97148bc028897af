package ai.typegraph.loader;

import java.io.IOException;
import java.net.URI;
import java.nio.file.FileSystem;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classes of the running JDK, read from the {@code jrt:/} image.
 * Each JDK module ({@code java.base}, ...) becomes its own module symbol.
 */
final class JrtClassSource implements ClassSource {

    private static final Logger log = LoggerFactory.getLogger(JrtClassSource.class);

    private final FileSystem jrt;
    private final Function<String, AsmModule> modules;
    private final Map<String, List<String>> modulesByPackage = new HashMap<>();

    private JrtClassSource(FileSystem jrt, Function<String, AsmModule> modules) {
        this.jrt = jrt;
        this.modules = modules;
    }

    /**
     * @param modules maps a JDK module name to its symbol
     * @return {@code null} when the runtime has no jrt image
     */
    static JrtClassSource open(Function<String, AsmModule> modules) {
        try {
            return new JrtClassSource(FileSystems.getFileSystem(URI.create("jrt:/")), modules);
        } catch (FileSystemNotFoundException | UnsupportedOperationException ex) {
            log.warn("JDK runtime image not available, JDK types stay unresolved: {}", ex.toString());
            return null;
        }
    }

    static String jdkVersion() {
        final StringBuilder sb = new StringBuilder();
        for (Integer part : Runtime.version().version()) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(part);
        }
        return sb.toString();
    }

    @Override
    public Found find(String internalName) throws IOException {
        final int slash = internalName.lastIndexOf('/');
        if (slash < 0) {
            return null;
        }
        final String pkg = internalName.substring(0, slash).replace('/', '.');
        for (String moduleName : modulesOf(pkg)) {
            final Path file = jrt.getPath("/modules", moduleName, internalName + ".class");
            if (Files.isRegularFile(file)) {
                return new Found(Files.readAllBytes(file), modules.apply(moduleName));
            }
        }
        return null;
    }

    // the JDK is only searched by name, never enumerated
    @Override
    public List<String> classNames() {
        return List.of();
    }

    private List<String> modulesOf(String pkg) throws IOException {
        final List<String> cached = modulesByPackage.get(pkg);
        if (cached != null) {
            return cached;
        }
        final Path dir = jrt.getPath("/packages", pkg);
        final List<String> found;
        if (Files.isDirectory(dir)) {
            try (Stream<Path> s = Files.list(dir)) {
                found = s.map(p -> p.getFileName().toString()).sorted().toList();
            }
        } else {
            found = List.of();
        }
        modulesByPackage.put(pkg, found);
        return found;
    }

    // the jrt file system is shared by the whole JVM and cannot be closed
    @Override
    public void close() {
    }
}
