package ai.typegraph.loader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.typegraph.modules.ModuleIdentity;
import ai.typegraph.symbols.AttributeData;
import ai.typegraph.symbols.NamedTypeSymbol;

/**
 * Opens a JAR or class directory as a module symbol.
 * Referenced classes are looked up in the target itself, then the reference
 * entries in order, then the running JDK; anything not found stays unresolved.
 */
public final class ClassFileLoader {

    private static final Logger log = LoggerFactory.getLogger(ClassFileLoader.class);

    private final List<Path> references;
    private final boolean includeJdk;

    public ClassFileLoader(List<Path> references) {
        this(references, true);
    }

    /**
     * @param includeJdk whether JDK classes resolve through the {@code jrt:/} image
     */
    public ClassFileLoader(List<Path> references, boolean includeJdk) {
        this.references = List.copyOf(Objects.requireNonNull(references, "references"));
        this.includeJdk = includeJdk;
    }

    /**
     * @param packages when non-empty, only these packages and their sub-packages are walked
     * @throws IOException when the target cannot be opened
     */
    public LoadedModule load(Path target, ModuleIdentity identity, Set<String> packages) throws IOException {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(packages, "packages");

        final NamespaceTable namespaces = new NamespaceTable();
        final List<ClassSource> sources = new ArrayList<>();
        // module attributes are read lazily, once the universe exists
        final TypeUniverse[] universe = new TypeUniverse[1];
        final PathClassSource[] own = new PathClassSource[1];

        final AsmModule module = new AsmModule(identity.name(), identity.version(), namespaces.global(),
                () -> moduleAttributes(own[0], universe[0]));
        final PathClassSource ownSource = PathClassSource.open(target, () -> module);
        own[0] = ownSource;
        sources.add(ownSource);

        try {
            for (Path reference : references) {
                sources.add(PathClassSource.open(reference, () -> referenceModule(reference)));
            }
        } catch (IOException ex) {
            closeQuietly(sources);
            throw ex;
        }

        if (includeJdk) {
            final Map<String, AsmModule> jdkModules = new HashMap<>();
            final String jdkVersion = JrtClassSource.jdkVersion();
            final JrtClassSource jrt = JrtClassSource.open(name -> jdkModules.computeIfAbsent(name,
                    n -> new AsmModule(n, jdkVersion, AsmNamespace.newGlobal(), List::of)));
            if (jrt != null) {
                sources.add(jrt);
            }
        }

        universe[0] = new TypeUniverse(sources, namespaces);

        final List<String> classNames;
        try {
            classNames = ownSource.classNames();
        } catch (IOException ex) {
            closeQuietly(sources);
            throw ex;
        }

        final List<NamedTypeSymbol> declared = new ArrayList<>();
        int skipped = 0;
        for (String internalName : classNames) {
            final NamedTypeSymbol type = universe[0].namedType(internalName);
            if (!(type instanceof AsmNamedType asm) || asm.containingModule() != module) {
                skipped++;
                continue;
            }
            declared.add(asm);
            final String pkg = NamespaceTable.packageOf(internalName);
            if (asm.model().isNestedMember() || asm.model().isLocalOrAnonymous() || !matches(pkg, packages)) {
                continue;
            }
            namespaces.get(pkg).addType(asm);
        }
        log.info("Loaded {} classes from {} ({} skipped)", declared.size(), target, skipped);
        return new LoadedModule(module, universe[0], declared, sources);
    }

    static boolean matches(String pkg, Set<String> packages) {
        if (packages.isEmpty()) {
            return true;
        }
        for (String p : packages) {
            if (pkg.equals(p) || pkg.startsWith(p + ".")) {
                return true;
            }
        }
        return false;
    }

    private static List<AttributeData> moduleAttributes(PathClassSource source, TypeUniverse universe) {
        try {
            final ClassSource.Found found = source.find("module-info");
            if (found == null) {
                return List.of();
            }
            return universe.annotations().convert(ClassModelReader.read(found.bytes()).annotations);
        } catch (IOException | IllegalArgumentException ex) {
            log.warn("Cannot read module-info of {}: {}", source.location(), ex.toString());
            return List.of();
        }
    }

    private static AsmModule referenceModule(Path reference) {
        ModuleIdentity identity;
        try {
            identity = ModuleIdentity.of(reference);
        } catch (IOException ex) {
            log.warn("Cannot read module identity of {}: {}", reference, ex.toString());
            final Path fileName = reference.getFileName();
            identity = new ModuleIdentity(fileName == null ? reference.toString() : fileName.toString(),
                    ModuleIdentity.DEFAULT_VERSION);
        }
        return new AsmModule(identity.name(), identity.version(), AsmNamespace.newGlobal(), List::of);
    }

    private static void closeQuietly(List<ClassSource> sources) {
        for (ClassSource source : sources) {
            try {
                source.close();
            } catch (IOException ex) {
                log.warn("Cannot close {}: {}", source, ex.toString());
            }
        }
    }
}
