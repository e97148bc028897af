package ai.typegraph.loader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

import ai.typegraph.symbols.ModuleSymbol;
import ai.typegraph.symbols.NamedTypeSymbol;

/**
 * A target module opened by {@link ClassFileLoader}, together with the class
 * sources it resolves references through. Close it to release open JARs.
 */
public final class LoadedModule implements AutoCloseable {

    private final AsmModule module;
    private final TypeUniverse universe;
    private final List<NamedTypeSymbol> declaredTypes;
    private final List<ClassSource> sources;

    LoadedModule(AsmModule module, TypeUniverse universe, List<NamedTypeSymbol> declaredTypes, List<ClassSource> sources) {
        this.module = Objects.requireNonNull(module, "module");
        this.universe = Objects.requireNonNull(universe, "universe");
        this.declaredTypes = List.copyOf(declaredTypes);
        this.sources = List.copyOf(sources);
    }

    public ModuleSymbol module() {
        return module;
    }

    /**
     * Every class read from the target, nested, local and anonymous ones included,
     * regardless of any package filter.
     */
    public List<NamedTypeSymbol> declaredTypes() {
        return declaredTypes;
    }

    /**
     * @param binaryName e.g. {@code java.util.Map$Entry} or {@code java/util/Map$Entry}
     * @return the type, possibly an unresolved placeholder; never {@code null}
     */
    public NamedTypeSymbol findType(String binaryName) {
        Objects.requireNonNull(binaryName, "binaryName");
        return universe.namedType(binaryName.replace('.', '/'));
    }

    /**
     * @return whether the type was read from a class file rather than left unresolved
     */
    public static boolean isResolved(NamedTypeSymbol type) {
        return !(type instanceof UnresolvedType);
    }

    @Override
    public void close() {
        IOException failure = null;
        for (ClassSource source : sources) {
            try {
                source.close();
            } catch (IOException ex) {
                if (failure == null) {
                    failure = ex;
                }
            }
        }
        if (failure != null) {
            throw new UncheckedIOException("Cannot close class sources", failure);
        }
    }
}
