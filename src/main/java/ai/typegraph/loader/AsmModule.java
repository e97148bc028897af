package ai.typegraph.loader;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import ai.typegraph.symbols.AttributeData;
import ai.typegraph.symbols.ModuleSymbol;
import ai.typegraph.symbols.NamespaceSymbol;

final class AsmModule implements ModuleSymbol {

    private final String name;
    private final String version;
    private final NamespaceSymbol globalNamespace;
    private final Supplier<List<AttributeData>> attributes;
    private List<AttributeData> resolvedAttributes;

    AsmModule(String name, String version, NamespaceSymbol globalNamespace, Supplier<List<AttributeData>> attributes) {
        this.name = Objects.requireNonNull(name, "name");
        this.version = Objects.requireNonNull(version, "version");
        this.globalNamespace = Objects.requireNonNull(globalNamespace, "globalNamespace");
        this.attributes = Objects.requireNonNull(attributes, "attributes");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public NamespaceSymbol globalNamespace() {
        return globalNamespace;
    }

    @Override
    public List<AttributeData> attributes() {
        if (resolvedAttributes == null) {
            resolvedAttributes = List.copyOf(attributes.get());
        }
        return resolvedAttributes;
    }

    @Override
    public String toString() {
        return name + " " + version;
    }
}
