package ai.typegraph.loader;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import ai.typegraph.symbols.NamedTypeSymbol;
import ai.typegraph.symbols.NamespaceSymbol;

/**
 * A Java package. Only packages holding walked types of the target module
 * are listed as children, and members come back sorted by name.
 */
final class AsmNamespace implements NamespaceSymbol {

    private final String name;
    private final String fullName;
    private final AsmNamespace parent;
    private final Map<String, AsmNamespace> children = new TreeMap<>();
    private final List<NamedTypeSymbol> types = new ArrayList<>();
    private boolean declared;

    AsmNamespace(String name, String fullName, AsmNamespace parent) {
        this.name = name;
        this.fullName = fullName;
        this.parent = parent;
    }

    static AsmNamespace newGlobal() {
        return new AsmNamespace("", "", null);
    }

    AsmNamespace child(String simpleName) {
        return children.computeIfAbsent(simpleName,
                n -> new AsmNamespace(n, fullName.isEmpty() ? n : fullName + "." + n, this));
    }

    void addType(NamedTypeSymbol type) {
        types.add(type);
        for (AsmNamespace ns = this; ns != null; ns = ns.parent) {
            ns.declared = true;
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String fullName() {
        return fullName;
    }

    @Override
    public NamespaceSymbol containingNamespace() {
        return parent;
    }

    @Override
    public List<NamedTypeSymbol> typeMembers() {
        final List<NamedTypeSymbol> out = new ArrayList<>(types);
        out.sort(Comparator.comparing(NamedTypeSymbol::name));
        return out;
    }

    @Override
    public List<NamespaceSymbol> namespaceMembers() {
        final List<NamespaceSymbol> out = new ArrayList<>();
        for (AsmNamespace child : children.values()) {
            if (child.declared) {
                out.add(child);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return fullName.isEmpty() ? "<global>" : fullName;
    }
}
