package ai.typegraph.symbols;

import java.util.List;

/**
 * A namespace in the tree rooted at the global namespace. Identity is the
 * dotted path, so the same namespace reached from different modules is one node.
 */
public interface NamespaceSymbol extends Symbol {

    /**
     * Dotted path, empty for the global namespace.
     */
    String fullName();

    /**
     * Parent namespace, {@code null} for the global namespace.
     */
    NamespaceSymbol containingNamespace();

    default boolean isGlobalNamespace() {
        return containingNamespace() == null;
    }

    /**
     * Types declared directly in this namespace by the module being walked.
     */
    List<NamedTypeSymbol> typeMembers();

    List<NamespaceSymbol> namespaceMembers();
}
