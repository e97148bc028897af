package ai.typegraph.symbols;

import java.util.List;

/**
 * A compiled program module: the unit an extraction run targets, and the
 * container that scopes type identities.
 */
public interface ModuleSymbol extends Symbol {

    String version();

    default String culture() {
        return "";
    }

    default byte[] publicKeyToken() {
        return new byte[0];
    }

    default boolean isInteractive() {
        return false;
    }

    NamespaceSymbol globalNamespace();

    default List<AttributeData> attributes() {
        return List.of();
    }
}
