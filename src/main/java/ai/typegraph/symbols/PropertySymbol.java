package ai.typegraph.symbols;

import java.util.List;

public interface PropertySymbol extends MemberSymbol {

    TypeSymbol type();

    /**
     * Indexer parameters; empty for ordinary properties.
     */
    default List<ParameterSymbol> parameters() {
        return List.of();
    }

    default boolean isIndexer() {
        return false;
    }

    MethodSymbol getMethod();

    MethodSymbol setMethod();

    default boolean isRequired() {
        return false;
    }

    default PropertySymbol overriddenProperty() {
        return null;
    }

    default List<PropertySymbol> explicitInterfaceImplementations() {
        return List.of();
    }
}
