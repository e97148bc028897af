package ai.typegraph.symbols;

import java.util.List;

public interface ParameterSymbol extends Symbol {

    /**
     * Zero-based position in the owning member's parameter list.
     */
    int ordinal();

    TypeSymbol type();

    /**
     * The method or indexer property that declares this parameter.
     */
    MemberSymbol containingSymbol();

    default boolean isOptional() {
        return false;
    }

    default boolean isParams() {
        return false;
    }

    default boolean isThis() {
        return false;
    }

    default boolean isDiscard() {
        return false;
    }

    default RefKind refKind() {
        return RefKind.NONE;
    }

    default boolean hasExplicitDefaultValue() {
        return false;
    }

    default Object explicitDefaultValue() {
        return null;
    }

    default List<AttributeData> attributes() {
        return List.of();
    }
}
