package ai.typegraph.symbols;

import java.util.List;

/**
 * A method, constructor, property, field or event owned by a named type.
 */
public interface MemberSymbol extends Symbol {

    Accessibility accessibility();

    boolean isCompilerGenerated();

    NamedTypeSymbol containingType();

    boolean isStatic();

    default boolean isAbstract() {
        return false;
    }

    default boolean isVirtual() {
        return false;
    }

    default boolean isOverride() {
        return false;
    }

    default boolean isSealed() {
        return false;
    }

    List<AttributeData> attributes();
}
