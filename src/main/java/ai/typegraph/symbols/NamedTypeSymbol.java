package ai.typegraph.symbols;

import java.util.List;

/**
 * A class, struct, interface, enum, delegate or record, either as declared
 * (its own original definition) or constructed with concrete type arguments.
 */
public interface NamedTypeSymbol extends TypeSymbol {

    Accessibility accessibility();

    boolean isCompilerGenerated();

    NamespaceSymbol containingNamespace();

    /**
     * Enclosing type for nested types, otherwise {@code null}.
     */
    NamedTypeSymbol containingType();

    boolean isAbstract();

    boolean isSealed();

    boolean isStatic();

    boolean isValueType();

    boolean isRecord();

    default boolean isRefLikeType() {
        return false;
    }

    default boolean isReadOnly() {
        return false;
    }

    default boolean isUnmanagedType() {
        return false;
    }

    default SpecialType specialType() {
        return SpecialType.NONE;
    }

    List<TypeParameterSymbol> typeParameters();

    /**
     * Type arguments in declaration order. For a generic definition these are
     * its own type parameters.
     */
    List<TypeSymbol> typeArguments();

    /**
     * The generic definition this type was constructed from, or itself.
     */
    NamedTypeSymbol originalDefinition();

    default boolean isGenericType() {
        return !typeParameters().isEmpty() || !typeArguments().isEmpty();
    }

    default boolean isUnboundGenericType() {
        return false;
    }

    NamedTypeSymbol baseType();

    List<NamedTypeSymbol> interfaces();

    default NamedTypeSymbol enumUnderlyingType() {
        return null;
    }

    List<MemberSymbol> members();

    List<NamedTypeSymbol> typeMembers();

    List<AttributeData> attributes();
}
