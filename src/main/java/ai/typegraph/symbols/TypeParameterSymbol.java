package ai.typegraph.symbols;

import java.util.List;

/**
 * A type parameter declared by exactly one type or one method.
 */
public interface TypeParameterSymbol extends TypeSymbol {

    int ordinal();

    default Variance variance() {
        return Variance.NONE;
    }

    default boolean hasReferenceTypeConstraint() {
        return false;
    }

    default boolean hasValueTypeConstraint() {
        return false;
    }

    default boolean hasUnmanagedTypeConstraint() {
        return false;
    }

    default boolean hasNotNullConstraint() {
        return false;
    }

    default boolean hasConstructorConstraint() {
        return false;
    }

    List<TypeSymbol> constraintTypes();

    /**
     * Declaring type, {@code null} when declared by a method.
     */
    NamedTypeSymbol declaringType();

    /**
     * Declaring method, {@code null} when declared by a type.
     */
    MethodSymbol declaringMethod();

    @Override
    default TypeKind typeKind() {
        return TypeKind.TYPE_PARAMETER;
    }

    @Override
    default String displayName() {
        return name();
    }

    @Override
    default ModuleSymbol containingModule() {
        if (declaringType() != null) {
            return declaringType().containingModule();
        }
        final MethodSymbol method = declaringMethod();
        return method != null ? method.containingType().containingModule() : null;
    }
}
