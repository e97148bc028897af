package ai.typegraph.symbols;

import java.util.List;

public interface MethodSymbol extends MemberSymbol {

    MethodKind methodKind();

    TypeSymbol returnType();

    boolean returnsVoid();

    List<ParameterSymbol> parameters();

    List<TypeParameterSymbol> typeParameters();

    /**
     * The base-class method this one overrides, or {@code null}.
     */
    MethodSymbol overriddenMethod();

    default List<MethodSymbol> explicitInterfaceImplementations() {
        return List.of();
    }

    default boolean isExtern() {
        return false;
    }

    default boolean isAsync() {
        return false;
    }

    default boolean isExtensionMethod() {
        return false;
    }

    default boolean isPartialDefinition() {
        return false;
    }

    default boolean isReadOnly() {
        return false;
    }

    /**
     * Only meaningful for property setters.
     */
    default boolean isInitOnly() {
        return false;
    }

    default List<AttributeData> returnTypeAttributes() {
        return List.of();
    }

    /**
     * Exception types named in the method's declared throws clause, where the host records one.
     */
    default List<TypeSymbol> declaredExceptions() {
        return List.of();
    }
}
