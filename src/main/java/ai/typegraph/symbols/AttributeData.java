package ai.typegraph.symbols;

import java.util.List;
import java.util.Objects;

/**
 * One attribute (annotation) instance applied to a symbol.
 *
 * @param attributeClass       the attribute's declaring type, {@code null} when it cannot be resolved
 * @param constructorArguments positional arguments in order
 * @param namedArguments       named arguments in order
 */
public record AttributeData(
        NamedTypeSymbol attributeClass,
        List<TypedConstant> constructorArguments,
        List<NamedArgument> namedArguments
) {
    public AttributeData {
        constructorArguments = List.copyOf(Objects.requireNonNull(constructorArguments, "constructorArguments"));
        namedArguments = List.copyOf(Objects.requireNonNull(namedArguments, "namedArguments"));
    }

    public record NamedArgument(String name, TypedConstant value) {
    }
}
