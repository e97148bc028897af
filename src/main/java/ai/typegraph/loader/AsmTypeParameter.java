package ai.typegraph.loader;

import java.util.ArrayList;
import java.util.List;

import ai.typegraph.symbols.MethodSymbol;
import ai.typegraph.symbols.NamedTypeSymbol;
import ai.typegraph.symbols.TypeParameterSymbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * A generic type variable. The implicit {@code Object} bound is not a constraint.
 */
final class AsmTypeParameter implements TypeParameterSymbol {

    private final TypeUniverse universe;
    private final String name;
    private final int ordinal;
    private final List<TypeRef> bounds;
    private final NamedTypeSymbol declaringType;
    private final MethodSymbol declaringMethod;
    private final TypeScope scope;
    private List<TypeSymbol> constraintTypes;

    AsmTypeParameter(TypeUniverse universe, SignatureCollector.FormalTypeParameter formal, int ordinal,
                     NamedTypeSymbol declaringType, MethodSymbol declaringMethod, TypeScope scope) {
        this.universe = universe;
        this.name = formal.name();
        this.ordinal = ordinal;
        this.bounds = List.copyOf(formal.bounds());
        this.declaringType = declaringType;
        this.declaringMethod = declaringMethod;
        this.scope = scope;
    }

    static List<TypeParameterSymbol> declare(TypeUniverse universe, List<SignatureCollector.FormalTypeParameter> formals,
                                          NamedTypeSymbol declaringType, MethodSymbol declaringMethod, TypeScope scope) {
        final List<TypeParameterSymbol> out = new ArrayList<>(formals.size());
        for (int i = 0; i < formals.size(); i++) {
            out.add(new AsmTypeParameter(universe, formals.get(i), i, declaringType, declaringMethod, scope));
        }
        return List.copyOf(out);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int ordinal() {
        return ordinal;
    }

    @Override
    public List<TypeSymbol> constraintTypes() {
        if (constraintTypes == null) {
            final List<TypeSymbol> out = new ArrayList<>();
            for (TypeRef bound : bounds) {
                if (TypeRef.ClassType.OBJECT.equals(bound)) {
                    continue;
                }
                out.add(universe.resolve(bound, scope));
            }
            constraintTypes = List.copyOf(out);
        }
        return constraintTypes;
    }

    @Override
    public NamedTypeSymbol declaringType() {
        return declaringType;
    }

    @Override
    public MethodSymbol declaringMethod() {
        return declaringMethod;
    }

    @Override
    public String toString() {
        return name;
    }
}
