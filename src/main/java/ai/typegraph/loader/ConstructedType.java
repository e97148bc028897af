package ai.typegraph.loader;

import java.util.List;
import java.util.Objects;

import ai.typegraph.symbols.Accessibility;
import ai.typegraph.symbols.AttributeData;
import ai.typegraph.symbols.MemberSymbol;
import ai.typegraph.symbols.ModuleSymbol;
import ai.typegraph.symbols.NamedTypeSymbol;
import ai.typegraph.symbols.NamespaceSymbol;
import ai.typegraph.symbols.SpecialType;
import ai.typegraph.symbols.TypeKind;
import ai.typegraph.symbols.TypeParameterSymbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * A generic type applied to arguments, e.g. {@code List<String>}.
 * Everything except the arguments comes from the definition; members are not substituted.
 */
final class ConstructedType implements NamedTypeSymbol {

    private final NamedTypeSymbol definition;
    private final List<TypeSymbol> arguments;

    ConstructedType(NamedTypeSymbol definition, List<TypeSymbol> arguments) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public String name() {
        return definition.name();
    }

    @Override
    public String displayName() {
        final String base = definition instanceof AsmNamedType asm ? asm.qualifiedName() : definition.displayName();
        final StringBuilder sb = new StringBuilder(base).append('<');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(arguments.get(i).displayName());
        }
        return sb.append('>').toString();
    }

    @Override
    public TypeKind typeKind() {
        return definition.typeKind();
    }

    @Override
    public ModuleSymbol containingModule() {
        return definition.containingModule();
    }

    @Override
    public Accessibility accessibility() {
        return definition.accessibility();
    }

    @Override
    public boolean isCompilerGenerated() {
        return definition.isCompilerGenerated();
    }

    @Override
    public NamespaceSymbol containingNamespace() {
        return definition.containingNamespace();
    }

    @Override
    public NamedTypeSymbol containingType() {
        return definition.containingType();
    }

    @Override
    public boolean isAbstract() {
        return definition.isAbstract();
    }

    @Override
    public boolean isSealed() {
        return definition.isSealed();
    }

    @Override
    public boolean isStatic() {
        return definition.isStatic();
    }

    @Override
    public boolean isValueType() {
        return definition.isValueType();
    }

    @Override
    public boolean isRecord() {
        return definition.isRecord();
    }

    @Override
    public SpecialType specialType() {
        return definition.specialType();
    }

    @Override
    public List<TypeParameterSymbol> typeParameters() {
        return definition.typeParameters();
    }

    @Override
    public List<TypeSymbol> typeArguments() {
        return arguments;
    }

    @Override
    public NamedTypeSymbol originalDefinition() {
        return definition;
    }

    @Override
    public NamedTypeSymbol baseType() {
        return definition.baseType();
    }

    @Override
    public List<NamedTypeSymbol> interfaces() {
        return definition.interfaces();
    }

    @Override
    public List<MemberSymbol> members() {
        return definition.members();
    }

    @Override
    public List<NamedTypeSymbol> typeMembers() {
        return definition.typeMembers();
    }

    @Override
    public List<AttributeData> attributes() {
        return definition.attributes();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ConstructedType other
                && definition.equals(other.definition)
                && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(definition, arguments);
    }

    @Override
    public String toString() {
        return displayName();
    }
}
