package ai.typegraph.loader;

import java.util.List;

import ai.typegraph.symbols.Accessibility;
import ai.typegraph.symbols.AttributeData;
import ai.typegraph.symbols.MemberSymbol;
import ai.typegraph.symbols.ModuleSymbol;
import ai.typegraph.symbols.NamedTypeSymbol;
import ai.typegraph.symbols.NamespaceSymbol;
import ai.typegraph.symbols.TypeKind;
import ai.typegraph.symbols.TypeParameterSymbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * A referenced class found in no class source. Its identity comes from the
 * reference alone; it has no module, no members and no body in the graph.
 */
final class UnresolvedType implements NamedTypeSymbol {

    private final String internalName;
    private final NamespaceSymbol namespace;

    UnresolvedType(String internalName, NamespaceSymbol namespace) {
        this.internalName = internalName;
        this.namespace = namespace;
    }

    @Override
    public String name() {
        final int slash = internalName.lastIndexOf('/');
        return internalName.substring(slash + 1);
    }

    @Override
    public String displayName() {
        return internalName.replace('/', '.');
    }

    @Override
    public TypeKind typeKind() {
        return TypeKind.ERROR;
    }

    @Override
    public ModuleSymbol containingModule() {
        return null;
    }

    @Override
    public Accessibility accessibility() {
        return Accessibility.NOT_APPLICABLE;
    }

    @Override
    public boolean isCompilerGenerated() {
        return false;
    }

    @Override
    public NamespaceSymbol containingNamespace() {
        return namespace;
    }

    @Override
    public NamedTypeSymbol containingType() {
        return null;
    }

    @Override
    public boolean isAbstract() {
        return false;
    }

    @Override
    public boolean isSealed() {
        return false;
    }

    @Override
    public boolean isStatic() {
        return false;
    }

    @Override
    public boolean isValueType() {
        return false;
    }

    @Override
    public boolean isRecord() {
        return false;
    }

    @Override
    public List<TypeParameterSymbol> typeParameters() {
        return List.of();
    }

    @Override
    public List<TypeSymbol> typeArguments() {
        return List.of();
    }

    @Override
    public NamedTypeSymbol originalDefinition() {
        return this;
    }

    @Override
    public NamedTypeSymbol baseType() {
        return null;
    }

    @Override
    public List<NamedTypeSymbol> interfaces() {
        return List.of();
    }

    @Override
    public List<MemberSymbol> members() {
        return List.of();
    }

    @Override
    public List<NamedTypeSymbol> typeMembers() {
        return List.of();
    }

    @Override
    public List<AttributeData> attributes() {
        return List.of();
    }

    @Override
    public String toString() {
        return displayName() + " (unresolved)";
    }
}
