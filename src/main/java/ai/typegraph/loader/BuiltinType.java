package ai.typegraph.loader;

import java.util.List;
import java.util.Map;

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
 * A primitive or {@code void}. Belongs to no module.
 */
final class BuiltinType implements NamedTypeSymbol {

    private static final Map<Character, BuiltinType> BY_DESCRIPTOR = Map.of(
            'Z', new BuiltinType("boolean", SpecialType.BOOLEAN),
            'C', new BuiltinType("char", SpecialType.CHAR),
            'B', new BuiltinType("byte", SpecialType.BYTE),
            'S', new BuiltinType("short", SpecialType.SHORT),
            'I', new BuiltinType("int", SpecialType.INT),
            'J', new BuiltinType("long", SpecialType.LONG),
            'F', new BuiltinType("float", SpecialType.FLOAT),
            'D', new BuiltinType("double", SpecialType.DOUBLE),
            'V', new BuiltinType("void", SpecialType.VOID));

    private final String name;
    private final SpecialType specialType;

    private BuiltinType(String name, SpecialType specialType) {
        this.name = name;
        this.specialType = specialType;
    }

    static BuiltinType of(char descriptor) {
        final BuiltinType type = BY_DESCRIPTOR.get(descriptor);
        if (type == null) {
            throw new IllegalArgumentException("Not a primitive descriptor: " + descriptor);
        }
        return type;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String displayName() {
        return name;
    }

    @Override
    public TypeKind typeKind() {
        return TypeKind.STRUCT;
    }

    @Override
    public ModuleSymbol containingModule() {
        return null;
    }

    @Override
    public Accessibility accessibility() {
        return Accessibility.PUBLIC;
    }

    @Override
    public boolean isCompilerGenerated() {
        return false;
    }

    @Override
    public NamespaceSymbol containingNamespace() {
        return null;
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
        return true;
    }

    @Override
    public boolean isStatic() {
        return false;
    }

    @Override
    public boolean isValueType() {
        return true;
    }

    @Override
    public boolean isRecord() {
        return false;
    }

    @Override
    public SpecialType specialType() {
        return specialType;
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
        return name;
    }
}
