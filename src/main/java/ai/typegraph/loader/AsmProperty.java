package ai.typegraph.loader;

import java.util.List;

import ai.typegraph.symbols.Accessibility;
import ai.typegraph.symbols.AttributeData;
import ai.typegraph.symbols.MethodSymbol;
import ai.typegraph.symbols.NamedTypeSymbol;
import ai.typegraph.symbols.PropertySymbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * A record component, exposed as a read-only property whose getter is the accessor method.
 */
final class AsmProperty implements PropertySymbol {

    private final AsmNamedType owner;
    private final ClassModel.ComponentModel model;
    private TypeSymbol type;

    AsmProperty(AsmNamedType owner, ClassModel.ComponentModel model) {
        this.owner = owner;
        this.model = model;
    }

    @Override
    public String name() {
        return model.name;
    }

    @Override
    public Accessibility accessibility() {
        final MethodSymbol getter = getMethod();
        return getter != null ? getter.accessibility() : Accessibility.PUBLIC;
    }

    @Override
    public boolean isCompilerGenerated() {
        return false;
    }

    @Override
    public NamedTypeSymbol containingType() {
        return owner;
    }

    @Override
    public boolean isStatic() {
        return false;
    }

    @Override
    public TypeSymbol type() {
        if (type == null) {
            final TypeRef ref = model.signature != null
                    ? SignatureCollector.parseType(model.signature)
                    : TypeRef.fromDescriptor(model.descriptor);
            type = owner.universe().resolve(ref, owner);
        }
        return type;
    }

    @Override
    public MethodSymbol getMethod() {
        return owner.findMethod(model.name, "()" + model.descriptor);
    }

    @Override
    public MethodSymbol setMethod() {
        return null;
    }

    @Override
    public List<AttributeData> attributes() {
        return owner.universe().annotations().convert(model.annotations);
    }

    @Override
    public String toString() {
        return owner.qualifiedName() + "." + model.name;
    }
}
