package ai.typegraph.loader;

import java.util.List;

import org.objectweb.asm.Opcodes;

import ai.typegraph.symbols.Accessibility;
import ai.typegraph.symbols.AttributeData;
import ai.typegraph.symbols.FieldSymbol;
import ai.typegraph.symbols.NamedTypeSymbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * A field. {@code static final} fields carrying a ConstantValue are constants;
 * other {@code final} fields are read-only.
 */
final class AsmField implements FieldSymbol {

    private final AsmNamedType owner;
    private final ClassModel.FieldModel model;
    private TypeSymbol type;

    AsmField(AsmNamedType owner, ClassModel.FieldModel model) {
        this.owner = owner;
        this.model = model;
    }

    @Override
    public String name() {
        return model.name;
    }

    @Override
    public Accessibility accessibility() {
        return AsmAccess.accessibility(model.access);
    }

    @Override
    public boolean isCompilerGenerated() {
        return (model.access & Opcodes.ACC_SYNTHETIC) != 0;
    }

    @Override
    public NamedTypeSymbol containingType() {
        return owner;
    }

    @Override
    public boolean isStatic() {
        return (model.access & Opcodes.ACC_STATIC) != 0;
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
    public boolean isReadOnly() {
        return (model.access & Opcodes.ACC_FINAL) != 0 && !isConst();
    }

    @Override
    public boolean isConst() {
        return isStatic() && (model.access & Opcodes.ACC_FINAL) != 0 && model.value != null;
    }

    @Override
    public boolean isVolatile() {
        return (model.access & Opcodes.ACC_VOLATILE) != 0;
    }

    @Override
    public boolean hasConstantValue() {
        return isConst();
    }

    /**
     * ConstantValue stores booleans and chars as ints; they come back in their declared type.
     */
    @Override
    public Object constantValue() {
        if (!isConst()) {
            return null;
        }
        if ("Z".equals(model.descriptor) && model.value instanceof Integer i) {
            return i != 0;
        }
        if ("C".equals(model.descriptor) && model.value instanceof Integer i) {
            return (char) i.intValue();
        }
        return model.value;
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
