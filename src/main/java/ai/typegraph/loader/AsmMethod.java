package ai.typegraph.loader;

import java.util.ArrayList;
import java.util.List;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

import ai.typegraph.symbols.Accessibility;
import ai.typegraph.symbols.AttributeData;
import ai.typegraph.symbols.MethodKind;
import ai.typegraph.symbols.MethodSymbol;
import ai.typegraph.symbols.NamedTypeSymbol;
import ai.typegraph.symbols.NamespaceSymbol;
import ai.typegraph.symbols.ParameterSymbol;
import ai.typegraph.symbols.TypeParameterSymbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * A method or constructor read from a class file.
 */
final class AsmMethod implements MethodSymbol, TypeScope {

    private static final String CONSTRUCTOR = "<init>";
    private static final String STATIC_INITIALIZER = "<clinit>";

    private final AsmNamedType owner;
    private final ClassModel.MethodModel model;

    private SignatureCollector signature;
    private boolean signatureParsed;
    private List<TypeParameterSymbol> typeParameters;
    private List<ParameterSymbol> parameters;
    private TypeSymbol returnType;
    private MethodSymbol overriddenMethod;
    private boolean overriddenResolved;

    AsmMethod(AsmNamedType owner, ClassModel.MethodModel model) {
        this.owner = owner;
        this.model = model;
    }

    ClassModel.MethodModel model() {
        return model;
    }

    @Override
    public String name() {
        return model.name;
    }

    @Override
    public MethodKind methodKind() {
        if (CONSTRUCTOR.equals(model.name)) {
            return MethodKind.CONSTRUCTOR;
        }
        if (STATIC_INITIALIZER.equals(model.name)) {
            return MethodKind.STATIC_CONSTRUCTOR;
        }
        if ("finalize".equals(model.name) && "()V".equals(model.descriptor)) {
            return MethodKind.DESTRUCTOR;
        }
        if (owner.isRecordAccessor(model)) {
            return MethodKind.PROPERTY_GET;
        }
        return MethodKind.ORDINARY;
    }

    @Override
    public Accessibility accessibility() {
        if (STATIC_INITIALIZER.equals(model.name)) {
            return Accessibility.PRIVATE;
        }
        return AsmAccess.accessibility(model.access);
    }

    @Override
    public boolean isCompilerGenerated() {
        return model.is(Opcodes.ACC_SYNTHETIC) || model.is(Opcodes.ACC_BRIDGE) || isEnumSupportMethod();
    }

    // values() and valueOf(String) are mandated for every enum
    private boolean isEnumSupportMethod() {
        if (!owner.model().is(Opcodes.ACC_ENUM) || !model.is(Opcodes.ACC_STATIC)) {
            return false;
        }
        final String self = "L" + owner.internalName() + ";";
        return ("values".equals(model.name) && model.descriptor.equals("()[" + self))
                || ("valueOf".equals(model.name) && model.descriptor.equals("(Ljava/lang/String;)" + self));
    }

    @Override
    public NamedTypeSymbol containingType() {
        return owner;
    }

    @Override
    public boolean isStatic() {
        return model.is(Opcodes.ACC_STATIC);
    }

    @Override
    public boolean isAbstract() {
        return model.is(Opcodes.ACC_ABSTRACT);
    }

    @Override
    public boolean isVirtual() {
        return isOverridable() && !model.is(Opcodes.ACC_ABSTRACT) && !model.is(Opcodes.ACC_FINAL)
                && overriddenMethod() == null;
    }

    @Override
    public boolean isOverride() {
        return overriddenMethod() != null;
    }

    @Override
    public boolean isSealed() {
        return model.is(Opcodes.ACC_FINAL);
    }

    @Override
    public boolean isExtern() {
        return model.is(Opcodes.ACC_NATIVE);
    }

    private boolean isOverridable() {
        return !model.is(Opcodes.ACC_STATIC) && !model.is(Opcodes.ACC_PRIVATE) && !model.name.startsWith("<");
    }

    private SignatureCollector signature() {
        if (!signatureParsed) {
            signatureParsed = true;
            if (model.signature != null) {
                signature = SignatureCollector.parse(model.signature);
            }
        }
        return signature;
    }

    @Override
    public List<TypeParameterSymbol> typeParameters() {
        if (typeParameters == null) {
            final SignatureCollector sig = signature();
            typeParameters = sig == null
                    ? List.of()
                    : AsmTypeParameter.declare(owner.universe(), sig.typeParameters, null, this, this);
        }
        return typeParameters;
    }

    @Override
    public TypeParameterSymbol typeParameter(String name) {
        for (TypeParameterSymbol tp : typeParameters()) {
            if (tp.name().equals(name)) {
                return tp;
            }
        }
        return owner.typeParameter(name);
    }

    @Override
    public boolean returnsVoid() {
        return model.descriptor.endsWith(")V");
    }

    @Override
    public TypeSymbol returnType() {
        if (returnType == null) {
            final SignatureCollector sig = signature();
            final TypeRef ref = sig != null && sig.returnType != null
                    ? sig.returnType
                    : TypeRef.fromAsmType(Type.getReturnType(model.descriptor));
            returnType = owner.universe().resolve(ref, this);
        }
        return returnType;
    }

    /**
     * Implicit leading parameters (outer instance, enum name and ordinal) appear
     * in the descriptor only; they keep their erased types.
     */
    @Override
    public List<ParameterSymbol> parameters() {
        if (parameters == null) {
            final Type[] erased = Type.getArgumentTypes(model.descriptor);
            final List<TypeRef> refs = new ArrayList<>(erased.length);
            final SignatureCollector sig = signature();
            final int generic = sig == null ? 0 : Math.min(sig.parameters.size(), erased.length);
            final int leading = erased.length - generic;
            for (int i = 0; i < erased.length; i++) {
                refs.add(i < leading ? TypeRef.fromAsmType(erased[i]) : sig.parameters.get(i - leading));
            }

            final List<String> names = parameterNames(erased);
            final List<ParameterSymbol> out = new ArrayList<>(erased.length);
            for (int i = 0; i < erased.length; i++) {
                final boolean varargs = model.is(Opcodes.ACC_VARARGS) && i == erased.length - 1;
                out.add(new AsmParameter(this, i, names.get(i), refs.get(i), varargs,
                        model.parameterAnnotations.getOrDefault(i - leading, List.of())));
            }
            parameters = List.copyOf(out);
        }
        return parameters;
    }

    // MethodParameters, else LocalVariableTable slots, else arg{i}
    private List<String> parameterNames(Type[] erased) {
        final List<String> names = new ArrayList<>(erased.length);
        if (model.parameterNames.size() == erased.length) {
            for (int i = 0; i < erased.length; i++) {
                final String name = model.parameterNames.get(i);
                names.add(name != null ? name : "arg" + i);
            }
            return names;
        }
        int slot = model.is(Opcodes.ACC_STATIC) ? 0 : 1;
        for (int i = 0; i < erased.length; i++) {
            final String name = model.localVariableNames.get(slot);
            names.add(name != null ? name : "arg" + i);
            slot += erased[i].getSize();
        }
        return names;
    }

    TypeUniverse universe() {
        return owner.universe();
    }

    /**
     * Nearest superclass method with the same name and erased parameter types.
     */
    @Override
    public MethodSymbol overriddenMethod() {
        if (!overriddenResolved) {
            overriddenResolved = true;
            overriddenMethod = isOverridable() ? findOverridden() : null;
        }
        return overriddenMethod;
    }

    private MethodSymbol findOverridden() {
        final String parameterPart = model.descriptor.substring(0, model.descriptor.indexOf(')') + 1);
        final NamespaceSymbol ownPackage = owner.containingNamespace();
        NamedTypeSymbol current = owner.baseType();
        int guard = 0;
        while (current != null && guard++ < 64) {
            if (!(current.originalDefinition() instanceof AsmNamedType type)) {
                return null;
            }
            for (AsmMethod candidate : type.methods()) {
                final ClassModel.MethodModel m = candidate.model;
                if (!m.name.equals(model.name) || !m.descriptor.startsWith(parameterPart)
                        || !candidate.isOverridable()) {
                    continue;
                }
                if (candidate.accessibility() == Accessibility.INTERNAL
                        && !type.containingNamespace().fullName().equals(ownPackage.fullName())) {
                    continue;
                }
                return candidate;
            }
            current = type.baseType();
        }
        return null;
    }

    @Override
    public List<TypeSymbol> declaredExceptions() {
        final SignatureCollector sig = signature();
        final List<TypeRef> refs = new ArrayList<>();
        if (sig != null && !sig.exceptions.isEmpty()) {
            refs.addAll(sig.exceptions);
        } else {
            for (String name : model.exceptions) {
                refs.add(new TypeRef.ClassType(name, List.of()));
            }
        }
        return owner.universe().resolveAll(refs, this);
    }

    @Override
    public List<AttributeData> attributes() {
        return owner.universe().annotations().convert(model.annotations);
    }

    @Override
    public List<AttributeData> returnTypeAttributes() {
        return owner.universe().annotations().convert(model.returnTypeAnnotations);
    }

    @Override
    public String toString() {
        return owner.qualifiedName() + "." + model.name + model.descriptor;
    }
}
