package ai.typegraph.loader;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.objectweb.asm.Opcodes;

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
 * A class, interface, enum, annotation type or record read from a class file,
 * in its declared (generic definition) form. Referenced types, members and
 * annotations are resolved on first access.
 */
final class AsmNamedType implements NamedTypeSymbol, TypeScope {

    private final TypeUniverse universe;
    private final ClassModel model;
    private final AsmModule module;

    private SignatureCollector signature;
    private List<TypeParameterSymbol> typeParameters;
    private NamedTypeSymbol baseType;
    private boolean baseTypeResolved;
    private List<NamedTypeSymbol> interfaces;
    private List<AsmMethod> methods;
    private List<MemberSymbol> members;
    private List<NamedTypeSymbol> typeMembers;
    private List<AttributeData> attributes;

    AsmNamedType(TypeUniverse universe, ClassModel model, AsmModule module) {
        this.universe = universe;
        this.model = model;
        this.module = module;
    }

    ClassModel model() {
        return model;
    }

    TypeUniverse universe() {
        return universe;
    }

    String internalName() {
        return model.internalName;
    }

    @Override
    public String name() {
        if (model.isNestedMember()) {
            return model.innerName;
        }
        final int slash = model.internalName.lastIndexOf('/');
        return model.internalName.substring(slash + 1);
    }

    /**
     * Dotted source-style name without type parameters, e.g. {@code java.util.Map.Entry}.
     */
    String qualifiedName() {
        final NamedTypeSymbol outer = containingType();
        if (outer instanceof AsmNamedType asmOuter) {
            return asmOuter.qualifiedName() + "." + name();
        }
        final String pkg = NamespaceTable.packageOf(model.internalName);
        return pkg.isEmpty() ? name() : pkg + "." + name();
    }

    @Override
    public String displayName() {
        final List<TypeParameterSymbol> params = typeParameters();
        if (params.isEmpty()) {
            return qualifiedName();
        }
        final StringBuilder sb = new StringBuilder(qualifiedName()).append('<');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(params.get(i).name());
        }
        return sb.append('>').toString();
    }

    @Override
    public TypeKind typeKind() {
        if (model.isInterface()) {
            return TypeKind.INTERFACE;
        }
        if (model.is(Opcodes.ACC_ENUM)) {
            return TypeKind.ENUM;
        }
        return TypeKind.CLASS;
    }

    @Override
    public ModuleSymbol containingModule() {
        return module;
    }

    @Override
    public Accessibility accessibility() {
        if (model.isLocalOrAnonymous()) {
            return Accessibility.PRIVATE;
        }
        if (model.isNestedMember()) {
            return AsmAccess.accessibility(model.innerAccess);
        }
        return model.is(Opcodes.ACC_PUBLIC) ? Accessibility.PUBLIC : Accessibility.INTERNAL;
    }

    @Override
    public boolean isCompilerGenerated() {
        return model.is(Opcodes.ACC_SYNTHETIC) || model.isAnonymous();
    }

    @Override
    public NamespaceSymbol containingNamespace() {
        return universe.namespaces().get(NamespaceTable.packageOf(model.internalName));
    }

    @Override
    public NamedTypeSymbol containingType() {
        return model.isNestedMember() ? universe.namedType(model.outerName) : null;
    }

    @Override
    public boolean isAbstract() {
        return model.is(Opcodes.ACC_ABSTRACT);
    }

    @Override
    public boolean isSealed() {
        return model.is(Opcodes.ACC_FINAL);
    }

    @Override
    public boolean isStatic() {
        return model.isNestedMember() && (model.innerAccess & Opcodes.ACC_STATIC) != 0;
    }

    @Override
    public boolean isValueType() {
        return false;
    }

    @Override
    public boolean isRecord() {
        return model.record;
    }

    @Override
    public boolean isReadOnly() {
        return model.record;
    }

    @Override
    public SpecialType specialType() {
        return switch (model.internalName) {
            case "java/lang/Object" -> SpecialType.OBJECT;
            case "java/lang/String" -> SpecialType.STRING;
            default -> SpecialType.NONE;
        };
    }

    SignatureCollector signature() {
        if (signature == null && model.signature != null) {
            signature = SignatureCollector.parse(model.signature);
        }
        return signature;
    }

    @Override
    public List<TypeParameterSymbol> typeParameters() {
        if (typeParameters == null) {
            final SignatureCollector sig = signature();
            typeParameters = sig == null
                    ? List.of()
                    : AsmTypeParameter.declare(universe, sig.typeParameters, this, null, this);
        }
        return typeParameters;
    }

    @Override
    public List<TypeSymbol> typeArguments() {
        return List.copyOf(typeParameters());
    }

    @Override
    public NamedTypeSymbol originalDefinition() {
        return this;
    }

    @Override
    public TypeParameterSymbol typeParameter(String name) {
        for (TypeParameterSymbol tp : typeParameters()) {
            if (tp.name().equals(name)) {
                return tp;
            }
        }
        if (containingType() instanceof AsmNamedType outer) {
            return outer.typeParameter(name);
        }
        return null;
    }

    @Override
    public NamedTypeSymbol baseType() {
        if (!baseTypeResolved) {
            baseTypeResolved = true;
            if (!model.isInterface() && model.superName != null) {
                final SignatureCollector sig = signature();
                final TypeRef ref = sig != null && sig.superclass != null
                        ? sig.superclass
                        : new TypeRef.ClassType(model.superName, List.of());
                baseType = universe.resolveNamed(ref, this);
            }
        }
        return baseType;
    }

    @Override
    public List<NamedTypeSymbol> interfaces() {
        if (interfaces == null) {
            final SignatureCollector sig = signature();
            final List<TypeRef> refs = new ArrayList<>();
            if (sig != null && !sig.interfaces.isEmpty()) {
                refs.addAll(sig.interfaces);
            } else {
                for (String name : model.interfaces) {
                    refs.add(new TypeRef.ClassType(name, List.of()));
                }
            }
            final List<NamedTypeSymbol> out = new ArrayList<>(refs.size());
            for (TypeRef ref : refs) {
                final NamedTypeSymbol iface = universe.resolveNamed(ref, this);
                if (iface != null) {
                    out.add(iface);
                }
            }
            interfaces = List.copyOf(out);
        }
        return interfaces;
    }

    List<AsmMethod> methods() {
        if (methods == null) {
            final List<AsmMethod> out = new ArrayList<>(model.methods.size());
            for (ClassModel.MethodModel m : model.methods) {
                out.add(new AsmMethod(this, m));
            }
            methods = List.copyOf(out);
        }
        return methods;
    }

    AsmMethod findMethod(String name, String descriptor) {
        for (AsmMethod method : methods()) {
            if (method.model().name.equals(name) && method.model().descriptor.equals(descriptor)) {
                return method;
            }
        }
        return null;
    }

    /**
     * Fields, then record components, then methods, each in class-file order.
     */
    @Override
    public List<MemberSymbol> members() {
        if (members == null) {
            final List<MemberSymbol> out = new ArrayList<>();
            for (ClassModel.FieldModel f : model.fields) {
                out.add(new AsmField(this, f));
            }
            for (ClassModel.ComponentModel c : model.components) {
                out.add(new AsmProperty(this, c));
            }
            out.addAll(methods());
            members = List.copyOf(out);
        }
        return members;
    }

    @Override
    public List<NamedTypeSymbol> typeMembers() {
        if (typeMembers == null) {
            final List<NamedTypeSymbol> out = new ArrayList<>();
            for (String name : model.memberTypes) {
                if (universe.namedType(name) instanceof AsmNamedType nested
                        && nested.containingModule() == module
                        && nested.model.isNestedMember()) {
                    out.add(nested);
                }
            }
            out.sort(Comparator.comparing(NamedTypeSymbol::name));
            typeMembers = List.copyOf(out);
        }
        return typeMembers;
    }

    boolean isRecordAccessor(ClassModel.MethodModel m) {
        if (!model.record || (m.access & Opcodes.ACC_STATIC) != 0 || !m.descriptor.startsWith("()")) {
            return false;
        }
        for (ClassModel.ComponentModel c : model.components) {
            if (c.name.equals(m.name) && m.descriptor.equals("()" + c.descriptor)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public List<AttributeData> attributes() {
        if (attributes == null) {
            attributes = universe.annotations().convert(model.annotations);
        }
        return attributes;
    }

    @Override
    public String toString() {
        return displayName();
    }
}
