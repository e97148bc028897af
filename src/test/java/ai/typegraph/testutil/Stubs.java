package ai.typegraph.testutil;

import java.util.ArrayList;
import java.util.List;

import ai.typegraph.symbols.Accessibility;
import ai.typegraph.symbols.ArrayTypeSymbol;
import ai.typegraph.symbols.AttributeData;
import ai.typegraph.symbols.EventSymbol;
import ai.typegraph.symbols.FieldSymbol;
import ai.typegraph.symbols.MemberSymbol;
import ai.typegraph.symbols.MethodKind;
import ai.typegraph.symbols.MethodSymbol;
import ai.typegraph.symbols.ModuleSymbol;
import ai.typegraph.symbols.NamedTypeSymbol;
import ai.typegraph.symbols.NamespaceSymbol;
import ai.typegraph.symbols.ParameterSymbol;
import ai.typegraph.symbols.PointerTypeSymbol;
import ai.typegraph.symbols.PropertySymbol;
import ai.typegraph.symbols.RefKind;
import ai.typegraph.symbols.SpecialType;
import ai.typegraph.symbols.TypeKind;
import ai.typegraph.symbols.TypeParameterSymbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * Hand-built symbols for host features class files cannot express
 * (structs, events, pointers, by-reference parameters) and for small graphs.
 */
public final class Stubs {

    private Stubs() {
    }

    /**
     * A value type outside every module, like a primitive.
     */
    public static Type builtin(String name) {
        final Type type = new Type(name, null, null, null);
        type.kind = TypeKind.STRUCT;
        type.valueType = true;
        return type;
    }

    public static final class Module implements ModuleSymbol {
        private final String name;
        private final String version;
        private final Namespace global = new Namespace("", null);
        public final List<AttributeData> attributes = new ArrayList<>();

        public Module(String name, String version) {
            this.name = name;
            this.version = version;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String version() {
            return version;
        }

        @Override
        public Namespace globalNamespace() {
            return global;
        }

        @Override
        public List<AttributeData> attributes() {
            return attributes;
        }

        /**
         * Namespace for a dotted path, created on demand.
         */
        public Namespace namespace(String dotted) {
            Namespace current = global;
            for (String part : dotted.split("\\.")) {
                current = current.child(part);
            }
            return current;
        }

        /**
         * Public class declared directly in the namespace.
         */
        public Type type(String namespace, String name) {
            final Namespace ns = namespace(namespace);
            final Type type = new Type(name, this, ns, null);
            ns.types.add(type);
            return type;
        }
    }

    public static final class Namespace implements NamespaceSymbol {
        private final String name;
        private final Namespace parent;
        final List<NamedTypeSymbol> types = new ArrayList<>();
        private final List<Namespace> children = new ArrayList<>();

        Namespace(String name, Namespace parent) {
            this.name = name;
            this.parent = parent;
        }

        Namespace child(String childName) {
            for (Namespace c : children) {
                if (c.name.equals(childName)) {
                    return c;
                }
            }
            final Namespace created = new Namespace(childName, this);
            children.add(created);
            return created;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String fullName() {
            if (parent == null) {
                return "";
            }
            return parent.isGlobalNamespace() ? name : parent.fullName() + "." + name;
        }

        @Override
        public NamespaceSymbol containingNamespace() {
            return parent;
        }

        @Override
        public List<NamedTypeSymbol> typeMembers() {
            return types;
        }

        @Override
        public List<NamespaceSymbol> namespaceMembers() {
            return new ArrayList<>(children);
        }
    }

    public static final class Type implements NamedTypeSymbol {
        private final String name;
        private final ModuleSymbol module;
        private final Namespace namespace;
        private final Type containingType;

        public TypeKind kind = TypeKind.CLASS;
        public Accessibility accessibility = Accessibility.PUBLIC;
        public boolean compilerGenerated;
        public boolean isAbstract;
        public boolean isSealed;
        public boolean isStatic;
        public boolean valueType;
        public boolean record;
        public SpecialType specialType = SpecialType.NONE;
        public NamedTypeSymbol baseType;
        public NamedTypeSymbol originalDefinition;
        public final List<TypeParameterSymbol> typeParameters = new ArrayList<>();
        public final List<TypeSymbol> typeArguments = new ArrayList<>();
        public final List<NamedTypeSymbol> interfaces = new ArrayList<>();
        public final List<MemberSymbol> members = new ArrayList<>();
        public final List<NamedTypeSymbol> typeMembers = new ArrayList<>();
        public final List<AttributeData> attributes = new ArrayList<>();

        Type(String name, ModuleSymbol module, Namespace namespace, Type containingType) {
            this.name = name;
            this.module = module;
            this.namespace = namespace;
            this.containingType = containingType;
        }

        public Type nested(String nestedName) {
            final Type type = new Type(nestedName, module, namespace, this);
            typeMembers.add(type);
            return type;
        }

        /**
         * {@code this<args>} constructed from this generic definition.
         */
        public Type construct(TypeSymbol... args) {
            final Type constructed = new Type(name, module, namespace, containingType);
            constructed.kind = kind;
            constructed.originalDefinition = this;
            constructed.typeArguments.addAll(List.of(args));
            return constructed;
        }

        public TypeParam typeParameter(String tpName) {
            final TypeParam tp = new TypeParam(tpName, typeParameters.size(), this, null);
            typeParameters.add(tp);
            return tp;
        }

        public Method method(String methodName) {
            final Method m = new Method(methodName, this);
            members.add(m);
            return m;
        }

        public Field field(String fieldName, TypeSymbol type) {
            final Field f = new Field(fieldName, this, type);
            members.add(f);
            return f;
        }

        public Property property(String propertyName, TypeSymbol type) {
            final Property p = new Property(propertyName, this, type);
            members.add(p);
            return p;
        }

        public Event event(String eventName, TypeSymbol type) {
            final Event e = new Event(eventName, this, type);
            members.add(e);
            return e;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public TypeKind typeKind() {
            return kind;
        }

        @Override
        public String displayName() {
            final String prefix = containingType != null
                    ? containingType.displayName() + "."
                    : namespace == null || namespace.isGlobalNamespace() ? "" : namespace.fullName() + ".";
            if (typeArguments.isEmpty()) {
                return prefix + name;
            }
            final StringBuilder sb = new StringBuilder(prefix + name).append('<');
            for (int i = 0; i < typeArguments.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append(typeArguments.get(i).displayName());
            }
            return sb.append('>').toString();
        }

        @Override
        public ModuleSymbol containingModule() {
            return module;
        }

        @Override
        public Accessibility accessibility() {
            return accessibility;
        }

        @Override
        public boolean isCompilerGenerated() {
            return compilerGenerated;
        }

        @Override
        public NamespaceSymbol containingNamespace() {
            return namespace;
        }

        @Override
        public NamedTypeSymbol containingType() {
            return containingType;
        }

        @Override
        public boolean isAbstract() {
            return isAbstract;
        }

        @Override
        public boolean isSealed() {
            return isSealed;
        }

        @Override
        public boolean isStatic() {
            return isStatic;
        }

        @Override
        public boolean isValueType() {
            return valueType;
        }

        @Override
        public boolean isRecord() {
            return record;
        }

        @Override
        public SpecialType specialType() {
            return specialType;
        }

        @Override
        public List<TypeParameterSymbol> typeParameters() {
            return typeParameters;
        }

        @Override
        public List<TypeSymbol> typeArguments() {
            return typeArguments.isEmpty() ? List.copyOf(typeParameters) : typeArguments;
        }

        @Override
        public NamedTypeSymbol originalDefinition() {
            return originalDefinition != null ? originalDefinition : this;
        }

        @Override
        public NamedTypeSymbol baseType() {
            return baseType;
        }

        @Override
        public List<NamedTypeSymbol> interfaces() {
            return interfaces;
        }

        @Override
        public List<MemberSymbol> members() {
            return members;
        }

        @Override
        public List<NamedTypeSymbol> typeMembers() {
            return typeMembers;
        }

        @Override
        public List<AttributeData> attributes() {
            return attributes;
        }

        @Override
        public String toString() {
            return displayName();
        }
    }

    public static final class TypeParam implements TypeParameterSymbol {
        private final String name;
        private final int ordinal;
        private final NamedTypeSymbol declaringType;
        private final MethodSymbol declaringMethod;
        public final List<TypeSymbol> constraints = new ArrayList<>();

        TypeParam(String name, int ordinal, NamedTypeSymbol declaringType, MethodSymbol declaringMethod) {
            this.name = name;
            this.ordinal = ordinal;
            this.declaringType = declaringType;
            this.declaringMethod = declaringMethod;
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
            return constraints;
        }

        @Override
        public NamedTypeSymbol declaringType() {
            return declaringType;
        }

        @Override
        public MethodSymbol declaringMethod() {
            return declaringMethod;
        }
    }

    public record Array(TypeSymbol elementType, int rank) implements ArrayTypeSymbol {
        @Override
        public String name() {
            return displayName();
        }

        @Override
        public String displayName() {
            return elementType.displayName() + "[]";
        }

        @Override
        public ModuleSymbol containingModule() {
            return elementType.containingModule();
        }
    }

    public record Pointer(TypeSymbol pointedAtType) implements PointerTypeSymbol {
        @Override
        public String name() {
            return displayName();
        }

        @Override
        public String displayName() {
            return pointedAtType.displayName() + "*";
        }

        @Override
        public ModuleSymbol containingModule() {
            return pointedAtType.containingModule();
        }
    }

    public abstract static class Member implements MemberSymbol {
        private final String name;
        private final NamedTypeSymbol owner;
        public Accessibility accessibility = Accessibility.PUBLIC;
        public boolean compilerGenerated;
        public boolean isStatic;
        public final List<AttributeData> attributes = new ArrayList<>();

        Member(String name, NamedTypeSymbol owner) {
            this.name = name;
            this.owner = owner;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Accessibility accessibility() {
            return accessibility;
        }

        @Override
        public boolean isCompilerGenerated() {
            return compilerGenerated;
        }

        @Override
        public NamedTypeSymbol containingType() {
            return owner;
        }

        @Override
        public boolean isStatic() {
            return isStatic;
        }

        @Override
        public List<AttributeData> attributes() {
            return attributes;
        }
    }

    public static final class Method extends Member implements MethodSymbol {
        public MethodKind kind = MethodKind.ORDINARY;
        public TypeSymbol returnType;
        public MethodSymbol overridden;
        public final List<ParameterSymbol> parameters = new ArrayList<>();
        public final List<TypeParameterSymbol> typeParameters = new ArrayList<>();
        public final List<AttributeData> returnTypeAttributes = new ArrayList<>();
        public final List<TypeSymbol> declaredExceptions = new ArrayList<>();

        Method(String name, NamedTypeSymbol owner) {
            super(name, owner);
        }

        public Method param(String paramName, TypeSymbol type) {
            return param(paramName, type, RefKind.NONE);
        }

        public Method param(String paramName, TypeSymbol type, RefKind refKind) {
            parameters.add(new Param(paramName, parameters.size(), type, this, refKind));
            return this;
        }

        public TypeParam typeParameter(String tpName) {
            final TypeParam tp = new TypeParam(tpName, typeParameters.size(), null, this);
            typeParameters.add(tp);
            return tp;
        }

        public Method returns(TypeSymbol type) {
            this.returnType = type;
            return this;
        }

        @Override
        public MethodKind methodKind() {
            return kind;
        }

        @Override
        public TypeSymbol returnType() {
            return returnType;
        }

        @Override
        public boolean returnsVoid() {
            return returnType == null;
        }

        @Override
        public List<ParameterSymbol> parameters() {
            return parameters;
        }

        @Override
        public List<TypeParameterSymbol> typeParameters() {
            return typeParameters;
        }

        @Override
        public MethodSymbol overriddenMethod() {
            return overridden;
        }

        @Override
        public List<AttributeData> returnTypeAttributes() {
            return returnTypeAttributes;
        }

        @Override
        public List<TypeSymbol> declaredExceptions() {
            return declaredExceptions;
        }
    }

    public static final class Param implements ParameterSymbol {
        private final String name;
        private final int ordinal;
        private final TypeSymbol type;
        private final MemberSymbol owner;
        private final RefKind refKind;

        Param(String name, int ordinal, TypeSymbol type, MemberSymbol owner, RefKind refKind) {
            this.name = name;
            this.ordinal = ordinal;
            this.type = type;
            this.owner = owner;
            this.refKind = refKind;
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
        public TypeSymbol type() {
            return type;
        }

        @Override
        public MemberSymbol containingSymbol() {
            return owner;
        }

        @Override
        public RefKind refKind() {
            return refKind;
        }
    }

    public static final class Field extends Member implements FieldSymbol {
        private final TypeSymbol type;
        public Object constantValue;
        public boolean readOnly;
        public boolean isVolatile;

        Field(String name, NamedTypeSymbol owner, TypeSymbol type) {
            super(name, owner);
            this.type = type;
        }

        @Override
        public TypeSymbol type() {
            return type;
        }

        @Override
        public boolean isReadOnly() {
            return readOnly;
        }

        @Override
        public boolean isConst() {
            return constantValue != null;
        }

        @Override
        public boolean isVolatile() {
            return isVolatile;
        }

        @Override
        public boolean hasConstantValue() {
            return constantValue != null;
        }

        @Override
        public Object constantValue() {
            return constantValue;
        }
    }

    public static final class Property extends Member implements PropertySymbol {
        private final TypeSymbol type;
        public MethodSymbol getter;
        public MethodSymbol setter;
        public final List<ParameterSymbol> parameters = new ArrayList<>();

        Property(String name, NamedTypeSymbol owner, TypeSymbol type) {
            super(name, owner);
            this.type = type;
        }

        public Property indexParam(String paramName, TypeSymbol paramType) {
            parameters.add(new Param(paramName, parameters.size(), paramType, this, RefKind.NONE));
            return this;
        }

        @Override
        public TypeSymbol type() {
            return type;
        }

        @Override
        public List<ParameterSymbol> parameters() {
            return parameters;
        }

        @Override
        public boolean isIndexer() {
            return !parameters.isEmpty();
        }

        @Override
        public MethodSymbol getMethod() {
            return getter;
        }

        @Override
        public MethodSymbol setMethod() {
            return setter;
        }
    }

    public static final class Event extends Member implements EventSymbol {
        private final TypeSymbol type;

        Event(String name, NamedTypeSymbol owner, TypeSymbol type) {
            super(name, owner);
            this.type = type;
        }

        @Override
        public TypeSymbol type() {
            return type;
        }
    }
}
