package ai.typegraph.model;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import ai.typegraph.symbols.ArrayTypeSymbol;
import ai.typegraph.symbols.EventSymbol;
import ai.typegraph.symbols.FieldSymbol;
import ai.typegraph.symbols.MemberSymbol;
import ai.typegraph.symbols.MethodSymbol;
import ai.typegraph.symbols.ModuleSymbol;
import ai.typegraph.symbols.NamedTypeSymbol;
import ai.typegraph.symbols.NamespaceSymbol;
import ai.typegraph.symbols.ParameterSymbol;
import ai.typegraph.symbols.PointerTypeSymbol;
import ai.typegraph.symbols.PropertySymbol;
import ai.typegraph.symbols.RefKind;
import ai.typegraph.symbols.Symbol;
import ai.typegraph.symbols.TypeParameterSymbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * Mints stable, hierarchical IRIs for symbols.
 * Pure: the same symbol always yields the same IRI and nothing is cached.
 */
public final class IriMinter {

    public static final String DEFAULT_BASE_URI = "http://jvm.example/";

    private final String baseUri;

    public IriMinter(String baseUri) {
        Objects.requireNonNull(baseUri, "baseUri");
        String trimmed = baseUri;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        this.baseUri = trimmed;
    }

    public String baseUri() {
        return baseUri;
    }

    public String ontologyPrefix() {
        return TypeGraphOntology.ONTOLOGY;
    }

    public String jvmOntologyPrefix() {
        return baseUri + "/ontology/";
    }

    public String module(ModuleSymbol module) {
        Objects.requireNonNull(module, "module");
        return baseUri + "/assembly/" + escape(module.name()) + "/" + escape(module.version());
    }

    public String namespace(NamespaceSymbol ns) {
        Objects.requireNonNull(ns, "ns");
        if (ns.isGlobalNamespace()) {
            return baseUri + "/namespace/_global_";
        }
        return baseUri + "/namespace/" + escape(ns.fullName());
    }

    public String type(TypeSymbol type) {
        Objects.requireNonNull(type, "type");
        final String fullName = fullMetadataName(type);
        final ModuleSymbol module = type.containingModule();
        if (module == null) {
            // primitives, void and references that never resolved
            return baseUri + "/type/_builtin_/" + escape(fullName);
        }
        return baseUri + "/type/" + escape(module.name()) + "/" + escape(module.version()) + "/" + escape(fullName);
    }

    public String member(MemberSymbol member) {
        Objects.requireNonNull(member, "member");
        return type(member.containingType()) + "/member/" + escape(member.name()) + memberSignature(member);
    }

    public String parameter(ParameterSymbol param) {
        Objects.requireNonNull(param, "param");
        return member(param.containingSymbol()) + "/param/" + param.ordinal();
    }

    public String typeParameter(Symbol owner, TypeParameterSymbol typeParam) {
        Objects.requireNonNull(typeParam, "typeParam");
        final String ownerIri;
        if (owner instanceof NamedTypeSymbol type) {
            ownerIri = type(type);
        } else if (owner instanceof MethodSymbol method) {
            ownerIri = member(method);
        } else {
            throw new IllegalArgumentException("Unexpected type parameter owner: " + describe(owner));
        }
        return ownerIri + "/typeparam/" + typeParam.ordinal();
    }

    public String attribute(Symbol target, int index) {
        final String targetIri;
        if (target instanceof ModuleSymbol module) {
            targetIri = module(module);
        } else if (target instanceof NamedTypeSymbol type) {
            targetIri = type(type);
        } else if (target instanceof MethodSymbol
                || target instanceof PropertySymbol
                || target instanceof FieldSymbol
                || target instanceof EventSymbol) {
            targetIri = member((MemberSymbol) target);
        } else if (target instanceof ParameterSymbol param) {
            targetIri = parameter(param);
        } else {
            throw new IllegalArgumentException("Unexpected attribute target: " + describe(target));
        }
        return targetIri + "/attr/" + index;
    }

    /**
     * Namespace-qualified name with {@code +} between nesting levels and
     * {@code `arity} on generic levels; constructed generics append their
     * arguments in brackets.
     */
    public static String fullMetadataName(TypeSymbol type) {
        if (type instanceof ArrayTypeSymbol array) {
            final StringBuilder sb = new StringBuilder(fullMetadataName(array.elementType()));
            for (int i = 0; i < Math.max(1, array.rank()); i++) {
                sb.append("[]");
            }
            return sb.toString();
        }
        if (type instanceof PointerTypeSymbol pointer) {
            return fullMetadataName(pointer.pointedAtType()) + "*";
        }
        if (type instanceof TypeParameterSymbol typeParam) {
            final String ownerPart;
            if (typeParam.declaringType() != null) {
                ownerPart = fullMetadataName(typeParam.declaringType());
            } else if (typeParam.declaringMethod() != null) {
                ownerPart = methodDisplayName(typeParam.declaringMethod());
            } else {
                ownerPart = "";
            }
            return "T:" + ownerPart + "." + typeParam.name();
        }
        if (!(type instanceof NamedTypeSymbol named)) {
            return type.displayName();
        }

        final StringBuilder sb = new StringBuilder();

        final Deque<NamedTypeSymbol> containing = new ArrayDeque<>();
        NamedTypeSymbol current = named.containingType();
        while (current != null) {
            containing.push(current);
            current = current.containingType();
        }

        final NamespaceSymbol ns = named.containingNamespace();
        if (ns != null && !ns.isGlobalNamespace()) {
            sb.append(ns.fullName()).append('.');
        }

        for (NamedTypeSymbol outer : containing) {
            sb.append(outer.name());
            appendTypeParameters(sb, outer);
            sb.append('+');
        }

        sb.append(named.name());
        appendTypeParameters(sb, named);
        return sb.toString();
    }

    private static void appendTypeParameters(StringBuilder sb, NamedTypeSymbol type) {
        final int parameterCount = type.typeParameters().size();
        final List<TypeSymbol> args = type.typeArguments();
        if (parameterCount == 0 && args.isEmpty()) {
            return;
        }

        sb.append('`').append(parameterCount > 0 ? parameterCount : args.size());

        if (!args.isEmpty() && !args.stream().allMatch(a -> a instanceof TypeParameterSymbol)) {
            sb.append('[');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append(fullMetadataName(args.get(i)));
            }
            sb.append(']');
        }
    }

    /**
     * Overload-disambiguating suffix. By-reference parameters are prefixed
     * {@code ref } whether declared ref or out, {@code in } for in; so two
     * overloads differing only in ref versus out share one IRI.
     */
    static String memberSignature(MemberSymbol member) {
        if (member instanceof MethodSymbol method) {
            final StringBuilder sb = new StringBuilder("(");
            final List<ParameterSymbol> params = method.parameters();
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                final ParameterSymbol param = params.get(i);
                if (param.refKind() == RefKind.REF || param.refKind() == RefKind.OUT) {
                    sb.append("ref ");
                } else if (param.refKind() == RefKind.IN) {
                    sb.append("in ");
                }
                sb.append(fullMetadataName(param.type()));
            }
            return sb.append(')').toString();
        }
        if (member instanceof PropertySymbol prop && prop.isIndexer()) {
            final StringBuilder sb = new StringBuilder("[");
            final List<ParameterSymbol> params = prop.parameters();
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append(fullMetadataName(params.get(i).type()));
            }
            return sb.append(']').toString();
        }
        return "";
    }

    /**
     * e.g. {@code sample.C.map<T>(T,java.lang.String)}
     */
    public static String methodDisplayName(MethodSymbol method) {
        final StringBuilder sb = new StringBuilder();
        sb.append(method.containingType().displayName()).append('.').append(method.name());
        if (!method.typeParameters().isEmpty()) {
            sb.append('<');
            for (int i = 0; i < method.typeParameters().size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append(method.typeParameters().get(i).name());
            }
            sb.append('>');
        }
        sb.append('(');
        for (int i = 0; i < method.parameters().size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(method.parameters().get(i).type().displayName());
        }
        return sb.append(')').toString();
    }

    /**
     * Percent-encodes every UTF-8 byte except ASCII letters, digits and {@code - _ . ~}.
     */
    public static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        final StringBuilder sb = new StringBuilder(bytes.length + 16);
        for (byte b : bytes) {
            final int c = b & 0xFF;
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '_' || c == '.' || c == '~') {
                sb.append((char) c);
            } else {
                sb.append('%');
                sb.append(Character.toUpperCase(Character.forDigit(c >> 4, 16)));
                sb.append(Character.toUpperCase(Character.forDigit(c & 0xF, 16)));
            }
        }
        return sb.toString();
    }

    private static String describe(Symbol symbol) {
        return symbol == null ? "null" : symbol.getClass().getSimpleName() + " " + symbol.name();
    }
}
