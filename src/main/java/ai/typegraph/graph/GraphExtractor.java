package ai.typegraph.graph;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.typegraph.io.TripleSink;
import ai.typegraph.model.IriMinter;
import ai.typegraph.model.TypeGraphOntology;
import ai.typegraph.model.TypeGraphOntology.AttrProps;
import ai.typegraph.model.TypeGraphOntology.AttrRels;
import ai.typegraph.model.TypeGraphOntology.Classes;
import ai.typegraph.model.TypeGraphOntology.MemberProps;
import ai.typegraph.model.TypeGraphOntology.MemberRels;
import ai.typegraph.model.TypeGraphOntology.ModuleProps;
import ai.typegraph.model.TypeGraphOntology.NamespaceProps;
import ai.typegraph.model.TypeGraphOntology.NamespaceRels;
import ai.typegraph.model.TypeGraphOntology.ParamProps;
import ai.typegraph.model.TypeGraphOntology.ParamRels;
import ai.typegraph.model.TypeGraphOntology.TypeArgProps;
import ai.typegraph.model.TypeGraphOntology.TypeParamProps;
import ai.typegraph.model.TypeGraphOntology.TypeParamRels;
import ai.typegraph.model.TypeGraphOntology.TypeProps;
import ai.typegraph.model.TypeGraphOntology.TypeRels;
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
import ai.typegraph.symbols.SpecialType;
import ai.typegraph.symbols.Symbol;
import ai.typegraph.symbols.TypeParameterSymbol;
import ai.typegraph.symbols.TypeSymbol;
import ai.typegraph.symbols.TypedConstant;

/**
 * Walks one module's symbol forest and streams its type surface into a {@link TripleSink}.
 * <p>
 * Every entity is emitted at most once per run: types and namespaces are
 * marked visited before anything they reference is followed, which also
 * breaks reference cycles. An instance serves a single run and is not
 * thread-safe.
 */
public final class GraphExtractor {

    private static final Logger log = LoggerFactory.getLogger(GraphExtractor.class);

    // accessor-like kinds are described through their property or event
    private static final Set<MethodKind> ROUTED_METHOD_KINDS = EnumSet.of(
            MethodKind.ORDINARY,
            MethodKind.CONSTRUCTOR,
            MethodKind.STATIC_CONSTRUCTOR,
            MethodKind.DESTRUCTOR,
            MethodKind.USER_DEFINED_OPERATOR,
            MethodKind.CONVERSION);

    private final TripleSink sink;
    private final ExtractionOptions options;
    private final IriMinter iris;
    private final InclusionPolicy policy;
    private final CrossReferenceProvider crossReferences;

    private final Set<String> emittedTypes = new HashSet<>();
    private final Set<String> emittedNamespaces = new HashSet<>();
    private final Set<String> walkedTypes = new HashSet<>();
    private int typeDepth;

    public GraphExtractor(TripleSink sink, ExtractionOptions options) {
        this(sink, options, null);
    }

    /**
     * @param crossReferences optional provider of throws / related-to edges, may be {@code null}
     */
    public GraphExtractor(TripleSink sink, ExtractionOptions options, CrossReferenceProvider crossReferences) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.options = Objects.requireNonNull(options, "options");
        this.iris = new IriMinter(options.baseUri());
        this.policy = new InclusionPolicy(options);
        this.crossReferences = crossReferences;

        sink.addPrefix("rdf", TypeGraphOntology.RDF);
        sink.addPrefix("rdfs", TypeGraphOntology.RDFS);
        sink.addPrefix("xsd", TypeGraphOntology.XSD);
        sink.addPrefix(TypeGraphOntology.PREFIX, iris.ontologyPrefix());
        sink.addPrefix(TypeGraphOntology.JVM_PREFIX, iris.jvmOntologyPrefix());
    }

    public IriMinter iris() {
        return iris;
    }

    /**
     * Describes the target module and every included type declared in it,
     * then flushes the sink.
     *
     * @throws ExtractionException when referenced types nest deeper than {@link ExtractionOptions#maxTypeDepth()}
     */
    public ExtractionResult extract(ModuleSymbol module) {
        Objects.requireNonNull(module, "module");
        emittedTypes.clear();
        emittedNamespaces.clear();
        walkedTypes.clear();
        typeDepth = 0;

        log.info("Extracting module {} {}", module.name(), module.version());
        final String moduleIri = extractModule(module);

        final List<NamedTypeSymbol> types = new ArrayList<>();
        collectTypes(module.globalNamespace(), types);

        final List<NamedTypeSymbol> included = new ArrayList<>(types.size());
        for (NamedTypeSymbol type : types) {
            if (policy.includes(type)) {
                included.add(type);
                walkedTypes.add(iris.type(type));
            }
        }

        int typeCount = 0;
        for (NamedTypeSymbol type : included) {
            extractType(type, moduleIri);
            typeCount++;
        }

        sink.flush();
        log.info("Extracted {} types, {} triples", typeCount, sink.tripleCount());
        return new ExtractionResult(moduleIri, typeCount, sink.tripleCount());
    }

    private String extractModule(ModuleSymbol module) {
        final String moduleIri = iris.module(module);
        emitKind(moduleIri, Classes.MODULE);
        sink.emitLiteral(moduleIri, tg(ModuleProps.NAME), module.name());
        sink.emitLiteral(moduleIri, tg(ModuleProps.VERSION), module.version());
        sink.emitLiteral(moduleIri, tg(TypeGraphOntology.LANGUAGE), TypeGraphOntology.LANGUAGE_VALUE);
        if (!module.culture().isEmpty()) {
            sink.emitLiteral(moduleIri, jvm(ModuleProps.CULTURE), module.culture());
        }
        final byte[] token = module.publicKeyToken();
        if (token.length > 0) {
            sink.emitLiteral(moduleIri, jvm(ModuleProps.PUBLIC_KEY_TOKEN), HexFormat.of().formatHex(token));
        }
        sink.emitBool(moduleIri, jvm(ModuleProps.IS_INTERACTIVE), module.isInteractive());

        if (options.includeAttributes()) {
            extractAttributes(moduleIri, module, module.attributes(), 0);
        }
        return moduleIri;
    }

    // parent before children, namespace members before child namespaces
    private static void collectTypes(NamespaceSymbol ns, List<NamedTypeSymbol> out) {
        for (NamedTypeSymbol type : ns.typeMembers()) {
            collectNested(type, out);
        }
        for (NamespaceSymbol child : ns.namespaceMembers()) {
            collectTypes(child, out);
        }
    }

    private static void collectNested(NamedTypeSymbol type, List<NamedTypeSymbol> out) {
        out.add(type);
        for (NamedTypeSymbol nested : type.typeMembers()) {
            collectNested(nested, out);
        }
    }

    private void extractType(NamedTypeSymbol type, String moduleIri) {
        final String typeIri = iris.type(type);
        if (!emittedTypes.add(typeIri)) {
            return;
        }
        log.debug("Type {}", type.displayName());

        emitKind(typeIri, Classes.TYPE);
        final String subKind = type.isRecord() ? Classes.RECORD : kindClass(type);
        if (subKind != null) {
            emitKind(typeIri, subKind);
        }

        sink.emitLiteral(typeIri, tg(TypeProps.NAME), type.name());
        sink.emitLiteral(typeIri, tg(TypeProps.FULL_NAME), type.displayName());
        sink.emitLiteral(typeIri, tg(TypeProps.TYPE_KIND), type.typeKind().displayName());
        sink.emitLiteral(typeIri, tg(TypeProps.ACCESSIBILITY), type.accessibility().displayName());

        sink.emitBool(typeIri, tg(TypeProps.IS_ABSTRACT), type.isAbstract());
        sink.emitBool(typeIri, tg(TypeProps.IS_SEALED), type.isSealed());
        sink.emitBool(typeIri, tg(TypeProps.IS_STATIC), type.isStatic());
        sink.emitBool(typeIri, tg(TypeProps.IS_GENERIC), type.isGenericType());
        sink.emitBool(typeIri, tg(TypeProps.IS_VALUE_TYPE), type.isValueType());
        sink.emitBool(typeIri, tg(TypeProps.IS_RECORD), type.isRecord());
        sink.emitBool(typeIri, tg(TypeProps.IS_REF_LIKE_TYPE), type.isRefLikeType());
        sink.emitBool(typeIri, tg(TypeProps.IS_READ_ONLY), type.isReadOnly());
        sink.emitBool(typeIri, tg(TypeProps.IS_UNMANAGED_TYPE), type.isUnmanagedType());

        if (type.specialType() != SpecialType.NONE) {
            sink.emitLiteral(typeIri, tg(TypeProps.SPECIAL_TYPE), type.specialType().displayName());
        }
        if (type.enumUnderlyingType() != null) {
            sink.emitIri(typeIri, tg(TypeProps.ENUM_UNDERLYING_TYPE), ensureTypeEmitted(type.enumUnderlyingType()));
        }

        sink.emitIri(typeIri, tg(TypeRels.DEFINED_IN_MODULE), moduleIri);

        final NamespaceSymbol ns = type.containingNamespace();
        if (ns != null && !ns.isGlobalNamespace()) {
            sink.emitIri(typeIri, tg(TypeRels.IN_NAMESPACE), ensureNamespaceEmitted(ns));
        }

        final NamedTypeSymbol base = type.baseType();
        if (base != null && base.specialType() != SpecialType.OBJECT) {
            sink.emitIri(typeIri, tg(TypeRels.INHERITS), ensureTypeEmitted(base));
        }
        for (NamedTypeSymbol iface : type.interfaces()) {
            sink.emitIri(typeIri, tg(TypeRels.IMPLEMENTS), ensureTypeEmitted(iface));
        }

        if (type.containingType() != null) {
            sink.emitIri(typeIri, tg(TypeRels.NESTED_IN), iris.type(type.containingType()));
        }

        for (TypeParameterSymbol typeParam : type.typeParameters()) {
            extractTypeParameter(typeIri, type, typeParam);
        }

        if (isConstructed(type)) {
            sink.emitIri(typeIri, tg(TypeRels.GENERIC_DEFINITION), iris.type(type.originalDefinition()));
            emitTypeArguments(typeIri, type);
        }

        if (options.includeAttributes()) {
            extractAttributes(typeIri, type, type.attributes(), 0);
        }

        emitCrossReferences(typeIri, type);

        for (MemberSymbol member : type.members()) {
            if (!policy.includes(member)) {
                continue;
            }
            if (member instanceof MethodSymbol method) {
                if (ROUTED_METHOD_KINDS.contains(method.methodKind())) {
                    extractMethod(typeIri, method);
                }
            } else if (member instanceof PropertySymbol property) {
                extractProperty(typeIri, property);
            } else if (member instanceof FieldSymbol field) {
                extractField(typeIri, field);
            } else if (member instanceof EventSymbol event) {
                extractEvent(typeIri, event);
            }
        }
    }

    private static String kindClass(NamedTypeSymbol type) {
        return switch (type.typeKind()) {
            case CLASS -> Classes.CLASS;
            case STRUCT -> Classes.STRUCT;
            case INTERFACE -> Classes.INTERFACE;
            case ENUM -> Classes.ENUM;
            case DELEGATE -> Classes.DELEGATE;
            default -> null;
        };
    }

    private static boolean isConstructed(NamedTypeSymbol type) {
        return !type.typeArguments().isEmpty()
                && !type.isUnboundGenericType()
                && !type.equals(type.originalDefinition());
    }

    private void emitTypeArguments(String typeIri, NamedTypeSymbol type) {
        final List<TypeSymbol> args = type.typeArguments();
        for (int i = 0; i < args.size(); i++) {
            final String argIri = typeIri + "/typearg/" + i;
            sink.emitIri(typeIri, tg(TypeRels.TYPE_ARGUMENT), argIri);
            sink.emitInt(argIri, tg(TypeArgProps.INDEX), i);
            sink.emitIri(argIri, tg(TypeArgProps.TYPE), ensureTypeEmitted(args.get(i)));
        }
    }

    /**
     * Returns the IRI of a referenced type, describing it first if this is
     * its first appearance. Types the walk will fully extract later are
     * only named here.
     */
    private String ensureTypeEmitted(TypeSymbol type) {
        typeDepth++;
        try {
            if (typeDepth > options.maxTypeDepth()) {
                throw new ExtractionException("Type reference nesting exceeds " + options.maxTypeDepth()
                        + " at " + type.displayName());
            }
            if (type instanceof ArrayTypeSymbol array) {
                return ensureArrayEmitted(array);
            }
            if (type instanceof PointerTypeSymbol pointer) {
                return ensurePointerEmitted(pointer);
            }
            final String typeIri = iris.type(type);
            if (!(type instanceof NamedTypeSymbol named)) {
                // type parameters are described where they are declared
                return typeIri;
            }
            if (walkedTypes.contains(typeIri) || !emittedTypes.add(typeIri)) {
                return typeIri;
            }
            if (!options.includeExternalTypes()) {
                return typeIri;
            }

            emitKind(typeIri, Classes.TYPE);
            sink.emitLiteral(typeIri, tg(TypeProps.NAME), named.name());
            sink.emitLiteral(typeIri, tg(TypeProps.FULL_NAME), named.displayName());
            sink.emitLiteral(typeIri, tg(TypeProps.TYPE_KIND), named.typeKind().displayName());

            final ModuleSymbol module = named.containingModule();
            if (module != null) {
                sink.emitIri(typeIri, tg(TypeRels.DEFINED_IN_MODULE), iris.module(module));
            }
            final NamespaceSymbol ns = named.containingNamespace();
            if (ns != null && !ns.isGlobalNamespace()) {
                sink.emitIri(typeIri, tg(TypeRels.IN_NAMESPACE), ensureNamespaceEmitted(ns));
            }
            if (isConstructed(named)) {
                sink.emitIri(typeIri, tg(TypeRels.GENERIC_DEFINITION), ensureTypeEmitted(named.originalDefinition()));
                emitTypeArguments(typeIri, named);
            }
            return typeIri;
        } finally {
            typeDepth--;
        }
    }

    private String ensureArrayEmitted(ArrayTypeSymbol array) {
        final String typeIri = iris.type(array);
        if (!emittedTypes.add(typeIri)) {
            return typeIri;
        }
        final String elementIri = ensureTypeEmitted(array.elementType());
        emitKind(typeIri, Classes.TYPE);
        sink.emitLiteral(typeIri, tg(TypeProps.NAME), array.displayName());
        sink.emitLiteral(typeIri, tg(TypeProps.TYPE_KIND), array.typeKind().displayName());
        sink.emitInt(typeIri, tg(TypeProps.ARRAY_RANK), array.rank());
        sink.emitIri(typeIri, tg(TypeRels.ARRAY_ELEMENT_TYPE), elementIri);
        return typeIri;
    }

    private String ensurePointerEmitted(PointerTypeSymbol pointer) {
        final String typeIri = iris.type(pointer);
        if (!emittedTypes.add(typeIri)) {
            return typeIri;
        }
        final String pointedIri = ensureTypeEmitted(pointer.pointedAtType());
        emitKind(typeIri, Classes.TYPE);
        sink.emitLiteral(typeIri, tg(TypeProps.NAME), pointer.displayName());
        sink.emitLiteral(typeIri, tg(TypeProps.TYPE_KIND), pointer.typeKind().displayName());
        sink.emitIri(typeIri, tg(TypeRels.POINTER_ELEMENT_TYPE), pointedIri);
        return typeIri;
    }

    private String ensureNamespaceEmitted(NamespaceSymbol ns) {
        final String nsIri = iris.namespace(ns);
        if (!emittedNamespaces.add(nsIri)) {
            return nsIri;
        }
        emitKind(nsIri, Classes.NAMESPACE);
        sink.emitLiteral(nsIri, tg(NamespaceProps.NAME), ns.name());
        sink.emitLiteral(nsIri, tg(NamespaceProps.FULL_NAME), ns.fullName());

        final NamespaceSymbol parent = ns.containingNamespace();
        if (parent != null && !parent.isGlobalNamespace()) {
            sink.emitIri(nsIri, tg(NamespaceRels.PARENT_NAMESPACE), ensureNamespaceEmitted(parent));
        }
        return nsIri;
    }

    private void extractTypeParameter(String ownerIri, Symbol owner, TypeParameterSymbol typeParam) {
        final String tpIri = iris.typeParameter(owner, typeParam);
        emitKind(tpIri, Classes.TYPE_PARAMETER);
        sink.emitLiteral(tpIri, tg(TypeParamProps.NAME), typeParam.name());
        sink.emitInt(tpIri, tg(TypeParamProps.ORDINAL), typeParam.ordinal());
        sink.emitLiteral(tpIri, tg(TypeParamProps.VARIANCE), typeParam.variance().displayName());

        sink.emitBool(tpIri, tg(TypeParamProps.HAS_REFERENCE_TYPE_CONSTRAINT), typeParam.hasReferenceTypeConstraint());
        sink.emitBool(tpIri, tg(TypeParamProps.HAS_VALUE_TYPE_CONSTRAINT), typeParam.hasValueTypeConstraint());
        sink.emitBool(tpIri, tg(TypeParamProps.HAS_UNMANAGED_TYPE_CONSTRAINT), typeParam.hasUnmanagedTypeConstraint());
        sink.emitBool(tpIri, tg(TypeParamProps.HAS_NOT_NULL_CONSTRAINT), typeParam.hasNotNullConstraint());
        sink.emitBool(tpIri, tg(TypeParamProps.HAS_CONSTRUCTOR_CONSTRAINT), typeParam.hasConstructorConstraint());

        sink.emitIri(ownerIri, tg(TypeRels.HAS_TYPE_PARAMETER), tpIri);
        sink.emitIri(tpIri, tg(TypeParamRels.TYPE_PARAMETER_OF), ownerIri);

        for (TypeSymbol constraint : typeParam.constraintTypes()) {
            sink.emitIri(tpIri, tg(TypeParamRels.CONSTRAINED_TO_TYPE), ensureTypeEmitted(constraint));
        }
    }

    /**
     * @return the next free attribute index on the same target
     */
    private int extractAttributes(String subjectIri, Symbol target, List<AttributeData> attributes, int firstIndex) {
        int index = firstIndex;
        for (AttributeData attribute : attributes) {
            extractAttribute(subjectIri, target, attribute, index++);
        }
        return index;
    }

    private void extractAttribute(String subjectIri, Symbol target, AttributeData attribute, int index) {
        if (attribute.attributeClass() == null) {
            return;
        }
        final String attrIri = iris.attribute(target, index);
        emitKind(attrIri, Classes.ATTRIBUTE);
        sink.emitIri(subjectIri, tg(TypeRels.HAS_ATTRIBUTE), attrIri);
        sink.emitIri(attrIri, tg(AttrRels.ATTRIBUTE_OF), subjectIri);
        sink.emitIri(attrIri, tg(AttrRels.ATTRIBUTE_TYPE), ensureTypeEmitted(attribute.attributeClass()));

        if (!attribute.constructorArguments().isEmpty()) {
            sink.emitLiteral(attrIri, tg(AttrProps.CONSTRUCTOR_ARGUMENTS),
                    formatArguments(attribute.constructorArguments()));
        }
        if (!attribute.namedArguments().isEmpty()) {
            sink.emitLiteral(attrIri, tg(AttrProps.NAMED_ARGUMENTS), formatNamedArguments(attribute.namedArguments()));
        }
    }

    private static String formatArguments(List<TypedConstant> args) {
        final StringJoiner joiner = new StringJoiner(", ");
        for (TypedConstant arg : args) {
            joiner.add(formatTypedConstant(arg));
        }
        return joiner.toString();
    }

    private static String formatNamedArguments(List<AttributeData.NamedArgument> args) {
        final StringJoiner joiner = new StringJoiner(", ");
        for (AttributeData.NamedArgument arg : args) {
            joiner.add(arg.name() + "=" + formatTypedConstant(arg.value()));
        }
        return joiner.toString();
    }

    static String formatTypedConstant(TypedConstant constant) {
        if (constant == null || constant.isNull()) {
            return "null";
        }
        if (constant.kind() == TypedConstant.Kind.ARRAY) {
            return "[" + formatArguments(constant.values()) + "]";
        }
        if (constant.value() instanceof TypeSymbol type) {
            return "typeof(" + type.displayName() + ")";
        }
        if (constant.value() instanceof AttributeData nested) {
            final String name = nested.attributeClass() == null ? "?" : nested.attributeClass().displayName();
            return "@" + name + "(" + formatNamedArguments(nested.namedArguments()) + ")";
        }
        if (constant.kind() == TypedConstant.Kind.ENUM) {
            return String.valueOf(constant.value());
        }
        if (constant.value() instanceof String s) {
            return "\"" + s + "\"";
        }
        return String.valueOf(constant.value());
    }

    private void emitCrossReferences(String subjectIri, Symbol symbol) {
        if (crossReferences == null) {
            return;
        }
        if (options.extractExceptions()) {
            for (TypeSymbol exception : crossReferences.exceptionTypesFor(symbol)) {
                sink.emitIri(subjectIri, tg(TypeRels.THROWS), ensureTypeEmitted(exception));
            }
        }
        if (options.extractSeeAlso()) {
            for (Symbol related : crossReferences.seeAlsoFor(symbol)) {
                if (related instanceof TypeSymbol relatedType) {
                    sink.emitIri(subjectIri, tg(TypeRels.RELATED_TO), ensureTypeEmitted(relatedType));
                } else if (related instanceof MemberSymbol relatedMember) {
                    sink.emitIri(subjectIri, tg(TypeRels.RELATED_TO), iris.member(relatedMember));
                }
            }
        }
    }

    private String beginMember(String typeIri, MemberSymbol member, String kindClass) {
        final String memberIri = iris.member(member);
        log.debug("  {} {}", kindClass, member.name());
        emitKind(memberIri, Classes.MEMBER);
        emitKind(memberIri, kindClass);
        sink.emitLiteral(memberIri, tg(MemberProps.NAME), member.name());
        sink.emitLiteral(memberIri, tg(MemberProps.ACCESSIBILITY), member.accessibility().displayName());
        sink.emitBool(memberIri, tg(MemberProps.IS_STATIC), member.isStatic());
        sink.emitIri(typeIri, tg(TypeRels.HAS_MEMBER), memberIri);
        sink.emitIri(memberIri, tg(MemberRels.MEMBER_OF), typeIri);
        return memberIri;
    }

    private void extractMethod(String typeIri, MethodSymbol method) {
        final String memberIri = beginMember(typeIri, method, Classes.METHOD);
        if (method.methodKind() == MethodKind.CONSTRUCTOR || method.methodKind() == MethodKind.STATIC_CONSTRUCTOR) {
            emitKind(memberIri, Classes.CONSTRUCTOR);
        }
        sink.emitLiteral(memberIri, tg(MemberProps.METHOD_KIND), method.methodKind().displayName());

        sink.emitBool(memberIri, tg(MemberProps.IS_ABSTRACT), method.isAbstract());
        sink.emitBool(memberIri, tg(MemberProps.IS_VIRTUAL), method.isVirtual());
        sink.emitBool(memberIri, tg(MemberProps.IS_OVERRIDE), method.isOverride());
        sink.emitBool(memberIri, tg(MemberProps.IS_SEALED), method.isSealed());
        sink.emitBool(memberIri, tg(MemberProps.IS_EXTERN), method.isExtern());
        sink.emitBool(memberIri, tg(MemberProps.IS_ASYNC), method.isAsync());
        sink.emitBool(memberIri, tg(MemberProps.IS_READ_ONLY), method.isReadOnly());
        sink.emitBool(memberIri, tg(MemberProps.IS_EXTENSION_METHOD), method.isExtensionMethod());
        sink.emitBool(memberIri, tg(MemberProps.IS_PARTIAL_DEFINITION), method.isPartialDefinition());

        if (!method.returnsVoid() && method.returnType() != null) {
            sink.emitIri(memberIri, tg(MemberRels.RETURN_TYPE), ensureTypeEmitted(method.returnType()));
        }

        for (TypeParameterSymbol typeParam : method.typeParameters()) {
            extractTypeParameter(memberIri, method, typeParam);
        }
        for (ParameterSymbol param : method.parameters()) {
            extractParameter(memberIri, param);
        }

        if (method.overriddenMethod() != null) {
            sink.emitIri(memberIri, tg(MemberRels.OVERRIDES_METHOD), iris.member(method.overriddenMethod()));
        }
        for (MethodSymbol impl : method.explicitInterfaceImplementations()) {
            sink.emitIri(memberIri, tg(MemberRels.EXPLICIT_INTERFACE_IMPL), iris.member(impl));
        }

        if (options.includeAttributes()) {
            final int next = extractAttributes(memberIri, method, method.attributes(), 0);
            extractAttributes(memberIri + "/return", method, method.returnTypeAttributes(), next);
        }

        emitCrossReferences(memberIri, method);
    }

    private void extractProperty(String typeIri, PropertySymbol property) {
        final String memberIri = beginMember(typeIri, property, Classes.PROPERTY);

        sink.emitBool(memberIri, tg(MemberProps.IS_ABSTRACT), property.isAbstract());
        sink.emitBool(memberIri, tg(MemberProps.IS_VIRTUAL), property.isVirtual());
        sink.emitBool(memberIri, tg(MemberProps.IS_OVERRIDE), property.isOverride());
        sink.emitBool(memberIri, tg(MemberProps.IS_SEALED), property.isSealed());
        sink.emitBool(memberIri, tg(MemberProps.IS_REQUIRED), property.isRequired());

        final MethodSymbol getter = property.getMethod();
        final MethodSymbol setter = property.setMethod();
        sink.emitBool(memberIri, tg(MemberProps.HAS_GETTER), getter != null);
        sink.emitBool(memberIri, tg(MemberProps.HAS_SETTER), setter != null);
        if (getter != null) {
            sink.emitLiteral(memberIri, tg(MemberProps.GETTER_ACCESSIBILITY), getter.accessibility().displayName());
        }
        if (setter != null) {
            sink.emitLiteral(memberIri, tg(MemberProps.SETTER_ACCESSIBILITY), setter.accessibility().displayName());
            sink.emitBool(memberIri, tg(MemberProps.IS_INIT_ONLY), setter.isInitOnly());
        }

        sink.emitIri(memberIri, tg(MemberRels.PROPERTY_TYPE), ensureTypeEmitted(property.type()));

        for (ParameterSymbol param : property.parameters()) {
            extractParameter(memberIri, param);
        }

        if (property.overriddenProperty() != null) {
            sink.emitIri(memberIri, tg(MemberRels.OVERRIDES_METHOD), iris.member(property.overriddenProperty()));
        }
        for (PropertySymbol impl : property.explicitInterfaceImplementations()) {
            sink.emitIri(memberIri, tg(MemberRels.EXPLICIT_INTERFACE_IMPL), iris.member(impl));
        }

        if (options.includeAttributes()) {
            extractAttributes(memberIri, property, property.attributes(), 0);
        }

        emitCrossReferences(memberIri, property);
    }

    private void extractField(String typeIri, FieldSymbol field) {
        final String memberIri = beginMember(typeIri, field, Classes.FIELD);

        sink.emitBool(memberIri, tg(MemberProps.IS_READ_ONLY), field.isReadOnly());
        sink.emitBool(memberIri, tg(MemberProps.IS_CONST), field.isConst());
        sink.emitBool(memberIri, tg(MemberProps.IS_VOLATILE), field.isVolatile());
        sink.emitBool(memberIri, tg(MemberProps.IS_REQUIRED), field.isRequired());

        if (field.hasConstantValue()) {
            sink.emitLiteral(memberIri, tg(MemberProps.CONST_VALUE), String.valueOf(field.constantValue()));
        }

        sink.emitIri(memberIri, tg(MemberRels.FIELD_TYPE), ensureTypeEmitted(field.type()));

        if (options.includeAttributes()) {
            extractAttributes(memberIri, field, field.attributes(), 0);
        }
    }

    private void extractEvent(String typeIri, EventSymbol event) {
        final String memberIri = beginMember(typeIri, event, Classes.EVENT);

        sink.emitBool(memberIri, tg(MemberProps.IS_ABSTRACT), event.isAbstract());
        sink.emitBool(memberIri, tg(MemberProps.IS_VIRTUAL), event.isVirtual());
        sink.emitBool(memberIri, tg(MemberProps.IS_OVERRIDE), event.isOverride());
        sink.emitBool(memberIri, tg(MemberProps.IS_SEALED), event.isSealed());

        sink.emitIri(memberIri, tg(MemberRels.EVENT_TYPE), ensureTypeEmitted(event.type()));

        if (event.overriddenEvent() != null) {
            sink.emitIri(memberIri, tg(MemberRels.OVERRIDES_METHOD), iris.member(event.overriddenEvent()));
        }
        for (EventSymbol impl : event.explicitInterfaceImplementations()) {
            sink.emitIri(memberIri, tg(MemberRels.EXPLICIT_INTERFACE_IMPL), iris.member(impl));
        }

        if (options.includeAttributes()) {
            extractAttributes(memberIri, event, event.attributes(), 0);
        }
    }

    private void extractParameter(String memberIri, ParameterSymbol param) {
        final String paramIri = iris.parameter(param);
        emitKind(paramIri, Classes.PARAMETER);
        sink.emitLiteral(paramIri, tg(ParamProps.NAME), param.name());
        sink.emitInt(paramIri, tg(ParamProps.ORDINAL), param.ordinal());
        sink.emitBool(paramIri, tg(ParamProps.IS_OPTIONAL), param.isOptional());
        sink.emitBool(paramIri, tg(ParamProps.IS_PARAMS), param.isParams());
        sink.emitBool(paramIri, tg(ParamProps.IS_THIS), param.isThis());
        sink.emitBool(paramIri, tg(ParamProps.IS_DISCARD), param.isDiscard());
        sink.emitLiteral(paramIri, tg(ParamProps.REF_KIND), param.refKind().displayName());
        sink.emitBool(paramIri, tg(ParamProps.HAS_EXPLICIT_DEFAULT_VALUE), param.hasExplicitDefaultValue());
        if (param.hasExplicitDefaultValue()) {
            sink.emitLiteral(paramIri, tg(ParamProps.DEFAULT_VALUE), String.valueOf(param.explicitDefaultValue()));
        }

        sink.emitIri(memberIri, tg(MemberRels.HAS_PARAMETER), paramIri);
        sink.emitIri(paramIri, tg(ParamRels.PARAMETER_OF), memberIri);
        sink.emitIri(paramIri, tg(ParamRels.PARAMETER_TYPE), ensureTypeEmitted(param.type()));

        if (options.includeAttributes()) {
            extractAttributes(paramIri, param, param.attributes(), 0);
        }
    }

    private void emitKind(String subjectIri, String ontologyClass) {
        sink.emitIri(subjectIri, TypeGraphOntology.RDF_TYPE, tg(ontologyClass));
    }

    private String tg(String local) {
        return iris.ontologyPrefix() + local;
    }

    private String jvm(String local) {
        return iris.jvmOntologyPrefix() + local;
    }
}
