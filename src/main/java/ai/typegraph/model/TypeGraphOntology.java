package ai.typegraph.model;

/**
 * RDF vocabulary for the type graph.
 * Terms shared by every host live under {@link #ONTOLOGY}; JVM specific
 * terms live under the minter's {@code jvmOntologyPrefix()}.
 */
public final class TypeGraphOntology {

    public static final String PREFIX = "tg";
    public static final String JVM_PREFIX = "jvm";

    public static final String ONTOLOGY = "http://typegraph.example/ontology/";
    public static final String RDF = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    public static final String RDFS = "http://www.w3.org/2000/01/rdf-schema#";
    public static final String XSD = "http://www.w3.org/2001/XMLSchema#";

    public static final String RDF_TYPE = RDF + "type";
    public static final String LANGUAGE = "language";
    public static final String LANGUAGE_VALUE = "jvm";

    private TypeGraphOntology() {
    }

    public static final class Classes {
        public static final String MODULE = "Module";
        public static final String NAMESPACE = "Namespace";
        public static final String TYPE = "Type";
        public static final String CLASS = "Class";
        public static final String STRUCT = "Struct";
        public static final String INTERFACE = "Interface";
        public static final String ENUM = "Enum";
        public static final String DELEGATE = "Delegate";
        public static final String RECORD = "Record";
        public static final String MEMBER = "Member";
        public static final String METHOD = "Method";
        public static final String CONSTRUCTOR = "Constructor";
        public static final String PROPERTY = "Property";
        public static final String FIELD = "Field";
        public static final String EVENT = "Event";
        public static final String PARAMETER = "Parameter";
        public static final String TYPE_PARAMETER = "TypeParameter";
        public static final String ATTRIBUTE = "Attribute";

        private Classes() {
        }
    }

    public static final class TypeProps {
        public static final String NAME = "name";
        public static final String FULL_NAME = "fullName";
        public static final String TYPE_KIND = "typeKind";
        public static final String ACCESSIBILITY = "accessibility";
        public static final String IS_ABSTRACT = "isAbstract";
        public static final String IS_SEALED = "isSealed";
        public static final String IS_STATIC = "isStatic";
        public static final String IS_GENERIC = "isGeneric";
        public static final String IS_VALUE_TYPE = "isValueType";
        public static final String IS_RECORD = "isRecord";
        public static final String IS_REF_LIKE_TYPE = "isRefLikeType";
        public static final String IS_READ_ONLY = "isReadOnly";
        public static final String IS_UNMANAGED_TYPE = "isUnmanagedType";
        public static final String SPECIAL_TYPE = "specialType";
        public static final String ENUM_UNDERLYING_TYPE = "enumUnderlyingType";
        public static final String ARRAY_RANK = "arrayRank";

        private TypeProps() {
        }
    }

    public static final class TypeRels {
        public static final String DEFINED_IN_MODULE = "definedInModule";
        public static final String IN_NAMESPACE = "inNamespace";
        public static final String INHERITS = "inherits";
        public static final String IMPLEMENTS = "implements";
        public static final String NESTED_IN = "nestedIn";
        public static final String HAS_MEMBER = "hasMember";
        public static final String HAS_TYPE_PARAMETER = "hasTypeParameter";
        public static final String HAS_ATTRIBUTE = "hasAttribute";
        public static final String GENERIC_DEFINITION = "genericDefinition";
        public static final String TYPE_ARGUMENT = "typeArgument";
        public static final String ARRAY_ELEMENT_TYPE = "arrayElementType";
        public static final String POINTER_ELEMENT_TYPE = "pointerElementType";
        public static final String THROWS = "throws";
        public static final String RELATED_TO = "relatedTo";

        private TypeRels() {
        }
    }

    /**
     * Facts on the reified node that carries one type argument.
     */
    public static final class TypeArgProps {
        public static final String INDEX = "index";
        public static final String TYPE = "type";

        private TypeArgProps() {
        }
    }

    public static final class MemberProps {
        public static final String NAME = "name";
        public static final String ACCESSIBILITY = "accessibility";
        public static final String IS_STATIC = "isStatic";
        public static final String IS_ABSTRACT = "isAbstract";
        public static final String IS_VIRTUAL = "isVirtual";
        public static final String IS_OVERRIDE = "isOverride";
        public static final String IS_SEALED = "isSealed";
        public static final String IS_EXTERN = "isExtern";
        public static final String IS_ASYNC = "isAsync";
        public static final String IS_READ_ONLY = "isReadOnly";
        public static final String IS_CONST = "isConst";
        public static final String IS_VOLATILE = "isVolatile";
        public static final String IS_REQUIRED = "isRequired";
        public static final String IS_INIT_ONLY = "isInitOnly";
        public static final String HAS_GETTER = "hasGetter";
        public static final String HAS_SETTER = "hasSetter";
        public static final String GETTER_ACCESSIBILITY = "getterAccessibility";
        public static final String SETTER_ACCESSIBILITY = "setterAccessibility";
        public static final String CONST_VALUE = "constValue";
        public static final String IS_EXTENSION_METHOD = "isExtensionMethod";
        public static final String IS_PARTIAL_DEFINITION = "isPartialDefinition";
        public static final String METHOD_KIND = "methodKind";

        private MemberProps() {
        }
    }

    public static final class MemberRels {
        public static final String MEMBER_OF = "memberOf";
        public static final String RETURN_TYPE = "returnType";
        public static final String PROPERTY_TYPE = "propertyType";
        public static final String FIELD_TYPE = "fieldType";
        public static final String EVENT_TYPE = "eventType";
        public static final String HAS_PARAMETER = "hasParameter";
        public static final String OVERRIDES_METHOD = "overridesMethod";
        public static final String EXPLICIT_INTERFACE_IMPL = "explicitInterfaceImplementation";

        private MemberRels() {
        }
    }

    public static final class ParamProps {
        public static final String NAME = "name";
        public static final String ORDINAL = "ordinal";
        public static final String IS_OPTIONAL = "isOptional";
        public static final String IS_PARAMS = "isParams";
        public static final String IS_THIS = "isThis";
        public static final String IS_DISCARD = "isDiscard";
        public static final String REF_KIND = "refKind";
        public static final String DEFAULT_VALUE = "defaultValue";
        public static final String HAS_EXPLICIT_DEFAULT_VALUE = "hasExplicitDefaultValue";

        private ParamProps() {
        }
    }

    public static final class ParamRels {
        public static final String PARAMETER_TYPE = "parameterType";
        public static final String PARAMETER_OF = "parameterOf";

        private ParamRels() {
        }
    }

    public static final class TypeParamProps {
        public static final String NAME = "name";
        public static final String ORDINAL = "ordinal";
        public static final String VARIANCE = "variance";
        public static final String HAS_REFERENCE_TYPE_CONSTRAINT = "hasReferenceTypeConstraint";
        public static final String HAS_VALUE_TYPE_CONSTRAINT = "hasValueTypeConstraint";
        public static final String HAS_UNMANAGED_TYPE_CONSTRAINT = "hasUnmanagedTypeConstraint";
        public static final String HAS_NOT_NULL_CONSTRAINT = "hasNotNullConstraint";
        public static final String HAS_CONSTRUCTOR_CONSTRAINT = "hasConstructorConstraint";

        private TypeParamProps() {
        }
    }

    public static final class TypeParamRels {
        public static final String TYPE_PARAMETER_OF = "typeParameterOf";
        public static final String CONSTRAINED_TO_TYPE = "constrainedToType";

        private TypeParamRels() {
        }
    }

    public static final class AttrProps {
        public static final String CONSTRUCTOR_ARGUMENTS = "constructorArguments";
        public static final String NAMED_ARGUMENTS = "namedArguments";

        private AttrProps() {
        }
    }

    public static final class AttrRels {
        public static final String ATTRIBUTE_OF = "attributeOf";
        public static final String ATTRIBUTE_TYPE = "attributeType";

        private AttrRels() {
        }
    }

    public static final class ModuleProps {
        public static final String NAME = "name";
        public static final String VERSION = "version";
        public static final String CULTURE = "culture";
        public static final String PUBLIC_KEY_TOKEN = "publicKeyToken";
        public static final String IS_INTERACTIVE = "isInteractive";

        private ModuleProps() {
        }
    }

    public static final class NamespaceProps {
        public static final String NAME = "name";
        public static final String FULL_NAME = "fullName";

        private NamespaceProps() {
        }
    }

    public static final class NamespaceRels {
        public static final String PARENT_NAMESPACE = "parentNamespace";

        private NamespaceRels() {
        }
    }
}
