package ai.typegraph.symbols;

/**
 * Role of a method. Accessor kinds are synthesized for properties and events
 * and are described through their owner rather than as standalone members.
 */
public enum MethodKind {
    ORDINARY("Ordinary"),
    CONSTRUCTOR("Constructor"),
    STATIC_CONSTRUCTOR("StaticConstructor"),
    DESTRUCTOR("Destructor"),
    USER_DEFINED_OPERATOR("UserDefinedOperator"),
    CONVERSION("Conversion"),
    PROPERTY_GET("PropertyGet"),
    PROPERTY_SET("PropertySet"),
    EVENT_ADD("EventAdd"),
    EVENT_REMOVE("EventRemove"),
    LAMBDA("LambdaMethod");

    private final String displayName;

    MethodKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
