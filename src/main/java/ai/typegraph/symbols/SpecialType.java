package ai.typegraph.symbols;

/**
 * Tags for the handful of types the host treats specially.
 * {@link #OBJECT} marks the universal root of the class hierarchy.
 */
public enum SpecialType {
    NONE("None"),
    OBJECT("Object"),
    STRING("String"),
    VOID("Void"),
    BOOLEAN("Boolean"),
    CHAR("Char"),
    BYTE("Byte"),
    SHORT("Short"),
    INT("Int"),
    LONG("Long"),
    FLOAT("Float"),
    DOUBLE("Double");

    private final String displayName;

    SpecialType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
