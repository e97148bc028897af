package ai.typegraph.symbols;

public enum RefKind {
    NONE("None"),
    REF("Ref"),
    OUT("Out"),
    IN("In");

    private final String displayName;

    RefKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
