package ai.typegraph.symbols;

public enum Variance {
    NONE("None"),
    IN("In"),
    OUT("Out");

    private final String displayName;

    Variance(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
