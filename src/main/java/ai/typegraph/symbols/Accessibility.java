package ai.typegraph.symbols;

public enum Accessibility {
    NOT_APPLICABLE("NotApplicable"),
    PRIVATE("Private"),
    PROTECTED_AND_INTERNAL("ProtectedAndInternal"),
    PROTECTED("Protected"),
    INTERNAL("Internal"),
    PROTECTED_OR_INTERNAL("ProtectedOrInternal"),
    PUBLIC("Public");

    private final String displayName;

    Accessibility(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
