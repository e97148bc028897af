package ai.typegraph.symbols;

public enum TypeKind {
    CLASS("Class"),
    STRUCT("Struct"),
    INTERFACE("Interface"),
    ENUM("Enum"),
    DELEGATE("Delegate"),
    ARRAY("Array"),
    POINTER("Pointer"),
    TYPE_PARAMETER("TypeParameter"),
    ERROR("Error");

    private final String displayName;

    TypeKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
