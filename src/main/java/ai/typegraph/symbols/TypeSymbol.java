package ai.typegraph.symbols;

public interface TypeSymbol extends Symbol {

    TypeKind typeKind();

    /**
     * Human readable, fully qualified rendering, e.g. {@code java.util.List<java.lang.String>}.
     */
    String displayName();

    /**
     * Module that defines this type, {@code null} for built-ins and unresolved references.
     */
    ModuleSymbol containingModule();
}
