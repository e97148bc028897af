package ai.typegraph.symbols;

public interface FieldSymbol extends MemberSymbol {

    TypeSymbol type();

    boolean isReadOnly();

    boolean isConst();

    boolean isVolatile();

    default boolean isRequired() {
        return false;
    }

    boolean hasConstantValue();

    Object constantValue();
}
