package ai.typegraph.symbols;

public interface ArrayTypeSymbol extends TypeSymbol {

    TypeSymbol elementType();

    int rank();

    @Override
    default TypeKind typeKind() {
        return TypeKind.ARRAY;
    }
}
