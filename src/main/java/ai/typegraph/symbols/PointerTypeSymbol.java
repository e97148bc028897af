package ai.typegraph.symbols;

public interface PointerTypeSymbol extends TypeSymbol {

    TypeSymbol pointedAtType();

    @Override
    default TypeKind typeKind() {
        return TypeKind.POINTER;
    }
}
