package ai.typegraph.loader;

import ai.typegraph.symbols.ArrayTypeSymbol;
import ai.typegraph.symbols.ModuleSymbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * A JVM array. Multi-dimensional arrays are arrays of arrays, so the rank is always one.
 */
record AsmArrayType(TypeSymbol elementType) implements ArrayTypeSymbol {

    @Override
    public int rank() {
        return 1;
    }

    @Override
    public String name() {
        return displayName();
    }

    @Override
    public String displayName() {
        return elementType.displayName() + "[]";
    }

    @Override
    public ModuleSymbol containingModule() {
        return elementType.containingModule();
    }
}
