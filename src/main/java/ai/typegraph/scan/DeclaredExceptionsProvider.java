package ai.typegraph.scan;

import java.util.List;

import ai.typegraph.graph.CrossReferenceProvider;
import ai.typegraph.symbols.MethodSymbol;
import ai.typegraph.symbols.Symbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * Reports the exception types listed in a method's {@code throws} clause.
 */
public final class DeclaredExceptionsProvider implements CrossReferenceProvider {

    @Override
    public List<TypeSymbol> exceptionTypesFor(Symbol symbol) {
        return symbol instanceof MethodSymbol method ? method.declaredExceptions() : List.of();
    }

    @Override
    public List<Symbol> seeAlsoFor(Symbol symbol) {
        return List.of();
    }
}
