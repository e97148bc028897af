package ai.typegraph.graph;

import java.util.List;

import ai.typegraph.symbols.Symbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * Supplies extra "throws" and "related-to" edges for a symbol, typically
 * derived from documentation comments. References that cannot be resolved
 * are left out rather than reported.
 */
public interface CrossReferenceProvider {

    List<TypeSymbol> exceptionTypesFor(Symbol symbol);

    /**
     * Related types or members, in source order.
     */
    List<Symbol> seeAlsoFor(Symbol symbol);
}
