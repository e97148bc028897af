package ai.typegraph.scan;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import ai.typegraph.graph.CrossReferenceProvider;
import ai.typegraph.symbols.Symbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * Concatenates the answers of several providers. A type reported by more than
 * one provider is kept once, under its first occurrence.
 */
public final class CompositeCrossReferenceProvider implements CrossReferenceProvider {

    private final List<CrossReferenceProvider> providers;

    public CompositeCrossReferenceProvider(List<CrossReferenceProvider> providers) {
        this.providers = List.copyOf(Objects.requireNonNull(providers, "providers"));
    }

    @Override
    public List<TypeSymbol> exceptionTypesFor(Symbol symbol) {
        final Set<String> seen = new LinkedHashSet<>();
        final List<TypeSymbol> out = new ArrayList<>();
        for (CrossReferenceProvider p : providers) {
            for (TypeSymbol type : p.exceptionTypesFor(symbol)) {
                if (seen.add(type.displayName())) {
                    out.add(type);
                }
            }
        }
        return out;
    }

    @Override
    public List<Symbol> seeAlsoFor(Symbol symbol) {
        final List<Symbol> out = new ArrayList<>();
        for (CrossReferenceProvider p : providers) {
            for (Symbol related : p.seeAlsoFor(symbol)) {
                if (!out.contains(related)) {
                    out.add(related);
                }
            }
        }
        return out;
    }
}
