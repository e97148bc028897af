package ai.typegraph.symbols;

/**
 * Common root of every node in the host type system's metadata graph.
 * Symbols are read-only and may be shared and cyclic.
 */
public interface Symbol {

    String name();
}
