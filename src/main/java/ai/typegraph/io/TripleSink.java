package ai.typegraph.io;

/**
 * Consumer of the triple stream produced by an extraction run.
 * Implementations own the concrete syntax, buffering and the fact counter.
 */
public interface TripleSink extends AutoCloseable {

    void emitIri(String subject, String predicate, String objectIri);

    void emitLiteral(String subject, String predicate, String value);

    void emitTypedLiteral(String subject, String predicate, String value, String datatypeIri);

    /**
     * Datatype {@code xsd:boolean}.
     */
    void emitBool(String subject, String predicate, boolean value);

    /**
     * Datatype {@code xsd:integer}.
     */
    void emitInt(String subject, String predicate, int value);

    /**
     * Datatype {@code xsd:long}.
     */
    void emitLong(String subject, String predicate, long value);

    /**
     * Declares a short name; must be called before the first emit to take effect
     * in syntaxes that support prefixes.
     */
    void addPrefix(String prefix, String iri);

    void flush();

    /**
     * Running total of facts emitted through any {@code emit*} call.
     */
    long tripleCount();

    @Override
    void close();
}
