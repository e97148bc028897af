package ai.typegraph.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.rio.RDFFormat;
import org.eclipse.rdf4j.rio.RDFHandlerException;
import org.eclipse.rdf4j.rio.RDFWriter;
import org.eclipse.rdf4j.rio.Rio;

import ai.typegraph.model.TypeGraphOntology;

/**
 * Base for the sinks backed by an RDF4J Rio writer. The writer is started lazily
 * on the first fact, so prefixes declared up to that point are handed over as
 * namespaces and a sink that never receives a fact writes nothing.
 * Output is complete once the sink is closed.
 */
abstract class RioTripleSink implements TripleSink {

    private static final ValueFactory VF = SimpleValueFactory.getInstance();
    private static final IRI XSD_INTEGER = VF.createIRI(TypeGraphOntology.XSD + "integer");
    private static final IRI XSD_LONG = VF.createIRI(TypeGraphOntology.XSD + "long");

    private final Writer out;
    private final RDFWriter writer;
    private final Map<String, String> prefixes = new LinkedHashMap<>();
    private boolean started;
    private long tripleCount;

    RioTripleSink(RDFFormat format, Writer out) {
        this.out = Objects.requireNonNull(out, "out");
        this.writer = Rio.createWriter(format, out);
    }

    @Override
    public void emitIri(String subject, String predicate, String objectIri) {
        write(subject, predicate, VF.createIRI(objectIri));
    }

    @Override
    public void emitLiteral(String subject, String predicate, String value) {
        write(subject, predicate, VF.createLiteral(value == null ? "" : value));
    }

    @Override
    public void emitTypedLiteral(String subject, String predicate, String value, String datatypeIri) {
        write(subject, predicate, VF.createLiteral(value == null ? "" : value, VF.createIRI(datatypeIri)));
    }

    @Override
    public void emitBool(String subject, String predicate, boolean value) {
        write(subject, predicate, VF.createLiteral(value));
    }

    @Override
    public void emitInt(String subject, String predicate, int value) {
        write(subject, predicate, VF.createLiteral(Integer.toString(value), XSD_INTEGER));
    }

    @Override
    public void emitLong(String subject, String predicate, long value) {
        write(subject, predicate, VF.createLiteral(Long.toString(value), XSD_LONG));
    }

    @Override
    public void addPrefix(String prefix, String iri) {
        if (!started) {
            prefixes.put(prefix, iri);
        }
    }

    @Override
    public void flush() {
        try {
            out.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("flush failed", ex);
        }
    }

    @Override
    public long tripleCount() {
        return tripleCount;
    }

    @Override
    public void close() {
        try {
            if (started) {
                writer.endRDF();
            }
            out.close();
        } catch (RDFHandlerException ex) {
            throw unchecked("close failed", ex);
        } catch (IOException ex) {
            throw new UncheckedIOException("close failed", ex);
        }
    }

    private void write(String subject, String predicate, Value object) {
        try {
            if (!started) {
                started = true;
                writer.startRDF();
                for (Map.Entry<String, String> e : prefixes.entrySet()) {
                    writer.handleNamespace(e.getKey(), e.getValue());
                }
            }
            writer.handleStatement(VF.createStatement(VF.createIRI(subject), VF.createIRI(predicate), object));
        } catch (RDFHandlerException ex) {
            throw unchecked("write failed", ex);
        }
        tripleCount++;
    }

    private static RuntimeException unchecked(String message, RDFHandlerException ex) {
        if (ex.getCause() instanceof IOException io) {
            return new UncheckedIOException(message, io);
        }
        return ex;
    }
}
