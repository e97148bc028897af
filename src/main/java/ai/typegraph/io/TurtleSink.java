package ai.typegraph.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

import org.eclipse.rdf4j.rio.RDFFormat;

/**
 * Turtle ({@code .ttl}). Prefixes declared before the first fact become the
 * {@code @prefix} header and are used to abbreviate IRIs; booleans and integers
 * are written as bare tokens.
 */
public final class TurtleSink extends RioTripleSink {

    public TurtleSink(Writer out) {
        super(RDFFormat.TURTLE, out);
    }

    public static TurtleSink open(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return new TurtleSink(Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE));
    }

    public static TurtleSink of(OutputStream stream) {
        return new TurtleSink(new BufferedWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8)));
    }
}
