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
 * One fact per line with full IRIs ({@code .nt}); suited to bulk loading.
 * The syntax has no prefixes, so declared ones are dropped; booleans are typed literals.
 */
public final class NTriplesSink extends RioTripleSink {

    public NTriplesSink(Writer out) {
        super(RDFFormat.NTRIPLES, out);
    }

    public static NTriplesSink open(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return new NTriplesSink(Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE));
    }

    public static NTriplesSink of(OutputStream stream) {
        return new NTriplesSink(new BufferedWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8)));
    }
}
