package ai.typegraph.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.typegraph.graph.ExtractionOptions;
import ai.typegraph.graph.ExtractionResult;

/**
 * Writes the JSON summary of one extraction run.
 */
public final class SummaryWriter {

    public static final String SCHEMA_VERSION = "jvm-typegraph-summary/v1";

    private final ObjectMapper jsonMapper;

    public SummaryWriter() {
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(Path file, RunSummary summary) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(summary, "summary");

        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        jsonMapper.writeValue(file.toFile(), summary);
    }

    public String toJson(RunSummary summary) throws IOException {
        return jsonMapper.writeValueAsString(summary);
    }

    public static RunSummary summarize(
            String generatedAt,
            ModuleInfo module,
            ExtractionResult result,
            ExtractionOptions options,
            OutputInfo output,
            List<String> references) {
        return new RunSummary(SCHEMA_VERSION, generatedAt, module, result.moduleIri(),
                result.typeCount(), result.tripleCount(), output, references, options);
    }

    // --- summary records ---

    public record RunSummary(
            String schema,
            String generatedAt,
            ModuleInfo module,
            String moduleIri,
            int types,
            long triples,
            OutputInfo output,
            List<String> references,
            ExtractionOptions options
    ) {
    }

    public record ModuleInfo(
            String name,
            String version,
            String location
    ) {
    }

    public record OutputInfo(
            String path,
            String format
    ) {
    }
}
