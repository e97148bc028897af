package ai.typegraph.io;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.typegraph.graph.ExtractionOptions;
import ai.typegraph.graph.ExtractionResult;

class SummaryWriterTest {

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = new ObjectMapper();

    private static SummaryWriter.RunSummary sample() {
        return SummaryWriter.summarize(
                "2024-01-01T00:00:00Z",
                new SummaryWriter.ModuleInfo("acme-core", "1.2.0", "/work/acme-core-1.2.0.jar"),
                new ExtractionResult("http://jvm.example/module/acme-core/1.2.0", 12, 345L),
                ExtractionOptions.defaults().withIncludePrivate(true),
                new SummaryWriter.OutputInfo("/work/acme-core-1.2.0.nt", "ntriples"),
                List.of("/work/lib/dep.jar"));
    }

    @Test
    void summaryCarriesCountsAndOptions() throws IOException {
        final JsonNode json = mapper.readTree(new SummaryWriter().toJson(sample()));

        assertThat(json.get("schema").asText()).isEqualTo(SummaryWriter.SCHEMA_VERSION);
        assertThat(json.get("generatedAt").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(json.at("/module/name").asText()).isEqualTo("acme-core");
        assertThat(json.at("/module/version").asText()).isEqualTo("1.2.0");
        assertThat(json.get("moduleIri").asText()).isEqualTo("http://jvm.example/module/acme-core/1.2.0");
        assertThat(json.get("types").asInt()).isEqualTo(12);
        assertThat(json.get("triples").asLong()).isEqualTo(345L);
        assertThat(json.at("/output/format").asText()).isEqualTo("ntriples");
        assertThat(json.get("references").get(0).asText()).isEqualTo("/work/lib/dep.jar");
        assertThat(json.at("/options/includePrivate").asBoolean()).isTrue();
        assertThat(json.at("/options/maxTypeDepth").asInt()).isEqualTo(ExtractionOptions.DEFAULT_MAX_TYPE_DEPTH);
    }

    @Test
    void writeCreatesParentDirectories() throws IOException {
        final Path file = tmp.resolve("reports/nested/summary.json");

        new SummaryWriter().write(file, sample());

        assertThat(file).exists();
        assertThat(mapper.readTree(file.toFile()).get("types").asInt()).isEqualTo(12);
        assertThat(Files.readString(file)).contains(System.lineSeparator());
    }
}
