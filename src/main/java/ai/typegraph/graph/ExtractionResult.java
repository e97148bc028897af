package ai.typegraph.graph;

/**
 * Outcome of one extraction run.
 */
public record ExtractionResult(
        String moduleIri,
        int typeCount,
        long tripleCount
) {
}
