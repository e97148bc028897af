package ai.typegraph.graph;

/**
 * Aborts an extraction run on a caller or input invariant violation.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }
}
