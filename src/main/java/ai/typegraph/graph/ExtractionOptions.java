package ai.typegraph.graph;

import java.util.Objects;

import ai.typegraph.model.IriMinter;

/**
 * Immutable configuration snapshot for one extraction run.
 *
 * @param maxTypeDepth cap on nested ensure-type recursion (array elements,
 *                     generic arguments, constraints); exceeding it aborts the run
 */
public record ExtractionOptions(
        String baseUri,
        boolean includePrivate,
        boolean includeInternal,
        boolean includeCompilerGenerated,
        boolean extractExceptions,
        boolean extractSeeAlso,
        boolean includeAttributes,
        boolean includeExternalTypes,
        int maxTypeDepth
) {
    public static final int DEFAULT_MAX_TYPE_DEPTH = 256;

    public ExtractionOptions {
        Objects.requireNonNull(baseUri, "baseUri");
        if (maxTypeDepth < 1) {
            throw new IllegalArgumentException("maxTypeDepth must be positive: " + maxTypeDepth);
        }
    }

    public static ExtractionOptions defaults() {
        return new ExtractionOptions(IriMinter.DEFAULT_BASE_URI, false, true, false,
                true, true, true, true, DEFAULT_MAX_TYPE_DEPTH);
    }

    public ExtractionOptions withBaseUri(String value) {
        return new ExtractionOptions(value, includePrivate, includeInternal, includeCompilerGenerated,
                extractExceptions, extractSeeAlso, includeAttributes, includeExternalTypes, maxTypeDepth);
    }

    public ExtractionOptions withIncludePrivate(boolean value) {
        return new ExtractionOptions(baseUri, value, includeInternal, includeCompilerGenerated,
                extractExceptions, extractSeeAlso, includeAttributes, includeExternalTypes, maxTypeDepth);
    }

    public ExtractionOptions withIncludeInternal(boolean value) {
        return new ExtractionOptions(baseUri, includePrivate, value, includeCompilerGenerated,
                extractExceptions, extractSeeAlso, includeAttributes, includeExternalTypes, maxTypeDepth);
    }

    public ExtractionOptions withIncludeCompilerGenerated(boolean value) {
        return new ExtractionOptions(baseUri, includePrivate, includeInternal, value,
                extractExceptions, extractSeeAlso, includeAttributes, includeExternalTypes, maxTypeDepth);
    }

    public ExtractionOptions withExtractExceptions(boolean value) {
        return new ExtractionOptions(baseUri, includePrivate, includeInternal, includeCompilerGenerated,
                value, extractSeeAlso, includeAttributes, includeExternalTypes, maxTypeDepth);
    }

    public ExtractionOptions withExtractSeeAlso(boolean value) {
        return new ExtractionOptions(baseUri, includePrivate, includeInternal, includeCompilerGenerated,
                extractExceptions, value, includeAttributes, includeExternalTypes, maxTypeDepth);
    }

    public ExtractionOptions withIncludeAttributes(boolean value) {
        return new ExtractionOptions(baseUri, includePrivate, includeInternal, includeCompilerGenerated,
                extractExceptions, extractSeeAlso, value, includeExternalTypes, maxTypeDepth);
    }

    public ExtractionOptions withIncludeExternalTypes(boolean value) {
        return new ExtractionOptions(baseUri, includePrivate, includeInternal, includeCompilerGenerated,
                extractExceptions, extractSeeAlso, includeAttributes, value, maxTypeDepth);
    }

    public ExtractionOptions withMaxTypeDepth(int value) {
        return new ExtractionOptions(baseUri, includePrivate, includeInternal, includeCompilerGenerated,
                extractExceptions, extractSeeAlso, includeAttributes, includeExternalTypes, value);
    }
}
