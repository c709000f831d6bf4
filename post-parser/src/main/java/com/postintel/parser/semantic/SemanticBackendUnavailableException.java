package com.postintel.parser.semantic;

/**
 * The semantic-search backend could not be loaded or queried. Callers skip the
 * semantic tier for the post; this never fails a batch.
 */
public class SemanticBackendUnavailableException extends RuntimeException {

    public SemanticBackendUnavailableException(String message) {
        super(message);
    }

    public SemanticBackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
