package com.postintel.parser.taxonomy;

/**
 * Raised when the keyword taxonomy cannot be loaded or defines no event clusters.
 * The engine cannot classify anything without it, so this is fatal at startup.
 */
public class TaxonomyException extends RuntimeException {

    public TaxonomyException(String message) {
        super(message);
    }

    public TaxonomyException(String message, Throwable cause) {
        super(message, cause);
    }
}
