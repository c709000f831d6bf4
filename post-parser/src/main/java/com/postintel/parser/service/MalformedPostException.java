package com.postintel.parser.service;

/**
 * An input record that cannot be turned into a post: not UTF-8, not JSON, not an object, or no text.
 * The batch skips the record and carries on.
 */
public class MalformedPostException extends RuntimeException {

    public MalformedPostException(String message) {
        super(message);
    }

    public MalformedPostException(String message, Throwable cause) {
        super(message, cause);
    }
}
