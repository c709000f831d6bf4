package com.postintel.parser.model;

/**
 * A post together with its annotation and processing metadata, as handed to the writers.
 */
public record AnnotatedPost(Post post, ParsedPost parsed, long processingTimeMs) {
}
