package com.postintel.parser.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which resolver tier produced a location.
 * Downstream routing discounts TEMPORAL_INFERENCE.
 */
public enum LocationSource {

    EXACT_DICTIONARY("exact-dictionary"),
    REGEX_CANDIDATE("regex-candidate"),
    LANDMARK("landmark"),
    HANDLE_INFERENCE("handle-inference"),
    SEMANTIC_SEARCH("semantic-search"),
    TEMPORAL_INFERENCE("temporal-inference"),
    NONE("none");

    private final String wireName;

    LocationSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isInferred() {
        return this == TEMPORAL_INFERENCE;
    }
}
