package com.postintel.parser.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ClassificationSource {

    KEYWORD("keyword"),
    RESCUE("rescue");

    private final String wireName;

    ClassificationSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
