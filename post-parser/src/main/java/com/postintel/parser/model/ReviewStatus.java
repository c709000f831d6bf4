package com.postintel.parser.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReviewStatus {

    AUTO_APPROVED("auto_approved"),
    PENDING("pending");

    private final String wireName;

    ReviewStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
