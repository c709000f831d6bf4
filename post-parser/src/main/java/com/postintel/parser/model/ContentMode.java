package com.postintel.parser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ContentMode {

    FIELD_EVENT("मैदान-स्तर कार्यक्रम"),
    POLICY_STATEMENT("नीति / वक्तव्य"),
    DIGITAL_POST("डिजिटल / सोशल-मीडिया पोस्ट"),
    SPORTS_REACTION("खेल / उपलब्धि पर प्रतिक्रिया"),
    GREETINGS("सामान्य शुभकामनाएँ / पर्व");

    private final String label;

    ContentMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ContentMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(m -> m.name().equalsIgnoreCase(value) || m.label.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown content mode: " + value));
    }
}
