package com.postintel.parser.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LanguageProfile(Language language, double devanagariRatio, double latinRatio, boolean mixed) {

    public enum Language { HINDI, ENGLISH, MIXED, UNKNOWN }

    public static LanguageProfile unknown() {
        return new LanguageProfile(Language.UNKNOWN, 0.0, 0.0, false);
    }
}
