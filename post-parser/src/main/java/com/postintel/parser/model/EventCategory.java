package com.postintel.parser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Fixed event taxonomy. Labels are the Hindi display names used by the review
 * dashboard; taxonomy files refer to categories by constant name.
 */
public enum EventCategory {

    MEETING("बैठक"),
    PUBLIC_OUTREACH("जनसम्पर्क / जनदर्शन"),
    ADMINISTRATIVE_REVIEW("प्रशासनिक समीक्षा बैठक"),
    INSPECTION("निरीक्षण"),
    RALLY("रैली"),
    ELECTION_CAMPAIGN("चुनाव प्रचार"),
    INAUGURATION("उद्घाटन"),
    SCHEME_ANNOUNCEMENT("योजना घोषणा"),
    RELIGIOUS_CULTURAL("धार्मिक / सांस्कृतिक कार्यक्रम"),
    FELICITATION("सम्मान / Felicitation"),
    PRESS_MEDIA("प्रेस कॉन्फ़्रेंस / मीडिया"),
    GREETINGS("शुभकामना / बधाई"),
    BIRTHDAY_GREETING("जन्मदिन शुभकामना"),
    CONDOLENCE("शोक संदेश"),
    INTERNAL_SECURITY("आंतरिक सुरक्षा / पुलिस"),
    SPORTS_ACHIEVEMENT("खेल / गौरव"),
    POLITICAL_STATEMENT("राजनीतिक वक्तव्य"),
    DISASTER_ACCIDENT("आपदा / दुर्घटना"),
    UNCATEGORIZED("अन्य");

    private final String label;

    EventCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isUncategorized() {
        return this == UNCATEGORIZED;
    }

    /**
     * Accepts either the constant name ("CONDOLENCE") or the display label ("शोक संदेश").
     */
    @JsonCreator
    public static EventCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Event category must not be blank");
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(c -> c.name().equalsIgnoreCase(trimmed) || c.label.equals(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event category: " + value));
    }
}
