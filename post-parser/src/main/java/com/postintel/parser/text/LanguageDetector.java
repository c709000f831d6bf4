package com.postintel.parser.text;

import com.postintel.parser.model.LanguageProfile;
import com.postintel.parser.model.LanguageProfile.Language;

/**
 * Rough script-ratio language detection for mixed Hindi/English posts.
 */
public final class LanguageDetector {

    private static final double DOMINANT_RATIO = 0.6;
    private static final double MIXED_RATIO = 0.2;
    private static final double MIXED_FLAG_RATIO = 0.1;

    private LanguageDetector() {
    }

    public static LanguageProfile detect(String text) {
        if (text == null || text.isBlank()) return LanguageProfile.unknown();

        String trimmed = text.strip();
        int total = trimmed.length();
        int devanagari = 0;
        int latin = 0;
        for (int i = 0; i < total; i++) {
            char c = trimmed.charAt(i);
            if (Transliterator.isDevanagari(c)) {
                devanagari++;
            } else if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
                latin++;
            }
        }

        double devRatio = round2((double) devanagari / total);
        double latRatio = round2((double) latin / total);

        Language language;
        if (devRatio > DOMINANT_RATIO) {
            language = Language.HINDI;
        } else if (latRatio > DOMINANT_RATIO) {
            language = Language.ENGLISH;
        } else if (devRatio > MIXED_RATIO && latRatio > MIXED_RATIO) {
            language = Language.MIXED;
        } else {
            language = Language.UNKNOWN;
        }

        return new LanguageProfile(language, devRatio, latRatio,
                devRatio > MIXED_FLAG_RATIO && latRatio > MIXED_FLAG_RATIO);
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
