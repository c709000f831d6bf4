package com.postintel.parser.location;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls ward and zone numbers out of urban posts: "वार्ड क्रमांक 12", "ward no. 5", "जोन 3".
 */
public final class WardZoneExtractor {

    private static final Pattern WARD = Pattern.compile(
            "(?:वार्ड|ward)\\s*(?:क्रमांक|no|number|नंबर|नं)?\\s*[.:-]?\\s*(\\d{1,4})", Pattern.CASE_INSENSITIVE);
    private static final Pattern ZONE = Pattern.compile(
            "(?:जोन|ज\u093Cोन|zone)\\s*(?:क्रमांक|no|number|नंबर|नं)?\\s*[.:-]?\\s*(\\d{1,4})", Pattern.CASE_INSENSITIVE);

    public record WardZone(String ward, String zone) {
        public boolean isEmpty() {
            return ward == null && zone == null;
        }
    }

    private WardZoneExtractor() {
    }

    public static WardZone extract(String text) {
        if (text == null || text.isBlank()) return new WardZone(null, null);
        return new WardZone(firstNumber(WARD, text), firstNumber(ZONE, text));
    }

    private static String firstNumber(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? String.valueOf(Integer.parseInt(m.group(1))) : null;
    }
}
