package com.postintel.parser.gazetteer;

import com.postintel.parser.text.TextNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Landmark phrases ("महानदी भवन", "बस्तर दशहरा") and the place each one implies.
 * Phrases are matched as folded substrings, longest first.
 */
public final class LandmarkTable {

    /** @param key folded form of the phrase, used for matching */
    public record Landmark(String key, String phrase, String place) {}

    private final List<Landmark> landmarks;

    private LandmarkTable(List<Landmark> landmarks) {
        this.landmarks = List.copyOf(landmarks);
    }

    public static LandmarkTable of(Map<String, String> phraseToPlace) {
        Map<String, Landmark> byKey = new LinkedHashMap<>();
        phraseToPlace.forEach((phrase, place) -> {
            String key = TextNormalizer.foldScript(phrase);
            if (!key.isEmpty() && place != null && !place.isBlank()) {
                byKey.putIfAbsent(key, new Landmark(key, phrase.trim(), place.trim()));
            }
        });
        List<Landmark> sorted = new ArrayList<>(byKey.values());
        sorted.sort((a, b) -> Integer.compare(b.key().length(), a.key().length()));
        return new LandmarkTable(sorted);
    }

    public static LandmarkTable empty() {
        return new LandmarkTable(List.of());
    }

    /** First (longest) landmark phrase contained in the already-folded text. */
    public Optional<Landmark> find(String foldedText) {
        if (foldedText == null || foldedText.isEmpty()) return Optional.empty();
        return landmarks.stream().filter(l -> foldedText.contains(l.key())).findFirst();
    }

    public int size() {
        return landmarks.size();
    }
}
