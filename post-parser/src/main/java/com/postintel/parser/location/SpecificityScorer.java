package com.postintel.parser.location;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.model.AdminType;
import com.postintel.parser.model.GazetteerRecord;
import com.postintel.parser.taxonomy.KeywordTaxonomy;
import com.postintel.parser.text.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tie-break score for gazetteer records matched by the same post.
 *
 *   score = base
 *         + type bonus        (village > urban body > district)
 *         + context bonus     (urban/rural vocabulary in the post agrees with the record's type)
 *         + marker bonus      (a type-appropriate marker directly abuts the name)
 *         + depth bonus x hierarchy depth
 *         + match confidence
 *
 * The marker bonus dominates: "रायपुर जिला" picks the district even though the urban
 * body of the same name is more specific. All weights are tuning knobs under
 * post-parser.location.tie-break.
 */
@Component
public class SpecificityScorer {

    private static final Map<AdminType, List<String>> MARKERS = new EnumMap<>(AdminType.class);

    static {
        MARKERS.put(AdminType.DISTRICT, normalized(List.of("जिला", "जिले", "ज़िला", "district", "zila", "jila")));
        MARKERS.put(AdminType.URBAN_LOCAL_BODY, normalized(List.of(
                "नगर निगम", "नगर पालिका", "नगर पंचायत", "निगम", "वार्ड", "जोन", "पार्षद", "शहर",
                "ward", "zone", "municipal", "nagar nigam", "city")));
        MARKERS.put(AdminType.VILLAGE, normalized(List.of(
                "ग्राम पंचायत", "ग्राम", "पंचायत", "गांव", "गाँव", "gram", "village")));
    }

    private final PostParserProperties.TieBreak weights;
    private final Set<String> urbanVocabulary;
    private final Set<String> ruralVocabulary;

    public SpecificityScorer(PostParserProperties properties, KeywordTaxonomy taxonomy) {
        this.weights = properties.getLocation().getTieBreak();
        this.urbanVocabulary = taxonomy.urbanContext();
        this.ruralVocabulary = taxonomy.ruralContext();
    }

    public double score(GazetteerRecord record, String surface, double matchConfidence, LocationContext context) {
        double score = weights.getBase() + typeBonus(record.type());
        if (contextAgrees(record.type(), context.area())) {
            score += weights.getContextBonus();
        }
        if (markerAdjacent(context.normalized(), surface, record.type())) {
            score += weights.getMarkerBonus();
        }
        score += record.depth() * weights.getDepthBonus();
        return score + matchConfidence;
    }

    /** Counts urban and rural vocabulary in the folded text; the larger side wins, a tie is NONE. */
    public AreaContext detectArea(String foldedText) {
        if (foldedText == null || foldedText.isEmpty()) return AreaContext.NONE;
        long urban = urbanVocabulary.stream().filter(foldedText::contains).count();
        long rural = ruralVocabulary.stream().filter(foldedText::contains).count();
        if (urban > rural) return AreaContext.URBAN;
        if (rural > urban) return AreaContext.RURAL;
        return AreaContext.NONE;
    }

    /**
     * True when a marker for this type sits immediately before or after some
     * occurrence of the surface form in the normalized text.
     */
    public boolean markerAdjacent(String normalizedText, String surface, AdminType type) {
        List<String> markers = MARKERS.get(type);
        if (markers == null || normalizedText == null || surface == null) return false;

        String needle = TextNormalizer.normalize(surface);
        if (needle.isEmpty()) return false;

        int from = 0;
        int idx;
        while ((idx = normalizedText.indexOf(needle, from)) >= 0) {
            String before = normalizedText.substring(0, idx).stripTrailing();
            String after = normalizedText.substring(idx + needle.length()).stripLeading();
            for (String marker : markers) {
                if (endsWithWord(before, marker) || startsWithWord(after, marker)) return true;
            }
            from = idx + 1;
        }
        return false;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private double typeBonus(AdminType type) {
        return switch (type) {
            case VILLAGE -> weights.getVillageBonus();
            case URBAN_LOCAL_BODY -> weights.getUrbanBodyBonus();
            case DISTRICT -> weights.getDistrictBonus();
            default -> 0.0;
        };
    }

    private static boolean contextAgrees(AdminType type, AreaContext area) {
        return (area == AreaContext.URBAN && type.isUrban())
                || (area == AreaContext.RURAL && type.isRural());
    }

    private static boolean endsWithWord(String text, String word) {
        if (!text.endsWith(word)) return false;
        int start = text.length() - word.length();
        return start == 0 || !isLetter(text.charAt(start - 1));
    }

    private static boolean startsWithWord(String text, String word) {
        if (!text.startsWith(word)) return false;
        return text.length() == word.length() || !isLetter(text.charAt(word.length()));
    }

    private static boolean isLetter(char c) {
        return Character.isLetter(c) || Character.getType(c) == Character.NON_SPACING_MARK
                || Character.getType(c) == Character.COMBINING_SPACING_MARK;
    }

    private static List<String> normalized(List<String> words) {
        return words.stream().map(TextNormalizer::normalize).distinct().toList();
    }
}
