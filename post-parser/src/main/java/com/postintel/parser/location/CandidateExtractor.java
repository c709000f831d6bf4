package com.postintel.parser.location;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.model.PostHints;
import com.postintel.parser.taxonomy.KeywordTaxonomy;
import com.postintel.parser.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds spans of a post that could name a place.
 *
 * Three passes, in priority order:
 *   1. phrases next to administrative markers ("जिला रायपुर", "भिलाई नगर निगम",
 *      "ग्राम सिलतरा") or locative postpositions ("रायपुर में")
 *   2. every non-stopword token
 *   3. 2..maxNgram token phrases, for multi-word names like "बलौदा बाजार"
 *
 * Only pass-1 spans are flagged marker-adjacent; the semantic tier queries just those.
 */
@Component
@Slf4j
public class CandidateExtractor {

    private static final String LETTERS = "\\u0900-\\u0963\\u0966-\\u097FA-Za-z";
    private static final String WORD = "[" + LETTERS + "]+(?:-[" + LETTERS + "]+)*";
    private static final String NOT_LETTER_BEFORE = "(?<![" + LETTERS + "])";
    private static final String NOT_LETTER_AFTER = "(?![" + LETTERS + "])";

    /** Markers that precede the place name: "जिला रायपुर", "ग्राम सिलतरा". */
    private static final List<String> LEADING_MARKERS = List.of(
            "ग्राम पंचायत", "नगर निगम", "नगर पालिका", "नगर पंचायत", "जिला", "जिले", "विधानसभा",
            "तहसील", "थाना", "विकासखंड", "ब्लॉक", "ग्राम", "गांव", "गाँव", "district", "village", "gram");

    /** Markers that follow the place name: "रायपुर जिला", "भिलाई नगर निगम", "कुरुद वार्ड". */
    private static final List<String> TRAILING_MARKERS = List.of(
            "ग्राम पंचायत", "नगर निगम", "नगर पालिका", "नगर पंचायत", "जिला", "जिले", "विधानसभा",
            "तहसील", "थाना", "विकासखंड", "ब्लॉक", "पंचायत", "वार्ड", "जोन", "शहर",
            "district", "ward", "zone", "municipal", "city");

    private static final List<String> POSTPOSITIONS = List.of("में", "से", "के", "me", "se", "ke");

    private final Pattern leading;
    private final Pattern trailing;
    private final Pattern postposition;
    private final Set<String> stopwords;
    private final PostParserProperties.Location config;

    public CandidateExtractor(KeywordTaxonomy taxonomy, PostParserProperties properties) {
        this.stopwords = taxonomy.stopwords();
        this.config = properties.getLocation();
        this.leading = Pattern.compile(NOT_LETTER_BEFORE + alternation(LEADING_MARKERS)
                + "\\s+(" + WORD + ")(?:\\s+(" + WORD + "))?", Pattern.CASE_INSENSITIVE);
        this.trailing = Pattern.compile("((?:" + WORD + "\\s+)??" + WORD + ")\\s+"
                + alternation(TRAILING_MARKERS) + NOT_LETTER_AFTER, Pattern.CASE_INSENSITIVE);
        this.postposition = Pattern.compile("(" + WORD + ")\\s+"
                + alternation(POSTPOSITIONS) + NOT_LETTER_AFTER, Pattern.CASE_INSENSITIVE);
    }

    /**
     * @param normalizedText output of TextNormalizer.normalize over the cleaned post text
     */
    public List<Candidate> extract(String normalizedText, PostHints hints) {
        Map<String, Candidate> out = new LinkedHashMap<>();
        if (normalizedText == null || normalizedText.isBlank()) return List.of();

        // 1. Marker-adjacent phrases
        Matcher m = leading.matcher(normalizedText);
        while (m.find()) {
            add(out, m.group(1), true);
            if (m.group(2) != null && !isStopword(m.group(2))) {
                add(out, m.group(1) + " " + m.group(2), true);
            }
        }
        m = trailing.matcher(normalizedText);
        while (m.find()) {
            String phrase = m.group(1);
            String[] words = phrase.split("\\s+");
            add(out, words[words.length - 1], true);
            if (words.length > 1 && !isStopword(words[0])) add(out, phrase, true);
        }
        m = postposition.matcher(normalizedText);
        while (m.find()) {
            add(out, m.group(1), true);
        }

        if (hints != null && hints.locationHint() != null) {
            add(out, TextNormalizer.normalize(hints.locationHint()), true);
        }

        // 2. Tokens
        for (String token : TextNormalizer.tokens(normalizedText, stopwords, config.getMinCandidateLength())) {
            add(out, token, false);
        }

        // 3. N-grams
        List<String> words = TextNormalizer.rawTokens(normalizedText);
        for (int n = 2; n <= config.getMaxNgram(); n++) {
            for (int i = 0; i + n <= words.size(); i++) {
                List<String> span = words.subList(i, i + n);
                if (isStopword(span.get(0)) || isStopword(span.get(n - 1))) continue;
                add(out, String.join(" ", span), false);
            }
        }

        log.debug("Extracted {} location candidates", out.size());
        return List.copyOf(out.values());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void add(Map<String, Candidate> out, String surface, boolean markerAdjacent) {
        if (surface == null) return;
        String s = surface.trim();
        if (s.length() < config.getMinCandidateLength() || isStopword(s)) return;
        out.merge(s, new Candidate(s, markerAdjacent),
                (a, b) -> a.markerAdjacent() ? a : new Candidate(s, b.markerAdjacent()));
    }

    private boolean isStopword(String word) {
        return stopwords.contains(TextNormalizer.normalize(word));
    }

    private static String alternation(List<String> words) {
        return Stream.concat(words.stream(), words.stream().map(TextNormalizer::normalize))
                .distinct()
                .map(w -> Pattern.quote(w).replace(" ", "\\E\\s+\\Q"))
                .collect(Collectors.joining("|", "(?:", ")"));
    }
}
