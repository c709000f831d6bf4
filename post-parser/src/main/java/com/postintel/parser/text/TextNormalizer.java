package com.postintel.parser.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text cleanup and script-variant folding shared by every stage.
 *
 * Two canonical forms are used:
 *   normalize() - NFC, lower case, single spaces. Keyword matching runs on this.
 *   foldScript() - normalize() plus nukta / virama / chandrabindu folding. Gazetteer keys use this.
 */
public final class TextNormalizer {

    private static final Pattern URL = Pattern.compile("https?://\\S+|www\\.\\S+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[\\s,।॥!?;:\"'“”‘’()\\[\\]{}<>|/\\\\#@…*=+_~.\\-]+");
    private static final Pattern HANDLE = Pattern.compile("@([A-Za-z0-9_]{2,})");
    private static final Pattern HASHTAG = Pattern.compile("#([\\p{L}\\p{M}\\p{N}_]+)");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    // Combining marks dropped when folding: nukta, virama, ZWNJ, ZWJ, variation selectors
    private static final Pattern COMBINING = Pattern.compile("[\\u093C\\u094D\\u200C\\u200D\\uFE00-\\uFE0F]");

    private TextNormalizer() {
    }

    /** Removes URLs and collapses whitespace. Keeps handles and hashtags. */
    public static String clean(String text) {
        if (text == null) return "";
        String noUrls = URL.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(noUrls).replaceAll(" ").trim();
    }

    public static String normalize(String text) {
        if (text == null || text.isBlank()) return "";
        String nfc = Normalizer.normalize(text, Normalizer.Form.NFC);
        return WHITESPACE.matcher(nfc.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * Folds Devanagari spelling variants onto one form: precomposed nukta letters
     * become their base letter, chandrabindu becomes anusvara, and nukta/virama/joiners
     * are dropped. "गाँव" and "गांव" fold to the same key.
     */
    public static String foldScript(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) return normalized;

        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            sb.append(foldChar(normalized.charAt(i)));
        }
        return COMBINING.matcher(sb).replaceAll("");
    }

    /**
     * Every lookup key a name should be indexed or searched under:
     * lower case, folded, and for Devanagari input the transliterated and
     * vowel-collapsed Latin forms.
     */
    public static Set<String> variants(String name) {
        Set<String> keys = new LinkedHashSet<>();
        if (name == null || name.isBlank()) return keys;

        String lower = normalize(name);
        keys.add(lower);
        String folded = foldScript(name);
        keys.add(folded);

        if (Transliterator.containsDevanagari(folded)) {
            String latin = Transliterator.transliterate(folded);
            keys.add(latin);
            keys.add(Transliterator.collapseVowels(latin));
        } else {
            keys.add(Transliterator.collapseVowels(lower));
        }
        keys.removeIf(String::isBlank);
        return keys;
    }

    /** Splits on whitespace and punctuation (including the danda) and drops stopwords and short tokens. */
    public static List<String> tokens(String text, Set<String> stopwords, int minLength) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) return tokens;

        for (String raw : TOKEN_SPLIT.split(text)) {
            String token = raw.trim();
            if (token.length() < minLength) continue;
            if (DIGITS.matcher(token).matches()) continue;
            if (stopwords.contains(normalize(token))) continue;
            tokens.add(token);
        }
        return tokens;
    }

    /** All tokens in order, stopwords included. Used to build n-grams. */
    public static List<String> rawTokens(String text) {
        if (text == null || text.isBlank()) return List.of();
        return Arrays.stream(TOKEN_SPLIT.split(text))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .toList();
    }

    public static List<String> extractHandles(String text) {
        return collect(HANDLE, text);
    }

    public static List<String> extractHashtags(String text) {
        return collect(HASHTAG, text);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static List<String> collect(Pattern pattern, String text) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            out.add(m.group(1));
        }
        return out;
    }

    // U+0958..U+095F never reach here: NFC decomposes them to base + nukta.
    // Only the nukta letters NFC composes need folding.
    private static char foldChar(char c) {
        return switch (c) {
            case '\u0929' -> '\u0928'; // nnna -> na
            case '\u0931' -> '\u0930'; // rra -> ra
            case '\u0934' -> '\u0933'; // llla -> lla
            case '\u0901' -> '\u0902'; // chandrabindu -> anusvara
            default -> c;
        };
    }
}
