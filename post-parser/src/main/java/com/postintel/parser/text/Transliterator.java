package com.postintel.parser.text;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Conservative Devanagari to Latin transliteration.
 *
 * Not a full scheme: inherent vowels are not inserted, so the output is a
 * consonant skeleton with explicit matras ("रायपुर" -> "raaypur"). That is enough to
 * line up Hinglish spellings once collapseVowels() has been applied to both sides.
 */
public final class Transliterator {

    private static final Map<Character, String> LETTERS = new HashMap<>();
    private static final Map<Character, String> MATRAS = new HashMap<>();
    private static final Pattern DOUBLE_VOWELS = Pattern.compile("aa|ee|ii|oo|uu");

    static {
        String[][] letters = {
                {"अ", "a"}, {"आ", "aa"}, {"इ", "i"}, {"ई", "ii"}, {"उ", "u"}, {"ऊ", "uu"},
                {"ऋ", "ri"}, {"ए", "e"}, {"ऐ", "ai"}, {"ओ", "o"}, {"औ", "au"}, {"ऑ", "o"},
                {"क", "k"}, {"ख", "kh"}, {"ग", "g"}, {"घ", "gh"}, {"ङ", "n"},
                {"च", "ch"}, {"छ", "chh"}, {"ज", "j"}, {"झ", "jh"}, {"ञ", "n"},
                {"ट", "t"}, {"ठ", "th"}, {"ड", "d"}, {"ढ", "dh"}, {"ण", "n"},
                {"त", "t"}, {"थ", "th"}, {"द", "d"}, {"ध", "dh"}, {"न", "n"},
                {"प", "p"}, {"फ", "ph"}, {"ब", "b"}, {"भ", "bh"}, {"म", "m"},
                {"य", "y"}, {"र", "r"}, {"ल", "l"}, {"ळ", "l"}, {"व", "v"},
                {"श", "sh"}, {"ष", "sh"}, {"स", "s"}, {"ह", "h"},
                {"ं", "n"}, {"ँ", "n"}, {"ः", "h"},
                {"०", "0"}, {"१", "1"}, {"२", "2"}, {"३", "3"}, {"४", "4"},
                {"५", "5"}, {"६", "6"}, {"७", "7"}, {"८", "8"}, {"९", "9"}
        };
        for (String[] pair : letters) {
            LETTERS.put(pair[0].charAt(0), pair[1]);
        }

        String[][] matras = {
                {"ा", "aa"}, {"ि", "i"}, {"ी", "ii"}, {"ु", "u"}, {"ू", "uu"},
                {"े", "e"}, {"ै", "ai"}, {"ो", "o"}, {"ौ", "au"}, {"ृ", "ri"},
                {"ॉ", "o"}, {"ॅ", "ae"}
        };
        for (String[] pair : matras) {
            MATRAS.put(pair[0].charAt(0), pair[1]);
        }
    }

    private Transliterator() {
    }

    public static boolean containsDevanagari(String text) {
        if (text == null) return false;
        for (int i = 0; i < text.length(); i++) {
            if (isDevanagari(text.charAt(i))) return true;
        }
        return false;
    }

    public static boolean isDevanagari(char c) {
        return c >= '\u0900' && c <= '\u097F';
    }

    public static String transliterate(String devanagari) {
        if (devanagari == null) return "";
        StringBuilder out = new StringBuilder(devanagari.length() * 2);
        for (int i = 0; i < devanagari.length(); i++) {
            char c = devanagari.charAt(i);
            String mapped = MATRAS.get(c);
            if (mapped == null) mapped = LETTERS.get(c);
            if (mapped != null) {
                out.append(mapped);
            } else if (c != '\u094D' && c != '\u093C') {
                out.append(c);
            }
        }
        return out.toString();
    }

    /** Collapses doubled vowels and 'w'/'v' so "Raaypur", "raypur" and "Raipur"-style spellings get closer. */
    public static String collapseVowels(String latin) {
        if (latin == null) return "";
        String collapsed = DOUBLE_VOWELS.matcher(latin.toLowerCase()).replaceAll(m -> m.group().substring(0, 1));
        return collapsed.replace('w', 'v');
    }
}
