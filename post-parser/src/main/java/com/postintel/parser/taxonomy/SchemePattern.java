package com.postintel.parser.taxonomy;

import java.util.regex.Pattern;

/** Regex for a government scheme mention and the canonical scheme name it maps to. */
public record SchemePattern(Pattern pattern, String canonical) {

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }
}
