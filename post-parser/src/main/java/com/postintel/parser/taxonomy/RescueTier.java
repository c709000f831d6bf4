package com.postintel.parser.taxonomy;

import com.postintel.parser.model.ContentMode;
import com.postintel.parser.model.EventCategory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One rescue strategy: a pattern set, the category it assigns and the bonus it grants.
 * A target of UNCATEGORIZED means the tier only tags the content mode.
 */
public record RescueTier(
        String tag,
        List<Pattern> patterns,
        EventCategory target,
        double confidenceBonus,
        ContentMode contentMode
) {

    public RescueTier {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("Rescue tier " + tag + " has no patterns");
        }
        patterns = List.copyOf(patterns);
    }

    /** Fraction of this tier's patterns found in the text, in [0,1]. */
    public double matchRatio(String normalizedText) {
        long hits = patterns.stream().filter(p -> p.matcher(normalizedText).find()).count();
        return (double) hits / patterns.size();
    }

    public boolean isTagOnly() {
        return target.isUncategorized();
    }
}
