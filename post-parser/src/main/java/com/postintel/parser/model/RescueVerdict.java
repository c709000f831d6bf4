package com.postintel.parser.model;

/**
 * Result of running the rescue tiers over an uncategorized post.
 *
 * A pass-through verdict keeps the input category and only carries a content mode
 * (and, for tag-only tiers such as digital posts, the tier tag).
 */
public record RescueVerdict(
        boolean rescued,
        EventCategory category,
        String rescueTag,
        double confidenceBonus,
        double matchRatio,
        ContentMode contentMode
) {

    public static RescueVerdict passThrough(EventCategory category, ContentMode mode) {
        return new RescueVerdict(false, category, null, 0.0, 0.0, mode);
    }

    public static RescueVerdict tagOnly(EventCategory category, String tag, double matchRatio, ContentMode mode) {
        return new RescueVerdict(false, category, tag, 0.0, matchRatio, mode);
    }
}
