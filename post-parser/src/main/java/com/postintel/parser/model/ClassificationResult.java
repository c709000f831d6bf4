package com.postintel.parser.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of keyword classification, possibly replaced by a rescue.
 *
 * @param primary      winning category, UNCATEGORIZED when nothing matched
 * @param secondary    ranked runner-up categories, at most three
 * @param scores       raw weighted score per matched category
 * @param primaryScore keyword confidence of the primary category
 * @param source       KEYWORD, or RESCUE once the rescue engine reassigned the primary
 */
public record ClassificationResult(
        EventCategory primary,
        List<EventCategory> secondary,
        Map<EventCategory, Double> scores,
        double primaryScore,
        ClassificationSource source
) {

    public ClassificationResult {
        secondary = List.copyOf(secondary);
        scores = Map.copyOf(scores);
    }

    public static ClassificationResult uncategorized(double confidence) {
        return new ClassificationResult(EventCategory.UNCATEGORIZED, List.of(), Map.of(),
                confidence, ClassificationSource.KEYWORD);
    }

    public ClassificationResult rescuedAs(EventCategory category) {
        return new ClassificationResult(category, secondary, scores, primaryScore, ClassificationSource.RESCUE);
    }
}
