package com.postintel.parser.classify;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.model.ClassificationResult;
import com.postintel.parser.model.ClassificationSource;
import com.postintel.parser.model.EventCategory;
import com.postintel.parser.taxonomy.EventCluster;
import com.postintel.parser.taxonomy.KeywordTaxonomy;
import com.postintel.parser.text.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted three-tier keyword classifier.
 *
 * For each cluster:
 *   score = ( min(strong hits x 0.6, 1.0)
 *           + min(medium hits x 0.3, 0.6)
 *           + min(weak hits x 0.1, 0.3) ) x cluster weight,   capped at 1.0
 *
 * Highest score is primary; equal scores go to the cluster listed first in the
 * taxonomy. Runners-up become secondary when they reach half the primary score
 * and clear an absolute floor. No hits at all gives UNCATEGORIZED.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EventClassifier {

    private final KeywordTaxonomy taxonomy;
    private final PostParserProperties properties;

    public ClassificationResult classify(String text) {
        PostParserProperties.Classification cfg = properties.getClassification();
        String cleaned = TextNormalizer.clean(text);
        String folded = TextNormalizer.foldScript(cleaned);

        Map<EventCategory, Double> scores = new LinkedHashMap<>();
        for (EventCluster cluster : taxonomy.clusters()) {
            double score = tierScore(hits(cluster.strong(), folded), cfg.getStrongHitWeight(), cfg.getStrongCap())
                    + tierScore(hits(cluster.medium(), folded), cfg.getMediumHitWeight(), cfg.getMediumCap())
                    + tierScore(hits(cluster.weak(), folded), cfg.getWeakHitWeight(), cfg.getWeakCap());
            score *= cluster.weight();
            if (score > 0) {
                scores.put(cluster.category(), round4(Math.min(score, 1.0)));
            }
        }

        if (scores.isEmpty()) {
            log.debug("No keyword hits - uncategorized");
            return ClassificationResult.uncategorized(cfg.getUncategorizedConfidence());
        }

        applySchemeBoost(scores, TextNormalizer.normalize(cleaned), cfg);

        EventCategory primary = null;
        double primaryScore = -1.0;
        for (Map.Entry<EventCategory, Double> e : scores.entrySet()) {
            if (e.getValue() > primaryScore) {
                primary = e.getKey();
                primaryScore = e.getValue();
            }
        }

        List<EventCategory> secondary = secondaryCategories(scores, primary, primaryScore, cfg);
        log.debug("Classified as {} ({}), secondary {}", primary, primaryScore, secondary);
        return new ClassificationResult(primary, secondary, scores, primaryScore, ClassificationSource.KEYWORD);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static int hits(List<String> keywords, String folded) {
        int count = 0;
        for (String keyword : keywords) {
            if (folded.contains(keyword)) count++;
        }
        return count;
    }

    private static double tierScore(int hits, double perHit, double cap) {
        return hits == 0 ? 0.0 : Math.min(hits * perHit, cap);
    }

    /** A named scheme strengthens an announcement that the keywords already found. */
    private void applySchemeBoost(Map<EventCategory, Double> scores, String normalized,
                                  PostParserProperties.Classification cfg) {
        Double current = scores.get(EventCategory.SCHEME_ANNOUNCEMENT);
        if (current == null || cfg.getSchemeBoost() <= 0) return;
        boolean namesScheme = taxonomy.schemes().stream().anyMatch(s -> s.matches(normalized));
        if (namesScheme) {
            scores.put(EventCategory.SCHEME_ANNOUNCEMENT, round4(Math.min(1.0, current + cfg.getSchemeBoost())));
        }
    }

    private static List<EventCategory> secondaryCategories(Map<EventCategory, Double> scores, EventCategory primary,
                                                           double primaryScore,
                                                           PostParserProperties.Classification cfg) {
        List<Map.Entry<EventCategory, Double>> ranked = new ArrayList<>(scores.entrySet());
        // stable sort keeps taxonomy order among equal scores
        ranked.sort(Map.Entry.<EventCategory, Double>comparingByValue(Comparator.reverseOrder()));

        List<EventCategory> secondary = new ArrayList<>();
        for (Map.Entry<EventCategory, Double> e : ranked) {
            if (e.getKey() == primary) continue;
            if (secondary.size() >= cfg.getMaxSecondary()) break;
            double score = e.getValue();
            if (score >= primaryScore * cfg.getSecondaryFraction() && score > cfg.getSecondaryFloor()) {
                secondary.add(e.getKey());
            }
        }
        return secondary;
    }

    private static double round4(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
