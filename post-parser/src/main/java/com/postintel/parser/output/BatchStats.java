package com.postintel.parser.output;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.postintel.parser.model.AnnotatedPost;
import com.postintel.parser.model.BatchRun;
import com.postintel.parser.model.ParsedPost;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of one batch, written next to the annotated output as {@code <stem>_stats.json}.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BatchStats {

    static final double HIGH_CONFIDENCE = 0.85;
    static final double MEDIUM_CONFIDENCE = 0.5;

    private BatchRun run;

    private int totalPosts;
    private int skippedRecords;
    private int withLocation;
    private int rescued;
    private int needsReview;
    private int autoApproved;
    private double averageProcessingTimeMs;

    private Map<String, Integer> byCategory;
    private Map<String, Integer> byLocationType;
    private Map<String, Integer> byLocationSource;
    /** high >= 0.85, medium >= 0.5, low below */
    private Map<String, Integer> byConfidence;

    public static BatchStats from(BatchRun run, List<AnnotatedPost> posts, int skipped) {
        Map<String, Integer> byCategory = new TreeMap<>();
        Map<String, Integer> byLocationType = new TreeMap<>();
        Map<String, Integer> byLocationSource = new TreeMap<>();
        Map<String, Integer> byConfidence = new TreeMap<>(Map.of("high", 0, "medium", 0, "low", 0));

        int withLocation = 0;
        int rescued = 0;
        int needsReview = 0;
        long totalMs = 0;

        for (AnnotatedPost annotated : posts) {
            ParsedPost p = annotated.parsed();
            totalMs += annotated.processingTimeMs();

            byCategory.merge(p.getEventType().name(), 1, Integer::sum);
            if (p.getLocation() != null) {
                withLocation++;
                byLocationType.merge(p.getLocation().locationType().code(), 1, Integer::sum);
                byLocationSource.merge(p.getLocation().source().wireName(), 1, Integer::sum);
            } else {
                byLocationSource.merge("none", 1, Integer::sum);
            }
            byConfidence.merge(bucket(p.getConfidence()), 1, Integer::sum);
            if (p.isRescued()) rescued++;
            if (p.isNeedsReview()) needsReview++;
        }

        return BatchStats.builder()
                .run(run)
                .totalPosts(posts.size())
                .skippedRecords(skipped)
                .withLocation(withLocation)
                .rescued(rescued)
                .needsReview(needsReview)
                .autoApproved(posts.size() - needsReview)
                .averageProcessingTimeMs(posts.isEmpty() ? 0.0
                        : Math.round(totalMs * 100.0 / posts.size()) / 100.0)
                .byCategory(byCategory)
                .byLocationType(byLocationType)
                .byLocationSource(byLocationSource)
                .byConfidence(byConfidence)
                .build();
    }

    static String bucket(double confidence) {
        if (confidence >= HIGH_CONFIDENCE) return "high";
        if (confidence >= MEDIUM_CONFIDENCE) return "medium";
        return "low";
    }
}
