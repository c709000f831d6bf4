package com.postintel.parser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Annotation attached to one post, ready for the review queue.
 *
 * Design notes:
 *  - location is null when no tier produced evidence; locationConfidence is then 0
 *  - confidence is rounded to two decimals before review routing, so
 *    needsReview always agrees with the emitted number
 *  - trace is diagnostic only and is not consumed by the review service
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedPost {

    // ── Source ──────────────────────────────────────────────────────────────
    private String postId;

    /** YYYY-MM-DD taken from the post timestamp */
    private String eventDate;

    // ── Classification ──────────────────────────────────────────────────────
    private EventCategory eventType;

    private List<EventCategory> eventTypeSecondary;

    private ClassificationSource classificationSource;

    private ContentMode contentMode;

    private boolean rescued;

    private String rescueTag;

    private double rescueConfidenceBonus;

    // ── Location ────────────────────────────────────────────────────────────
    private ResolvedLocation location;

    private double locationConfidence;

    // ── Entities ────────────────────────────────────────────────────────────
    private EntityBundle entities;

    private LanguageProfile language;

    // ── Confidence & review ─────────────────────────────────────────────────
    private ConfidenceSignals signals;

    /** Consensus confidence, two decimals */
    private double confidence;

    private ReviewStatus reviewStatus;

    private boolean needsReview;

    // ── Diagnostics ─────────────────────────────────────────────────────────
    private List<String> trace;
}
