package com.postintel.parser.scoring;

import com.postintel.parser.model.ReviewStatus;

/** Routing outcome for one post: the bar it was held to and whether it cleared it. */
public record ReviewDecision(ReviewStatus status, boolean needsReview, double threshold) {
}
