package com.postintel.parser.scoring;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.model.EventCategory;
import com.postintel.parser.model.ReviewStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Sends a post to human review unless its confidence clears the category's bar.
 * Condolence, birthday, security, sports and disaster posts are held to a stricter bar
 * because a wrong auto-approval there is costly.
 */
@Component
@RequiredArgsConstructor
public class ReviewRouter {

    private final PostParserProperties properties;

    public ReviewDecision route(double confidence, EventCategory category) {
        double threshold = thresholdFor(category);
        boolean approved = confidence >= threshold;
        return new ReviewDecision(approved ? ReviewStatus.AUTO_APPROVED : ReviewStatus.PENDING, !approved, threshold);
    }

    public double thresholdFor(EventCategory category) {
        PostParserProperties.Scoring cfg = properties.getScoring();
        return cfg.getHighPrecisionCategories().contains(category)
                ? cfg.getHighPrecisionThreshold()
                : cfg.getAutoApproveThreshold();
    }
}
