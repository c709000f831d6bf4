package com.postintel.parser.classify;

import com.postintel.parser.model.ClassificationResult;
import com.postintel.parser.model.ContentMode;
import com.postintel.parser.model.EventCategory;
import com.postintel.parser.model.RescueVerdict;
import com.postintel.parser.taxonomy.RescueTier;
import com.postintel.parser.text.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Second chance for posts the keyword classifier could not place.
 *
 * Only UNCATEGORIZED posts are eligible; anything else passes through untouched.
 * Tiers are tried in registry order and the first whose match ratio exceeds 0.5 wins,
 * so specific tiers (security, sports, disaster) are listed before generic ones
 * (greetings, digital). A tag-only tier (target UNCATEGORIZED) marks the content mode
 * without rescuing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RescueEngine {

    private static final double MIN_MATCH_RATIO = 0.5;

    private final RescueTierRegistry registry;

    public RescueVerdict rescue(ClassificationResult classification, String text) {
        EventCategory current = classification.primary();
        if (!current.isUncategorized()) {
            return RescueVerdict.passThrough(current, contentModeFor(current));
        }

        String normalized = TextNormalizer.normalize(text);
        for (RescueTier tier : registry.tiers()) {
            double ratio = tier.matchRatio(normalized);
            if (ratio <= MIN_MATCH_RATIO) continue;

            if (tier.isTagOnly()) {
                log.debug("Tagged by rescue tier '{}' ({})", tier.tag(), ratio);
                return RescueVerdict.tagOnly(current, tier.tag(), ratio, tier.contentMode());
            }
            log.debug("Rescued as {} by tier '{}' ({})", tier.target(), tier.tag(), ratio);
            return new RescueVerdict(true, tier.target(), tier.tag(), tier.confidenceBonus(), ratio, tier.contentMode());
        }
        return RescueVerdict.passThrough(current, ContentMode.DIGITAL_POST);
    }

    /** Content mode implied by a keyword-classified category. */
    public static ContentMode contentModeFor(EventCategory category) {
        return switch (category) {
            case SPORTS_ACHIEVEMENT -> ContentMode.SPORTS_REACTION;
            case GREETINGS, BIRTHDAY_GREETING, CONDOLENCE -> ContentMode.GREETINGS;
            case POLITICAL_STATEMENT, PRESS_MEDIA, INTERNAL_SECURITY -> ContentMode.POLICY_STATEMENT;
            case UNCATEGORIZED -> ContentMode.DIGITAL_POST;
            default -> ContentMode.FIELD_EVENT;
        };
    }
}
