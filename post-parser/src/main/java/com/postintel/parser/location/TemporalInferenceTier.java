package com.postintel.parser.location;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.model.LocationSource;
import com.postintel.parser.model.ResolvedLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Last resort: a post that names no place probably happened where the author's
 * previous posts did. Reuses the most recent window entry at a discounted confidence,
 * min(cap, prior x penalty-factor).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TemporalInferenceTier implements LocationTier {

    private final PostParserProperties properties;

    @Override
    public String name() {
        return "temporal";
    }

    @Override
    public Optional<TierResult> resolve(LocationContext context) {
        PostParserProperties.Temporal cfg = properties.getLocation().getTemporal();
        if (!cfg.isEnabled() || context.window() == null) return Optional.empty();

        Duration maxAge = Duration.ofMinutes(cfg.getMaxAgeMinutes());
        return context.window().latest(context.post().timestamp(), maxAge).map(prior -> {
            double confidence = Math.min(cfg.getConfidenceCap(), prior.confidence() * cfg.getPenaltyFactor());
            ResolvedLocation inferred = prior.withProvenance(LocationSource.TEMPORAL_INFERENCE, confidence);
            log.debug("Inferred {} from recent posts at {}", prior.canonical(), confidence);
            return TierResult.of(inferred, null);
        });
    }
}
