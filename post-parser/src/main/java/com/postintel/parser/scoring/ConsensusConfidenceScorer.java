package com.postintel.parser.scoring;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.model.ConfidenceSignals;
import com.postintel.parser.model.ConfidenceSignals.Signal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Blends the independent signals into one confidence.
 *
 *   confidence = sum(weight x score) / sum(weight of signals present)
 *
 * then x1.1 when three or more signals exceed 0.8, clamped to [0, 1].
 * Absent signals carry no weight, so a post is not punished for evidence
 * that simply does not apply to it.
 */
@Component
@RequiredArgsConstructor
public class ConsensusConfidenceScorer {

    private final PostParserProperties properties;

    public double score(ConfidenceSignals signals) {
        PostParserProperties.Scoring cfg = properties.getScoring();

        double weighted = 0.0;
        double totalWeight = 0.0;
        int highSignals = 0;
        for (Signal signal : Signal.values()) {
            if (!signals.has(signal)) continue;
            double value = signals.get(signal).orElse(0.0);
            double weight = cfg.getWeights().getOrDefault(signal.wireName(), 0.0);
            weighted += weight * value;
            totalWeight += weight;
            if (value > cfg.getHighSignalLevel()) highSignals++;
        }
        if (totalWeight <= 0.0) return 0.0;

        double confidence = weighted / totalWeight;
        if (highSignals >= cfg.getHighSignalCount()) {
            confidence *= cfg.getAgreementBoost();
        }
        return clamp(confidence);
    }

    /**
     * Final emitted confidence: consensus, capped for posts that stayed uncategorized,
     * rounded to two decimals.
     */
    public double finalConfidence(ConfidenceSignals signals, boolean uncategorized) {
        double confidence = score(signals);
        if (uncategorized) {
            confidence = Math.min(confidence, properties.getScoring().getUncategorizedCeiling());
        }
        return round2(confidence);
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
