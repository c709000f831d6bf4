package com.postintel.parser.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Independent evidence scores for one post. A signal that was not observed is
 * absent, not zero, so it carries no weight in the consensus.
 */
public final class ConfidenceSignals {

    public enum Signal {
        KEYWORD, LOCATION, RESCUE, DICTIONARY_AGREEMENT, SEMANTIC_AGREEMENT;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    private final Map<Signal, Double> scores;

    private ConfidenceSignals(Map<Signal, Double> scores) {
        this.scores = Collections.unmodifiableMap(scores);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Double> get(Signal signal) {
        return Optional.ofNullable(scores.get(signal));
    }

    public boolean has(Signal signal) {
        return scores.containsKey(signal);
    }

    public Map<Signal, Double> asMap() {
        return scores;
    }

    /** Serialised form: {"keyword": 0.6, "location": 0.9, ...} in signal order. */
    @JsonValue
    public Map<String, Double> toWire() {
        Map<String, Double> wire = new LinkedHashMap<>();
        scores.forEach((signal, score) -> wire.put(signal.wireName(), score));
        return wire;
    }

    public int size() {
        return scores.size();
    }

    @Override
    public String toString() {
        return "ConfidenceSignals" + scores;
    }

    public static final class Builder {

        private final EnumMap<Signal, Double> scores = new EnumMap<>(Signal.class);

        private Builder() {
        }

        public Builder put(Signal signal, double score) {
            if (Double.isNaN(score)) {
                throw new IllegalArgumentException("Signal " + signal + " must not be NaN");
            }
            scores.put(signal, Math.max(0.0, Math.min(1.0, score)));
            return this;
        }

        /** Records the signal only when a value is present. */
        public Builder putIfPresent(Signal signal, Double score) {
            if (score != null) put(signal, score);
            return this;
        }

        public ConfidenceSignals build() {
            return new ConfidenceSignals(new EnumMap<>(scores));
        }
    }
}
