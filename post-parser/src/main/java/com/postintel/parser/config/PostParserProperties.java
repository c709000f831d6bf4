package com.postintel.parser.config;

import com.postintel.parser.model.EventCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * All tuning knobs for the annotation engine.
 *
 * Tie-break bonuses, tier confidences and signal weights were tuned empirically
 * against the golden review set; override them in application.yml rather than in code.
 */
@Component
@ConfigurationProperties(prefix = "post-parser")
@Data
public class PostParserProperties {

    private String modelName = "post-parser";
    private String version = "1.0.0";
    /** Zone used to derive event_date from post timestamps */
    private String timeZone = "Asia/Kolkata";

    private Gazetteer gazetteer = new Gazetteer();
    private Taxonomy taxonomy = new Taxonomy();
    private Location location = new Location();
    private Semantic semantic = new Semantic();
    private Classification classification = new Classification();
    private Scoring scoring = new Scoring();
    private Batch batch = new Batch();
    private Output output = new Output();

    @Data
    public static class Gazetteer {
        private String state = "छत्तीसगढ़";
        private String stateCode = "CG";
        private String villages = "classpath:reference/villages.ndjson";
        private String urbanBodies = "classpath:reference/urban_bodies.ndjson";
        private String districts = "classpath:reference/districts.json";
        private String aliases = "classpath:reference/aliases.csv";
        private String landmarks = "classpath:reference/landmarks.json";
    }

    @Data
    public static class Taxonomy {
        private String path = "classpath:taxonomy/taxonomy.json";
        /** Optional rescue-tier proposals from the advisory assistant */
        private String proposedRescueTiers = "";
    }

    @Data
    public static class Location {
        private double landmarkConfidence = 0.95;
        private double villageConfidence = 0.95;
        private double urbanBodyConfidence = 0.90;
        private double districtConfidence = 0.85;
        private double handleConfidence = 0.85;
        /** Penalty applied when a match only hit through a folded or transliterated variant */
        private double variantMatchPenalty = 0.03;
        private int minCandidateLength = 2;
        private int maxNgram = 3;
        private TieBreak tieBreak = new TieBreak();
        private Temporal temporal = new Temporal();
    }

    @Data
    public static class TieBreak {
        private double base = 0.5;
        private double villageBonus = 0.3;
        private double urbanBodyBonus = 0.2;
        private double districtBonus = 0.1;
        private double contextBonus = 0.5;
        private double markerBonus = 1.0;
        private double depthBonus = 0.05;
    }

    @Data
    public static class Temporal {
        private boolean enabled = true;
        private int windowSize = 3;
        private double penaltyFactor = 0.6;
        private double confidenceCap = 0.75;
        /** Posts further apart than this never share a location; 0 disables the check */
        private long maxAgeMinutes = 240;
    }

    @Data
    public static class Semantic {
        private Mode mode = Mode.NGRAM;
        private double minSimilarity = 0.75;
        private double confidenceFactor = 0.9;
        private int topK = 1;
        private int minCandidateLength = 3;
        /** Ask the backend to confirm locations resolved by other tiers */
        private boolean crossCheck = false;
        private int ngramSize = 3;
        private Http http = new Http();

        public enum Mode {
            NGRAM, HTTP, DISABLED
        }

        @Data
        public static class Http {
            private String baseUrl = "http://localhost:8090";
            private int connectTimeoutMs = 2000;
            private int readTimeoutMs = 3000;
        }
    }

    @Data
    public static class Classification {
        private double strongHitWeight = 0.6;
        private double strongCap = 1.0;
        private double mediumHitWeight = 0.3;
        private double mediumCap = 0.6;
        private double weakHitWeight = 0.1;
        private double weakCap = 0.3;
        private double secondaryFraction = 0.5;
        private double secondaryFloor = 0.4;
        private int maxSecondary = 3;
        private double uncategorizedConfidence = 0.3;
        private double schemeBoost = 0.1;
    }

    @Data
    public static class Scoring {
        private Map<String, Double> weights = new LinkedHashMap<>(Map.of(
                "keyword", 0.25,
                "location", 0.20,
                "rescue", 0.15,
                "dictionary_agreement", 0.10,
                "semantic_agreement", 0.10));
        private double highSignalLevel = 0.8;
        private int highSignalCount = 3;
        private double agreementBoost = 1.1;
        private double uncategorizedCeiling = 0.5;
        private double autoApproveThreshold = 0.85;
        private double highPrecisionThreshold = 0.92;
        private Set<EventCategory> highPrecisionCategories = EnumSet.of(
                EventCategory.CONDOLENCE,
                EventCategory.BIRTHDAY_GREETING,
                EventCategory.INTERNAL_SECURITY,
                EventCategory.SPORTS_ACHIEVEMENT,
                EventCategory.DISASTER_ACCIDENT);
    }

    @Data
    public static class Batch {
        /** NDJSON input file; when set the batch runs on startup */
        private String input = "";
        private int workers = 1;
        /** Per-post budget in milliseconds; 0 disables the budget */
        private long postBudgetMs = 0;
        private int progressEvery = 100;
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.NDJSON;
        private String outputDir = "output";
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            NDJSON, CSV, BOTH
        }
    }
}
