package com.postintel.parser.service;

import com.postintel.parser.classify.EventClassifier;
import com.postintel.parser.classify.RescueEngine;
import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.entity.EntityExtractor;
import com.postintel.parser.location.LocationResolution;
import com.postintel.parser.location.LocationResolver;
import com.postintel.parser.location.LocationWindow;
import com.postintel.parser.location.NoOpLocationWindow;
import com.postintel.parser.model.ClassificationResult;
import com.postintel.parser.model.ClassificationSource;
import com.postintel.parser.model.ConfidenceSignals;
import com.postintel.parser.model.ConfidenceSignals.Signal;
import com.postintel.parser.model.ContentMode;
import com.postintel.parser.model.EntityBundle;
import com.postintel.parser.model.EventCategory;
import com.postintel.parser.model.LanguageProfile;
import com.postintel.parser.model.ParsedPost;
import com.postintel.parser.model.Post;
import com.postintel.parser.model.RescueVerdict;
import com.postintel.parser.model.ReviewStatus;
import com.postintel.parser.scoring.ConsensusConfidenceScorer;
import com.postintel.parser.scoring.ReviewDecision;
import com.postintel.parser.scoring.ReviewRouter;
import com.postintel.parser.text.LanguageDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Annotates a single post: classify, resolve location, rescue, extract entities,
 * score and route.
 *
 * Synchronous and side-effect free apart from the caller's location window.
 * A failure inside one post never escapes: the post comes back as a sparse
 * annotation with confidence 0 that goes straight to review.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PostParsingService {

    private final EventClassifier classifier;
    private final LocationResolver locationResolver;
    private final RescueEngine rescueEngine;
    private final EntityExtractor entityExtractor;
    private final ConsensusConfidenceScorer scorer;
    private final ReviewRouter reviewRouter;
    private final PostParserProperties properties;

    /** Annotates a post with no temporal context. */
    public ParsedPost parse(Post post) {
        return parse(post, NoOpLocationWindow.INSTANCE);
    }

    public ParsedPost parse(Post post, LocationWindow window) {
        try {
            return annotate(post, window);
        } catch (RuntimeException e) {
            log.warn("Post {} could not be annotated: {}", post.id(), e.getMessage(), e);
            return sparse(post, "error: " + e.getMessage());
        }
    }

    /**
     * Minimal annotation for a post that could not be processed.
     * Always routed to review.
     */
    public ParsedPost sparse(Post post, String reason) {
        return ParsedPost.builder()
                .postId(post.id())
                .eventDate(eventDate(post))
                .eventType(EventCategory.UNCATEGORIZED)
                .eventTypeSecondary(List.of())
                .classificationSource(ClassificationSource.KEYWORD)
                .contentMode(ContentMode.DIGITAL_POST)
                .locationConfidence(0.0)
                .entities(EntityBundle.empty())
                .language(LanguageProfile.unknown())
                .signals(ConfidenceSignals.builder().build())
                .confidence(0.0)
                .reviewStatus(ReviewStatus.PENDING)
                .needsReview(true)
                .trace(List.of(reason))
                .build();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ParsedPost annotate(Post post, LocationWindow window) {
        List<String> trace = new ArrayList<>();

        ClassificationResult classification = classifier.classify(post.text());
        trace.add("classify: " + classification.primary().name() + " (" + classification.primaryScore() + ")");

        LocationResolution location = locationResolver.resolve(post, window);
        trace.addAll(location.trace());

        RescueVerdict verdict = rescueEngine.rescue(classification, post.text());
        if (verdict.rescued()) {
            classification = classification.rescuedAs(verdict.category());
            trace.add("rescue: " + verdict.rescueTag() + " -> " + verdict.category().name()
                    + " (ratio " + verdict.matchRatio() + ")");
        } else if (verdict.rescueTag() != null) {
            trace.add("rescue: tagged " + verdict.rescueTag());
        }

        EntityBundle entities = entityExtractor.extract(post.text());

        ConfidenceSignals signals = signals(classification, location, verdict);
        EventCategory category = classification.primary();
        double confidence = scorer.finalConfidence(signals, category.isUncategorized());
        ReviewDecision decision = reviewRouter.route(confidence, category);
        trace.add("confidence: " + confidence + " vs " + decision.threshold() + " -> " + decision.status().wireName());

        log.debug("Post {}: {} @ {} ({})", post.id(), category.name(),
                location.isResolved() ? location.location().canonical() : "-", confidence);

        return ParsedPost.builder()
                .postId(post.id())
                .eventDate(eventDate(post))
                .eventType(category)
                .eventTypeSecondary(classification.secondary())
                .classificationSource(classification.source())
                .contentMode(verdict.contentMode())
                .rescued(verdict.rescued())
                .rescueTag(verdict.rescueTag())
                .rescueConfidenceBonus(verdict.confidenceBonus())
                .location(location.location())
                .locationConfidence(location.confidence())
                .entities(entities)
                .language(LanguageDetector.detect(post.text()))
                .signals(signals)
                .confidence(confidence)
                .reviewStatus(decision.status())
                .needsReview(decision.needsReview())
                .trace(trace)
                .build();
    }

    private static ConfidenceSignals signals(ClassificationResult classification,
                                             LocationResolution location,
                                             RescueVerdict verdict) {
        ConfidenceSignals.Builder signals = ConfidenceSignals.builder()
                .put(Signal.KEYWORD, classification.primaryScore());
        if (location.isResolved()) {
            signals.put(Signal.LOCATION, location.confidence());
        }
        if (verdict.rescued()) {
            signals.put(Signal.RESCUE, Math.min(1.0, verdict.matchRatio() + verdict.confidenceBonus()));
        }
        return signals
                .putIfPresent(Signal.DICTIONARY_AGREEMENT, location.dictionaryAgreement())
                .putIfPresent(Signal.SEMANTIC_AGREEMENT, location.semanticAgreement())
                .build();
    }

    private String eventDate(Post post) {
        if (post.timestamp() == null) return null;
        return post.timestamp().atZone(ZoneId.of(properties.getTimeZone())).toLocalDate().toString();
    }
}
