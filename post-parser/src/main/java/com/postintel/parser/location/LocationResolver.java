package com.postintel.parser.location;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.model.Post;
import com.postintel.parser.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the location tiers in a fixed order and returns the first answer:
 *
 *   landmark -> gazetteer -> handle -> semantic -> temporal
 *
 * Explicit evidence always beats inference. Only the resolver writes to the window,
 * and only with locations that were not themselves inferred from it.
 */
@Component
@Slf4j
public class LocationResolver {

    private final List<LocationTier> tiers;
    private final CandidateExtractor candidateExtractor;
    private final SpecificityScorer specificityScorer;
    private final SemanticSearchTier crossChecker;
    private final PostParserProperties properties;

    @Autowired
    public LocationResolver(LandmarkTier landmarkTier,
                            GazetteerTier gazetteerTier,
                            HandleInferenceTier handleTier,
                            SemanticSearchTier semanticTier,
                            TemporalInferenceTier temporalTier,
                            CandidateExtractor candidateExtractor,
                            SpecificityScorer specificityScorer,
                            PostParserProperties properties) {
        this(List.of(landmarkTier, gazetteerTier, handleTier, semanticTier, temporalTier),
                candidateExtractor, specificityScorer, semanticTier, properties);
    }

    public LocationResolver(List<LocationTier> tiers,
                            CandidateExtractor candidateExtractor,
                            SpecificityScorer specificityScorer,
                            SemanticSearchTier crossChecker,
                            PostParserProperties properties) {
        this.tiers = List.copyOf(tiers);
        this.candidateExtractor = candidateExtractor;
        this.specificityScorer = specificityScorer;
        this.crossChecker = crossChecker;
        this.properties = properties;
    }

    public LocationResolution resolve(Post post, LocationWindow window) {
        LocationWindow effectiveWindow = window == null ? NoOpLocationWindow.INSTANCE : window;
        List<String> trace = new ArrayList<>();

        try {
            LocationContext context = contextFor(post, effectiveWindow);
            trace.add("candidates: " + context.candidates().size() + ", area: " + context.area());

            for (LocationTier tier : tiers) {
                Optional<TierResult> result = tier.resolve(context);
                if (result.isEmpty()) {
                    trace.add(tier.name() + ": none");
                    continue;
                }

                TierResult r = result.get();
                trace.add(tier.name() + ": " + r.location().canonical() + " ("
                        + r.source().wireName() + ", " + r.confidence() + ")");

                Double semanticAgreement = r.semanticScore();
                if (semanticAgreement == null && properties.getSemantic().isCrossCheck() && !r.source().isInferred()) {
                    semanticAgreement = crossChecker.crossCheck(r.matchedText(), r.location()).orElse(null);
                }

                if (!r.source().isInferred()) {
                    effectiveWindow.push(r.location(), post.timestamp());
                }
                return new LocationResolution(r.location(), r.confidence(), r.source(),
                        r.dictionaryAgreement(), semanticAgreement, trace);
            }
            return LocationResolution.unresolved(trace);

        } catch (RuntimeException e) {
            log.warn("Location resolution failed for post {}: {}", post.id(), e.getMessage(), e);
            trace.add("error: " + e.getMessage());
            return LocationResolution.unresolved(trace);
        }
    }

    private LocationContext contextFor(Post post, LocationWindow window) {
        String cleaned = TextNormalizer.clean(post.text());
        String normalized = TextNormalizer.normalize(cleaned);
        String folded = TextNormalizer.foldScript(cleaned);
        return new LocationContext(post, cleaned, normalized, folded,
                candidateExtractor.extract(normalized, post.hints()),
                specificityScorer.detectArea(folded),
                window);
    }
}
