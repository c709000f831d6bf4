package com.postintel.parser.location;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.gazetteer.GazetteerIndex;
import com.postintel.parser.model.GazetteerRecord;
import com.postintel.parser.model.LocationSource;
import com.postintel.parser.model.ResolvedLocation;
import com.postintel.parser.semantic.LocationSearchClient;
import com.postintel.parser.semantic.SearchHit;
import com.postintel.parser.semantic.SemanticBackendUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Nearest-neighbour fallback for misspelled or unusually written place names.
 *
 * Only marker-adjacent candidates are queried, so a stray word is never promoted to a
 * place just because it looks like one. The hit is mapped back through the gazetteer;
 * confidence = similarity x confidence-factor.
 *
 * A backend that cannot answer is not an error: the tier is skipped for that post and
 * the first occurrence is logged at warn.
 */
@Component
@Slf4j
public class SemanticSearchTier implements LocationTier {

    private final LocationSearchClient client;
    private final GazetteerIndex gazetteer;
    private final PostParserProperties properties;
    private final AtomicBoolean unavailableLogged = new AtomicBoolean(false);

    public SemanticSearchTier(LocationSearchClient client, GazetteerIndex gazetteer, PostParserProperties properties) {
        this.client = client;
        this.gazetteer = gazetteer;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "semantic";
    }

    @Override
    public Optional<TierResult> resolve(LocationContext context) {
        PostParserProperties.Semantic cfg = properties.getSemantic();
        if (cfg.getMode() == PostParserProperties.Semantic.Mode.DISABLED) return Optional.empty();

        for (Candidate candidate : context.candidates()) {
            if (!candidate.markerAdjacent() || candidate.surface().length() < cfg.getMinCandidateLength()) continue;

            Optional<List<SearchHit>> hits = query(candidate.surface());
            if (hits.isEmpty()) return Optional.empty();

            for (SearchHit hit : hits.get()) {
                Optional<GazetteerRecord> record = gazetteer.resolveByName(hit.name());
                if (record.isEmpty()) continue;

                double confidence = round4(hit.score() * cfg.getConfidenceFactor());
                ResolvedLocation location = ResolvedLocations.from(record.get(), LocationSource.SEMANTIC_SEARCH,
                        confidence, properties.getGazetteer().getStateCode());
                log.debug("Semantic hit '{}' -> {} ({})", candidate.surface(), hit.name(), hit.score());
                return Optional.of(new TierResult(location, LocationSource.SEMANTIC_SEARCH, confidence,
                        candidate.surface(), null, hit.score()));
            }
        }
        return Optional.empty();
    }

    /**
     * Independent check of a location found by another tier: the similarity of the
     * backend's best hit for the matched span when it names the same place, 0 when it
     * names another place, empty when the backend is unavailable or finds nothing.
     */
    public Optional<Double> crossCheck(String matchedText, ResolvedLocation location) {
        if (matchedText == null || location == null) return Optional.empty();
        if (properties.getSemantic().getMode() == PostParserProperties.Semantic.Mode.DISABLED) return Optional.empty();

        return query(matchedText).flatMap(hits -> hits.stream().findFirst())
                .map(top -> gazetteer.resolveByName(top.name())
                        .filter(r -> r.canonical().equals(location.canonical()))
                        .map(r -> top.score())
                        .orElse(0.0));
    }

    private Optional<List<SearchHit>> query(String text) {
        PostParserProperties.Semantic cfg = properties.getSemantic();
        try {
            return Optional.of(client.search(text, cfg.getTopK(), cfg.getMinSimilarity()));
        } catch (SemanticBackendUnavailableException e) {
            if (unavailableLogged.compareAndSet(false, true)) {
                log.warn("Semantic search unavailable, skipping tier: {}", e.getMessage());
            } else {
                log.debug("Semantic search unavailable: {}", e.getMessage());
            }
            return Optional.empty();
        }
    }

    private static double round4(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
