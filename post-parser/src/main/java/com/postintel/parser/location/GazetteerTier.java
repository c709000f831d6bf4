package com.postintel.parser.location;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.gazetteer.GazetteerIndex;
import com.postintel.parser.gazetteer.GazetteerMatch;
import com.postintel.parser.model.GazetteerRecord;
import com.postintel.parser.model.LocationSource;
import com.postintel.parser.model.ResolvedLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Dictionary tier: every candidate span is looked up in the gazetteer and the
 * best-scoring record wins (see {@link SpecificityScorer}).
 *
 * Source is EXACT_DICTIONARY when the winning span was itself an indexed name and
 * REGEX_CANDIDATE when only a folded or transliterated variant matched; the latter
 * also pays a small confidence penalty.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GazetteerTier implements LocationTier {

    private final GazetteerIndex gazetteer;
    private final SpecificityScorer scorer;
    private final PostParserProperties properties;

    @Override
    public String name() {
        return "gazetteer";
    }

    @Override
    public Optional<TierResult> resolve(LocationContext context) {
        if (gazetteer.isEmpty()) return Optional.empty();

        Map<GazetteerRecord, GazetteerMatch> matches = new LinkedHashMap<>();
        for (Candidate candidate : context.candidates()) {
            for (GazetteerMatch match : gazetteer.lookupAll(candidate.surface())) {
                matches.merge(match.record(), match, (kept, next) -> !kept.exact() && next.exact() ? next : kept);
            }
        }
        if (matches.isEmpty()) return Optional.empty();

        GazetteerMatch winner = null;
        double winnerConfidence = 0.0;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (GazetteerMatch match : matches.values()) {
            double confidence = matchConfidence(match);
            double score = scorer.score(match.record(), match.surface(), confidence, context);
            log.debug("Gazetteer candidate {} ({}) via '{}' scored {}",
                    match.record().canonical(), match.record().type(), match.surface(), score);
            if (score > bestScore) {
                bestScore = score;
                winner = match;
                winnerConfidence = confidence;
            }
        }

        GazetteerRecord record = Objects.requireNonNull(winner).record();
        LocationSource source = winner.exact() ? LocationSource.EXACT_DICTIONARY : LocationSource.REGEX_CANDIDATE;
        ResolvedLocation location = ResolvedLocations.from(record, source, winnerConfidence,
                properties.getGazetteer().getStateCode());
        if (record.type().isUrban()) {
            location = ResolvedLocations.withWardZone(location, WardZoneExtractor.extract(context.normalized()));
        }

        return Optional.of(new TierResult(location, source, winnerConfidence, winner.surface(),
                agreement(record, matches), null));
    }

    /** Share of distinct matched records whose district equals the winner's. */
    private static double agreement(GazetteerRecord winner, Map<GazetteerRecord, GazetteerMatch> matches) {
        if (winner.district() == null) return 1.0 / matches.size();
        long agreeing = matches.keySet().stream()
                .filter(r -> winner.district().equals(r.district()))
                .count();
        return (double) agreeing / matches.size();
    }

    private double matchConfidence(GazetteerMatch match) {
        PostParserProperties.Location cfg = properties.getLocation();
        double base = switch (match.record().type()) {
            case VILLAGE -> cfg.getVillageConfidence();
            case URBAN_LOCAL_BODY -> cfg.getUrbanBodyConfidence();
            default -> cfg.getDistrictConfidence();
        };
        return match.exact() ? base : Math.max(0.0, base - cfg.getVariantMatchPenalty());
    }
}
