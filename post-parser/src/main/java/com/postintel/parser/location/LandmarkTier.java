package com.postintel.parser.location;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.gazetteer.GazetteerIndex;
import com.postintel.parser.gazetteer.LandmarkTable;
import com.postintel.parser.model.LocationSource;
import com.postintel.parser.model.ResolvedLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Landmark phrases imply a place even when no place name appears:
 * "महानदी भवन में बैठक" resolves to नवा रायपुर.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LandmarkTier implements LocationTier {

    private final LandmarkTable landmarks;
    private final GazetteerIndex gazetteer;
    private final PostParserProperties properties;

    @Override
    public String name() {
        return "landmark";
    }

    @Override
    public Optional<TierResult> resolve(LocationContext context) {
        return landmarks.find(context.folded()).flatMap(landmark -> {
            Optional<ResolvedLocation> location = gazetteer.resolveByName(landmark.place())
                    .map(record -> ResolvedLocations.from(record, LocationSource.LANDMARK,
                                    properties.getLocation().getLandmarkConfidence(),
                                    properties.getGazetteer().getStateCode())
                            .toBuilder()
                            .landmarkTrigger(landmark.phrase())
                            .build());
            if (location.isEmpty()) {
                log.debug("Landmark '{}' points at unknown place '{}'", landmark.phrase(), landmark.place());
            }
            return location.map(l -> TierResult.of(l, landmark.phrase()));
        });
    }
}
