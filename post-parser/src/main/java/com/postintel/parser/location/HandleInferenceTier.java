package com.postintel.parser.location;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.gazetteer.GazetteerIndex;
import com.postintel.parser.model.GazetteerRecord;
import com.postintel.parser.model.LocationSource;
import com.postintel.parser.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Infers a district or urban body from account handles: "@CollectorRaipur" or
 * "@BhilaiNagarNigam" name their place. Uses handles carried in the post hints plus
 * any @mentions in the text.
 */
@Component
@Slf4j
public class HandleInferenceTier implements LocationTier {

    private static final int MIN_NAME_LENGTH = 4;

    private final List<Map.Entry<String, GazetteerRecord>> latinNames;
    private final PostParserProperties properties;

    public HandleInferenceTier(GazetteerIndex gazetteer, PostParserProperties properties) {
        this.latinNames = gazetteer.latinNames(MIN_NAME_LENGTH);
        this.properties = properties;
    }

    @Override
    public String name() {
        return "handle";
    }

    @Override
    public Optional<TierResult> resolve(LocationContext context) {
        Set<String> handles = new LinkedHashSet<>(context.post().hints().handles());
        handles.addAll(TextNormalizer.extractHandles(context.cleaned()));

        for (String handle : handles) {
            String key = handle.toLowerCase().replaceAll("[^a-z]", "");
            for (Map.Entry<String, GazetteerRecord> name : latinNames) {
                if (key.contains(name.getKey())) {
                    log.debug("Handle @{} implies {}", handle, name.getValue().canonical());
                    return Optional.of(TierResult.of(
                            ResolvedLocations.from(name.getValue(), LocationSource.HANDLE_INFERENCE,
                                    properties.getLocation().getHandleConfidence(),
                                    properties.getGazetteer().getStateCode()),
                            "@" + handle));
                }
            }
        }
        return Optional.empty();
    }
}
