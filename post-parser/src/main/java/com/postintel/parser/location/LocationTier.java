package com.postintel.parser.location;

import java.util.Optional;

/**
 * One way of finding a post's location. Tiers are chained in a fixed order by
 * {@link LocationResolver}; the first tier that returns a result wins.
 *
 * Implementations must not mutate shared state. The temporal window is only
 * read here; the resolver alone writes to it.
 */
public interface LocationTier {

    /** Short name used in the parsing trace, e.g. "gazetteer". */
    String name();

    Optional<TierResult> resolve(LocationContext context);
}
