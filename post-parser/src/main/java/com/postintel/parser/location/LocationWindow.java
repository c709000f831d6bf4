package com.postintel.parser.location;

import com.postintel.parser.model.ResolvedLocation;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Recent explicitly-resolved locations, used to infer the location of a
 * follow-up post that names none. This is the only order-dependent state in the
 * engine; give each concurrent worker its own window, or a {@link NoOpLocationWindow}.
 */
public interface LocationWindow {

    void push(ResolvedLocation location, Instant postedAt);

    /**
     * Most recent location usable for a post made at {@code postedAt}. When both
     * timestamps are known and maxAge is positive, older entries are skipped.
     */
    Optional<ResolvedLocation> latest(Instant postedAt, Duration maxAge);

    int size();

    void clear();
}
