package com.postintel.parser.location;

import com.postintel.parser.model.ResolvedLocation;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/** A window that remembers nothing. Temporal inference never fires with it. */
public final class NoOpLocationWindow implements LocationWindow {

    public static final NoOpLocationWindow INSTANCE = new NoOpLocationWindow();

    private NoOpLocationWindow() {
    }

    @Override
    public void push(ResolvedLocation location, Instant postedAt) {
        // nothing to remember
    }

    @Override
    public Optional<ResolvedLocation> latest(Instant postedAt, Duration maxAge) {
        return Optional.empty();
    }

    @Override
    public int size() {
        return 0;
    }

    @Override
    public void clear() {
        // nothing to clear
    }
}
