package com.postintel.parser.location;

import com.postintel.parser.model.ResolvedLocation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Holds back the pushes of one post until the caller decides to keep them.
 * Reads go straight to the underlying window; staged locations stay invisible
 * until {@link #commit()}. Not thread-safe, one instance per post.
 */
public class StagedLocationWindow implements LocationWindow {

    private record Pending(ResolvedLocation location, Instant postedAt) {}

    private final LocationWindow target;
    private final List<Pending> pending = new ArrayList<>();

    public StagedLocationWindow(LocationWindow target) {
        this.target = target;
    }

    @Override
    public void push(ResolvedLocation location, Instant postedAt) {
        if (location == null) return;
        pending.add(new Pending(location, postedAt));
    }

    @Override
    public Optional<ResolvedLocation> latest(Instant postedAt, Duration maxAge) {
        return target.latest(postedAt, maxAge);
    }

    @Override
    public int size() {
        return target.size();
    }

    @Override
    public void clear() {
        pending.clear();
        target.clear();
    }

    public void commit() {
        for (Pending p : pending) {
            target.push(p.location(), p.postedAt());
        }
        pending.clear();
    }

    public void discard() {
        pending.clear();
    }
}
