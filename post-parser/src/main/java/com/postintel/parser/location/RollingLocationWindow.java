package com.postintel.parser.location;

import com.postintel.parser.model.ResolvedLocation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;

/** Fixed-capacity ring buffer of the last N resolved locations. Thread-safe. */
public class RollingLocationWindow implements LocationWindow {

    private record Entry(ResolvedLocation location, Instant postedAt) {}

    private final int capacity;
    private final Deque<Entry> entries;

    public RollingLocationWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    @Override
    public synchronized void push(ResolvedLocation location, Instant postedAt) {
        if (location == null) return;
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(new Entry(location, postedAt));
    }

    @Override
    public synchronized Optional<ResolvedLocation> latest(Instant postedAt, Duration maxAge) {
        Iterator<Entry> newestFirst = entries.descendingIterator();
        while (newestFirst.hasNext()) {
            Entry e = newestFirst.next();
            if (withinAge(e, postedAt, maxAge)) return Optional.of(e.location());
        }
        return Optional.empty();
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    @Override
    public synchronized void clear() {
        entries.clear();
    }

    private static boolean withinAge(Entry e, Instant postedAt, Duration maxAge) {
        if (maxAge == null || maxAge.isZero() || maxAge.isNegative()) return true;
        if (postedAt == null || e.postedAt() == null) return true;
        Duration gap = Duration.between(e.postedAt(), postedAt).abs();
        return gap.compareTo(maxAge) <= 0;
    }
}
