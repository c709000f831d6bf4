package com.postintel.parser.location;

import com.postintel.parser.model.ResolvedLocation;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RollingLocationWindowTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final Duration FOUR_HOURS = Duration.ofHours(4);

    private static ResolvedLocation place(String name) {
        return ResolvedLocation.builder().canonical(name).build();
    }

    @Test
    void latestReturnsNewestEntry() {
        RollingLocationWindow window = new RollingLocationWindow(3);
        window.push(place("रायपुर"), T0);
        window.push(place("धमतरी"), T0.plusSeconds(60));

        assertThat(window.latest(T0.plusSeconds(120), FOUR_HOURS)).get()
                .extracting(ResolvedLocation::canonical).isEqualTo("धमतरी");
    }

    @Test
    void oldestEntryIsEvictedAtCapacity() {
        RollingLocationWindow window = new RollingLocationWindow(2);
        window.push(place("a"), T0);
        window.push(place("b"), T0);
        window.push(place("c"), T0);

        assertThat(window.size()).isEqualTo(2);
    }

    @Test
    void staleNewestFallsBackToNothingOlder() {
        RollingLocationWindow window = new RollingLocationWindow(3);
        window.push(place("रायपुर"), T0);

        assertThat(window.latest(T0.plus(Duration.ofHours(5)), FOUR_HOURS)).isEmpty();
        assertThat(window.latest(T0.plus(Duration.ofHours(3)), FOUR_HOURS)).isPresent();
    }

    @Test
    void missingTimestampsSkipTheAgeCheck() {
        RollingLocationWindow window = new RollingLocationWindow(3);
        window.push(place("रायपुर"), null);

        assertThat(window.latest(T0, FOUR_HOURS)).isPresent();
    }

    @Test
    void nullLocationIsIgnored() {
        RollingLocationWindow window = new RollingLocationWindow(3);
        window.push(null, T0);

        assertThat(window.size()).isZero();
    }

    @Test
    void clearEmptiesTheWindow() {
        RollingLocationWindow window = new RollingLocationWindow(3);
        window.push(place("रायपुर"), T0);
        window.clear();

        assertThat(window.latest(T0, FOUR_HOURS)).isEmpty();
    }

    @Test
    void capacityMustBePositive() {
        assertThatThrownBy(() -> new RollingLocationWindow(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
