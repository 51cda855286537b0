package com.redhat.cdsync.engine.source;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class BackoffTest {

    @Test
    void ceilingDoublesUpToMax() {
        Backoff backoff = new Backoff(Duration.ofSeconds(5), Duration.ofMinutes(5), () -> 1.0);
        assertThat(backoff.ceiling(0)).isEqualTo(Duration.ZERO);
        assertThat(backoff.ceiling(1)).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.ceiling(2)).isEqualTo(Duration.ofSeconds(10));
        assertThat(backoff.ceiling(4)).isEqualTo(Duration.ofSeconds(40));
        assertThat(backoff.ceiling(7)).isEqualTo(Duration.ofMinutes(5));
        assertThat(backoff.ceiling(100)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void fullJitter() {
        assertThat(new Backoff(Duration.ofSeconds(5), Duration.ofMinutes(5), () -> 0.5).delay(3))
                .isEqualTo(Duration.ofSeconds(10));
        assertThat(new Backoff(Duration.ofSeconds(5), Duration.ofMinutes(5), () -> 0.0).delay(3))
                .isEqualTo(Duration.ZERO);
        Duration random = new Backoff(Duration.ofSeconds(5), Duration.ofMinutes(5)).delay(2);
        assertThat(random).isBetween(Duration.ZERO, Duration.ofSeconds(10));
    }
}
