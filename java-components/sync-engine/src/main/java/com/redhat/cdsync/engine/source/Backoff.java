package com.redhat.cdsync.engine.source;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with full jitter: after {@code n} consecutive failures the delay is uniformly distributed
 * between zero and {@code min(max, base * 2^(n-1))}.
 */
public class Backoff {

    private final Duration base;
    private final Duration max;
    private final DoubleSupplier random;

    public Backoff(Duration base, Duration max) {
        this(base, max, () -> ThreadLocalRandom.current().nextDouble());
    }

    public Backoff(Duration base, Duration max, DoubleSupplier random) {
        if (base.isNegative() || base.isZero() || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("invalid backoff " + base + " / " + max);
        }
        this.base = base;
        this.max = max;
        this.random = random;
    }

    public Duration ceiling(int failures) {
        if (failures <= 0) {
            return Duration.ZERO;
        }
        long baseMillis = base.toMillis();
        int shift = Math.min(failures - 1, 30);
        long ceiling = baseMillis << shift;
        if (ceiling <= 0 || ceiling > max.toMillis() || (ceiling >> shift) != baseMillis) {
            return max;
        }
        return Duration.ofMillis(ceiling);
    }

    public Duration delay(int failures) {
        return Duration.ofMillis((long) (random.getAsDouble() * ceiling(failures).toMillis()));
    }
}
