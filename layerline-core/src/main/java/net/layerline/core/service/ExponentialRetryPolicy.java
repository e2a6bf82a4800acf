package net.layerline.core.service;

import java.time.Duration;

final class ExponentialRetryPolicy implements RetryPolicy {
    private final Duration base;
    private final Duration max;

    ExponentialRetryPolicy(Duration base, Duration max) {
        if (base.isNegative() || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("invalid backoff range: " + base + ".." + max);
        }
        this.base = base;
        this.max = max;
    }

    @Override
    public Duration nextBackoff(long attempt) {
        long shift = Math.max(0, Math.min(attempt - 1, 30));
        long millis = base.toMillis() << shift;
        if (millis < 0 || millis > max.toMillis()) return max;
        return Duration.ofMillis(millis);
    }
}
