package net.layerline.core.poll;

import java.time.Duration;
import java.util.Objects;

/**
 * @param interval              기본 조회 간격
 * @param minInterval           provider 가 제안한 간격의 하한
 * @param maxInterval           provider 가 제안한 간격의 상한
 * @param maxDuration           전체 폴링 벽시계 상한
 * @param maxAttempts           조회 횟수 상한
 * @param maxConsecutiveErrors  연속 조회 오류 허용 횟수 (초과 시 마지막 오류로 종료)
 */
public record PollOptions(
        Duration interval,
        Duration minInterval,
        Duration maxInterval,
        Duration maxDuration,
        int maxAttempts,
        int maxConsecutiveErrors
) {
    public PollOptions {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(maxDuration, "maxDuration");
        minInterval = minInterval == null ? Duration.ZERO : minInterval;
        maxInterval = maxInterval == null ? interval.multipliedBy(10) : maxInterval;
        if (interval.isNegative()) throw new IllegalArgumentException("interval < 0");
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (maxConsecutiveErrors < 0) throw new IllegalArgumentException("maxConsecutiveErrors < 0");
    }

    /** 5초 간격, 30분 / 360회 상한 */
    public static PollOptions defaults() {
        return new PollOptions(Duration.ofSeconds(5), Duration.ofMillis(500), Duration.ofSeconds(30),
                Duration.ofMinutes(30), 360, 10);
    }

    public PollOptions withInterval(Duration interval) {
        return new PollOptions(interval, minInterval, maxInterval, maxDuration, maxAttempts, maxConsecutiveErrors);
    }

    public PollOptions withMaxAttempts(int maxAttempts) {
        return new PollOptions(interval, minInterval, maxInterval, maxDuration, maxAttempts, maxConsecutiveErrors);
    }

    public PollOptions withMaxDuration(Duration maxDuration) {
        return new PollOptions(interval, minInterval, maxInterval, maxDuration, maxAttempts, maxConsecutiveErrors);
    }

    public PollOptions withMaxConsecutiveErrors(int maxConsecutiveErrors) {
        return new PollOptions(interval, minInterval, maxInterval, maxDuration, maxAttempts, maxConsecutiveErrors);
    }

    Duration nextDelay(Duration suggested) {
        if (suggested == null || suggested.isNegative()) return interval;
        if (suggested.compareTo(minInterval) < 0) return minInterval;
        if (suggested.compareTo(maxInterval) > 0) return maxInterval;
        return suggested;
    }
}
