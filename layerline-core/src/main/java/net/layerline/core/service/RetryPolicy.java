package net.layerline.core.service;

import java.time.Duration;

public interface RetryPolicy {
    /** attempt 번째 재시도(1-base) 전에 기다릴 시간 */
    Duration nextBackoff(long attempt);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        return attempt -> backoff;
    }

    /** base, 2*base, 4*base ... 최대 max */
    static RetryPolicy exponential(Duration base, Duration max) {
        return new ExponentialRetryPolicy(base, max);
    }
}
