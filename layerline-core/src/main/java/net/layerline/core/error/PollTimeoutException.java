package net.layerline.core.error;

import java.time.Duration;

/** 폴링 상한(시간/횟수) 초과. provider 실패와 구분되며 재시도 대상 */
public class PollTimeoutException extends TransientProcessingException {
    private final int attempts;

    public PollTimeoutException(String providerJobId, int attempts, Duration elapsed) {
        super("The processing server did not finish in time",
                "poll timeout for provider job " + providerJobId + " after " + attempts
                        + " attempts / " + elapsed.toMillis() + "ms");
        this.attempts = attempts;
    }

    public int attempts() { return attempts; }
}
