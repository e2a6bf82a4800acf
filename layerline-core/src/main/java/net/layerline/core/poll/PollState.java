package net.layerline.core.poll;

import java.time.Instant;

/** 한 번의 폴링 세션 동안만 존재하는 상태. 저장되지 않는다 */
public record PollState(
        String providerJobId,
        int percent,
        String statusText,
        int attempts,
        Instant startedAt
) {
    static PollState start(String providerJobId, Instant now) {
        return new PollState(providerJobId, 0, "", 0, now);
    }

    PollState tick() {
        return new PollState(providerJobId, percent, statusText, attempts + 1, startedAt);
    }

    PollState with(ProgressSnapshot s) {
        return new PollState(providerJobId, s.percent(), s.statusText(), attempts, startedAt);
    }

    ProgressSnapshot snapshot() {
        return new ProgressSnapshot(percent, statusText);
    }
}
