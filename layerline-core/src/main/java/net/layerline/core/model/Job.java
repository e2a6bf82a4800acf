package net.layerline.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Job(
        String id,
        JobType type,
        ResourceKey resourceKey,
        JobStatus status,
        Map<String, Object> inputParams,   // 생성 후 불변
        String outputUrl,                  // COMPLETED 일 때만
        Map<String, Object> outputMetadata,
        String errorMessage,               // FAILED 일 때만
        int retryCount,
        int maxRetries,
        Integer progressPercent,
        String progressText,
        long version,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant updatedAt
) {
    public Job {
        inputParams = inputParams == null ? Map.of() : withoutNulls(inputParams);
        outputMetadata = outputMetadata == null ? null : withoutNulls(outputMetadata);
    }

    public static Job ofNew(String id, JobType type, ResourceKey key, Map<String, Object> inputParams,
                            int maxRetries, Instant now) {
        return new Job(id, type, key, JobStatus.PENDING, inputParams, null, null, null,
                0, maxRetries, null, null, 1L, now, null, null, now);
    }

    public boolean isTerminal() { return status.isTerminal(); }

    public boolean hasRetryBudget() { return retryCount < maxRetries; }

    // JSON 의 null 값은 키가 없는 것과 같게 취급
    private static Map<String, Object> withoutNulls(Map<String, Object> m) {
        var copy = new LinkedHashMap<String, Object>();
        m.forEach((k, v) -> { if (k != null && v != null) copy.put(k, v); });
        return Collections.unmodifiableMap(copy);
    }
}
