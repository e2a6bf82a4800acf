package net.layerline.core.service;

import net.layerline.core.cache.CacheIndex;
import net.layerline.core.model.ArtifactRef;
import net.layerline.core.model.Job;
import net.layerline.core.model.JobType;
import net.layerline.core.model.ResourceKey;
import net.layerline.core.model.Submission;
import net.layerline.core.spi.JobRepository.CreateOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 사용자 요청의 진입점.
 * 캐시 적중이면 Job 을 만들지 않고, 같은 리소스의 활성 Job 이 있으면 거기에 합류시킨다.
 */
public final class JobSubmitter {
    private static final Logger log = LoggerFactory.getLogger(JobSubmitter.class);

    public static final int DEFAULT_MAX_RETRIES = 3;

    private final CacheIndex cache;
    private final JobStore store;
    private final JobExecutor executor;
    private final ProcessorRegistry processors;
    private final int defaultMaxRetries;

    public JobSubmitter(CacheIndex cache, JobStore store, JobExecutor executor,
                        ProcessorRegistry processors, int defaultMaxRetries) {
        this.cache = cache;
        this.store = store;
        this.executor = executor;
        this.processors = processors;
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public Submission submit(JobType type, ResourceKey key, Map<String, Object> params) throws Exception {
        return submit(type, key, params, defaultMaxRetries);
    }

    public Submission submit(JobType type, ResourceKey key, Map<String, Object> params, int maxRetries) throws Exception {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(key, "resourceKey");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        if (!processors.supports(type)) {
            throw new IllegalArgumentException("no processor registered for job type " + type.code());
        }
        // 저장된 Job 의 inputParams 와 같은 모양이어야 완료 시 기록되는 캐시 키와 일치한다
        Map<String, Object> input = withoutNulls(params);

        // 1) 이미 만든 산출물
        String cacheKey = cache.keyFor(key, input);
        Optional<ArtifactRef> hit = cache.lookup(cacheKey);
        if (hit.isPresent()) {
            log.debug("cache hit: key={}", cacheKey);
            return new Submission.Cached(hit.get());
        }

        // 2) 진행 중인 Job 에 합류
        Optional<Job> active = store.findActive(key);
        if (active.isPresent()) {
            return new Submission.Accepted(active.get().id(), true);
        }

        // 3) 조건부 생성. 동시에 들어온 요청 중 하나만 created=true
        CreateOutcome out = store.createIfAbsent(type, key, input, maxRetries);
        if (!out.created()) {
            return new Submission.Accepted(out.job().id(), true);
        }
        executor.execute(out.job());
        return new Submission.Accepted(out.job().id(), false);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> params) {
        if (params == null || params.isEmpty()) return Map.of();
        var copy = new LinkedHashMap<String, Object>();
        params.forEach((k, v) -> { if (k != null && v != null) copy.put(k, v); });
        return Collections.unmodifiableMap(copy);
    }
}
