package net.layerline.core.service;

import net.layerline.core.model.Job;
import net.layerline.core.model.JobStatus;
import net.layerline.core.model.JobType;
import net.layerline.core.model.ResourceKey;
import net.layerline.core.notify.JobChangeListener;
import net.layerline.core.spi.Clock;
import net.layerline.core.spi.JobRepository;
import net.layerline.core.spi.JobRepository.CreateOutcome;
import net.layerline.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Job 상태 기계. 모든 쓰기는 여기를 거친다.
 * <ul>
 *   <li>허용되지 않은 전이는 {@link IllegalStateException}</li>
 *   <li>종결 Job 에 대한 쓰기는 no-op (Optional.empty)</li>
 *   <li>version 경합에서 지면 최신 상태로 다시 판단</li>
 *   <li>커밋 후 {@link JobChangeListener} 로 변경 전달</li>
 * </ul>
 */
public final class JobStore {
    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    /** 처리 중에 보고할 수 있는 최대 진행률. 100 은 완료 전이만 */
    public static final int PROCESSING_PROGRESS_CAP = 95;
    static final int MAX_WRITE_ATTEMPTS = 5;

    private final JobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final JobChangeListener listener;

    public JobStore(JobRepository jobs, TxRunner tx, Clock clock, JobChangeListener listener) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.listener = listener == null ? JobChangeListener.NONE : listener;
    }

    /** 같은 resourceKey 의 활성 Job 이 없을 때만 PENDING 으로 생성 */
    public CreateOutcome createIfAbsent(JobType type, ResourceKey key,
                                        Map<String, Object> inputParams, int maxRetries) throws Exception {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        Job candidate = Job.ofNew(UUID.randomUUID().toString(), type, key, inputParams, maxRetries, clock.now());
        CreateOutcome out = tx.required(() -> jobs.createIfNoActive(candidate));
        if (out.created()) {
            log.info("job created: id={} type={} key={}", out.job().id(), type.code(), key.value());
            publish(out.job());
        } else {
            log.debug("active job exists: id={} key={}", out.job().id(), key.value());
        }
        return out;
    }

    public Optional<Job> find(String id) throws Exception {
        return tx.required(() -> jobs.findById(id));
    }

    public Optional<Job> findActive(ResourceKey key) throws Exception {
        return tx.required(() -> jobs.findActiveByResourceKey(key));
    }

    /** PENDING -> PROCESSING. 이미 처리 중이거나 종결이면 empty */
    public Optional<Job> markProcessing(String id) throws Exception {
        return write(id, cur -> {
            if (cur.status() != JobStatus.PENDING) return null;
            return next(cur, JobStatus.PROCESSING)
                    .startedAt(cur.startedAt() == null ? clock.now() : cur.startedAt())
                    .build();
        });
    }

    /**
     * PROCESSING -> PROCESSING, retryCount + 1.
     * 예산이 없으면 대신 FAILED 로 전이한다 (반환된 Job 의 상태로 구분).
     */
    public Optional<Job> recordRetry(String id, String failureMessage) throws Exception {
        return write(id, cur -> {
            if (!cur.hasRetryBudget()) {
                return failed(cur, failureMessage);
            }
            return next(cur, JobStatus.PROCESSING).retryCount(cur.retryCount() + 1).build();
        });
    }

    /** 진행률 보고. 역행하지 않고 PROCESSING 중에는 {@value #PROCESSING_PROGRESS_CAP} 를 넘지 않는다 */
    public Optional<Job> updateProgress(String id, int percent, String statusText) throws Exception {
        return write(id, cur -> {
            if (cur.status() != JobStatus.PROCESSING) return null;
            int prev = cur.progressPercent() == null ? 0 : cur.progressPercent();
            int pct = Math.max(prev, Math.min(Math.max(percent, 0), PROCESSING_PROGRESS_CAP));
            String text = statusText == null ? cur.progressText() : statusText;
            if (cur.progressPercent() != null && pct == prev && Objects.equals(text, cur.progressText())) {
                return null;
            }
            return next(cur, JobStatus.PROCESSING).progress(pct, text).build();
        });
    }

    public Optional<Job> markCompleted(String id, String outputUrl, Map<String, Object> outputMetadata) throws Exception {
        if (outputUrl == null || outputUrl.isBlank()) throw new IllegalArgumentException("outputUrl is required");
        return write(id, cur -> next(cur, JobStatus.COMPLETED)
                .output(outputUrl, outputMetadata)
                .progress(100, cur.progressText())
                .completedAt(clock.now())
                .build());
    }

    public Optional<Job> markFailed(String id, String errorMessage) throws Exception {
        return write(id, cur -> failed(cur, errorMessage));
    }

    private Job failed(Job cur, String errorMessage) {
        String msg = errorMessage == null || errorMessage.isBlank() ? "Processing failed" : errorMessage;
        return next(cur, JobStatus.FAILED).error(msg).completedAt(clock.now()).build();
    }

    /**
     * change 가 null 을 돌려주면 쓸 것이 없다는 뜻 (empty).
     * 종결 Job 이면 empty. update 가 false 면 (경합) 다시 읽어 판단한다.
     */
    private Optional<Job> write(String id, UnaryOperator<Job> change) throws Exception {
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            WriteResult r = tx.required(() -> {
                Job cur = jobs.findById(id)
                        .orElseThrow(() -> new IllegalArgumentException("job not found: " + id));
                if (cur.isTerminal()) return WriteResult.SKIPPED;
                Job next = change.apply(cur);
                if (next == null) return WriteResult.SKIPPED;
                if (!cur.status().canMoveTo(next.status())) {
                    throw new IllegalStateException(
                            "illegal transition " + cur.status() + " -> " + next.status() + " for job " + id);
                }
                return jobs.update(next, cur.version()) ? new WriteResult(next) : WriteResult.CONFLICT;
            });
            if (r == WriteResult.CONFLICT) {
                log.debug("version conflict on job={} (attempt {})", id, attempt);
                continue;
            }
            if (r.job() != null) {
                log.debug("job {} -> {} (v{})", id, r.job().status().code(), r.job().version());
                publish(r.job());
            }
            return Optional.ofNullable(r.job());
        }
        throw new IllegalStateException("job " + id + " kept changing concurrently");
    }

    private record WriteResult(Job job) {
        static final WriteResult SKIPPED = new WriteResult(null);
        static final WriteResult CONFLICT = new WriteResult(null);
    }

    private void publish(Job job) {
        try {
            listener.onChange(job);
        } catch (RuntimeException e) {
            log.warn("change listener failed for job={}", job.id(), e);
        }
    }

    private Builder next(Job cur, JobStatus status) {
        return new Builder(cur, status, clock);
    }

    /** 다음 버전의 Job. version+1, updatedAt=now, 상태에 맞지 않는 필드는 비운다 */
    private static final class Builder {
        private final Job cur;
        private final JobStatus status;
        private final Clock clock;
        private String outputUrl;
        private Map<String, Object> outputMetadata;
        private String errorMessage;
        private int retryCount;
        private Integer progressPercent;
        private String progressText;
        private Instant startedAt;
        private Instant completedAt;

        Builder(Job cur, JobStatus status, Clock clock) {
            this.cur = cur;
            this.status = status;
            this.clock = clock;
            this.retryCount = cur.retryCount();
            this.progressPercent = cur.progressPercent();
            this.progressText = cur.progressText();
            this.startedAt = cur.startedAt();
        }

        Builder output(String url, Map<String, Object> metadata) {
            this.outputUrl = url;
            this.outputMetadata = metadata;
            return this;
        }

        Builder error(String message) { this.errorMessage = message; return this; }

        Builder retryCount(int n) { this.retryCount = n; return this; }

        Builder progress(Integer percent, String text) {
            this.progressPercent = percent;
            this.progressText = text;
            return this;
        }

        Builder startedAt(Instant t) { this.startedAt = t; return this; }

        Builder completedAt(Instant t) { this.completedAt = t; return this; }

        Job build() {
            return new Job(cur.id(), cur.type(), cur.resourceKey(), status, cur.inputParams(),
                    outputUrl, outputMetadata, errorMessage, retryCount, cur.maxRetries(),
                    progressPercent, progressText, cur.version() + 1,
                    cur.createdAt(), startedAt, completedAt, updatedAt());
        }

        private Instant updatedAt() {
            Instant now = clock.now();
            return cur.updatedAt() != null && now.isBefore(cur.updatedAt()) ? cur.updatedAt() : now;
        }
    }
}
