package net.layerline.core.service;

import net.layerline.core.cache.CacheIndex;
import net.layerline.core.error.ErrorClassifier;
import net.layerline.core.error.PermanentProcessingException;
import net.layerline.core.error.ProcessingException;
import net.layerline.core.error.TransientProcessingException;
import net.layerline.core.model.ArtifactRef;
import net.layerline.core.model.Job;
import net.layerline.core.model.JobStatus;
import net.layerline.core.model.PushMessage;
import net.layerline.core.notify.ObserverPresence;
import net.layerline.core.poll.PollSession;
import net.layerline.core.poll.ProgressPoller;
import net.layerline.core.spi.ArtifactStorage;
import net.layerline.core.spi.PolledProcessor;
import net.layerline.core.spi.ProcessorRequest;
import net.layerline.core.spi.ProcessorResult;
import net.layerline.core.spi.PushNotifier;
import net.layerline.core.spi.RemoteProcessor;
import net.layerline.core.spi.SyncProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Job 하나를 종결 상태까지 끌고 간다. 호출자(화면)의 수명과 무관하게 worker 풀에서 돈다.
 *
 * <ol>
 *   <li>PENDING -> PROCESSING</li>
 *   <li>소스 아티팩트 stage</li>
 *   <li>원격 처리 (동기 또는 submit + 폴링)</li>
 *   <li>산출물 persist, 완료 전이, 캐시 기록</li>
 *   <li>실패 시 분류 후 재시도(backoff) 또는 실패 전이</li>
 * </ol>
 */
public final class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    static final String NO_PROCESSOR_MESSAGE = "No processor is available for this job type";
    static final String SOURCE_FETCH_MESSAGE = "The source model could not be fetched";
    static final String ARTIFACT_STORE_MESSAGE = "The result could not be saved";

    private final JobStore store;
    private final ProcessorRegistry processors;
    private final ArtifactStorage storage;
    private final ProgressPoller poller;
    private final CacheIndex cache;
    private final RetryPolicy retry;
    private final ObserverPresence presence;
    private final PushNotifier push;
    private final ExecutorService workers;

    public JobExecutor(JobStore store,
                       ProcessorRegistry processors,
                       ArtifactStorage storage,
                       ProgressPoller poller,
                       CacheIndex cache,
                       RetryPolicy retry,
                       ObserverPresence presence,
                       PushNotifier push,
                       ExecutorService workers) {
        this.store = store;
        this.processors = processors;
        this.storage = storage;
        this.poller = poller;
        this.cache = cache;
        this.retry = retry;
        this.presence = presence == null ? ObserverPresence.NOBODY : presence;
        this.push = push;
        this.workers = workers;
    }

    /** 비동기 실행. 반환 즉시 호출자는 떠나도 된다 */
    public void execute(Job job) {
        dispatch(job.id(), false);
    }

    /** 중단된 PROCESSING Job 재개 (maintenance) */
    public void resume(Job job) {
        dispatch(job.id(), true);
    }

    private void dispatch(String jobId, boolean resumed) {
        try {
            workers.execute(() -> run(jobId, resumed));
        } catch (RejectedExecutionException e) {
            // Job 은 PENDING/PROCESSING 으로 남고 maintenance 가 다시 집어간다
            log.warn("worker pool rejected job={}", jobId, e);
        }
    }

    /** 현재 스레드에서 끝까지 실행 */
    void run(String jobId, boolean resumed) {
        try {
            Optional<Job> started = resumed
                    ? store.find(jobId).filter(j -> j.status() == JobStatus.PROCESSING)
                    : store.markProcessing(jobId);
            if (started.isEmpty()) {
                log.debug("job {} not runnable (taken or finished)", jobId);
                return;
            }
            loop(started.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("job {} interrupted; left for maintenance", jobId);
        } catch (RejectedExecutionException e) {
            // 폴링 scheduler 종료. 재시도 횟수를 쓰지 않고 maintenance 재개를 기다린다
            log.warn("job {} poll rejected; left for maintenance", jobId);
        } catch (Exception e) {
            log.error("job {} executor failure", jobId, e);
        }
    }

    private void loop(Job job) throws Exception {
        while (true) {
            ArtifactRef artifact;
            try {
                artifact = persistOutputs(job, attempt(job));
            } catch (InterruptedException | RejectedExecutionException e) {
                throw e;
            } catch (Exception e) {
                ProcessingException pe = ErrorClassifier.classify(e);
                Optional<Job> next = onFailure(job, pe);
                if (next.isEmpty()) return;
                job = next.get();
                Duration backoff = retry.nextBackoff(job.retryCount());
                if (!backoff.isZero() && !backoff.isNegative()) Thread.sleep(backoff.toMillis());
                continue;
            }
            complete(job, artifact);
            return;
        }
    }

    /** @return 재시도할 Job (없으면 종결) */
    private Optional<Job> onFailure(Job job, ProcessingException pe) throws Exception {
        if (pe.retryable() && job.hasRetryBudget()) {
            log.warn("job {} attempt {} failed, retrying: {}", job.id(), job.retryCount() + 1, pe.getMessage(), pe);
            Optional<Job> retried = store.recordRetry(job.id(), pe.userMessage());
            if (retried.isPresent() && retried.get().status() == JobStatus.PROCESSING) return retried;
            retried.ifPresent(this::notifyTerminal);
            return Optional.empty();
        }
        if (pe.retryable()) {
            log.warn("job {} failed after {} retries: {}", job.id(), job.retryCount(), pe.getMessage(), pe);
        } else {
            log.warn("job {} failed permanently: {}", job.id(), pe.getMessage(), pe);
        }
        store.markFailed(job.id(), pe.userMessage()).ifPresent(this::notifyTerminal);
        return Optional.empty();
    }

    private ProcessorResult attempt(Job job) throws Exception {
        RemoteProcessor processor = processors.find(job.type())
                .orElseThrow(() -> new PermanentProcessingException(NO_PROCESSOR_MESSAGE,
                        "no processor registered for " + job.type().code()));

        var request = new ProcessorRequest(job.id(), job.resourceKey(), stage(job), job.inputParams());

        if (processor instanceof SyncProcessor sync) {
            return sync.process(request);
        }
        if (processor instanceof PolledProcessor polled) {
            String providerJobId = polled.submit(request);
            log.info("job {} submitted to {}: providerJob={}", job.id(), job.type().code(), providerJobId);
            PollSession session = poller.poll(providerJobId, polled,
                    (pct, text) -> reportProgress(job.id(), pct, text), polled.pollOptions());
            try {
                return session.result().get();
            } catch (InterruptedException e) {
                session.cancel();
                throw e;
            } catch (ExecutionException e) {
                throw unwrap(e);
            }
        }
        throw new PermanentProcessingException(NO_PROCESSOR_MESSAGE, "unsupported processor " + processor.getClass());
    }

    private String stage(Job job) throws ProcessingException {
        Object source = job.inputParams().get(JobParams.SOURCE_URL);
        if (source == null) return null;
        try {
            return storage.stage(source.toString());
        } catch (Exception e) {
            throw new TransientProcessingException(SOURCE_FETCH_MESSAGE, "stage failed: " + source, e);
        }
    }

    /** primary 산출물 실패는 재시도 대상, 부가 산출물 실패는 메타데이터에서 빠질 뿐 */
    private ArtifactRef persistOutputs(Job job, ProcessorResult result) throws ProcessingException {
        String primary;
        try {
            primary = storage.persist(result.primaryUrl(), objectKey(job, "output", result.primaryUrl()));
        } catch (Exception e) {
            throw new TransientProcessingException(ARTIFACT_STORE_MESSAGE, "persist failed: " + result.primaryUrl(), e);
        }

        Map<String, Object> metadata = new HashMap<>();
        result.metadata().forEach((k, v) -> { if (v != null) metadata.put(k, v); });
        result.secondaryUrls().forEach((role, url) -> {
            try {
                metadata.put(role, storage.persist(url, objectKey(job, role, url)));
            } catch (Exception e) {
                log.warn("job {} secondary artifact '{}' skipped: {}", job.id(), role, e.toString());
            }
        });
        return new ArtifactRef(primary, metadata);
    }

    private void complete(Job job, ArtifactRef artifact) throws Exception {
        Optional<Job> done = store.markCompleted(job.id(), artifact.url(), artifact.metadata());
        if (done.isEmpty()) {
            log.info("job {} finished elsewhere; result discarded", job.id());
            return;
        }
        log.info("job {} completed: {}", job.id(), artifact.url());
        try {
            cache.record(cache.keyFor(job.resourceKey(), job.inputParams()), job.resourceKey(), artifact);
        } catch (Exception e) {
            log.warn("job {} cache record failed", job.id(), e);
        }
        notifyTerminal(done.get());
    }

    private void reportProgress(String jobId, int percent, String text) {
        try {
            store.updateProgress(jobId, percent, text);
        } catch (Exception e) {
            log.warn("progress update failed for job={}", jobId, e);
        }
    }

    /** 보고 있는 사람이 없을 때만 push. 실패는 Job 결과에 영향 없음 */
    private void notifyTerminal(Job job) {
        if (push == null || presence.hasObservers(job)) return;
        try {
            push.send(new PushMessage(job.id(), job.status(), summary(job)));
        } catch (Exception e) {
            log.warn("push notification failed for job={}", job.id(), e);
        }
    }

    static String summary(Job job) {
        Object name = job.inputParams().get(JobParams.DISPLAY_NAME);
        String subject = name == null ? job.type().label() : name + " (" + job.type().label() + ")";
        return job.status() == JobStatus.COMPLETED
                ? subject + " is ready"
                : subject + " failed: " + job.errorMessage();
    }

    static String objectKey(Job job, String role, String url) {
        String path = url;
        int q = path.indexOf('?');
        if (q >= 0) path = path.substring(0, q);
        int slash = path.lastIndexOf('/');
        String file = slash >= 0 ? path.substring(slash + 1) : path;
        int dot = file.lastIndexOf('.');
        String ext = dot > 0 && file.length() - dot <= 6 ? file.substring(dot) : "";
        return "jobs/" + job.id() + "/" + role + ext;
    }

    private static Exception unwrap(ExecutionException e) {
        Throwable c = e.getCause();
        if (c instanceof CancellationException ce) return ce;
        return c instanceof Exception ex ? ex : e;
    }
}
