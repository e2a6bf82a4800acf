package net.layerline.core.poll;

import net.layerline.core.error.ErrorClassifier;
import net.layerline.core.error.PermanentProcessingException;
import net.layerline.core.error.PollTimeoutException;
import net.layerline.core.error.ProcessingException;
import net.layerline.core.spi.Clock;
import net.layerline.core.spi.PolledProcessor;
import net.layerline.core.spi.ProcessorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * submit/poll 계약만 있는 provider 를 주기적으로 조회한다.
 * tick 사이에는 스레드를 점유하지 않고 scheduler 에 다음 tick 을 예약한다.
 */
public final class ProgressPoller {
    private static final Logger log = LoggerFactory.getLogger(ProgressPoller.class);

    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public ProgressPoller(ScheduledExecutorService scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public PollSession poll(String providerJobId, PolledProcessor processor,
                            ProgressListener onProgress, PollOptions options) {
        return poll(providerJobId, processor::getStatus, processor.progressAdapter(), onProgress, options);
    }

    public PollSession poll(String providerJobId, StatusSource source, ProgressAdapter adapter,
                            ProgressListener onProgress, PollOptions options) {
        var session = new Session(providerJobId, source, adapter,
                onProgress == null ? ProgressListener.NONE : onProgress, options, clock.now());
        session.schedule(Duration.ZERO);
        return session;
    }

    private final class Session implements PollSession {
        private final String providerJobId;
        private final StatusSource source;
        private final ProgressAdapter adapter;
        private final ProgressListener listener;
        private final PollOptions options;
        private final CompletableFuture<ProcessorResult> result = new CompletableFuture<>();

        private volatile PollState state;
        private volatile ScheduledFuture<?> next;
        private volatile boolean cancelled;
        private int consecutiveErrors;

        Session(String providerJobId, StatusSource source, ProgressAdapter adapter,
                ProgressListener listener, PollOptions options, Instant startedAt) {
            this.providerJobId = providerJobId;
            this.source = source;
            this.adapter = adapter;
            this.listener = listener;
            this.options = options;
            this.state = PollState.start(providerJobId, startedAt);
        }

        @Override public CompletableFuture<ProcessorResult> result() { return result; }

        @Override public PollState state() { return state; }

        @Override public boolean isCancelled() { return cancelled; }

        @Override
        public void cancel() {
            cancelled = true;
            var f = next;
            if (f != null) f.cancel(false);
            result.completeExceptionally(new CancellationException("poll cancelled: " + providerJobId));
        }

        void schedule(Duration delay) {
            if (cancelled || result.isDone()) return;
            try {
                next = scheduler.schedule(this::tick, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                // scheduler 종료 중. 기다리는 워커가 영원히 막히지 않도록 결과를 닫는다
                log.warn("poll tick rejected: providerJob={}", providerJobId);
                result.completeExceptionally(e);
            }
        }

        private void tick() {
            if (cancelled || result.isDone()) return;

            Duration elapsed = Duration.between(state.startedAt(), clock.now());
            if (state.attempts() >= options.maxAttempts() || elapsed.compareTo(options.maxDuration()) >= 0) {
                log.warn("poll timeout: providerJob={} attempts={} elapsedMs={}",
                        providerJobId, state.attempts(), elapsed.toMillis());
                result.completeExceptionally(new PollTimeoutException(providerJobId, state.attempts(), elapsed));
                return;
            }
            state = state.tick();

            ProviderStatus status;
            try {
                status = source.fetch(providerJobId);
            } catch (Exception e) {
                onFetchError(e);
                return;
            }
            if (status == null) {
                onFetchError(new IOException("empty status response"));
                return;
            }
            consecutiveErrors = 0;

            switch (adapter.phase(status)) {
                case SUCCEEDED -> {
                    if (status.result() == null) {
                        result.completeExceptionally(new PermanentProcessingException(
                                "The processing server returned no result",
                                "provider job " + providerJobId + " succeeded without result"));
                    } else {
                        result.complete(status.result());
                    }
                }
                case FAILED -> result.completeExceptionally(new PermanentProcessingException(
                        "The processing server could not process this input",
                        "provider job " + providerJobId + " failed: " + status.error()));
                default -> {
                    report(adapter.normalize(status, state.snapshot()));
                    schedule(options.nextDelay(status.retryAfter()));
                }
            }
        }

        private void report(ProgressSnapshot s) {
            ProgressSnapshot prev = state.snapshot();
            // 단조 증가 보장 (어댑터 구현과 무관하게)
            ProgressSnapshot next = new ProgressSnapshot(Math.max(prev.percent(), s.percent()), s.statusText());
            if (next.equals(prev)) return;
            state = state.with(next);
            if (cancelled) return;
            try {
                listener.onProgress(next.percent(), next.statusText());
            } catch (RuntimeException e) {
                log.warn("progress listener failed for providerJob={}", providerJobId, e);
            }
        }

        private void onFetchError(Exception e) {
            ProcessingException pe = ErrorClassifier.classify(e);
            if (!pe.retryable() || ++consecutiveErrors > options.maxConsecutiveErrors()) {
                log.warn("poll aborted: providerJob={} errors={} cause={}", providerJobId, consecutiveErrors, e.toString());
                result.completeExceptionally(pe);
                return;
            }
            log.debug("poll error (attempt {}): providerJob={} cause={}", state.attempts(), providerJobId, e.toString());
            schedule(options.interval());
        }
    }
}
