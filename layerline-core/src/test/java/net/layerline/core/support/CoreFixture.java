package net.layerline.core.support;

import net.layerline.core.cache.CacheIndex;
import net.layerline.core.cache.CacheKeyPolicy;
import net.layerline.core.notify.ChangeNotifier;
import net.layerline.core.poll.ProgressPoller;
import net.layerline.core.service.JobExecutor;
import net.layerline.core.service.JobStore;
import net.layerline.core.service.JobSubmitter;
import net.layerline.core.service.ProcessorRegistry;
import net.layerline.core.service.RetryPolicy;
import net.layerline.core.spi.RemoteProcessor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/** 메모리 저장소 위에 코어 서비스를 전부 조립한다 */
public final class CoreFixture implements AutoCloseable {
    public final InMemoryJobRepository jobs = new InMemoryJobRepository();
    public final InMemoryCacheIndexRepository cacheRows = new InMemoryCacheIndexRepository();
    public final DirectTxRunner tx = new DirectTxRunner();
    public final RecordingStorage storage = new RecordingStorage();
    public final RecordingPushNotifier push = new RecordingPushNotifier();
    public final ExecutorService workers = Executors.newFixedThreadPool(4);
    public final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);

    public final ChangeNotifier notifier = new ChangeNotifier(jobs, Runnable::run);
    public final JobStore store = new JobStore(jobs, tx, Instant::now, notifier);
    public final CacheIndex cache;
    public final ProgressPoller poller = new ProgressPoller(scheduler, Instant::now);
    public final ProcessorRegistry processors;
    public final JobExecutor executor;
    public final JobSubmitter submitter;

    public CoreFixture(RemoteProcessor... processors) {
        this(RetryPolicy.fixed(Duration.ZERO), processors);
    }

    public CoreFixture(RetryPolicy retry, RemoteProcessor... processors) {
        this(CacheKeyPolicy.resourceKeyOnly(), retry, processors);
    }

    private CoreFixture(CacheKeyPolicy keys, RetryPolicy retry, RemoteProcessor... processors) {
        this.cache = new CacheIndex(cacheRows, tx, Instant::now, keys);
        this.processors = new ProcessorRegistry(List.of(processors));
        this.executor = new JobExecutor(store, this.processors, storage, poller, cache, retry, notifier, push, workers);
        this.submitter = new JobSubmitter(cache, store, executor, this.processors, JobSubmitter.DEFAULT_MAX_RETRIES);
    }

    /** 입력 파라미터 일부를 캐시 키에 섞는 구성 */
    public static CoreFixture withCacheKeys(CacheKeyPolicy keys, RemoteProcessor... processors) {
        return new CoreFixture(keys, RetryPolicy.fixed(Duration.ZERO), processors);
    }

    @Override
    public void close() throws InterruptedException {
        workers.shutdownNow();
        scheduler.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
    }
}
