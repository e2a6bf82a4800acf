package net.layerline.bootstrap.autoconfigure;

import org.springframework.beans.factory.DisposableBean;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 실행기/폴러/알림 전달 스레드 풀. ExecutorService 빈으로 직접 노출하면
 * Spring 의 @Scheduled 스케줄러와 섞이므로 한 객체로 감싼다.
 */
public final class LayerlineThreads implements DisposableBean {
    private final ExecutorService workers;
    private final ScheduledExecutorService pollScheduler;
    private final ExecutorService delivery;

    public LayerlineThreads(int workerThreads, int pollerThreads) {
        this.workers = Executors.newFixedThreadPool(workerThreads, named("layerline-worker"));
        this.pollScheduler = Executors.newScheduledThreadPool(pollerThreads, named("layerline-poll"));
        this.delivery = Executors.newSingleThreadExecutor(named("layerline-notify"));
    }

    public ExecutorService workers() { return workers; }

    public ScheduledExecutorService pollScheduler() { return pollScheduler; }

    public ExecutorService delivery() { return delivery; }

    @Override
    public void destroy() throws InterruptedException {
        // 진행 중 Job 은 PROCESSING 으로 남고 다음 기동 시 maintenance 가 재개한다
        workers.shutdownNow();
        pollScheduler.shutdownNow();
        delivery.shutdown();
        workers.awaitTermination(10, TimeUnit.SECONDS);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
