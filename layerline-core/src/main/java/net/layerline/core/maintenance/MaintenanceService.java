package net.layerline.core.maintenance;

import net.layerline.core.model.Job;
import net.layerline.core.model.JobStatus;
import net.layerline.core.service.JobExecutor;
import net.layerline.core.service.JobStore;
import net.layerline.core.spi.Clock;
import net.layerline.core.spi.JobRepository;
import net.layerline.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    public static final String INTERRUPTED_MESSAGE = "Processing was interrupted";

    private final JobRepository jobs;
    private final JobStore store;
    private final JobExecutor executor;
    private final TxRunner tx;
    private final Clock clock;
    private final int batchSize;

    public MaintenanceService(JobRepository jobs, JobStore store, JobExecutor executor,
                              TxRunner tx, Clock clock, int batchSize) {
        this.jobs = jobs;
        this.store = store;
        this.executor = executor;
        this.tx = tx;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    /**
     * 주기 점검.
     * - 오래 PENDING 인 Job 재디스패치 (프로세스 재시작 등으로 실행기가 못 받은 것)
     * - 오래 갱신 없는 PROCESSING 은 재시도 예산을 써서 재개, 없으면 실패 처리
     *
     * @param pendingGrace  생성 후 이 시간이 지나도 PENDING 이면 재디스패치
     * @param stalledAfter  이 시간 동안 갱신이 없으면 중단된 것으로 본다 (폴링 상한보다 길어야 함)
     */
    public MaintenanceReport runOnce(Duration pendingGrace, Duration stalledAfter) throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        // 1) 방치된 PENDING
        List<Job> pending = tx.required(() ->
                jobs.findByStatusOlderThan(JobStatus.PENDING, now.minus(pendingGrace), batchSize));
        for (Job j : pending) {
            executor.execute(j);
            r.redispatched++;
        }

        // 2) 멈춘 PROCESSING
        List<Job> stalled = tx.required(() ->
                jobs.findByStatusOlderThan(JobStatus.PROCESSING, now.minus(stalledAfter), batchSize));
        for (Job j : stalled) {
            var next = store.recordRetry(j.id(), INTERRUPTED_MESSAGE);
            if (next.isEmpty()) continue;
            if (next.get().status() == JobStatus.PROCESSING) {
                executor.resume(next.get());
                r.retried++;
            } else {
                r.failed++;
            }
        }

        r.timestamp = now;
        if (r.redispatched + r.retried + r.failed > 0) log.info("maintenance: {}", r);
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int redispatched;
        public int retried;
        public int failed;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", redispatched=" + redispatched +
                    ", retried=" + retried +
                    ", failed=" + failed +
                    '}';
        }
    }
}
