package net.layerline.core.notify;

import net.layerline.core.model.Job;
import net.layerline.core.spi.Clock;
import net.layerline.core.spi.JobRepository;
import net.layerline.core.spi.TxRunner;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 다른 프로세스가 쓴 Job 변경을 이 프로세스의 {@link ChangeNotifier} 로 중계한다.
 * (updatedAt, id) keyset 으로 페이지를 넘기고, 다 읽으면 overlap 만큼 되돌아가 다시 훑는다
 * (at-least-once, 중복은 Notifier 가 흡수).
 */
public final class StoreChangeRelay {
    private final JobRepository jobs;
    private final TxRunner tx;
    private final JobChangeListener sink;
    private final int batchSize;
    private final Duration overlap;

    // 지금까지 본 가장 늦은 updatedAt
    private volatile Instant cursor;
    private Instant pageTime;
    private String pageId = "";

    /**
     * @param overlap 커서를 이만큼 겹쳐 읽는다 (같은 시각에 커밋된 행 누락 방지)
     */
    public StoreChangeRelay(JobRepository jobs, TxRunner tx, JobChangeListener sink,
                            Clock clock, int batchSize, Duration overlap) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0: " + batchSize);
        this.jobs = jobs;
        this.tx = tx;
        this.sink = sink;
        this.batchSize = batchSize;
        this.overlap = overlap;
        this.cursor = clock.now();
        this.pageTime = cursor.minus(overlap);
    }

    /** @return 전달한 행 수 */
    public synchronized int pollOnce() throws Exception {
        Instant since = pageTime;
        String afterId = pageId;
        List<Job> changed = tx.required(() -> jobs.findUpdatedAfter(since, afterId, batchSize));
        Instant max = cursor;
        for (Job j : changed) {
            sink.onChange(j);
            if (j.updatedAt().isAfter(max)) max = j.updatedAt();
        }
        cursor = max;

        if (changed.size() >= batchSize) {
            // 아직 남았다. 마지막 행 뒤에서 이어 읽는다
            Job last = changed.get(changed.size() - 1);
            pageTime = last.updatedAt();
            pageId = last.id();
        } else {
            pageTime = max.minus(overlap);
            pageId = "";
        }
        return changed.size();
    }

    public Instant cursor() { return cursor; }
}
