package net.layerline.core.maintenance;

import net.layerline.core.model.Job;
import net.layerline.core.model.JobStatus;
import net.layerline.core.model.JobType;
import net.layerline.core.model.ResourceKey;
import net.layerline.core.support.CoreFixture;
import net.layerline.core.support.ScriptedSyncProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class MaintenanceServiceTest {

    CoreFixture fx;
    MaintenanceService maintenance;
    Instant longAgo = Instant.now().minus(Duration.ofHours(2));

    @BeforeEach
    void setUp() {
        fx = new CoreFixture(new ScriptedSyncProcessor(JobType.SLICING));
        maintenance = new MaintenanceService(fx.jobs, fx.store, fx.executor, fx.tx, Instant::now, 50);
    }

    @AfterEach
    void tearDown() throws Exception {
        fx.close();
    }

    Job stalledProcessing(String id, int retryCount, int maxRetries) {
        Job p = Job.ofNew(id, JobType.SLICING, ResourceKey.of(id, "p"), Map.of(), maxRetries, longAgo);
        return new Job(p.id(), p.type(), p.resourceKey(), JobStatus.PROCESSING, p.inputParams(), null, null, null,
                retryCount, maxRetries, 40, "slicing", 3, longAgo, longAgo, null, longAgo);
    }

    @Test
    void sweep_redispatchesRetriesAndFails() throws Exception {
        fx.jobs.put(Job.ofNew("orphan", JobType.SLICING, ResourceKey.of("orphan", "p"), Map.of(), 3, longAgo));
        fx.jobs.put(stalledProcessing("stalled", 1, 3));
        fx.jobs.put(stalledProcessing("exhausted", 3, 3));
        fx.jobs.put(Job.ofNew("fresh", JobType.SLICING, ResourceKey.of("fresh", "p"), Map.of(), 3, Instant.now()));

        var report = maintenance.runOnce(Duration.ofMinutes(5), Duration.ofMinutes(45));

        assertEquals(1, report.redispatched);
        assertEquals(1, report.retried);
        assertEquals(1, report.failed);

        await().atMost(Duration.ofSeconds(5)).until(() ->
                fx.store.find("orphan").orElseThrow().isTerminal()
                        && fx.store.find("stalled").orElseThrow().isTerminal());
        assertEquals(JobStatus.COMPLETED, fx.store.find("orphan").orElseThrow().status());

        Job stalled = fx.store.find("stalled").orElseThrow();
        assertEquals(JobStatus.COMPLETED, stalled.status());
        assertEquals(2, stalled.retryCount());

        Job exhausted = fx.store.find("exhausted").orElseThrow();
        assertEquals(JobStatus.FAILED, exhausted.status());
        assertEquals(MaintenanceService.INTERRUPTED_MESSAGE, exhausted.errorMessage());

        assertEquals(JobStatus.PENDING, fx.store.find("fresh").orElseThrow().status());
    }

    @Test
    void emptySweep_reportsZero() throws Exception {
        var report = maintenance.runOnce(Duration.ofMinutes(5), Duration.ofMinutes(45));
        assertEquals(0, report.redispatched + report.retried + report.failed);
        assertNotNull(report.timestamp);
    }
}
