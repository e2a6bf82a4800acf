package net.layerline.core.service;

import net.layerline.core.cache.CacheKeyPolicy;
import net.layerline.core.model.ArtifactRef;
import net.layerline.core.model.Job;
import net.layerline.core.model.JobStatus;
import net.layerline.core.model.JobType;
import net.layerline.core.model.ResourceKey;
import net.layerline.core.model.Submission;
import net.layerline.core.poll.ProviderStatus;
import net.layerline.core.spi.ProcessorResult;
import net.layerline.core.support.CoreFixture;
import net.layerline.core.support.ScriptedPolledProcessor;
import net.layerline.core.support.ScriptedSyncProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class JobSubmitterTest {

    CoreFixture fx;
    ResourceKey key = ResourceKey.of("model-42", "prusa-mk4");

    @AfterEach
    void tearDown() throws Exception {
        if (fx != null) fx.close();
    }

    @Test
    void secondSubmitAfterCompletion_returnsCachedWithoutNewJob() throws Exception {
        fx = new CoreFixture(new ScriptedSyncProcessor(JobType.SLICING));

        var first = (Submission.Accepted) fx.submitter.submit(JobType.SLICING, key, Map.of());
        await().atMost(Duration.ofSeconds(5)).until(() ->
                fx.cache.lookup(fx.cache.keyFor(key, Map.of())).isPresent());
        int jobsBefore = fx.jobs.size();

        Submission second = fx.submitter.submit(JobType.SLICING, key, Map.of());

        assertInstanceOf(Submission.Cached.class, second);
        ArtifactRef ref = ((Submission.Cached) second).artifact();
        assertEquals(fx.store.find(first.jobId()).orElseThrow().outputUrl(), ref.url());
        assertEquals(jobsBefore, fx.jobs.size());
    }

    @Test
    void nullParamValue_stillHitsCacheOnResubmit() throws Exception {
        fx = CoreFixture.withCacheKeys(CacheKeyPolicy.digestOf(List.of("layer_height", "support")),
                new ScriptedSyncProcessor(JobType.SLICING));
        var params = new HashMap<String, Object>();
        params.put("layer_height", 0.2);
        params.put("support", null);

        var first = (Submission.Accepted) fx.submitter.submit(JobType.SLICING, key, params);
        await().atMost(Duration.ofSeconds(5)).until(() ->
                fx.cache.lookup(fx.cache.keyFor(key, Map.of("layer_height", 0.2))).isPresent());
        assertEquals(JobStatus.COMPLETED, fx.store.find(first.jobId()).orElseThrow().status());
        int jobsBefore = fx.jobs.size();

        Submission second = fx.submitter.submit(JobType.SLICING, key, params);

        assertInstanceOf(Submission.Cached.class, second);
        assertEquals(jobsBefore, fx.jobs.size());
    }

    @Test
    void submitWhileInFlight_attachesToActiveJob() throws Exception {
        var gate = new CountDownLatch(1);
        fx = new CoreFixture(new ScriptedSyncProcessor(JobType.SLICING).blockUntil(gate));

        var first = (Submission.Accepted) fx.submitter.submit(JobType.SLICING, key, Map.of());
        var second = (Submission.Accepted) fx.submitter.submit(JobType.SLICING, key, Map.of());
        gate.countDown();

        assertFalse(first.attached());
        assertTrue(second.attached());
        assertEquals(first.jobId(), second.jobId());
        assertEquals(1, fx.jobs.size());
    }

    @Test
    void concurrentSubmits_createAtMostOneActiveJob() throws Exception {
        var gate = new CountDownLatch(1);
        fx = new CoreFixture(new ScriptedSyncProcessor(JobType.SLICING).blockUntil(gate));
        int threads = 16;
        var start = new CountDownLatch(1);
        var pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Submission>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Submission> c = () -> {
                    start.await();
                    return fx.submitter.submit(JobType.SLICING, key, Map.of());
                };
                futures.add(pool.submit(c));
            }
            start.countDown();

            Set<String> ids = ConcurrentHashMap.newKeySet();
            int fresh = 0;
            for (var f : futures) {
                var a = (Submission.Accepted) f.get();
                ids.add(a.jobId());
                if (!a.attached()) fresh++;
            }
            assertEquals(1, ids.size());
            assertEquals(1, fresh);
            assertEquals(1, fx.jobs.creates);
        } finally {
            gate.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void lateResubscribe_receivesCompletedState() throws Exception {
        var gate = new CountDownLatch(1);
        fx = new CoreFixture(new ScriptedSyncProcessor(JobType.SLICING).blockUntil(gate));
        var s = (Submission.Accepted) fx.submitter.submit(JobType.SLICING, key, Map.of());

        List<Job> early = new CopyOnWriteArrayList<>();
        var sub = fx.notifier.subscribe(s.jobId(), early::add);
        await().atMost(Duration.ofSeconds(2)).until(() ->
                early.stream().anyMatch(j -> j.status() == JobStatus.PROCESSING));
        sub.unsubscribe();

        gate.countDown();
        await().atMost(Duration.ofSeconds(5)).until(() -> fx.store.find(s.jobId()).orElseThrow().isTerminal());
        assertTrue(early.stream().noneMatch(Job::isTerminal), "unsubscribed observer gets nothing more");

        List<Job> late = new CopyOnWriteArrayList<>();
        fx.notifier.subscribe(s.jobId(), late::add);
        assertEquals(1, late.size());
        assertEquals(JobStatus.COMPLETED, late.get(0).status());
    }

    @Test
    void detachedJob_stillReachesTerminalState_andPushes() throws Exception {
        var gate = new CountDownLatch(1);
        fx = new CoreFixture(new ScriptedSyncProcessor(JobType.SLICING).blockUntil(gate));
        var s = (Submission.Accepted) fx.submitter.submit(JobType.SLICING, key, Map.of());
        var sub = fx.notifier.subscribeResource(key, j -> {});
        sub.unsubscribe();
        assertEquals(0, fx.notifier.observerCount());

        gate.countDown();

        await().atMost(Duration.ofSeconds(5)).until(() -> fx.store.find(s.jobId()).orElseThrow().isTerminal());
        assertEquals(JobStatus.COMPLETED, fx.store.find(s.jobId()).orElseThrow().status());
        await().atMost(Duration.ofSeconds(2)).until(() -> fx.push.sent.size() == 1);
    }

    @Test
    void observedJob_doesNotPush() throws Exception {
        fx = new CoreFixture(new ScriptedSyncProcessor(JobType.SLICING));
        List<Job> seen = new CopyOnWriteArrayList<>();
        fx.notifier.subscribeResource(key, seen::add);

        fx.submitter.submit(JobType.SLICING, key, Map.of());

        await().atMost(Duration.ofSeconds(5)).until(() -> seen.stream().anyMatch(Job::isTerminal));
        assertTrue(fx.push.sent.isEmpty());
    }

    @Test
    void polledJob_persistsMonotonicProgress() throws Exception {
        var proc = new ScriptedPolledProcessor(JobType.MODEL_GENERATION, List.of(
                ProviderStatus.running("PENDING", 0.0, null),
                ProviderStatus.running("PROCESSING", 20.0, null),
                ProviderStatus.running("PROCESSING", 10.0, null),
                ProviderStatus.running("PROCESSING", 70.0, null),
                ProviderStatus.running("PROCESSING", 99.0, null),
                ProviderStatus.succeeded("SUCCEEDED", ProcessorResult.of("https://ai.example/m/model.glb"))));
        fx = new CoreFixture(proc);
        List<Integer> percents = new CopyOnWriteArrayList<>();
        fx.notifier.subscribeResource(key, j -> {
            if (j.progressPercent() != null) percents.add(j.progressPercent());
        });

        var s = (Submission.Accepted) fx.submitter.submit(JobType.MODEL_GENERATION, key, Map.of("prompt", "a frog"));
        await().atMost(Duration.ofSeconds(5)).until(() -> fx.store.find(s.jobId()).orElseThrow().isTerminal());

        Job done = fx.store.find(s.jobId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals("store://jobs/" + done.id() + "/output.glb", done.outputUrl());
        assertEquals(List.of("task-1"), proc.submitted);
        for (int i = 1; i < percents.size(); i++) {
            assertTrue(percents.get(i) >= percents.get(i - 1), "progress regressed: " + percents);
        }
        assertTrue(percents.contains(95), "processing progress is capped: " + percents);
        assertEquals(100, percents.get(percents.size() - 1));
    }

    @Test
    void providerFailure_isPermanent() throws Exception {
        var proc = new ScriptedPolledProcessor(JobType.MODEL_GENERATION, List.of(
                ProviderStatus.running("PROCESSING", 30.0, null),
                ProviderStatus.failed("FAILED", "mesh generation failed")));
        fx = new CoreFixture(proc);

        var s = (Submission.Accepted) fx.submitter.submit(JobType.MODEL_GENERATION, key, Map.of());
        await().atMost(Duration.ofSeconds(5)).until(() -> fx.store.find(s.jobId()).orElseThrow().isTerminal());

        Job failed = fx.store.find(s.jobId()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(0, failed.retryCount());
        assertEquals("The processing server could not process this input", failed.errorMessage());
    }

    @Test
    void unsupportedType_isRejectedSynchronously() {
        fx = new CoreFixture(new ScriptedSyncProcessor(JobType.SLICING));
        assertThrows(IllegalArgumentException.class,
                () -> fx.submitter.submit(JobType.GCODE_ANALYSIS, key, Map.of()));
        assertEquals(0, fx.jobs.size());
    }
}
