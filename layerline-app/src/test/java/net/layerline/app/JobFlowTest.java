package net.layerline.app;

import net.layerline.core.cache.CacheIndex;
import net.layerline.core.model.Job;
import net.layerline.core.model.JobStatus;
import net.layerline.core.model.JobType;
import net.layerline.core.model.ResourceKey;
import net.layerline.core.model.Submission;
import net.layerline.core.notify.ChangeNotifier;
import net.layerline.core.notify.Subscription;
import net.layerline.core.service.JobParams;
import net.layerline.core.service.JobStore;
import net.layerline.core.service.JobSubmitter;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/** H2 + 가짜 AI 서버 위에서 제출부터 완료/실패까지 */
@SpringBootTest
class JobFlowTest {

    static final FakeAiServer ai = new FakeAiServer();
    static final Path dataRoot = tempDir("layerline-data");
    static final Path uploads = tempDir("layerline-uploads");

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", () -> "jdbc:h2:mem:jobflow;MODE=PostgreSQL;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        r.add("spring.datasource.username", () -> "sa");
        r.add("spring.datasource.password", () -> "");
        r.add("layerline.scheduler.enabled", () -> "false");
        r.add("layerline.providers.ai-base-url", ai::baseUrl);
        r.add("layerline.push.webhook-url", () -> ai.baseUrl() + "hooks/jobs");
        r.add("layerline.storage.root", dataRoot::toString);
        r.add("layerline.poll.interval", () -> "50ms");
        r.add("layerline.retry.base-backoff", () -> "10ms");
        r.add("layerline.retry.max-backoff", () -> "20ms");
    }

    @AfterAll
    static void stopServer() throws IOException {
        ai.close();
    }

    @Autowired JobSubmitter submitter;
    @Autowired JobStore store;
    @Autowired CacheIndex cache;
    @Autowired ChangeNotifier notifier;
    @Autowired JdbcTemplate jdbc;

    @BeforeEach
    void clean() {
        jdbc.update("DELETE FROM TB_JOB");
        jdbc.update("DELETE FROM TB_ARTIFACT_CACHE");
        ai.hooks.clear();
    }

    @Test
    void slicing_completesPersistsAndIsCachedForTheNextCaller() throws Exception {
        ResourceKey key = ResourceKey.of("vase", "prusa-mk4");
        Map<String, Object> params = Map.of(JobParams.SOURCE_URL, upload("vase.stl", "solid vase\nendsolid vase\n"));

        var accepted = (Submission.Accepted) submitter.submit(JobType.SLICING, key, params);
        assertThat(accepted.attached()).isFalse();

        Job done = awaitTerminal(accepted.jobId());
        assertThat(done.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.progressPercent()).isEqualTo(100);
        assertThat(done.outputMetadata()).containsEntry("task_id", "s-1");
        Path gcode = Path.of(URI.create(done.outputUrl()));
        assertThat(gcode).startsWith(dataRoot).hasContent("G28\nG1 X10\n");

        // 아무도 보고 있지 않았으므로 push
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(ai.hooks)
                .anyMatch(h -> h.contains(accepted.jobId()) && h.contains("\"status\":\"completed\"")));

        // 캐시 기록은 완료 전이 직후에 일어난다
        await().atMost(Duration.ofSeconds(5)).until(() -> cache.lookup(cache.keyFor(key, params)).isPresent());
        Submission again = submitter.submit(JobType.SLICING, key, params);
        assertThat(again).isInstanceOf(Submission.Cached.class);
        assertThat(((Submission.Cached) again).artifact().url()).isEqualTo(done.outputUrl());
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM TB_JOB", Integer.class)).isEqualTo(1);
    }

    @Test
    void concurrentSubmits_shareOneJob() throws Exception {
        ResourceKey key = ResourceKey.of("bracket", "ender-3");
        Map<String, Object> params = Map.of(JobParams.SOURCE_URL, upload("bracket.stl", "solid bracket\n"));
        int before = ai.sliceCalls.get();

        var pool = Executors.newFixedThreadPool(8);
        List<Future<Submission>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                Callable<Submission> c = () -> submitter.submit(JobType.SLICING, key, params);
                futures.add(pool.submit(c));
            }
            List<String> ids = new ArrayList<>();
            for (Future<Submission> f : futures) {
                Submission s = f.get();
                if (s instanceof Submission.Accepted a) ids.add(a.jobId());
            }
            assertThat(ids).isNotEmpty();
            assertThat(ids.stream().distinct()).hasSize(1);
            awaitTerminal(ids.get(0));
        } finally {
            pool.shutdownNow();
        }

        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM TB_JOB WHERE SOURCE_ID = 'bracket'", Integer.class))
                .isEqualTo(1);
        assertThat(ai.sliceCalls.get() - before).isEqualTo(1);
    }

    @Test
    void modelGeneration_streamsMonotonicProgressToObservers() throws Exception {
        ResourceKey key = ResourceKey.of("img-1", "default");
        List<Job> seen = new CopyOnWriteArrayList<>();

        String jobId;
        try (Subscription ignored = notifier.subscribeResource(key, seen::add)) {
            var accepted = (Submission.Accepted) submitter.submit(JobType.MODEL_GENERATION, key,
                    Map.of("prompt", "a small vase", JobParams.DISPLAY_NAME, "Vase"));

            await().atMost(Duration.ofSeconds(10)).until(() ->
                    !seen.isEmpty() && seen.get(seen.size() - 1).status() == JobStatus.COMPLETED);

            jobId = accepted.jobId();
            Job done = store.find(jobId).orElseThrow();
            assertThat(Path.of(URI.create(done.outputUrl()))).hasContent("glTF");
            // 썸네일은 404 였으므로 메타데이터에 없다
            assertThat(done.outputMetadata()).doesNotContainKey("thumbnailUrl");
        }

        List<Integer> percents = seen.stream()
                .map(Job::progressPercent)
                .filter(p -> p != null)
                .toList();
        assertThat(percents).isSorted().contains(20, 60, 100);
        // 관찰자가 있었으므로 push 는 없다
        assertThat(ai.hooks).noneMatch(h -> h.contains(jobId));
    }

    @Test
    void providerRejection_failsWithoutRetryAndWithUserFacingMessage() throws Exception {
        ResourceKey key = ResourceKey.of("broken", "prusa-mk4");
        int before = ai.sliceCalls.get();

        var accepted = (Submission.Accepted) submitter.submit(JobType.SLICING, key,
                Map.of(JobParams.SOURCE_URL, upload("broken.stl", "solid broken\n")));

        Job failed = awaitTerminal(accepted.jobId());
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.errorMessage()).isEqualTo("The model could not be sliced");
        assertThat(failed.retryCount()).isZero();
        assertThat(ai.sliceCalls.get() - before).isEqualTo(1);

        // 실패한 Job 은 캐시되지 않고 새 제출을 막지 않는다
        var retry = submitter.submit(JobType.SLICING, key,
                Map.of(JobParams.SOURCE_URL, upload("broken.stl", "solid broken\n")));
        assertThat(retry).isInstanceOf(Submission.Accepted.class);
        assertThat(((Submission.Accepted) retry).jobId()).isNotEqualTo(accepted.jobId());
        awaitTerminal(((Submission.Accepted) retry).jobId());
    }

    private Job awaitTerminal(String jobId) {
        await().atMost(Duration.ofSeconds(10)).until(() -> store.find(jobId).map(Job::isTerminal).orElse(false));
        try {
            return store.find(jobId).orElseThrow();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static String upload(String name, String content) throws IOException {
        return Files.writeString(uploads.resolve(name), content).toUri().toString();
    }

    private static Path tempDir(String prefix) {
        try {
            return Files.createTempDirectory(prefix).toAbsolutePath().normalize();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
