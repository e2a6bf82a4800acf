package net.layerline.bootstrap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.layerline.adapter.http.JsonHttp;
import net.layerline.adapter.http.OkHttpFactory;
import net.layerline.adapter.http.processor.GcodeAnalysisProcessor;
import net.layerline.adapter.http.processor.ModelGenerationProcessor;
import net.layerline.adapter.http.processor.SlicingProcessor;
import net.layerline.adapter.http.push.WebhookPushNotifier;
import net.layerline.adapter.http.storage.LocalArtifactStorage;
import net.layerline.bootstrap.props.LayerlineProperties;
import net.layerline.core.cache.CacheIndex;
import net.layerline.core.cache.CacheKeyPolicy;
import net.layerline.core.maintenance.MaintenanceService;
import net.layerline.core.notify.ChangeNotifier;
import net.layerline.core.notify.LoggingPushNotifier;
import net.layerline.core.notify.StoreChangeRelay;
import net.layerline.core.poll.PollOptions;
import net.layerline.core.poll.ProgressPoller;
import net.layerline.core.service.JobExecutor;
import net.layerline.core.service.JobStore;
import net.layerline.core.service.JobSubmitter;
import net.layerline.core.service.ProcessorRegistry;
import net.layerline.core.service.RetryPolicy;
import net.layerline.core.spi.ArtifactStorage;
import net.layerline.core.spi.CacheIndexRepository;
import net.layerline.core.spi.Clock;
import net.layerline.core.spi.JobRepository;
import net.layerline.core.spi.PushNotifier;
import net.layerline.core.spi.RemoteProcessor;
import net.layerline.core.spi.TxRunner;
import net.layerline.integration.spring.LayerlineSpringConfig;
import net.layerline.integration.spring.sched.LayerlineSchedulers;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.nio.file.Path;
import java.util.stream.Collectors;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration"})
@EnableConfigurationProperties(LayerlineProperties.class)
@Import(LayerlineSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class LayerlineAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(LayerlineAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public LayerlineThreads layerlineThreads(LayerlineProperties props) {
        return new LayerlineThreads(props.getExecutor().getThreads(), props.getExecutor().getPollerThreads());
    }

    // --- HTTP / 외부 연동 ---

    @Bean
    @ConditionalOnMissingBean
    public OkHttpClient layerlineHttpClient(LayerlineProperties props) {
        var p = props.getProviders();
        return OkHttpFactory.create(p.getConnectTimeout(), p.getReadTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonHttp layerlineJsonHttp(OkHttpClient client, ObjectProvider<ObjectMapper> mapper) {
        return new JsonHttp(client, mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ArtifactStorage artifactStorage(OkHttpClient client, LayerlineProperties props) {
        return new LocalArtifactStorage(client, Path.of(props.getStorage().getRoot()));
    }

    @Bean
    @ConditionalOnMissingBean
    public PushNotifier pushNotifier(JsonHttp http, LayerlineProperties props) {
        String url = props.getPush().getWebhookUrl();
        if (url == null || url.isBlank()) return new LoggingPushNotifier();
        return new WebhookPushNotifier(http, url);
    }

    // --- 처리기 (AI 서버 주소가 있을 때만) ---

    @Bean
    @ConditionalOnProperty(prefix = "layerline.providers", name = "ai-base-url")
    public ModelGenerationProcessor modelGenerationProcessor(JsonHttp http, LayerlineProperties props) {
        return new ModelGenerationProcessor(http, props.getProviders().getAiBaseUrl(),
                pollOptions(props).withInterval(props.getPoll().getInterval()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "layerline.providers", name = "ai-base-url")
    public SlicingProcessor slicingProcessor(OkHttpClient client, ObjectProvider<ObjectMapper> mapper,
                                             LayerlineProperties props) {
        OkHttpClient slow = OkHttpFactory.withReadTimeout(client, props.getProviders().getSlicingReadTimeout());
        return new SlicingProcessor(new JsonHttp(slow, mapper.getIfAvailable(ObjectMapper::new)), client,
                props.getProviders().getAiBaseUrl());
    }

    @Bean
    @ConditionalOnProperty(prefix = "layerline.providers", name = "ai-base-url")
    public GcodeAnalysisProcessor gcodeAnalysisProcessor(JsonHttp http, LayerlineProperties props) {
        return new GcodeAnalysisProcessor(http, props.getProviders().getAiBaseUrl(),
                pollOptions(props).withInterval(props.getPoll().getGcodeInterval()));
    }

    private static PollOptions pollOptions(LayerlineProperties props) {
        var p = props.getPoll();
        return PollOptions.defaults()
                .withMaxDuration(p.getMaxDuration())
                .withMaxAttempts(p.getMaxAttempts())
                .withMaxConsecutiveErrors(p.getMaxConsecutiveErrors());
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public ProcessorRegistry processorRegistry(ObjectProvider<RemoteProcessor> processors) {
        var registry = new ProcessorRegistry(processors.orderedStream().collect(Collectors.toList()));
        if (processors.stream().findAny().isEmpty()) {
            log.warn("no remote processors registered; submissions will be rejected (set layerline.providers.ai-base-url)");
        }
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ChangeNotifier changeNotifier(JobRepository jobs, LayerlineThreads threads) {
        return new ChangeNotifier(jobs, threads.delivery());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore jobStore(JobRepository jobs, TxRunner tx, Clock clock, ChangeNotifier notifier) {
        return new JobStore(jobs, tx, clock, notifier);
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheIndex cacheIndex(CacheIndexRepository repo, TxRunner tx, Clock clock, LayerlineProperties props) {
        var fields = props.getCache().getKeyFields();
        CacheKeyPolicy policy = fields.isEmpty() ? CacheKeyPolicy.resourceKeyOnly() : CacheKeyPolicy.digestOf(fields);
        return new CacheIndex(repo, tx, clock, policy);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProgressPoller progressPoller(LayerlineThreads threads, Clock clock) {
        return new ProgressPoller(threads.pollScheduler(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(LayerlineProperties props) {
        return RetryPolicy.exponential(props.getRetry().getBaseBackoff(), props.getRetry().getMaxBackoff());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutor jobExecutor(JobStore store,
                                   ProcessorRegistry processors,
                                   ArtifactStorage storage,
                                   ProgressPoller poller,
                                   CacheIndex cache,
                                   RetryPolicy retry,
                                   ChangeNotifier notifier,
                                   PushNotifier push,
                                   LayerlineThreads threads) {
        return new JobExecutor(store, processors, storage, poller, cache, retry, notifier, push, threads.workers());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobSubmitter jobSubmitter(CacheIndex cache, JobStore store, JobExecutor executor,
                                     ProcessorRegistry processors, LayerlineProperties props) {
        return new JobSubmitter(cache, store, executor, processors, props.getRetry().getDefaultMaxRetries());
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(JobRepository jobs, JobStore store, JobExecutor executor,
                                          TxRunner tx, Clock clock, LayerlineProperties props) {
        return new MaintenanceService(jobs, store, executor, tx, clock, props.getMaintenance().getBatchSize());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "layerline.relay", name = "enabled", havingValue = "true")
    public StoreChangeRelay storeChangeRelay(JobRepository jobs, TxRunner tx, ChangeNotifier notifier,
                                             Clock clock, LayerlineProperties props) {
        var r = props.getRelay();
        return new StoreChangeRelay(jobs, tx, notifier, clock, r.getBatchSize(), r.getOverlap());
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "layerline.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public LayerlineSchedulers layerlineSchedulers(MaintenanceService maintenance,
                                                   ObjectProvider<StoreChangeRelay> relay,
                                                   LayerlineProperties props) {
        var s = new LayerlineSchedulers(maintenance, relay.getIfAvailable());
        // @Scheduled 딜레이는 layerline.maintenance.delay-ms / layerline.relay.delay-ms 에서 읽힌다
        s.setMaintenanceEnabled(props.getMaintenance().isEnabled());
        s.setPendingGrace(props.getMaintenance().getPendingGrace());
        s.setStalledAfter(props.getMaintenance().getStalledAfter());
        if (props.getMaintenance().getStalledAfter().compareTo(props.getPoll().getMaxDuration()) <= 0) {
            log.warn("layerline.maintenance.stalled-after ({}) should exceed layerline.poll.max-duration ({})",
                    props.getMaintenance().getStalledAfter(), props.getPoll().getMaxDuration());
        }
        return s;
    }
}
