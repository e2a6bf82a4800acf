package net.layerline.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("layerline")
public class LayerlineProperties {
    private Executor executor = new Executor();
    private Retry retry = new Retry();
    private Poll poll = new Poll();
    private Maintenance maintenance = new Maintenance();
    private Relay relay = new Relay();
    private Providers providers = new Providers();
    private Storage storage = new Storage();
    private Push push = new Push();
    private Cache cache = new Cache();
    private Scheduler scheduler = new Scheduler();

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Poll getPoll() {
        return poll;
    }

    public void setPoll(Poll poll) {
        this.poll = poll;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public void setMaintenance(Maintenance maintenance) {
        this.maintenance = maintenance;
    }

    public Relay getRelay() {
        return relay;
    }

    public void setRelay(Relay relay) {
        this.relay = relay;
    }

    public Providers getProviders() {
        return providers;
    }

    public void setProviders(Providers providers) {
        this.providers = providers;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Push getPush() {
        return push;
    }

    public void setPush(Push push) {
        this.push = push;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /** @Scheduled 틱 전체 on/off (테스트에서 끈다) */
    public static class Scheduler {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Executor {
        private int threads = 4;
        private int pollerThreads = 2;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public int getPollerThreads() {
            return pollerThreads;
        }

        public void setPollerThreads(int pollerThreads) {
            this.pollerThreads = pollerThreads;
        }
    }

    public static class Retry {
        private Duration baseBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofSeconds(60);
        private int defaultMaxRetries = 3;

        public Duration getBaseBackoff() {
            return baseBackoff;
        }

        public void setBaseBackoff(Duration baseBackoff) {
            this.baseBackoff = baseBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public int getDefaultMaxRetries() {
            return defaultMaxRetries;
        }

        public void setDefaultMaxRetries(int defaultMaxRetries) {
            this.defaultMaxRetries = defaultMaxRetries;
        }
    }

    public static class Poll {
        private Duration interval = Duration.ofSeconds(5);
        private Duration gcodeInterval = Duration.ofSeconds(2);
        private Duration maxDuration = Duration.ofMinutes(30);
        private int maxAttempts = 360;
        private int maxConsecutiveErrors = 10;

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getGcodeInterval() {
            return gcodeInterval;
        }

        public void setGcodeInterval(Duration gcodeInterval) {
            this.gcodeInterval = gcodeInterval;
        }

        public Duration getMaxDuration() {
            return maxDuration;
        }

        public void setMaxDuration(Duration maxDuration) {
            this.maxDuration = maxDuration;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public int getMaxConsecutiveErrors() {
            return maxConsecutiveErrors;
        }

        public void setMaxConsecutiveErrors(int maxConsecutiveErrors) {
            this.maxConsecutiveErrors = maxConsecutiveErrors;
        }
    }

    public static class Maintenance {
        private boolean enabled = true;
        private long delayMs = 30000;
        private Duration pendingGrace = Duration.ofMinutes(2);
        // 폴링 상한(maxDuration)보다 길어야 한다
        private Duration stalledAfter = Duration.ofMinutes(45);
        private int batchSize = 50;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }

        public Duration getPendingGrace() {
            return pendingGrace;
        }

        public void setPendingGrace(Duration pendingGrace) {
            this.pendingGrace = pendingGrace;
        }

        public Duration getStalledAfter() {
            return stalledAfter;
        }

        public void setStalledAfter(Duration stalledAfter) {
            this.stalledAfter = stalledAfter;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Relay {
        private boolean enabled = false;
        private long delayMs = 1000;
        private int batchSize = 200;
        private Duration overlap = Duration.ofSeconds(2);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getOverlap() {
            return overlap;
        }

        public void setOverlap(Duration overlap) {
            this.overlap = overlap;
        }
    }

    public static class Providers {
        /** AI 서버 base URL. 비어 있으면 HTTP 처리기를 등록하지 않는다 */
        private String aiBaseUrl;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private Duration slicingReadTimeout = Duration.ofSeconds(180);

        public String getAiBaseUrl() {
            return aiBaseUrl;
        }

        public void setAiBaseUrl(String aiBaseUrl) {
            this.aiBaseUrl = aiBaseUrl;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public Duration getSlicingReadTimeout() {
            return slicingReadTimeout;
        }

        public void setSlicingReadTimeout(Duration slicingReadTimeout) {
            this.slicingReadTimeout = slicingReadTimeout;
        }
    }

    public static class Storage {
        private String root = "./layerline-data";

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }
    }

    public static class Push {
        private String webhookUrl;

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }
    }

    public static class Cache {
        /** 캐시 키에 포함할 입력 파라미터. 비어 있으면 resourceKey 만 쓴다 */
        private List<String> keyFields = new ArrayList<>();

        public List<String> getKeyFields() {
            return keyFields;
        }

        public void setKeyFields(List<String> keyFields) {
            this.keyFields = keyFields;
        }
    }
}
