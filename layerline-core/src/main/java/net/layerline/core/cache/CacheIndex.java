package net.layerline.core.cache;

import net.layerline.core.model.ArtifactRef;
import net.layerline.core.model.CacheEntry;
import net.layerline.core.model.ResourceKey;
import net.layerline.core.spi.CacheIndexRepository;
import net.layerline.core.spi.Clock;
import net.layerline.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/** content key -> 이전에 만들어진 산출물. 제출 전에 조회, 완료 직후 1회 기록 */
public final class CacheIndex {
    private static final Logger log = LoggerFactory.getLogger(CacheIndex.class);

    private final CacheIndexRepository repo;
    private final TxRunner tx;
    private final Clock clock;
    private final CacheKeyPolicy keys;

    public CacheIndex(CacheIndexRepository repo, TxRunner tx, Clock clock, CacheKeyPolicy keys) {
        this.repo = repo;
        this.tx = tx;
        this.clock = clock;
        this.keys = keys;
    }

    public String keyFor(ResourceKey key, Map<String, Object> inputParams) {
        return keys.keyFor(key, inputParams);
    }

    /** miss 는 부수효과 없음 */
    public Optional<ArtifactRef> lookup(String cacheKey) throws Exception {
        return tx.required(() -> repo.find(cacheKey)).map(CacheEntry::artifact);
    }

    /** 멱등: 같은 key 는 덮어쓴다 */
    public void record(String cacheKey, ResourceKey resourceKey, ArtifactRef artifact) throws Exception {
        tx.inTx(() -> repo.upsert(new CacheEntry(cacheKey, resourceKey, artifact, clock.now())));
        log.debug("cache recorded: key={} url={}", cacheKey, artifact.url());
    }

    /** 소유 리소스(소스 아티팩트) 삭제 시 호출 */
    public int evictSource(String sourceId) throws Exception {
        int n = tx.required(() -> repo.deleteBySourceId(sourceId));
        if (n > 0) log.info("cache evicted: sourceId={} entries={}", sourceId, n);
        return n;
    }
}
