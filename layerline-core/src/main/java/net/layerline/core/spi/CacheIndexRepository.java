package net.layerline.core.spi;

import net.layerline.core.model.CacheEntry;

import java.util.Optional;

public interface CacheIndexRepository {
    Optional<CacheEntry> find(String cacheKey) throws Exception;

    /** 멱등 upsert: 같은 key 면 덮어쓴다 */
    void upsert(CacheEntry entry) throws Exception;

    /** 소스 리소스 삭제 시 해당 소스의 항목 제거 */
    int deleteBySourceId(String sourceId) throws Exception;

    int delete(String cacheKey) throws Exception;
}
