package net.layerline.core.model;

import java.time.Instant;

public record CacheEntry(
        String cacheKey,
        ResourceKey resourceKey,
        ArtifactRef artifact,
        Instant createdAt
) {}
