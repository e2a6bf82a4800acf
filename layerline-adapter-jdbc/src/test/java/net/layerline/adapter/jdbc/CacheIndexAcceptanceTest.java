package net.layerline.adapter.jdbc;

import net.layerline.adapter.jdbc.repo.JdbcCacheIndexRepository;
import net.layerline.core.cache.CacheIndex;
import net.layerline.core.cache.CacheKeyPolicy;
import net.layerline.core.model.ArtifactRef;
import net.layerline.core.model.ResourceKey;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CacheIndexAcceptanceTest extends TestSupport {

    CacheIndex cache;
    ResourceKey key = ResourceKey.of("model-3", "ender3");

    @BeforeAll
    void initAll() {
        cache = new CacheIndex(new JdbcCacheIndexRepository(), new JdbcTxRunner(ds), Instant::now,
                CacheKeyPolicy.digestOf(List.of("layerHeight")));
    }

    @Test
    void recordTwice_keepsOneRowWithLatestArtifact() throws Exception {
        String k = cache.keyFor(key, Map.of("layerHeight", 0.2));
        cache.record(k, key, new ArtifactRef("store://a.gcode", Map.of("layers", 100)));
        cache.record(k, key, new ArtifactRef("store://b.gcode", Map.of("layers", 101)));

        ArtifactRef hit = cache.lookup(k).orElseThrow();
        assertEquals("store://b.gcode", hit.url());
        assertEquals(101, hit.metadata().get("layers"));

        int rows = new JdbcTxRunner(ds).required(() -> {
            try (var st = TxContext.get().createStatement();
                 var rs = st.executeQuery("SELECT COUNT(*) FROM TB_ARTIFACT_CACHE")) {
                rs.next();
                return rs.getInt(1);
            }
        });
        assertEquals(1, rows);
    }

    @Test
    void differentOutputParams_areDifferentEntries() throws Exception {
        String fine = cache.keyFor(key, Map.of("layerHeight", 0.12));
        String draft = cache.keyFor(key, Map.of("layerHeight", 0.28));
        cache.record(fine, key, ArtifactRef.of("store://fine.gcode"));

        assertTrue(cache.lookup(fine).isPresent());
        assertTrue(cache.lookup(draft).isEmpty());
    }

    @Test
    void evictSource_deletesAllProfilesOfThatSource() throws Exception {
        cache.record("k1", key, ArtifactRef.of("store://1"));
        cache.record("k2", ResourceKey.of("model-3", "mk4"), ArtifactRef.of("store://2"));
        cache.record("k3", ResourceKey.of("model-4", "mk4"), ArtifactRef.of("store://3"));

        assertEquals(2, cache.evictSource("model-3"));
        assertTrue(cache.lookup("k1").isEmpty());
        assertTrue(cache.lookup("k3").isPresent());
    }
}
