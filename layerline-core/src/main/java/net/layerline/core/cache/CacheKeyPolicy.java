package net.layerline.core.cache;

import net.layerline.core.model.ResourceKey;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 캐시 키 계산. resourceKey 만 쓰거나, 결과에 영향을 주는 입력 파라미터 일부를
 * 해시로 덧붙여 더 좁은 키를 만든다 (표시용 필드는 제외).
 */
@FunctionalInterface
public interface CacheKeyPolicy {

    String keyFor(ResourceKey key, Map<String, Object> inputParams);

    static CacheKeyPolicy resourceKeyOnly() {
        return (key, params) -> key.value();
    }

    /** resourceKey + "#" + sha256(선택 필드의 정렬된 표현). null 값은 없는 필드와 같다 */
    static CacheKeyPolicy digestOf(List<String> outputAffectingFields) {
        List<String> fields = List.copyOf(outputAffectingFields);
        return (key, params) -> {
            var selected = new TreeMap<String, Object>();
            for (String f : fields) {
                Object v = params == null ? null : params.get(f);
                if (v != null) selected.put(f, canonical(v));
            }
            if (selected.isEmpty()) return key.value();
            return key.value() + "#" + sha256(selected.toString());
        };
    }

    private static Object canonical(Object v) {
        if (v instanceof Map<?, ?> m) {
            var sorted = new TreeMap<String, Object>();
            m.forEach((k, val) -> sorted.put(String.valueOf(k), canonical(val)));
            return sorted;
        }
        if (v instanceof List<?> l) return l.stream().map(CacheKeyPolicy::canonical).toList();
        return v;
    }

    private static String sha256(String s) {
        try {
            var md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
