package net.layerline.core.spi;

import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 성공한 원격 호출 결과.
 * primaryUrl 은 필수, secondaryUrls (미리보기 등) 는 선택이며 실패해도 Job 은 완료된다.
 */
public record ProcessorResult(
        String primaryUrl,
        Map<String, String> secondaryUrls,
        Map<String, Object> metadata
) {
    public ProcessorResult {
        Objects.requireNonNull(primaryUrl, "primaryUrl");
        secondaryUrls = present(secondaryUrls);
        metadata = present(metadata);
    }

    // provider 응답의 빈 값(null)은 없는 것으로 본다
    private static <V> Map<String, V> present(Map<String, V> m) {
        if (m == null) return Map.of();
        return m.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public static ProcessorResult of(String primaryUrl) {
        return new ProcessorResult(primaryUrl, Map.of(), Map.of());
    }
}
