package net.layerline.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/** 완료된 Job 이 만든 산출물 참조 (URL/경로 + 부가 메타데이터) */
public record ArtifactRef(String url, Map<String, Object> metadata) {
    public ArtifactRef {
        Objects.requireNonNull(url, "url");
        metadata = metadata == null ? Map.of() : metadata.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public static ArtifactRef of(String url) { return new ArtifactRef(url, Map.of()); }
}
