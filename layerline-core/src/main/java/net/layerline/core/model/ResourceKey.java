package net.layerline.core.model;

import java.util.Objects;

/**
 * "무엇을 만드는가"의 식별자. 소스 아티팩트 id + 대상 프로파일 id.
 * 캐시 조회와 진행 중 중복 제출 감지에 사용된다.
 */
public record ResourceKey(String sourceId, String profileId) {
    private static final char SEP = ':';

    public ResourceKey {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(profileId, "profileId");
        if (sourceId.isBlank()) throw new IllegalArgumentException("sourceId is blank");
        if (sourceId.indexOf(SEP) >= 0) throw new IllegalArgumentException("sourceId must not contain ':'");
    }

    public static ResourceKey of(String sourceId, String profileId) {
        return new ResourceKey(sourceId, profileId == null ? "" : profileId);
    }

    public static ResourceKey parse(String value) {
        Objects.requireNonNull(value, "value");
        int i = value.indexOf(SEP);
        if (i < 0) return new ResourceKey(value, "");
        return new ResourceKey(value.substring(0, i), value.substring(i + 1));
    }

    public String value() { return sourceId + SEP + profileId; }

    @Override public String toString() { return value(); }
}
