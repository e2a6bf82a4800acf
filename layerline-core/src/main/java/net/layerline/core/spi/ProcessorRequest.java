package net.layerline.core.spi;

import net.layerline.core.model.ResourceKey;

import java.util.Map;

/** 원격 처리기에 넘기는 입력. stagedInputUrl 은 처리기에서 접근 가능한 소스 위치 (없으면 null) */
public record ProcessorRequest(
        String jobId,
        ResourceKey resourceKey,
        String stagedInputUrl,
        Map<String, Object> params
) {
    public ProcessorRequest {
        params = params == null ? Map.of() : Map.copyOf(params);
    }
}
