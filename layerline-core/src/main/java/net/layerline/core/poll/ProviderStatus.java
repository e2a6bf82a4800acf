package net.layerline.core.poll;

import net.layerline.core.spi.ProcessorResult;

import java.time.Duration;

/**
 * provider 의 상태 조회 응답을 가공 없이 담는다. 형태는 provider 마다 다르므로
 * percent/fraction/step 중 무엇이 채워지는지는 {@link ProgressAdapter} 가 해석한다.
 *
 * @param state      provider 상태 문자열 (예: PROCESSING, SUCCEEDED, running, done)
 * @param progress   provider 가 보고한 수치 (0..100 또는 0..1, 없으면 null)
 * @param message    진행 메시지나 단계 이름 (없으면 null)
 * @param result     성공 시 산출물
 * @param error      실패 시 provider 오류 메시지
 * @param retryAfter provider 가 제안한 다음 조회 간격 (ETA 등, 없으면 null)
 */
public record ProviderStatus(
        String state,
        Double progress,
        String message,
        ProcessorResult result,
        String error,
        Duration retryAfter
) {
    public static ProviderStatus running(String state, Double progress, String message) {
        return new ProviderStatus(state, progress, message, null, null, null);
    }

    public static ProviderStatus succeeded(String state, ProcessorResult result) {
        return new ProviderStatus(state, null, null, result, null, null);
    }

    public static ProviderStatus failed(String state, String error) {
        return new ProviderStatus(state, null, null, null, error, null);
    }
}
