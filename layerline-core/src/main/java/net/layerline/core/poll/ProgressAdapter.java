package net.layerline.core.poll;

/** provider 별 진행률 페이로드를 표준 {@link ProgressSnapshot} 으로 정규화 */
public interface ProgressAdapter {

    Phase phase(ProviderStatus status);

    /**
     * 이전 스냅샷을 기준으로 새 스냅샷을 계산한다.
     * 알 수 없는 상태는 이전 percent 를 유지하고 statusText 만 갱신한다 (바가 뒤로 가지 않음).
     */
    ProgressSnapshot normalize(ProviderStatus status, ProgressSnapshot previous);

    enum Phase { RUNNING, SUCCEEDED, FAILED, UNKNOWN }
}
