package net.layerline.core.poll;

import java.util.List;

/** progress 를 0..100 정수로 보고하고 상태는 enum 문자열인 provider (모델 생성 서버) */
public final class PercentProgressAdapter extends AbstractProgressAdapter {

    public PercentProgressAdapter() {
        this(List.of("PENDING", "QUEUED", "PROCESSING", "IN_PROGRESS", "RUNNING"),
                List.of("SUCCEEDED"),
                List.of("FAILED", "ERROR"));
    }

    public PercentProgressAdapter(List<String> running, List<String> succeeded, List<String> failed) {
        super(running, succeeded, failed);
    }

    @Override
    protected Integer percentOf(ProviderStatus status) {
        if (status.progress() == null) return null;
        return (int) Math.round(status.progress());
    }

    @Override
    protected String statusText(ProviderStatus status) {
        return status.state();
    }
}
