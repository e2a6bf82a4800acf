package net.layerline.core.poll;

import java.util.List;

/** progress 를 0..1 비율로 보고하고 progress_message 를 같이 주는 provider (G-code 분석 서버) */
public final class FractionProgressAdapter extends AbstractProgressAdapter {

    public FractionProgressAdapter() {
        this(List.of("queued", "pending", "running", "processing"),
                List.of("completed", "done", "finished"),
                List.of("failed", "error"));
    }

    public FractionProgressAdapter(List<String> running, List<String> succeeded, List<String> failed) {
        super(running, succeeded, failed);
    }

    @Override
    protected Integer percentOf(ProviderStatus status) {
        if (status.progress() == null) return null;
        return (int) Math.round(status.progress() * 100.0);
    }
}
