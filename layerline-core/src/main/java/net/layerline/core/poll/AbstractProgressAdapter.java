package net.layerline.core.poll;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** 상태 문자열 분류(대소문자 무시)와 percent 단조 증가/범위 보정을 공통 처리 */
public abstract class AbstractProgressAdapter implements ProgressAdapter {
    private final Set<String> running;
    private final Set<String> succeeded;
    private final Set<String> failed;

    protected AbstractProgressAdapter(Collection<String> running,
                                      Collection<String> succeeded,
                                      Collection<String> failed) {
        this.running = lower(running);
        this.succeeded = lower(succeeded);
        this.failed = lower(failed);
    }

    @Override
    public Phase phase(ProviderStatus status) {
        if (status == null || status.state() == null) return Phase.UNKNOWN;
        String s = status.state().trim().toLowerCase(Locale.ROOT);
        if (succeeded.contains(s)) return Phase.SUCCEEDED;
        if (failed.contains(s)) return Phase.FAILED;
        if (running.contains(s)) return Phase.RUNNING;
        return Phase.UNKNOWN;
    }

    @Override
    public final ProgressSnapshot normalize(ProviderStatus status, ProgressSnapshot previous) {
        ProgressSnapshot prev = previous == null ? ProgressSnapshot.INITIAL : previous;
        String text = statusText(status);
        if (text == null || text.isBlank()) text = prev.statusText();

        Integer raw = phase(status) == Phase.UNKNOWN ? null : percentOf(status);
        if (raw == null) return new ProgressSnapshot(prev.percent(), text);

        int clamped = Math.max(0, Math.min(100, raw));
        return new ProgressSnapshot(Math.max(prev.percent(), clamped), text);
    }

    /** 이 provider 형태에서 percent 를 추출. 알 수 없으면 null */
    protected abstract Integer percentOf(ProviderStatus status);

    protected String statusText(ProviderStatus status) {
        if (status == null) return null;
        return status.message() != null && !status.message().isBlank() ? status.message() : status.state();
    }

    private static Set<String> lower(Collection<String> states) {
        return states.stream().map(s -> s.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    }
}
