package net.layerline.core.poll;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 단계 이름만 보고하는 provider. 순서가 정해진 단계 목록에서의 위치로 percent 를 계산한다.
 * i 번째(0-base) 단계는 i * 100 / steps.size(). 목록에 없는 단계는 이전 percent 유지.
 */
public final class StepProgressAdapter extends AbstractProgressAdapter {
    private final List<String> steps;

    public StepProgressAdapter(List<String> steps, List<String> succeeded, List<String> failed) {
        super(steps, succeeded, failed);
        Objects.requireNonNull(steps, "steps");
        if (steps.isEmpty()) throw new IllegalArgumentException("steps must not be empty");
        this.steps = steps.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }

    @Override
    protected Integer percentOf(ProviderStatus status) {
        int i = steps.indexOf(status.state().trim().toLowerCase(Locale.ROOT));
        if (i < 0) return null;
        return i * 100 / steps.size();
    }

    @Override
    protected String statusText(ProviderStatus status) {
        return status.state();
    }
}
