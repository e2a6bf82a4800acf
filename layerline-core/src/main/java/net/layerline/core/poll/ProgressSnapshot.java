package net.layerline.core.poll;

/** 표준 진행률 형태 {percent 0..100, statusText} */
public record ProgressSnapshot(int percent, String statusText) {
    public static final ProgressSnapshot INITIAL = new ProgressSnapshot(0, "");

    public ProgressSnapshot {
        if (percent < 0 || percent > 100) throw new IllegalArgumentException("percent out of range: " + percent);
        statusText = statusText == null ? "" : statusText;
    }
}
