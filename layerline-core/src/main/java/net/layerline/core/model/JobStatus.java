package net.layerline.core.model;

public enum JobStatus {
    PENDING, PROCESSING, COMPLETED, FAILED;

    public static JobStatus from(String s) {
        if (s == null) throw new IllegalArgumentException("status is null");
        return JobStatus.valueOf(s.trim().toUpperCase());
    }

    /** 저장소에 기록되는 값 (소문자) */
    public String code() { return name().toLowerCase(); }

    public boolean isTerminal() { return this == COMPLETED || this == FAILED; }

    /** 허용된 전이만 true. PROCESSING -> PROCESSING 은 재시도 */
    public boolean canMoveTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING;
            case PROCESSING -> next == PROCESSING || next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
