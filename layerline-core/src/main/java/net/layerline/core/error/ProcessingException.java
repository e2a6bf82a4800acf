package net.layerline.core.error;

/**
 * 원격 처리 실패. userMessage 는 사용자에게 보여줄 짧은 요약이고,
 * 기술적 상세(원인 예외, provider payload)는 cause/getMessage 쪽에만 둔다.
 */
public abstract class ProcessingException extends Exception {
    private final String userMessage;

    protected ProcessingException(String userMessage, String detail, Throwable cause) {
        super(detail == null ? userMessage : detail, cause);
        this.userMessage = userMessage;
    }

    public String userMessage() { return userMessage; }

    public abstract boolean retryable();
}
