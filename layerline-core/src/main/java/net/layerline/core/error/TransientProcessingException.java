package net.layerline.core.error;

/** 네트워크 오류, upstream timeout, rate limit 등. 재시도 대상 */
public class TransientProcessingException extends ProcessingException {

    public TransientProcessingException(String userMessage, String detail, Throwable cause) {
        super(userMessage, detail, cause);
    }

    public TransientProcessingException(String userMessage, String detail) {
        this(userMessage, detail, null);
    }

    @Override public boolean retryable() { return true; }
}
