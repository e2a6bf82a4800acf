package net.layerline.core.error;

/** 잘못된 입력, provider 가 보고한 처리 불가, 권한/쿼터 실패. 재시도하지 않는다 */
public class PermanentProcessingException extends ProcessingException {

    public PermanentProcessingException(String userMessage, String detail, Throwable cause) {
        super(userMessage, detail, cause);
    }

    public PermanentProcessingException(String userMessage, String detail) {
        this(userMessage, detail, null);
    }

    @Override public boolean retryable() { return false; }
}
