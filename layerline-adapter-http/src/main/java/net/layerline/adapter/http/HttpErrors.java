package net.layerline.adapter.http;

import net.layerline.core.error.PermanentProcessingException;
import net.layerline.core.error.ProcessingException;
import net.layerline.core.error.TransientProcessingException;

/**
 * HTTP 상태를 재시도 가능/불가로 나눈다.
 * 408, 429, 5xx 는 일시적 오류, 나머지 4xx 는 영구 오류.
 */
public final class HttpErrors {
    static final String BUSY_MESSAGE = "The processing server is busy";
    static final String UNAVAILABLE_MESSAGE = "The processing server is unavailable";
    static final String REJECTED_MESSAGE = "The processing server rejected the request";
    static final String AUTH_MESSAGE = "The processing server denied access";
    static final String BAD_RESPONSE_MESSAGE = "The processing server sent an unreadable response";

    private HttpErrors() {}

    public static boolean isRetryable(int code) {
        return code == 408 || code == 429 || code >= 500;
    }

    public static ProcessingException forStatus(int code, String method, String url, String body) {
        String detail = method + " " + url + " -> " + code + (body == null || body.isBlank() ? "" : ": " + abbreviate(body));
        if (code == 408 || code == 429) return new TransientProcessingException(BUSY_MESSAGE, detail);
        if (code >= 500) return new TransientProcessingException(UNAVAILABLE_MESSAGE, detail);
        if (code == 401 || code == 402 || code == 403) return new PermanentProcessingException(AUTH_MESSAGE, detail);
        return new PermanentProcessingException(REJECTED_MESSAGE, detail);
    }

    public static ProcessingException unreadable(String url, Exception cause) {
        return new TransientProcessingException(BAD_RESPONSE_MESSAGE, "unparseable response from " + url, cause);
    }

    static String abbreviate(String s) {
        return s.length() <= 500 ? s : s.substring(0, 500) + "...";
    }
}
