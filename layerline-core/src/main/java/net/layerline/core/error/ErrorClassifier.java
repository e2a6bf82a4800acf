package net.layerline.core.error;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/** 임의의 Throwable 을 재시도 가능/불가 ProcessingException 으로 정규화 */
public final class ErrorClassifier {
    static final String NETWORK_MESSAGE = "A network error occurred while processing";
    static final String TIMEOUT_MESSAGE = "The processing server timed out";
    static final String INVALID_INPUT_MESSAGE = "The job input is invalid";
    static final String UNEXPECTED_MESSAGE = "Processing failed unexpectedly";

    private ErrorClassifier() {}

    public static ProcessingException classify(Throwable t) {
        Throwable e = unwrap(t);
        if (e instanceof ProcessingException pe) return pe;
        if (e instanceof TimeoutException) {
            return new TransientProcessingException(TIMEOUT_MESSAGE, e.toString(), e);
        }
        if (e instanceof IOException || e instanceof UncheckedIOException) {
            return new TransientProcessingException(NETWORK_MESSAGE, e.toString(), e);
        }
        if (e instanceof IllegalArgumentException) {
            return new PermanentProcessingException(INVALID_INPUT_MESSAGE, e.toString(), e);
        }
        return new PermanentProcessingException(UNEXPECTED_MESSAGE, e.toString(), e);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof ExecutionException || cur instanceof CompletionException)
                && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
