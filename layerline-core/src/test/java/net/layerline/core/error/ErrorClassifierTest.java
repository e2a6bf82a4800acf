package net.layerline.core.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    @Test
    void networkAndTimeout_areRetryable() {
        assertTrue(ErrorClassifier.classify(new IOException("reset")).retryable());
        assertTrue(ErrorClassifier.classify(new TimeoutException()).retryable());
        assertEquals(ErrorClassifier.TIMEOUT_MESSAGE, ErrorClassifier.classify(new TimeoutException()).userMessage());
    }

    @Test
    void wrappersAreUnwrapped() {
        var pe = new PermanentProcessingException("Quota exceeded", "402");
        assertSame(pe, ErrorClassifier.classify(new ExecutionException(new CompletionException(pe))));
    }

    @Test
    void invalidInputAndUnknown_arePermanent() {
        var invalid = ErrorClassifier.classify(new IllegalArgumentException("layerHeight < 0"));
        assertFalse(invalid.retryable());
        assertEquals(ErrorClassifier.INVALID_INPUT_MESSAGE, invalid.userMessage());
        assertFalse(ErrorClassifier.classify(new NullPointerException()).retryable());
    }

    @Test
    void userMessage_hidesTechnicalDetail() {
        var e = ErrorClassifier.classify(new IOException("host 10.0.0.7 unreachable"));
        assertFalse(e.userMessage().contains("10.0.0.7"));
        assertTrue(e.getMessage().contains("10.0.0.7"));
    }
}
