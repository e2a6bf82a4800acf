package net.layerline.adapter.http;

import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;

/** 요청/응답 요약을 남긴다. 본문은 TRACE 에서만 (산출물 다운로드는 크다) */
public final class LoggingInterceptor implements Interceptor {
    private static final Logger log = LoggerFactory.getLogger(LoggingInterceptor.class);
    private static final long MAX_LOGGED_BODY = 4096;

    @NotNull
    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        long start = System.nanoTime();
        log.debug("-> {} {}", request.method(), request.url());

        Response response;
        try {
            response = chain.proceed(request);
        } catch (SocketTimeoutException e) {
            log.warn("Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsedMs(start));
            throw e;
        } catch (ConnectException e) {
            log.warn("Connection error: {} {} ({}ms): {}", request.method(), request.url(), elapsedMs(start), e.getMessage());
            throw e;
        } catch (IOException e) {
            log.warn("IO error: {} {} ({}ms): {}", request.method(), request.url(), elapsedMs(start), e.toString());
            throw e;
        }

        log.debug("<- {} {} {} ({}ms)", response.code(), request.method(), request.url(), elapsedMs(start));
        if (log.isTraceEnabled()) {
            log.trace("response body: {}", response.peekBody(MAX_LOGGED_BODY).string());
        }
        return response;
    }

    private static long elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
