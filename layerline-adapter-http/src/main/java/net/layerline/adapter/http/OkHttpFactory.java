package net.layerline.adapter.http;

import okhttp3.OkHttpClient;

import java.time.Duration;

public final class OkHttpFactory {
    private OkHttpFactory() {}

    /** 공통 client. provider 별 read timeout 은 {@link #withReadTimeout} 로 파생 */
    public static OkHttpClient create(Duration connectTimeout, Duration readTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .addInterceptor(new LoggingInterceptor())
                .build();
    }

    public static OkHttpClient create() {
        return create(Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    /** 커넥션 풀과 dispatcher 는 공유한다 */
    public static OkHttpClient withReadTimeout(OkHttpClient base, Duration readTimeout) {
        return base.newBuilder().readTimeout(readTimeout).build();
    }
}
