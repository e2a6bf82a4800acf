package net.layerline.adapter.http.push;

import net.layerline.adapter.http.JsonHttp;
import net.layerline.core.model.PushMessage;
import net.layerline.core.spi.PushNotifier;
import okhttp3.Request;

import java.util.LinkedHashMap;
import java.util.Map;

/** 종료 알림을 webhook 으로 POST. 실패는 예외로 올리고 삼키는 쪽은 호출자 */
public final class WebhookPushNotifier implements PushNotifier {
    private final JsonHttp http;
    private final String url;

    public WebhookPushNotifier(JsonHttp http, String url) {
        this.http = http;
        this.url = url;
    }

    @Override
    public void send(PushMessage message) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobId", message.jobId());
        body.put("status", message.status().code());
        body.put("summary", message.summary());
        http.execute(new Request.Builder().url(url).post(http.jsonBody(body)).build());
    }
}
