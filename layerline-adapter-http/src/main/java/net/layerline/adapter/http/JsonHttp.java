package net.layerline.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.layerline.core.error.ProcessingException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/** JSON 요청/응답 한 번. 네트워크 오류는 IOException 그대로, HTTP 오류는 분류된 예외 */
public final class JsonHttp {
    public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public JsonHttp(OkHttpClient client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    public ObjectMapper mapper() { return mapper; }

    public RequestBody jsonBody(Object value) throws JsonProcessingException {
        return RequestBody.create(mapper.writeValueAsBytes(value), JSON);
    }

    public JsonNode execute(Request request) throws IOException, ProcessingException {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw HttpErrors.forStatus(response.code(), request.method(), request.url().toString(), text);
            }
            try {
                return mapper.readTree(text);
            } catch (JsonProcessingException e) {
                throw HttpErrors.unreadable(request.url().toString(), e);
            }
        }
    }
}
