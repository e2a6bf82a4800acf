package net.layerline.app;

import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** 슬라이싱/모델 생성/파일 다운로드/push webhook 을 흉내내는 서버 */
final class FakeAiServer extends Dispatcher {
    final MockWebServer server = new MockWebServer();
    final List<String> hooks = new CopyOnWriteArrayList<>();
    final AtomicInteger sliceCalls = new AtomicInteger();
    private final Map<String, AtomicInteger> polls = new ConcurrentHashMap<>();

    FakeAiServer() {
        server.setDispatcher(this);
        try {
            server.start();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    String baseUrl() { return server.url("/").toString(); }

    void close() throws IOException { server.shutdown(); }

    @NotNull
    @Override
    public MockResponse dispatch(@NotNull RecordedRequest request) {
        String path = request.getPath() == null ? "" : request.getPath();
        String body = request.getBody().readUtf8();

        if (path.equals("/v1/process/upload-stl-and-slice")) {
            sliceCalls.incrementAndGet();
            if (body.contains("solid broken")) {
                return json("{\"status\":\"error\",\"data\":null,\"error\":\"non-manifold mesh\"}");
            }
            // 동시 제출 검증용으로 조금 늦게 응답
            return json("{\"status\":\"ok\",\"data\":{\"task_id\":\"s-1\",\"gcode_url\":\"/files/s-1.gcode\"}}")
                    .setBodyDelay(200, java.util.concurrent.TimeUnit.MILLISECONDS);
        }
        if (path.startsWith("/v1/process/modelling?")) {
            return json("{\"status\":\"ok\",\"data\":{\"task_id\":\"m-1\"}}");
        }
        if (path.startsWith("/v1/process/modelling/")) {
            String taskId = path.substring(path.lastIndexOf('/') + 1);
            int n = polls.computeIfAbsent(taskId, k -> new AtomicInteger()).incrementAndGet();
            if (n == 1) return json("{\"data\":{\"status\":\"PROCESSING\",\"progress\":20}}");
            if (n == 2) return json("{\"data\":{\"status\":\"PROCESSING\",\"progress\":60}}");
            return json("{\"data\":{\"status\":\"SUCCEEDED\",\"progress\":100,"
                    + "\"glb_download_url\":\"/files/" + taskId + ".glb\","
                    + "\"thumbnail_download_url\":\"/files/missing.png\"}}");
        }
        if (path.equals("/files/s-1.gcode")) return new MockResponse().setBody("G28\nG1 X10\n");
        if (path.equals("/files/m-1.glb")) return new MockResponse().setBody("glTF");
        if (path.equals("/hooks/jobs")) {
            hooks.add(body);
            return json("{}");
        }
        return new MockResponse().setResponseCode(404);
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
