package net.layerline.adapter.http.processor;

import com.fasterxml.jackson.databind.JsonNode;
import net.layerline.adapter.http.JsonHttp;
import net.layerline.core.error.PermanentProcessingException;
import net.layerline.core.error.TransientProcessingException;
import net.layerline.core.model.JobType;
import net.layerline.core.poll.PercentProgressAdapter;
import net.layerline.core.poll.PollOptions;
import net.layerline.core.poll.ProgressAdapter;
import net.layerline.core.poll.ProviderStatus;
import net.layerline.core.spi.PolledProcessor;
import net.layerline.core.spi.ProcessorRequest;
import net.layerline.core.spi.ProcessorResult;
import okhttp3.HttpUrl;
import okhttp3.Request;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 텍스트/이미지 -> 3D 모델 생성 서버.
 * <pre>
 * POST {base}/v1/process/modelling?async_mode=true   -> {status, data:{task_id}}
 * GET  {base}/v1/process/modelling/{taskId}          -> {data:{status, progress, glb_download_url, ...}}
 * </pre>
 */
public final class ModelGenerationProcessor implements PolledProcessor {
    public static final String ROLE_STL = "stlUrl";
    public static final String ROLE_THUMBNAIL = "thumbnailUrl";

    private final JsonHttp http;
    private final HttpUrl base;
    private final PollOptions pollOptions;
    private final ProgressAdapter adapter = new PercentProgressAdapter();

    public ModelGenerationProcessor(JsonHttp http, String baseUrl, PollOptions pollOptions) {
        this.http = http;
        this.base = HttpUrl.get(baseUrl);
        this.pollOptions = pollOptions;
    }

    @Override public JobType type() { return JobType.MODEL_GENERATION; }

    @Override
    public String submit(ProcessorRequest request) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>(request.params());
        if (request.stagedInputUrl() != null) body.put("image_url", request.stagedInputUrl());

        HttpUrl url = base.newBuilder()
                .addPathSegments("v1/process/modelling")
                .addQueryParameter("async_mode", "true")
                .build();
        JsonNode json = http.execute(new Request.Builder().url(url).post(http.jsonBody(body)).build());

        if ("error".equalsIgnoreCase(ProviderUrls.text(json, "status"))) {
            throw new PermanentProcessingException("The model could not be generated from this input",
                    "modelling submit rejected: " + ProviderUrls.text(json, "error"));
        }
        String taskId = ProviderUrls.text(json.path("data"), "task_id");
        if (taskId == null) {
            throw new TransientProcessingException("The processing server sent an unreadable response",
                    "modelling submit without task_id: " + json);
        }
        return taskId;
    }

    @Override
    public ProviderStatus getStatus(String taskId) throws Exception {
        HttpUrl url = base.newBuilder().addPathSegments("v1/process/modelling").addPathSegment(taskId).build();
        JsonNode data = http.execute(new Request.Builder().url(url).get().build()).path("data");

        String state = ProviderUrls.text(data, "status");
        Double progress = data.path("progress").isNumber() ? data.path("progress").asDouble() : null;
        ProviderStatus running = ProviderStatus.running(state, progress, null);
        if (adapter.phase(running) == ProgressAdapter.Phase.SUCCEEDED) {
            return ProviderStatus.succeeded(state, toResult(taskId, data));
        }
        if (adapter.phase(running) == ProgressAdapter.Phase.FAILED) {
            String error = ProviderUrls.text(data, "error");
            return ProviderStatus.failed(state, error == null ? ProviderUrls.text(data, "message") : error);
        }
        return running;
    }

    /** GLB 가 없으면 download_url 로 대체. 둘 다 없으면 null (결과 없음) */
    private ProcessorResult toResult(String taskId, JsonNode data) {
        String glb = ProviderUrls.absolute(base, ProviderUrls.text(data, "glb_download_url"));
        if (glb == null) glb = ProviderUrls.absolute(base, ProviderUrls.text(data, "download_url"));
        if (glb == null) return null;

        Map<String, String> secondary = new HashMap<>();
        String stl = ProviderUrls.absolute(base, ProviderUrls.text(data, "stl_download_url"));
        String thumb = ProviderUrls.absolute(base, ProviderUrls.text(data, "thumbnail_download_url"));
        if (stl != null) secondary.put(ROLE_STL, stl);
        if (thumb != null) secondary.put(ROLE_THUMBNAIL, thumb);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("task_id", taskId);
        metadata.put("format", "glb");
        return new ProcessorResult(glb, secondary, metadata);
    }

    @Override public ProgressAdapter progressAdapter() { return adapter; }

    @Override public PollOptions pollOptions() { return pollOptions; }
}
