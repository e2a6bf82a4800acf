package net.layerline.adapter.http.processor;

import com.fasterxml.jackson.databind.JsonNode;
import net.layerline.adapter.http.JsonHttp;
import net.layerline.core.error.TransientProcessingException;
import net.layerline.core.model.JobType;
import net.layerline.core.poll.FractionProgressAdapter;
import net.layerline.core.poll.PollOptions;
import net.layerline.core.poll.ProgressAdapter;
import net.layerline.core.poll.ProviderStatus;
import net.layerline.core.spi.PolledProcessor;
import net.layerline.core.spi.ProcessorRequest;
import net.layerline.core.spi.ProcessorResult;
import okhttp3.HttpUrl;
import okhttp3.Request;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * G-code 분석 서버. 결과물은 별도 파일이 아니라 분석 리소스 자체이므로
 * 완료 시 분석 조회 URL 을 primary 로 돌려준다.
 * <pre>
 * POST {base}/api/v1/gcode/analyze        -> {analysis_id, status}
 * GET  {base}/api/v1/gcode/analysis/{id}  -> {status, progress(0..1), progress_message, result, error}
 * </pre>
 */
public final class GcodeAnalysisProcessor implements PolledProcessor {

    // summary_completed 는 요약만 끝난 중간 단계
    private static final ProgressAdapter ADAPTER = new FractionProgressAdapter(
            List.of("queued", "pending", "running", "processing", "summary_completed"),
            List.of("completed", "done", "finished"),
            List.of("failed", "error"));

    private final JsonHttp http;
    private final HttpUrl base;
    private final PollOptions pollOptions;

    public GcodeAnalysisProcessor(JsonHttp http, String baseUrl, PollOptions pollOptions) {
        this.http = http;
        this.base = HttpUrl.get(baseUrl);
        this.pollOptions = pollOptions;
    }

    @Override public JobType type() { return JobType.GCODE_ANALYSIS; }

    @Override
    public String submit(ProcessorRequest request) throws Exception {
        if (request.stagedInputUrl() == null) {
            throw new IllegalArgumentException("G-code analysis requires a source file");
        }
        Map<String, Object> body = new LinkedHashMap<>(request.params());
        URI staged = URI.create(request.stagedInputUrl());
        if ("file".equalsIgnoreCase(staged.getScheme())) {
            body.put("gcode_content", Files.readString(Path.of(staged), StandardCharsets.UTF_8));
        } else {
            body.put("gcode_url", request.stagedInputUrl());
        }

        HttpUrl url = base.newBuilder().addPathSegments("api/v1/gcode/analyze").build();
        JsonNode json = http.execute(new Request.Builder().url(url).post(http.jsonBody(body)).build());
        String analysisId = ProviderUrls.text(json, "analysis_id");
        if (analysisId == null) {
            throw new TransientProcessingException("The processing server sent an unreadable response",
                    "analyze without analysis_id: " + json);
        }
        return analysisId;
    }

    @Override
    public ProviderStatus getStatus(String analysisId) throws Exception {
        HttpUrl url = analysisUrl(analysisId);
        JsonNode json = http.execute(new Request.Builder().url(url).get().build());

        String state = ProviderUrls.text(json, "status");
        Double progress = json.path("progress").isNumber() ? json.path("progress").asDouble() : null;
        ProviderStatus running = ProviderStatus.running(state, progress, ProviderUrls.text(json, "progress_message"));
        switch (ADAPTER.phase(running)) {
            case SUCCEEDED: {
                Map<String, Object> metadata = new HashMap<>();
                metadata.put("analysis_id", analysisId);
                if (json.path("result").isObject()) {
                    metadata.put("result", http.mapper().convertValue(json.get("result"), Map.class));
                }
                return ProviderStatus.succeeded(state, new ProcessorResult(url.toString(), Map.of(), metadata));
            }
            case FAILED:
                return ProviderStatus.failed(state, ProviderUrls.text(json, "error"));
            default:
                return running;
        }
    }

    HttpUrl analysisUrl(String analysisId) {
        return base.newBuilder().addPathSegments("api/v1/gcode/analysis").addPathSegment(analysisId).build();
    }

    @Override public ProgressAdapter progressAdapter() { return ADAPTER; }

    @Override public PollOptions pollOptions() { return pollOptions; }
}
