package net.layerline.adapter.http.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.layerline.adapter.http.JsonHttp;
import net.layerline.core.error.PermanentProcessingException;
import net.layerline.core.model.JobType;
import net.layerline.core.spi.ProcessorRequest;
import net.layerline.core.spi.ProcessorResult;
import net.layerline.core.spi.SyncProcessor;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * STL 업로드 + 슬라이싱을 한 번의 요청으로 처리하는 서버.
 * <pre>
 * POST {base}/v1/process/upload-stl-and-slice (multipart)
 *   model_file, cura_settings_json, printer_definition_json
 *   -> {status: ok|error, data:{gcode_url, ...}, error}
 * </pre>
 */
public final class SlicingProcessor implements SyncProcessor {
    public static final String PARAM_CURA_SETTINGS = "curaSettings";
    public static final String PARAM_PRINTER_DEFINITION = "printerDefinition";
    public static final String PARAM_FILE_NAME = "fileName";

    static final String SLICE_FAILED_MESSAGE = "The model could not be sliced";
    private static final MediaType STL = MediaType.get("application/octet-stream");

    private final JsonHttp http;
    private final OkHttpClient downloads;
    private final HttpUrl base;

    /**
     * @param http      슬라이싱 요청용 (read timeout 을 길게)
     * @param downloads 원격 staging 위치에서 STL 을 받을 때
     */
    public SlicingProcessor(JsonHttp http, OkHttpClient downloads, String baseUrl) {
        this.http = http;
        this.downloads = downloads;
        this.base = HttpUrl.get(baseUrl);
    }

    @Override public JobType type() { return JobType.SLICING; }

    @Override
    public ProcessorResult process(ProcessorRequest request) throws Exception {
        if (request.stagedInputUrl() == null) {
            throw new IllegalArgumentException("slicing requires a source model");
        }
        ObjectMapper mapper = http.mapper();
        Map<String, Object> params = request.params();
        String fileName = params.getOrDefault(PARAM_FILE_NAME, request.resourceKey().sourceId() + ".stl").toString();

        var form = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("model_file", fileName, modelBody(request.stagedInputUrl()));
        if (params.get(PARAM_CURA_SETTINGS) != null) {
            form.addFormDataPart("cura_settings_json", mapper.writeValueAsString(params.get(PARAM_CURA_SETTINGS)));
        }
        if (params.get(PARAM_PRINTER_DEFINITION) != null) {
            form.addFormDataPart("printer_definition_json", mapper.writeValueAsString(params.get(PARAM_PRINTER_DEFINITION)));
        }

        HttpUrl url = base.newBuilder().addPathSegments("v1/process/upload-stl-and-slice").build();
        JsonNode json = http.execute(new Request.Builder().url(url).post(form.build()).build());

        JsonNode data = json.path("data");
        String gcodeUrl = ProviderUrls.absolute(base, ProviderUrls.text(data, "gcode_url"));
        if (!"ok".equalsIgnoreCase(ProviderUrls.text(json, "status")) || gcodeUrl == null) {
            throw new PermanentProcessingException(SLICE_FAILED_MESSAGE,
                    "slicer returned status=" + ProviderUrls.text(json, "status") + " error=" + ProviderUrls.text(json, "error"));
        }

        Map<String, Object> metadata = new HashMap<>();
        putIfPresent(metadata, "task_id", ProviderUrls.text(data, "task_id"));
        if (data.hasNonNull("gcode_metadata")) {
            metadata.put("gcode_metadata", mapper.convertValue(data.get("gcode_metadata"), Map.class));
        }
        if (data.hasNonNull("cura_settings")) {
            metadata.put("cura_settings", mapper.convertValue(data.get("cura_settings"), Map.class));
        }
        return new ProcessorResult(gcodeUrl, Map.of(), metadata);
    }

    /** staging 결과가 로컬 파일이면 그대로, 원격이면 내려받아 올린다 */
    private RequestBody modelBody(String stagedUrl) throws IOException {
        URI uri = URI.create(stagedUrl);
        if ("file".equalsIgnoreCase(uri.getScheme())) {
            return RequestBody.create(new File(uri), STL);
        }
        try (Response r = downloads.newCall(new Request.Builder().url(stagedUrl).get().build()).execute()) {
            if (!r.isSuccessful() || r.body() == null) {
                throw new IOException("staged model unavailable: " + r.code() + " " + stagedUrl);
            }
            return RequestBody.create(r.body().bytes(), STL);
        }
    }

    private static void putIfPresent(Map<String, Object> m, String k, String v) {
        if (v != null) m.put(k, v);
    }
}
