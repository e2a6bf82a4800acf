package net.layerline.adapter.http.processor;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.HttpUrl;

/** provider 가 돌려준 상대 경로를 base URL 기준 절대 URL 로 */
final class ProviderUrls {
    private ProviderUrls() {}

    static String absolute(HttpUrl base, String url) {
        if (url == null || url.isBlank()) return null;
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed != null) return parsed.toString();
        HttpUrl resolved = base.resolve(url);
        return resolved == null ? url : resolved.toString();
    }

    static String text(JsonNode node, String field) {
        var v = node.path(field);
        return v.isMissingNode() || v.isNull() ? null : v.asText();
    }
}
