package net.layerline.adapter.http.storage;

import net.layerline.core.spi.ArtifactStorage;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * 로컬 디렉터리를 내구 저장소로 쓰는 구현.
 * stage: root/staging 아래로 내려받고 file: URI 를 돌려준다 (이미 root 아래면 그대로).
 * persist: root/{objectKey} 로 내려받는다. 같은 key 는 덮어쓴다.
 */
public final class LocalArtifactStorage implements ArtifactStorage {
    private static final Logger log = LoggerFactory.getLogger(LocalArtifactStorage.class);

    private final OkHttpClient client;
    private final Path root;

    public LocalArtifactStorage(OkHttpClient client, Path root) {
        this.client = client;
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() { return root; }

    @Override
    public String stage(String sourceUrl) throws IOException {
        URI uri = URI.create(sourceUrl);
        if ("file".equalsIgnoreCase(uri.getScheme())) {
            Path p = Path.of(uri).toAbsolutePath().normalize();
            if (p.startsWith(root)) return p.toUri().toString();
        }
        Path target = root.resolve("staging").resolve(UUID.randomUUID() + extension(uri.getPath()));
        copy(sourceUrl, target);
        log.debug("staged {} -> {}", sourceUrl, target);
        return target.toUri().toString();
    }

    @Override
    public String persist(String remoteUrl, String objectKey) throws IOException {
        Path target = root.resolve(objectKey).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("object key escapes storage root: " + objectKey);
        }
        copy(remoteUrl, target);
        log.debug("persisted {} -> {}", remoteUrl, target);
        return target.toUri().toString();
    }

    private void copy(String url, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = target.resolveSibling(target.getFileName() + ".part");
        URI uri = URI.create(url);
        if ("file".equalsIgnoreCase(uri.getScheme())) {
            Files.copy(Path.of(uri), tmp, StandardCopyOption.REPLACE_EXISTING);
        } else {
            try (Response r = client.newCall(new Request.Builder().url(url).get().build()).execute()) {
                ResponseBody body = r.body();
                if (!r.isSuccessful() || body == null) {
                    throw new IOException("download failed: " + r.code() + " " + url);
                }
                try (InputStream in = body.byteStream()) {
                    Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
        // 부분 파일이 최종 경로에 보이지 않도록
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static String extension(String path) {
        if (path == null) return "";
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash || path.length() - dot > 7) return "";
        return path.substring(dot);
    }
}
