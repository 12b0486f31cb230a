package io.github.yok.dataporter.gharchive;

import io.github.yok.dataporter.config.GhArchiveConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Downloads hourly archive files over HTTP into uniquely named temporary files.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class ArchiveDownloader {

    private final OkHttpClient http;

    /**
     * Creates a downloader whose calls time out after {@code gharchive.timeout-seconds}.
     *
     * @param config archive loader settings
     */
    public ArchiveDownloader(GhArchiveConfig config) {
        this.http = new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(config.getTimeoutSeconds())).build();
    }

    /**
     * Streams the resource at {@code url} into a new temporary file in {@code directory}.
     *
     * <p>
     * The file name starts with the last URL segment so that concurrent runs never share a file.
     * The caller deletes the file.
     * </p>
     *
     * @param url archive URL
     * @param directory directory for the temporary file
     * @return downloaded file
     * @throws ArchiveNotFoundException if the server answers with an error status
     * @throws IOException on any other transfer failure
     */
    public Path download(String url, Path directory) throws IOException {
        Request req = new Request.Builder().url(url).get().build();
        Files.createDirectories(directory);
        String prefix = StringUtils.substringAfterLast(url, "/") + ".";
        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw new ArchiveNotFoundException(url, resp.code());
            }
            ResponseBody body = resp.body();
            if (body == null) {
                throw new IOException("Empty response body for URL " + url);
            }
            Path target = Files.createTempFile(directory, prefix, ".tmp");
            try (InputStream in = body.byteStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                Files.deleteIfExists(target);
                throw e;
            }
            log.info("  downloaded {} ({} bytes)", target, Files.size(target));
            return target;
        }
    }
}
