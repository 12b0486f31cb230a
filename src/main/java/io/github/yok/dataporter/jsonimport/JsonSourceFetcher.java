package io.github.yok.dataporter.jsonimport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.dataporter.config.JsonImportConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

/**
 * Reads the JSON document to import from a file or an HTTP API.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class JsonSourceFetcher {

    private final ObjectMapper mapper = new ObjectMapper();
    private final OkHttpClient http;

    /**
     * Creates a fetcher whose HTTP calls time out after {@code json-import.timeout-seconds}.
     *
     * @param config JSON import settings
     */
    public JsonSourceFetcher(JsonImportConfig config) {
        this.http = new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(config.getTimeoutSeconds())).build();
    }

    /**
     * Reads and parses the source.
     *
     * @param source file path or URL
     * @param type kind of source
     * @return parsed document
     * @throws IOException if the source cannot be read, the server answers with an error status
     *         or the content is not JSON
     */
    public JsonNode fetch(String source, SourceType type) throws IOException {
        log.debug("Fetching JSON data from {} ({})", source, type);
        switch (type) {
            case FILE:
                try (Reader reader = Files.newBufferedReader(Paths.get(source),
                        StandardCharsets.UTF_8)) {
                    return mapper.readTree(reader);
                }
            case API:
                return fetchApi(source);
            default:
                throw new IllegalArgumentException("Unsupported source type: " + type);
        }
    }

    private JsonNode fetchApi(String url) throws IOException {
        Request req = new Request.Builder().url(url).get().addHeader("accept", "application/json")
                .build();
        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw new IOException("HTTP " + resp.code() + " for URL " + url);
            }
            ResponseBody body = resp.body();
            if (body == null) {
                throw new IOException("Empty response body for URL " + url);
            }
            try (InputStream in = body.byteStream()) {
                return mapper.readTree(in);
            }
        }
    }
}
