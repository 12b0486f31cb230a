package io.github.yok.dataporter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code gharchive} section in {@code application.yml}.
 *
 * <pre>
 * gharchive:
 *   base-url: https://data.gharchive.org
 *   table-name: public.github_events_2023
 *   download-dir: /tmp
 *   timeout-seconds: 300
 *   progress-interval: 25000
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "gharchive")
@Data
public class GhArchiveConfig {

    // Base URL of the hourly archive files
    private String baseUrl = "https://data.gharchive.org";

    // Target table used when --table is omitted
    private String tableName = "public.github_events_2023";

    // Directory for the temporary downloaded archives
    private String downloadDir = System.getProperty("java.io.tmpdir");

    // HTTP call timeout for one archive download
    private long timeoutSeconds = 300;

    // A progress line is logged every N processed rows
    private int progressInterval = 25_000;
}
