package io.github.yok.dataporter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code json-import} section in {@code application.yml}.
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "json-import")
@Data
public class JsonImportConfig {

    /**
     * HTTP call timeout used when the source is an API URL.
     */
    private long timeoutSeconds = 60;
}
