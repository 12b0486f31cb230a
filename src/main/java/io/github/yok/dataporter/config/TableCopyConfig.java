package io.github.yok.dataporter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code table-copy} section in {@code application.yml}.
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "table-copy")
@Data
public class TableCopyConfig {

    /**
     * Rows fetched and inserted per JDBC batch when {@code --batch-size} is omitted.
     */
    private int batchSize = 1000;
}
