package io.github.yok.dataporter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code dbf-import} section in {@code application.yml}.
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "dbf-import")
@Data
public class DbfImportConfig {

    /**
     * Rows inserted per JDBC batch when {@code --batch-size} is omitted.
     */
    private int batchSize = 1000;

    /**
     * Character set of text fields when {@code --encoding} is omitted. Blank means the code page
     * declared in the DBF header.
     */
    private String encoding;
}
