package io.github.yok.dataporter.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds the named database connections from {@code application.yml}.
 *
 * <p>
 * Commands select an entry with {@code --connection <id>}. An entry may give a full JDBC URL or,
 * for PostgreSQL, the {@code host}/{@code port}/{@code dbname} triple used by the connection files
 * of the loader scripts.
 * </p>
 *
 * <pre>
 * connections:
 *   - id: pg
 *     host: localhost
 *     port: 5432
 *     dbname: github
 *     user: postgres
 *     password: postgres
 *   - id: mssql
 *     url: jdbc:sqlserver://localhost:1433;databaseName=master;trustServerCertificate=true
 *     user: sa
 *     password: secret
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections = new ArrayList<>();

    /**
     * Looks up a connection entry by its ID (case-insensitive).
     *
     * @param id connection ID
     * @return matching entry, or empty when no entry has that ID
     */
    public Optional<Entry> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return connections.stream().filter(e -> id.equalsIgnoreCase(e.getId())).findFirst();
    }

    /**
     * Inner class that holds one DB connection setting.
     */
    @Data
    public static class Entry {
        // Logical ID of the connection (e.g., "pg")
        private String id;
        // JDBC URL; when blank the URL is composed from host/port/dbname
        private String url;
        // PostgreSQL host name
        private String host = "localhost";
        // PostgreSQL port
        private int port = 5432;
        // PostgreSQL database name
        private String dbname;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name (optional; JDBC 4 auto-loading otherwise)
        private String driverClass;

        /**
         * Returns the JDBC URL of this entry.
         *
         * @return configured URL, or {@code jdbc:postgresql://host:port/dbname}
         * @throws IllegalStateException if neither a URL nor a database name is configured
         */
        public String resolveUrl() {
            if (StringUtils.isNotBlank(url)) {
                return url;
            }
            if (StringUtils.isBlank(dbname)) {
                throw new IllegalStateException(
                        "Connection '" + id + "' needs either 'url' or 'dbname'.");
            }
            return "jdbc:postgresql://" + host + ":" + port + "/" + dbname;
        }
    }
}
