package io.github.yok.dataporter.db;

import io.github.yok.dataporter.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Opens JDBC connections for the entries configured in {@link ConnectionConfig}.
 *
 * <p>
 * Connections are returned with auto-commit disabled; every command commits explicitly.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionFactory {

    private final ConnectionConfig connectionConfig;

    /**
     * Opens a connection for the entry with the given ID.
     *
     * @param connectionId ID of a {@code connections} entry
     * @return open connection with auto-commit disabled
     * @throws IllegalArgumentException if no entry has that ID
     * @throws SQLException if the driver cannot be loaded or the connection fails
     */
    public Connection open(String connectionId) throws SQLException {
        ConnectionConfig.Entry entry = connectionConfig.find(connectionId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown connection id: " + connectionId));
        return open(entry);
    }

    /**
     * Opens a connection for the given entry.
     *
     * @param entry connection settings
     * @return open connection with auto-commit disabled
     * @throws SQLException if the driver cannot be loaded or the connection fails
     */
    public Connection open(ConnectionConfig.Entry entry) throws SQLException {
        loadDriverIfConfigured(entry.getDriverClass());
        String url = entry.resolveUrl();
        log.info("[{}] Opening connection: {}", entry.getId(), url);
        Connection conn = DriverManager.getConnection(url, entry.getUser(), entry.getPassword());
        conn.setAutoCommit(false);
        return conn;
    }

    /**
     * Loads the JDBC driver class only when one is configured, otherwise relies on JDBC 4
     * auto-loading.
     *
     * @param driverClass fully qualified driver class name, or {@code null}/blank
     * @throws SQLException when the class cannot be found
     */
    static void loadDriverIfConfigured(String driverClass) throws SQLException {
        if (StringUtils.isBlank(driverClass)) {
            return;
        }
        try {
            Class.forName(driverClass);
        } catch (ClassNotFoundException e) {
            throw new SQLException("JDBC driver not found: " + driverClass, e);
        }
    }
}
