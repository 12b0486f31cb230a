package io.github.yok.dataporter.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * PostgreSQL catalog and DDL operations shared by the JSON loaders.
 *
 * <p>
 * The loaders store one JSON document per row in a table of the form
 * {@code (id SERIAL PRIMARY KEY, jsonb_data JSONB compression lz4, data_source VARCHAR)}. This
 * class checks for, creates, drops and truncates such tables, inspects their relation kind and
 * sizes, and builds the insert statements.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class PostgresTableOperations {

    /**
     * {@code pg_class.relkind} of a partitioned table.
     */
    public static final String RELKIND_PARTITIONED = "p";

    /**
     * Returns whether the table exists according to {@code information_schema.tables}.
     *
     * @param conn JDBC connection
     * @param table table name
     * @return {@code true} when the table exists
     * @throws SQLException on SQL error
     */
    public boolean tableExists(Connection conn, TableName table) throws SQLException {
        String sql = table.isQualified()
                ? "SELECT EXISTS (SELECT 1 FROM information_schema.tables"
                        + " WHERE table_schema = ? AND table_name = ?)"
                : "SELECT EXISTS (SELECT 1 FROM information_schema.tables WHERE table_name = ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            if (table.isQualified()) {
                ps.setString(idx++, table.getSchema());
            }
            ps.setString(idx, table.getTable());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    /**
     * Creates the JSONB document table and commits.
     *
     * @param conn JDBC connection
     * @param table table name
     * @throws SQLException on SQL error
     */
    public void createJsonbTable(Connection conn, TableName table) throws SQLException {
        execute(conn, "CREATE TABLE " + table.qualified() + " (id SERIAL PRIMARY KEY,"
                + " jsonb_data JSONB compression lz4, data_source VARCHAR)");
        conn.commit();
        log.info("Table {} created.", table);
    }

    /**
     * Creates the JSONB document table when it does not exist yet.
     *
     * @param conn JDBC connection
     * @param table table name
     * @return {@code true} when the table was created
     * @throws SQLException on SQL error
     */
    public boolean createJsonbTableIfMissing(Connection conn, TableName table)
            throws SQLException {
        if (tableExists(conn, table)) {
            log.debug("Table {} already exists", table);
            return false;
        }
        createJsonbTable(conn, table);
        return true;
    }

    /**
     * Drops the table if it exists and commits.
     *
     * @param conn JDBC connection
     * @param table table name
     * @throws SQLException on SQL error
     */
    public void dropTable(Connection conn, TableName table) throws SQLException {
        log.info("Dropping table: {}", table);
        execute(conn, "DROP TABLE IF EXISTS " + table.qualified());
        conn.commit();
    }

    /**
     * Truncates the table. The caller commits.
     *
     * @param conn JDBC connection
     * @param table table name
     * @throws SQLException on SQL error
     */
    public void truncateTable(Connection conn, TableName table) throws SQLException {
        log.info("Truncating table: {}", table);
        execute(conn, "TRUNCATE TABLE " + table.qualified());
    }

    /**
     * Looks up {@code pg_class.relkind} of the table ({@code r} for a plain table, {@code p} for a
     * partitioned one).
     *
     * @param conn JDBC connection
     * @param table table name
     * @return relation kind, or empty if the relation is not found
     * @throws SQLException on SQL error
     */
    public Optional<String> relationKind(Connection conn, TableName table) throws SQLException {
        String sql = table.isQualified()
                ? "SELECT relkind FROM pg_class"
                        + " WHERE relnamespace::regnamespace::text = ? AND relname = ?"
                : "SELECT relkind FROM pg_class WHERE relname = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            if (table.isQualified()) {
                ps.setString(idx++, table.getSchema());
            }
            ps.setString(idx, table.getTable());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    /**
     * Measures relation, table and index sizes of the table.
     *
     * @param conn JDBC connection
     * @param table table name
     * @return sizes in bytes
     * @throws SQLException on SQL error, including a missing relation
     */
    public TableSizes sizes(Connection conn, TableName table) throws SQLException {
        String sql = "SELECT pg_relation_size(CAST(? AS regclass)),"
                + " pg_table_size(CAST(? AS regclass)), pg_indexes_size(CAST(? AS regclass))";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, table.qualified());
            ps.setString(2, table.qualified());
            ps.setString(3, table.qualified());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return TableSizes.EMPTY;
                }
                return new TableSizes(rs.getLong(1), rs.getLong(2), rs.getLong(3));
            }
        }
    }

    /**
     * Lists the GIN indexes defined on the table as quoted {@code schema.index} names.
     *
     * @param conn JDBC connection
     * @param table table name
     * @return GIN index names (empty if none)
     * @throws SQLException on SQL error
     */
    public List<String> ginIndexNames(Connection conn, TableName table) throws SQLException {
        String tableFilter = table.isQualified() ? "schemaname||'.'||tablename = ?"
                : "tablename = ?";
        String sql = "SELECT quote_ident(relnamespace::regnamespace::text)||'.'"
                + "||quote_ident(relname) FROM pg_class"
                + " WHERE relnamespace::regnamespace::text||'.'||relname IN ("
                + "SELECT schemaname||'.'||indexname FROM pg_indexes WHERE " + tableFilter
                + " AND indexdef ILIKE '% using gin %')";
        List<String> names = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, table.qualified());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
        }
        return names;
    }

    /**
     * Returns the insert statement for one JSON document.
     *
     * @param table table name
     * @param withDataSource whether the {@code data_source} column is bound as second parameter
     * @return SQL with one or two bind parameters
     */
    public String insertDocumentSql(TableName table, boolean withDataSource) {
        if (withDataSource) {
            return "INSERT INTO " + table.qualified()
                    + " (jsonb_data, data_source) VALUES (CAST(? AS jsonb), ?)";
        }
        return "INSERT INTO " + table.qualified() + " (jsonb_data) VALUES (CAST(? AS jsonb))";
    }

    private void execute(Connection conn, String sql) throws SQLException {
        log.debug("Executing: {}", sql);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
