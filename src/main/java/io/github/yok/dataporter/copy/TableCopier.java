package io.github.yok.dataporter.copy;

import io.github.yok.dataporter.db.ConnectionFactory;
import io.github.yok.dataporter.db.TableName;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs the {@code table-copy} command: copies every row of a table from one database to another.
 *
 * <p>
 * The source is read with a forward-only cursor fetching {@code batchSize} rows at a time. The
 * target table is created from the source column metadata when it does not exist. Rows are
 * inserted with JDBC batches of {@code batchSize} and committed after each batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableCopier {

    private final ConnectionFactory connectionFactory;

    /**
     * Executes the command.
     *
     * @param options command options
     * @return number of copied rows
     * @throws SQLException on any database failure
     */
    public long execute(TableCopyOptions options) throws SQLException {
        log.info("=== table-copy started: [{}] {} -> [{}] {} (batch size {}) ===",
                options.getSourceConnectionId(), options.getSourceTable(),
                options.getTargetConnectionId(), options.getTargetTable(),
                options.getBatchSize());
        try (Connection source = connectionFactory.open(options.getSourceConnectionId());
                Connection target = connectionFactory.open(options.getTargetConnectionId())) {
            long copied = copy(source, target, options);
            log.info("=== table-copy finished: {} rows copied ===", copied);
            return copied;
        }
    }

    /**
     * Copies the rows between two open connections.
     *
     * @param source source connection
     * @param target target connection, auto-commit disabled
     * @param options command options
     * @return number of copied rows
     * @throws SQLException on any database failure
     */
    long copy(Connection source, Connection target, TableCopyOptions options)
            throws SQLException {
        int batchSize = options.getBatchSize();
        try (Statement stmt = source.createStatement(ResultSet.TYPE_FORWARD_ONLY,
                ResultSet.CONCUR_READ_ONLY)) {
            stmt.setFetchSize(batchSize);
            try (ResultSet rs =
                    stmt.executeQuery("SELECT * FROM " + options.getSourceTable().qualified())) {
                List<SourceColumn> columns = SourceColumn.describe(rs.getMetaData());
                log.info("Source columns: {}", columns.stream().map(SourceColumn::getName)
                        .collect(Collectors.toList()));
                return write(target, options.getTargetTable(), columns, resultSetRows(rs, columns),
                        batchSize);
            }
        }
    }

    /**
     * Creates the target table when it does not exist and inserts every row read from
     * {@code rows}.
     *
     * @param target target connection, auto-commit disabled
     * @param table target table
     * @param columns column definitions, in row value order
     * @param rows row source
     * @param batchSize rows per insert batch and commit
     * @return number of inserted rows
     * @throws SQLException on any database failure
     */
    public long write(Connection target, TableName table, List<SourceColumn> columns,
            RowReader rows, int batchSize) throws SQLException {
        if (!tableExists(target, table)) {
            createTable(target, table, columns);
        }
        return insertAll(rows, target, table, columns, batchSize);
    }

    /**
     * Returns the {@code CREATE TABLE} statement for the target.
     *
     * @param table target table
     * @param columns source columns
     * @param mapper type mapper of the target database
     * @return DDL
     */
    static String createTableSql(TableName table, List<SourceColumn> columns,
            ColumnTypeMapper mapper) {
        return "CREATE TABLE " + table.qualified() + " (" + columns.stream()
                .map(c -> c.getName() + " " + mapper.toDdl(c)
                        + (c.isNullable() ? "" : " NOT NULL"))
                .collect(Collectors.joining(", ")) + ")";
    }

    /**
     * Returns the parameterized insert statement for the target.
     *
     * @param table target table
     * @param columns source columns
     * @return insert SQL
     */
    static String insertSql(TableName table, List<SourceColumn> columns) {
        return "INSERT INTO " + table.qualified() + " ("
                + columns.stream().map(SourceColumn::getName).collect(Collectors.joining(", "))
                + ") VALUES (" + String.join(", ", Collections.nCopies(columns.size(), "?"))
                + ")";
    }

    private boolean tableExists(Connection conn, TableName table) throws SQLException {
        DatabaseMetaData meta = conn.getMetaData();
        String schemaPattern = table.getSchema() == null ? null
                : foldIdentifier(meta, table.getSchema());
        // Unquoted identifiers are folded to upper case by some databases, lower case by others
        for (String name : List.of(table.getTable(), table.getTable().toUpperCase(Locale.ROOT),
                table.getTable().toLowerCase(Locale.ROOT))) {
            try (ResultSet rs = meta.getTables(null, schemaPattern, name,
                    new String[] {"TABLE", "BASE TABLE"})) {
                if (rs.next()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String foldIdentifier(DatabaseMetaData meta, String identifier)
            throws SQLException {
        if (meta.storesUpperCaseIdentifiers()) {
            return identifier.toUpperCase(Locale.ROOT);
        }
        if (meta.storesLowerCaseIdentifiers()) {
            return identifier.toLowerCase(Locale.ROOT);
        }
        return identifier;
    }

    private void createTable(Connection conn, TableName table, List<SourceColumn> columns)
            throws SQLException {
        ColumnTypeMapper mapper =
                ColumnTypeMapper.forProduct(conn.getMetaData().getDatabaseProductName());
        String ddl = createTableSql(table, columns, mapper);
        log.info("Creating target table: {}", ddl);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
        }
        conn.commit();
    }

    private static RowReader resultSetRows(ResultSet rs, List<SourceColumn> columns) {
        return () -> {
            if (!rs.next()) {
                return null;
            }
            Object[] values = new Object[columns.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = rs.getObject(i + 1);
            }
            return values;
        };
    }

    private long insertAll(RowReader rows, Connection target, TableName table,
            List<SourceColumn> columns, int batchSize) throws SQLException {
        long copied = 0;
        int pending = 0;
        try (PreparedStatement ps = target.prepareStatement(insertSql(table, columns))) {
            Object[] row;
            while ((row = rows.next()) != null) {
                for (int i = 1; i <= columns.size(); i++) {
                    Object value = row[i - 1];
                    if (value == null) {
                        ps.setNull(i, columns.get(i - 1).getJdbcType());
                    } else {
                        ps.setObject(i, value);
                    }
                }
                ps.addBatch();
                pending++;
                if (pending == batchSize) {
                    ps.executeBatch();
                    target.commit();
                    copied += pending;
                    pending = 0;
                    log.info("  {} rows copied", copied);
                }
            }
            if (pending > 0) {
                ps.executeBatch();
                target.commit();
                copied += pending;
            }
        }
        return copied;
    }
}
