package io.github.yok.dataporter.jsonimport;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.yok.dataporter.db.ConnectionFactory;
import io.github.yok.dataporter.db.PostgresTableOperations;
import io.github.yok.dataporter.db.TableName;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Runs the {@code json-import} command.
 *
 * <p>
 * In analyze-only mode the document is only inspected with {@link JsonStructureAnalyzer}.
 * Otherwise the rows found at the structure path are inserted one by one into
 * {@code (jsonb_data, data_source)} of a PostgreSQL table, which is created when missing. Every
 * row is committed on its own; a row that fails is rolled back and counted as an error.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonImporter {

    // JSON escape of the NUL character, rejected by jsonb
    private static final String NUL_ESCAPE = "\\u0000";

    private final JsonSourceFetcher fetcher;
    private final JsonStructureAnalyzer analyzer;
    private final ConnectionFactory connectionFactory;
    private final PostgresTableOperations tableOperations;

    /**
     * Executes the command.
     *
     * @param options command options
     * @return insert counts, or the suggestions in analyze-only mode
     * @throws IOException if the source cannot be read
     * @throws SQLException if the connection or table preparation fails
     */
    public ImportResult execute(JsonImportOptions options) throws IOException, SQLException {
        log.info("****** import of JSON data into PostgreSQL ******");
        log.info("Source: {} ({}), data source name: {}, table: {}", options.getSource(),
                options.getSourceType(), options.getDataSourceName(), options.getTable());
        JsonNode document = fetcher.fetch(options.getSource(), options.getSourceType());
        if (options.isAnalyzeOnly()) {
            return ImportResult.analyzed(analyzer.analyze(document));
        }
        if (StringUtils.isBlank(options.getConnectionId())) {
            log.error("Error: No connection provided.");
            return ImportResult.imported(0L, 0L);
        }
        if (options.getTable() == null) {
            log.error("Error: No table name provided.");
            return ImportResult.imported(0L, 0L);
        }
        List<JsonNode> rows = rowsAt(document, options.getStructurePath());
        try (Connection conn = connectionFactory.open(options.getConnectionId())) {
            tableOperations.createJsonbTableIfMissing(conn, options.getTable());
            return insertRows(conn, options.getTable(), options.getDataSourceName(), rows);
        }
    }

    /**
     * Follows the structure path and returns the rows found there.
     *
     * @param document parsed document
     * @param structurePath object keys, or array indexes, to follow
     * @return array elements, or the node itself when it is an object
     * @throws IllegalArgumentException if a segment does not exist or the node holds no rows
     */
    static List<JsonNode> rowsAt(JsonNode document, List<String> structurePath) {
        JsonNode node = document;
        for (String segment : structurePath) {
            log.debug("Getting part: {}", segment);
            JsonNode next = node.isArray() && StringUtils.isNumeric(segment)
                    ? node.get(Integer.parseInt(segment))
                    : node.get(segment);
            if (next == null) {
                throw new IllegalArgumentException(
                        "Structure path segment '" + segment + "' not found");
            }
            node = next;
        }
        List<JsonNode> rows = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(rows::add);
        } else if (node.isObject()) {
            rows.add(node);
        } else {
            throw new IllegalArgumentException(
                    "No rows at structure path /" + String.join("/", structurePath));
        }
        return rows;
    }

    private ImportResult insertRows(Connection conn, TableName table, String dataSourceName,
            List<JsonNode> rows) throws SQLException {
        log.info("Inserting {} rows...", rows.size());
        long inserted = 0;
        long errors = 0;
        try (PreparedStatement ps =
                conn.prepareStatement(tableOperations.insertDocumentSql(table, true))) {
            for (JsonNode row : rows) {
                try {
                    ps.setString(1, StringUtils.remove(row.toString(), NUL_ESCAPE));
                    ps.setString(2, dataSourceName);
                    ps.executeUpdate();
                    conn.commit();
                    inserted++;
                } catch (SQLException e) {
                    log.debug("Error inserting data: {}, table: {}, row: {}. Error: {}",
                            dataSourceName, table, row, e.getMessage());
                    conn.rollback();
                    errors++;
                }
            }
        }
        log.info("Insert done: inserted: {} / errors: {}", inserted, errors);
        return ImportResult.imported(inserted, errors);
    }
}
