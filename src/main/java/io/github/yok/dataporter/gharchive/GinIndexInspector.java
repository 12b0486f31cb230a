package io.github.yok.dataporter.gharchive;

import io.github.yok.dataporter.db.PostgresTableOperations;
import io.github.yok.dataporter.db.TableName;
import io.github.yok.dataporter.util.SqlTextUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs a user supplied inspection script once per GIN index of a table.
 *
 * <p>
 * Before each run the session settings {@code inspect_gin_index.table_name},
 * {@code inspect_gin_index.index_name}, {@code inspect_gin_index.result_target} ({@code table})
 * and {@code inspect_gin_index.insert_commit_runtime} are set so that the script knows what to
 * inspect and where to store its results. Each run is committed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GinIndexInspector {

    private final PostgresTableOperations tableOperations;

    /**
     * Inspects every GIN index of {@code table}.
     *
     * @param conn JDBC connection
     * @param table table whose indexes are inspected
     * @param script SQL file executed for each index
     * @param insertCommitRuntime runtime reported to the script
     * @return number of inspected indexes
     * @throws IOException if the script cannot be read
     * @throws SQLException on SQL error
     */
    public int inspect(Connection conn, TableName table, Path script, Duration insertCommitRuntime)
            throws IOException, SQLException {
        log.debug("inspect_gin_index: {}", table);
        List<String> indexes = tableOperations.ginIndexNames(conn, table);
        if (indexes.isEmpty()) {
            return 0;
        }
        String sql = Files.readString(script, StandardCharsets.UTF_8);
        String runtime = LoopMetrics.formatRuntime(insertCommitRuntime);
        for (String index : indexes) {
            log.debug("gin_index_name: {}", index);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("SET inspect_gin_index.table_name = "
                        + SqlTextUtil.quoteLiteral(table.qualified()));
                stmt.execute(
                        "SET inspect_gin_index.index_name = " + SqlTextUtil.quoteLiteral(index));
                stmt.execute("SET inspect_gin_index.result_target = 'table'");
                stmt.execute("SET inspect_gin_index.insert_commit_runtime = "
                        + SqlTextUtil.quoteLiteral(runtime));
                stmt.execute(sql);
            }
            conn.commit();
        }
        return indexes.size();
    }
}
