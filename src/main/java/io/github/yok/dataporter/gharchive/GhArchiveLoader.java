package io.github.yok.dataporter.gharchive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import io.github.yok.dataporter.config.GhArchiveConfig;
import io.github.yok.dataporter.db.ConnectionFactory;
import io.github.yok.dataporter.db.PostgresTableOperations;
import io.github.yok.dataporter.db.TableName;
import io.github.yok.dataporter.db.TableSizes;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.zip.GZIPInputStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs the {@code gharchive} command: downloads hourly GitHub event archives and loads every
 * event into the {@code jsonb_data} column of a PostgreSQL table.
 *
 * <p>
 * For each hour from start to end (inclusive) the archive is downloaded, decompressed and inserted
 * row by row with a commit after every row. A row that fails is skipped and counted. An hour whose
 * archive the server does not have is logged and recorded with zero rows. After each hour the
 * optional GIN inspection script runs, the table sizes are measured and a {@link LoopMetrics} row
 * is appended to the runtime file.
 * </p>
 *
 * <p>
 * When the target table is partitioned, inspection and size measurement address the daily
 * partition {@code <table>_yyyyMMdd}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class GhArchiveLoader {

    private static final DateTimeFormatter URL_HOUR = DateTimeFormatter.ofPattern("yyyy-MM-dd-H");
    private static final DateTimeFormatter PARTITION_DAY = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final ConnectionFactory connectionFactory;
    private final PostgresTableOperations tableOperations;
    private final ArchiveDownloader downloader;
    private final GinIndexInspector ginInspector;
    private final RuntimeMetricsWriter metricsWriter;
    private final GhArchiveConfig config;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Random random;

    /**
     * Creates the loader used by the application.
     *
     * @param connectionFactory opens the target connection
     * @param tableOperations table DDL and catalog queries
     * @param downloader archive downloader
     * @param ginInspector GIN inspection runner
     * @param metricsWriter runtime CSV writer
     * @param config archive loader settings
     */
    @Autowired
    public GhArchiveLoader(ConnectionFactory connectionFactory,
            PostgresTableOperations tableOperations, ArchiveDownloader downloader,
            GinIndexInspector ginInspector, RuntimeMetricsWriter metricsWriter,
            GhArchiveConfig config) {
        this(connectionFactory, tableOperations, downloader, ginInspector, metricsWriter, config,
                Clock.systemDefaultZone(), new Random());
    }

    GhArchiveLoader(ConnectionFactory connectionFactory, PostgresTableOperations tableOperations,
            ArchiveDownloader downloader, GinIndexInspector ginInspector,
            RuntimeMetricsWriter metricsWriter, GhArchiveConfig config, Clock clock,
            Random random) {
        this.connectionFactory = connectionFactory;
        this.tableOperations = tableOperations;
        this.downloader = downloader;
        this.ginInspector = ginInspector;
        this.metricsWriter = metricsWriter;
        this.config = config;
        this.mapper = new ObjectMapper();
        this.clock = clock;
        this.random = random;
    }

    /**
     * Executes the command.
     *
     * @param options command options
     * @return metrics of every processed hour, in processing order
     * @throws IOException if a download fails for a reason other than an HTTP error status, or
     *         the runtime file or inspection script cannot be accessed
     * @throws SQLException on table preparation or measurement failure
     * @throws IllegalArgumentException if {@code gharchive.progress-interval} is not positive
     */
    public List<LoopMetrics> execute(GhArchiveOptions options) throws IOException, SQLException {
        Preconditions.checkArgument(config.getProgressInterval() > 0,
                "gharchive.progress-interval must be positive: %s",
                config.getProgressInterval());
        TableName table = options.getTable();
        log.info("=== gharchive started: {} - {}, table {} ===", options.getStart(),
                options.getEnd(), table);
        EventTransformer transformer =
                new EventTransformer(mapper, random, options.isRandomDrop());
        List<LoopMetrics> results = new ArrayList<>();
        try (Connection conn = connectionFactory.open(options.getConnectionId())) {
            if (options.isDropTable()) {
                tableOperations.dropTable(conn, table);
            }
            tableOperations.createJsonbTableIfMissing(conn, table);
            if (options.isTruncateTable()) {
                tableOperations.truncateTable(conn, table);
                conn.commit();
            }
            metricsWriter.prepare(options.getRuntimeFile(), options.isRewriteRuntimeFile());
            log.debug("Runtimes file: {}", options.getRuntimeFile());

            for (LocalDateTime hour = options.getStart(); !hour.isAfter(options.getEnd());
                    hour = hour.plusHours(1)) {
                LoopMetrics metrics = processHour(conn, hour, options, transformer);
                metricsWriter.append(options.getRuntimeFile(), metrics);
                results.add(metrics);
            }
            conn.commit();
        }
        log.info("=== gharchive finished: {} hour(s) ===", results.size());
        return results;
    }

    /**
     * Returns the archive URL of an hour. GH Archive does not zero-pad the hour.
     *
     * @param hour hour to load
     * @return URL of the gzipped JSON lines file
     */
    String archiveUrl(LocalDateTime hour) {
        return StringUtils.removeEnd(config.getBaseUrl(), "/") + "/" + URL_HOUR.format(hour)
                + ".json.gz";
    }

    /**
     * Returns the relation inspected and measured for an hour.
     *
     * @param conn JDBC connection
     * @param table target table
     * @param hour hour being loaded
     * @return the table itself, or its daily partition when the table is partitioned
     * @throws SQLException on SQL error
     */
    TableName measuredRelation(Connection conn, TableName table, LocalDateTime hour)
            throws SQLException {
        String relkind = tableOperations.relationKind(conn, table).orElse("r");
        log.info("  table type: {}", relkind);
        if (PostgresTableOperations.RELKIND_PARTITIONED.equals(relkind)) {
            TableName partition = table.withSuffix("_" + PARTITION_DAY.format(hour));
            log.info("  partition: {}", partition);
            return partition;
        }
        return table;
    }

    private LoopMetrics processHour(Connection conn, LocalDateTime hour, GhArchiveOptions options,
            EventTransformer transformer) throws IOException, SQLException {
        String label = GhArchiveOptions.HOUR_FORMAT.format(hour);
        String url = archiveUrl(hour);
        log.info("* Processing {}", url);
        TableName target = measuredRelation(conn, options.getTable(), hour);

        RowCounter counter = new RowCounter();
        LocalDateTime loopStart = LocalDateTime.now(clock);
        Path archive = null;
        try {
            archive = downloader.download(url, Paths.get(config.getDownloadDir()));
            loopStart = LocalDateTime.now(clock);
            loadArchive(conn, archive, options, target, transformer, counter);
            conn.commit();
            log.info("  Inserted into {}: {} rows, errors: {}", options.getTable(),
                    counter.rows, counter.errors);
        } catch (ArchiveNotFoundException e) {
            log.warn("  file for {} not found ({})", label, e.getMessage());
        } finally {
            if (archive != null) {
                FileUtils.deleteQuietly(archive.toFile());
            }
        }
        LocalDateTime loopEnd = LocalDateTime.now(clock);
        log.info("  processed in {}", LoopMetrics.formatRuntime(Duration.between(loopStart,
                loopEnd)));

        if (options.getGinInspectionScript() != null) {
            ginInspector.inspect(conn, target, options.getGinInspectionScript(),
                    Duration.between(loopStart, loopEnd));
        }
        TableSizes sizes = tableOperations.sizes(conn, target);
        log.info("  table size: {}", sizes.getTableSize());

        return LoopMetrics.builder().fileName(label)
                .unixTimestamp(hour.atZone(clock.getZone()).toEpochSecond()).loopStart(loopStart)
                .loopEnd(loopEnd).relationSize(sizes.getRelationSize())
                .tableSize(sizes.getTableSize()).indexSize(sizes.getIndexesSize())
                .rowsInserted(counter.rows).errors(counter.errors).build();
    }

    private void loadArchive(Connection conn, Path archive, GhArchiveOptions options,
            TableName target, EventTransformer transformer, RowCounter counter)
            throws IOException, SQLException {
        String sql = tableOperations.insertDocumentSql(options.getTable(), false);
        log.info("  processing {}, table {}", archive, options.getTable());
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new GZIPInputStream(Files.newInputStream(archive)), StandardCharsets.UTF_8));
                PreparedStatement ps = conn.prepareStatement(sql)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (StringUtils.isBlank(line)) {
                    continue;
                }
                counter.rows++;
                if (counter.rows % config.getProgressInterval() == 0) {
                    log.info("  processed {} rows", counter.rows);
                }
                try {
                    ps.setString(1, transformer.transform(line));
                    LocalDateTime insertStart = LocalDateTime.now(clock);
                    ps.executeUpdate();
                    conn.commit();
                    Duration insertCommit =
                            Duration.between(insertStart, LocalDateTime.now(clock));
                    if (options.isGinInspectionAfterInsert()) {
                        log.info("GIN inspection: after {} rows inserted", counter.rows);
                        ginInspector.inspect(conn, target, options.getGinInspectionScript(),
                                insertCommit);
                    }
                } catch (JsonProcessingException | SQLException e) {
                    log.warn("  Skipping row: {}, Error: {}", counter.rows, e.getMessage());
                    counter.errors++;
                    conn.rollback();
                }
            }
        }
    }

    // Per-hour row and error counts
    private static final class RowCounter {
        private long rows;
        private long errors;
    }
}
