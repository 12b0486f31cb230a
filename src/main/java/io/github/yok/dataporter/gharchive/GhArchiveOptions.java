package io.github.yok.dataporter.gharchive;

import io.github.yok.dataporter.CommandLineOptions;
import io.github.yok.dataporter.config.GhArchiveConfig;
import io.github.yok.dataporter.db.TableName;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import lombok.Builder;
import lombok.Value;

/**
 * Options of the {@code gharchive} command.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class GhArchiveOptions {

    /**
     * Format of {@code --start} and {@code --end}.
     */
    public static final DateTimeFormatter HOUR_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd-HH");

    LocalDateTime start;
    LocalDateTime end;
    Path runtimeFile;
    String connectionId;
    TableName table;
    boolean rewriteRuntimeFile;
    // null when no inspection is requested
    Path ginInspectionScript;
    boolean ginInspectionAfterInsert;
    boolean truncateTable;
    boolean dropTable;
    boolean randomDrop;

    /**
     * Builds the options from the command line.
     *
     * @param options parsed command line
     * @param config archive loader settings supplying the default table
     * @return options
     * @throws IllegalArgumentException if a required option is missing or malformed, or if
     *         {@code --gin-inspection-after-insert} is given without a script
     */
    public static GhArchiveOptions from(CommandLineOptions options, GhArchiveConfig config) {
        boolean afterInsert = options.has("gin-inspection-after-insert");
        Path script = options.get("gin-inspection-script").map(Paths::get).orElse(null);
        if (afterInsert && script == null) {
            throw new IllegalArgumentException("You requested GIN index inspection after each"
                    + " insert but GIN inspection script is not set!");
        }
        return GhArchiveOptions.builder().start(parseHour(options.require("start")))
                .end(parseHour(options.require("end")))
                .runtimeFile(Paths.get(options.require("runtime-file")))
                .connectionId(options.require("connection"))
                .table(TableName.parse(options.get("table").orElse(config.getTableName())))
                .rewriteRuntimeFile(options.has("rewrite-runtime-file"))
                .ginInspectionScript(script).ginInspectionAfterInsert(afterInsert)
                .truncateTable(options.has("truncate-table")).dropTable(options.has("drop-table"))
                .randomDrop(options.has("random-drop")).build();
    }

    static LocalDateTime parseHour(String text) {
        try {
            return LocalDateTime.parse(text.trim(), HOUR_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "Invalid hour '" + text + "', expected YYYY-MM-DD-HH", e);
        }
    }
}
