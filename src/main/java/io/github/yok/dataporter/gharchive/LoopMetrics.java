package io.github.yok.dataporter.gharchive;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.time.DurationFormatUtils;

/**
 * Measurements of one processed hour, written as one row of the runtime CSV file.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class LoopMetrics {

    /**
     * Header of the runtime CSV file.
     */
    public static final String[] HEADER = {"file_name", "unix_timestamp", "loop_start",
            "loop_end", "runtime", "total_run_time_seconds", "relation_size", "table_size",
            "index_size", "rows_inserted", "rows_per_second", "errors"};

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    // Hour label in the command-line format, e.g. 2023-01-01-05
    String fileName;
    long unixTimestamp;
    LocalDateTime loopStart;
    LocalDateTime loopEnd;
    long relationSize;
    long tableSize;
    long indexSize;
    long rowsInserted;
    long errors;

    /**
     * Returns the elapsed time between loop start and end.
     *
     * @return runtime
     */
    public Duration getRuntime() {
        return Duration.between(loopStart, loopEnd);
    }

    /**
     * Returns the runtime in seconds rounded to milliseconds.
     *
     * @return seconds with three decimals
     */
    public BigDecimal getTotalRunTimeSeconds() {
        return BigDecimal.valueOf(getRuntime().toNanos(), 9).setScale(3, RoundingMode.HALF_UP);
    }

    /**
     * Returns the throughput of the hour.
     *
     * @return rows per second with three decimals, zero when the runtime rounds to zero
     */
    public BigDecimal getRowsPerSecond() {
        BigDecimal seconds = getTotalRunTimeSeconds();
        if (seconds.signum() == 0) {
            return BigDecimal.ZERO.setScale(3);
        }
        return BigDecimal.valueOf(rowsInserted).divide(seconds, 3, RoundingMode.HALF_UP);
    }

    /**
     * Returns the CSV record, in {@link #HEADER} order.
     *
     * @return record values
     */
    public List<Object> toRecord() {
        return List.of(fileName, unixTimestamp, TIMESTAMP.format(loopStart),
                TIMESTAMP.format(loopEnd), formatRuntime(getRuntime()), getTotalRunTimeSeconds(),
                relationSize, tableSize, indexSize, rowsInserted, getRowsPerSecond(), errors);
    }

    /**
     * Formats a duration as {@code H:mm:ss.SSS}.
     *
     * @param runtime duration
     * @return formatted text
     */
    public static String formatRuntime(Duration runtime) {
        return DurationFormatUtils.formatDuration(runtime.toMillis(), "H:mm:ss.SSS");
    }
}
