package io.github.yok.dataporter.copy;

import com.google.common.base.Preconditions;
import io.github.yok.dataporter.CommandLineOptions;
import io.github.yok.dataporter.config.TableCopyConfig;
import io.github.yok.dataporter.db.TableName;
import lombok.Builder;
import lombok.Value;

/**
 * Options of the {@code table-copy} command.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class TableCopyOptions {

    String sourceConnectionId;
    TableName sourceTable;
    String targetConnectionId;
    TableName targetTable;
    // Rows per fetch and per insert batch
    int batchSize;

    /**
     * Builds the options from the command line.
     *
     * @param options parsed command line
     * @param config table copy settings supplying the default batch size
     * @return options
     * @throws IllegalArgumentException if a required option is missing or the batch size is not
     *         positive
     */
    public static TableCopyOptions from(CommandLineOptions options, TableCopyConfig config) {
        int batchSize = options.getInt("batch-size", config.getBatchSize());
        Preconditions.checkArgument(batchSize > 0, "--batch-size must be positive: %s",
                batchSize);
        return TableCopyOptions.builder()
                .sourceConnectionId(options.require("source-connection"))
                .sourceTable(TableName.parse(options.require("source-table")))
                .targetConnectionId(options.require("target-connection"))
                .targetTable(TableName.parse(options.require("target-table")))
                .batchSize(batchSize).build();
    }
}
