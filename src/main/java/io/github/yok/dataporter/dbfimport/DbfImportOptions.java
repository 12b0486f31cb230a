package io.github.yok.dataporter.dbfimport;

import com.google.common.base.Preconditions;
import io.github.yok.dataporter.CommandLineOptions;
import io.github.yok.dataporter.config.DbfImportConfig;
import io.github.yok.dataporter.db.TableName;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Options of the {@code dbf-import} command.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class DbfImportOptions {

    Path file;
    String connectionId;
    // Defaults to the file name without extension
    TableName table;
    int batchSize;
    // null when the code page of the DBF header is used
    Charset encoding;

    /**
     * Builds the options from the command line.
     *
     * @param options parsed command line
     * @param config DBF import settings supplying the defaults
     * @return options
     * @throws IllegalArgumentException if a required option is missing, the batch size is not
     *         positive or the encoding is unknown
     */
    public static DbfImportOptions from(CommandLineOptions options, DbfImportConfig config) {
        Path file = Paths.get(options.require("file"));
        int batchSize = options.getInt("batch-size", config.getBatchSize());
        Preconditions.checkArgument(batchSize > 0, "--batch-size must be positive: %s",
                batchSize);
        String table = options.get("table").orElseGet(() -> FilenameUtils
                .getBaseName(file.getFileName().toString()).toLowerCase(Locale.ROOT));
        String encoding = options.get("encoding").orElse(config.getEncoding());
        return DbfImportOptions.builder().file(file)
                .connectionId(options.require("connection")).table(TableName.parse(table))
                .batchSize(batchSize)
                .encoding(StringUtils.isBlank(encoding) ? null : Charset.forName(encoding.trim()))
                .build();
    }
}
