package io.github.yok.dataporter.jsonimport;

import io.github.yok.dataporter.CommandLineOptions;
import io.github.yok.dataporter.db.TableName;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Options of the {@code json-import} command.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class JsonImportOptions {

    // File path or URL
    String source;
    SourceType sourceType;
    // Stored in the data_source column of every row
    String dataSourceName;
    boolean analyzeOnly;
    // Segments of --structure-path; empty when the rows are the document itself
    List<String> structurePath;
    // null when --table is omitted
    TableName table;
    // null when --connection is omitted
    String connectionId;

    /**
     * Builds the options from the command line.
     *
     * @param options parsed command line
     * @return options
     * @throws IllegalArgumentException if a required option is missing or malformed
     */
    public static JsonImportOptions from(CommandLineOptions options) {
        return JsonImportOptions.builder().source(options.require("source"))
                .sourceType(SourceType.from(options.require("data-type")))
                .dataSourceName(options.require("data-source-name"))
                .analyzeOnly(options.has("analyze-only"))
                .structurePath(splitPath(options.get("structure-path").orElse("")))
                .table(options.get("table").map(TableName::parse).orElse(null))
                .connectionId(options.get("connection").orElse(null)).build();
    }

    static List<String> splitPath(String path) {
        return Arrays.stream(StringUtils.split(path, '/')).map(String::trim)
                .filter(StringUtils::isNotEmpty).collect(Collectors.toList());
    }
}
