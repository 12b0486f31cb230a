package io.github.yok.dataporter.explain;

import io.github.yok.dataporter.CommandLineOptions;
import io.github.yok.dataporter.config.ExplainConfig;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Builder;
import lombok.Value;

/**
 * Options of the {@code explain} command.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class ExplainOptions {

    // EXPLAIN ANALYZE text file (--file)
    Path inputFile;
    // PNG destination (--output, default explain.output-file)
    Path outputFile;
    // false with --no-chart
    boolean renderChart;

    /**
     * Builds the options from the command line.
     *
     * @param options parsed command line
     * @param config explain settings supplying defaults
     * @return options
     * @throws IllegalArgumentException if {@code --file} is missing
     */
    public static ExplainOptions from(CommandLineOptions options, ExplainConfig config) {
        return ExplainOptions.builder().inputFile(Paths.get(options.require("file")))
                .outputFile(Paths.get(options.get("output").orElse(config.getOutputFile())))
                .renderChart(!options.has("no-chart")).build();
    }
}
