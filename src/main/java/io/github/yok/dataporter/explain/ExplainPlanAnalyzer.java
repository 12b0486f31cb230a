package io.github.yok.dataporter.explain;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

/**
 * Turns PostgreSQL {@code EXPLAIN ANALYZE} text output into a {@link PlanSummary}.
 *
 * <p>
 * The analysis is a reverse scan followed by forward assembly: lines are visited from the last to
 * the first, each line is classified by {@link PlanLineParser}, and matches are fed in that order
 * to a fresh {@link TimelineBuilder}, so the first operation of the report ends up last.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class ExplainPlanAnalyzer {

    private final PlanLineParser parser = new PlanLineParser();

    /**
     * Reads and analyzes a report file. The file is decoded as UTF-8; malformed bytes are replaced
     * rather than rejected.
     *
     * @param file report file
     * @return plan summary
     * @throws IOException if the file cannot be read
     */
    public PlanSummary analyze(Path file) throws IOException {
        List<String> lines;
        try {
            lines = FileUtils.readLines(file.toFile(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IOException("Cannot read file: " + file, e);
        }
        log.debug("Read {} lines from {}", lines.size(), file);
        return analyze(lines);
    }

    /**
     * Analyzes report lines given in report order.
     *
     * @param lines report lines, top to bottom
     * @return plan summary
     */
    public PlanSummary analyze(List<String> lines) {
        TimelineBuilder builder = new TimelineBuilder();
        scanInReverse(lines, builder);
        return builder.build();
    }

    private void scanInReverse(List<String> lines, TimelineBuilder builder) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            parser.parse(lines.get(i)).ifPresent(builder::accept);
        }
    }
}
