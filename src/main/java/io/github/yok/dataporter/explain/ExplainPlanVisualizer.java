package io.github.yok.dataporter.explain;

import io.github.yok.dataporter.config.ExplainConfig;
import java.io.IOException;
import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs the {@code explain} command: analyzes an {@code EXPLAIN ANALYZE} report, logs the summary
 * and renders the timeline image.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExplainPlanVisualizer {

    private final ExplainPlanAnalyzer analyzer;
    private final TimelineChartRenderer renderer;
    private final ExplainConfig explainConfig;

    /**
     * Executes the command.
     *
     * @param options command options
     * @return the analyzed plan
     * @throws IOException if the report cannot be read or the image cannot be written
     */
    public PlanSummary execute(ExplainOptions options) throws IOException {
        log.info("=== explain started (file={}) ===", options.getInputFile());
        PlanSummary summary = analyzer.analyze(options.getInputFile());

        log.info("planning_time: {}", describe(summary.getPlanningTimeMs()));
        log.info("execution_time: {}", describe(summary.getExecutionTimeMs()));
        log.info("parts: {}", summary.getOperations().stream().map(ParsedOperation::getLabel)
                .collect(Collectors.toList()));
        List<String> sortInfo = summary.getOperations().stream()
                .map(ParsedOperation::getSortAnnotation).collect(Collectors.toList());
        log.info("sort_method_info: {}", sortInfo);

        if (options.isRenderChart()) {
            TimelineChartLayout layout =
                    TimelineChartLayout.of(summary, explainConfig.getLabelWrapWidth());
            renderer.render(layout, options.getOutputFile());
        } else {
            log.info("Chart rendering skipped (--no-chart)");
        }
        log.info("=== explain finished ({} operations) ===", summary.getOperations().size());
        return summary;
    }

    private static String describe(OptionalDouble value) {
        return value.isPresent() ? String.valueOf(value.getAsDouble()) : "(not reported)";
    }
}
