package io.github.yok.dataporter.explain;

import java.util.Optional;
import lombok.Value;

/**
 * One plan node with its measured timing, as reported by {@code EXPLAIN ANALYZE}.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ParsedOperation {

    /**
     * Label of the entry synthesized from the {@code Execution Time} line.
     */
    public static final String TOTAL_EXECUTION_TIME = "Total Execution Time";

    // Node description, e.g. "Seq Scan on orders"
    String label;
    // actual time=<start>..
    double startMs;
    // actual time=..<end>
    double endMs;
    long rowCount;
    long loopCount;
    // Sort method annotation, or "" when none
    String sortAnnotation;

    /**
     * Creates the entry that spans the whole execution.
     *
     * @param executionTimeMs total execution time
     * @return synthesized entry labeled {@link #TOTAL_EXECUTION_TIME}
     */
    public static ParsedOperation totalExecutionTime(double executionTimeMs) {
        return new ParsedOperation(TOTAL_EXECUTION_TIME, 0d, executionTimeMs, 0L, 1L, "");
    }

    /**
     * Returns a copy carrying the given sort annotation.
     *
     * @param annotation formatted sort method text
     * @return annotated copy
     */
    ParsedOperation withSortAnnotation(String annotation) {
        return new ParsedOperation(label, startMs, endMs, rowCount, loopCount, annotation);
    }

    /**
     * Returns whether this entry was synthesized from the {@code Execution Time} line.
     *
     * @return {@code true} for the total execution time entry
     */
    public boolean isTotalExecutionTime() {
        return TOTAL_EXECUTION_TIME.equals(label);
    }

    /**
     * Returns the sort annotation when one was attached.
     *
     * @return annotation, or empty
     */
    public Optional<String> findSortAnnotation() {
        return sortAnnotation.isEmpty() ? Optional.empty() : Optional.of(sortAnnotation);
    }
}
