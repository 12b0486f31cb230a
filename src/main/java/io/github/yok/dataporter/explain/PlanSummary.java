package io.github.yok.dataporter.explain;

import java.util.List;
import java.util.OptionalDouble;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one pass over an {@code EXPLAIN ANALYZE} report.
 *
 * <p>
 * {@link #getOperations()} is in <em>reverse scan order</em>: the last operation line of the
 * report comes first, and the synthesized {@value ParsedOperation#TOTAL_EXECUTION_TIME} entry sits
 * at the position where the {@code Execution Time} line was reached (usually first, since that
 * line closes the report). The timeline renderer relies on this order.
 * </p>
 *
 * <p>
 * Planning and execution times are absent when the report has no such line.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PlanSummary {

    @Getter(AccessLevel.NONE)
    private final Double planningTimeMs;

    @Getter(AccessLevel.NONE)
    private final Double executionTimeMs;

    private final List<ParsedOperation> operations;

    // Buffers descriptions, kept for reporting only
    private final List<String> buffers;

    // Heap Blocks exact counts, kept for reporting only
    private final List<Long> heapBlocks;

    PlanSummary(Double planningTimeMs, Double executionTimeMs, List<ParsedOperation> operations,
            List<String> buffers, List<Long> heapBlocks) {
        this.planningTimeMs = planningTimeMs;
        this.executionTimeMs = executionTimeMs;
        this.operations = List.copyOf(operations);
        this.buffers = List.copyOf(buffers);
        this.heapBlocks = List.copyOf(heapBlocks);
    }

    /**
     * Returns the planning time.
     *
     * @return planning time in milliseconds, or empty when the report has no such line
     */
    public OptionalDouble getPlanningTimeMs() {
        return planningTimeMs == null ? OptionalDouble.empty() : OptionalDouble.of(planningTimeMs);
    }

    /**
     * Returns the execution time.
     *
     * @return execution time in milliseconds, or empty when the report has no such line
     */
    public OptionalDouble getExecutionTimeMs() {
        return executionTimeMs == null ? OptionalDouble.empty()
                : OptionalDouble.of(executionTimeMs);
    }
}
