package io.github.yok.dataporter.explain;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Accumulates matched plan lines into a {@link PlanSummary}.
 *
 * <p>
 * Lines must be fed in reverse report order. A {@code Sort Method} line annotates the operation
 * printed directly after it in the report, which is the operation fed most recently. Lines that
 * are not operations (buffers, heap blocks, times) do not break that link. A {@code Sort Method}
 * line with no operation below it is dropped. When two {@code Sort Method} lines share an
 * operation, the upper one wins.
 * </p>
 *
 * <p>
 * Instances are single use and not thread-safe.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TimelineBuilder {

    private final List<ParsedOperation> operations = new ArrayList<>();
    private final List<String> buffers = new ArrayList<>();
    private final List<Long> heapBlocks = new ArrayList<>();
    // Index in operations of the last fed plan node, -1 before the first one
    private int lastOperationIndex = -1;
    private Double planningTimeMs;
    private Double executionTimeMs;

    /**
     * Feeds one matched line.
     *
     * @param match matched line
     * @return this builder
     */
    public TimelineBuilder accept(PlanLineMatch match) {
        switch (match.getKind()) {
            case OPERATION:
                operations.add(new ParsedOperation(match.getLabel(), match.getStartMs(),
                        match.getEndMs(), match.getRowCount(), match.getLoopCount(), ""));
                lastOperationIndex = operations.size() - 1;
                break;
            case BUFFERS:
                buffers.add(match.getText());
                break;
            case HEAP_BLOCKS:
                heapBlocks.add(match.getHeapBlocks());
                break;
            case PLANNING_TIME:
                if (planningTimeMs != null) {
                    log.debug("Planning Time seen again; {} replaces {}", match.getTimeMs(),
                            planningTimeMs);
                }
                planningTimeMs = match.getTimeMs();
                break;
            case EXECUTION_TIME:
                if (executionTimeMs != null) {
                    log.debug("Execution Time seen again; {} replaces {}", match.getTimeMs(),
                            executionTimeMs);
                }
                executionTimeMs = match.getTimeMs();
                operations.add(ParsedOperation.totalExecutionTime(executionTimeMs));
                break;
            case SORT_METHOD:
                if (lastOperationIndex < 0) {
                    log.debug("Sort Method line without an operation below it dropped: {}",
                            match.getText());
                    break;
                }
                operations.set(lastOperationIndex,
                        operations.get(lastOperationIndex).withSortAnnotation(match.getText()));
                break;
            default:
                throw new IllegalArgumentException("Unsupported line kind: " + match.getKind());
        }
        return this;
    }

    /**
     * Returns an immutable snapshot of everything fed so far.
     *
     * @return plan summary
     */
    public PlanSummary build() {
        return new PlanSummary(planningTimeMs, executionTimeMs, operations, buffers, heapBlocks);
    }
}
