package io.github.yok.dataporter.explain;

import io.github.yok.dataporter.util.SizeFormatUtil;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Typed fields extracted from one matched plan line.
 *
 * <p>
 * Only the fields belonging to {@link #getKind()} are meaningful; the others keep their zero or
 * {@code null} value. Instances are created through the static factories.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PlanLineMatch {

    PlanLineKind kind;
    // OPERATION
    String label;
    double startMs;
    double endMs;
    long rowCount;
    long loopCount;
    // BUFFERS description, or SORT_METHOD annotation
    String text;
    // HEAP_BLOCKS exact count
    long heapBlocks;
    // PLANNING_TIME / EXECUTION_TIME
    double timeMs;

    static PlanLineMatch operation(String label, double startMs, double endMs, long rowCount,
            long loopCount) {
        return new PlanLineMatch(PlanLineKind.OPERATION, label, startMs, endMs, rowCount,
                loopCount, null, 0L, 0d);
    }

    static PlanLineMatch buffers(String description) {
        return new PlanLineMatch(PlanLineKind.BUFFERS, null, 0d, 0d, 0L, 0L, description, 0L, 0d);
    }

    static PlanLineMatch heapBlocks(long exact) {
        return new PlanLineMatch(PlanLineKind.HEAP_BLOCKS, null, 0d, 0d, 0L, 0L, null, exact, 0d);
    }

    static PlanLineMatch planningTime(double ms) {
        return new PlanLineMatch(PlanLineKind.PLANNING_TIME, null, 0d, 0d, 0L, 0L, null, 0L, ms);
    }

    static PlanLineMatch executionTime(double ms) {
        return new PlanLineMatch(PlanLineKind.EXECUTION_TIME, null, 0d, 0d, 0L, 0L, null, 0L, ms);
    }

    /**
     * Creates a sort-method match whose text is the display annotation
     * {@code "\n<method> <target>\n<formatted size>"}.
     *
     * @param method sort method, e.g. {@code external merge}
     * @param target {@code Memory} or {@code Disk}
     * @param size raw size, e.g. {@code 4096kB}
     * @return sort-method match
     */
    static PlanLineMatch sortMethod(String method, String target, String size) {
        String annotation =
                "\n" + method + " " + target + "\n" + SizeFormatUtil.formatSize(size);
        return new PlanLineMatch(PlanLineKind.SORT_METHOD, null, 0d, 0d, 0L, 0L, annotation, 0L,
                0d);
    }
}
