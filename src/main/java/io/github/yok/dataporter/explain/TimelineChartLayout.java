package io.github.yok.dataporter.explain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import lombok.Value;
import org.apache.commons.text.WordUtils;

/**
 * Presentation values derived from a {@link PlanSummary}, independent of the drawing backend.
 *
 * <p>
 * Each operation occupies one y position, equal to its index in
 * {@link PlanSummary#getOperations()}. When the first operation is the synthesized total execution
 * time entry it keeps its y position but is not plotted. Bubble areas are proportional to the row
 * count relative to the largest row count, with {@value #MAX_BUBBLE_AREA} for the largest.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class TimelineChartLayout {

    /**
     * Bubble area (in points squared) of the operation with the most rows.
     */
    public static final double MAX_BUBBLE_AREA = 1000d;

    /**
     * Space added to the right of the latest end time on the x axis.
     */
    public static final double X_PADDING_MS = 100d;

    /**
     * One plotted operation.
     */
    @Value
    public static class Entry {
        // y position (index in the operation list)
        int position;
        String label;
        double startMs;
        double endMs;
        long rowCount;
        long loopCount;
        double bubbleArea;
        String bubbleText;
        String sortAnnotation;

        /**
         * Returns the middle of the time span, where the annotation and bubble are placed.
         *
         * @return midpoint in milliseconds
         */
        public double getMidMs() {
            return (startMs + endMs) / 2d;
        }
    }

    // Number of y positions
    int positionCount;
    double xMaxMs;
    List<Entry> entries;
    // Wrapped y tick labels, one per y position
    List<List<String>> tickLabels;
    OptionalDouble planningTimeMs;
    OptionalDouble executionTimeMs;

    /**
     * Computes the layout of a summary.
     *
     * @param summary analyzed plan
     * @param labelWrapWidth column at which y tick labels are wrapped
     * @return layout
     */
    public static TimelineChartLayout of(PlanSummary summary, int labelWrapWidth) {
        List<ParsedOperation> ops = summary.getOperations();
        int n = ops.size();
        long maxRows = ops.stream().mapToLong(ParsedOperation::getRowCount).max().orElse(0L);
        double maxEnd = ops.stream().mapToDouble(ParsedOperation::getEndMs).max().orElse(0d);

        List<Entry> entries = new ArrayList<>();
        List<List<String>> tickLabels = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            ParsedOperation op = ops.get(i);
            tickLabels.add(wrap(op.getLabel(), labelWrapWidth));
            if (i == 0 && op.isTotalExecutionTime()) {
                continue;
            }
            double area = maxRows == 0L ? 0d : MAX_BUBBLE_AREA * op.getRowCount() / maxRows;
            entries.add(new Entry(i, op.getLabel(), op.getStartMs(), op.getEndMs(),
                    op.getRowCount(), op.getLoopCount(), area, bubbleText(ops, i),
                    op.getSortAnnotation()));
        }
        return new TimelineChartLayout(n, maxEnd + X_PADDING_MS,
                Collections.unmodifiableList(entries), Collections.unmodifiableList(tickLabels),
                summary.getPlanningTimeMs(), summary.getExecutionTimeMs());
    }

    /**
     * Returns the plotted entries in legend order (top y position first).
     *
     * @return entries, reversed
     */
    public List<Entry> legendEntries() {
        List<Entry> reversed = new ArrayList<>(entries);
        Collections.reverse(reversed);
        return reversed;
    }

    private static String bubbleText(List<ParsedOperation> ops, int i) {
        int n = ops.size();
        if (i < n - 1) {
            ParsedOperation op = ops.get(i);
            return String.format(Locale.US, "rows: %,d\nloops: %,d", op.getRowCount(),
                    op.getLoopCount());
        }
        // Top node of the report; the total is read from the entry before it
        ParsedOperation source = n >= 2 ? ops.get(n - 2) : ops.get(n - 1);
        return String.format(Locale.US, "Total rows: %,d", source.getRowCount());
    }

    static List<String> wrap(String label, int width) {
        String wrapped = WordUtils.wrap(label, width, "\n", true);
        return List.copyOf(Arrays.asList(wrapped.split("\n")));
    }
}
