package io.github.yok.dataporter.explain;

/**
 * Kinds of lines recognized in {@code EXPLAIN ANALYZE} text output, in matching priority order.
 *
 * @author Yasuharu.Okawauchi
 */
public enum PlanLineKind {
    // "-> Seq Scan on t (cost=...) (actual time=A..B rows=R loops=L)"
    OPERATION,
    // "Buffers: shared hit=..."
    BUFFERS,
    // "Heap Blocks: exact=N"
    HEAP_BLOCKS,
    // "Planning Time: N ms"
    PLANNING_TIME,
    // "Execution Time: N ms"
    EXECUTION_TIME,
    // "Sort Method: quicksort  Memory: 25kB"
    SORT_METHOD
}
