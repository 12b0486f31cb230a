package io.github.yok.dataporter.db;

import lombok.Value;

/**
 * On-disk sizes of a PostgreSQL table in bytes, as reported by {@code pg_relation_size},
 * {@code pg_table_size} and {@code pg_indexes_size}.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class TableSizes {

    /**
     * Sizes used when the relation could not be measured.
     */
    public static final TableSizes EMPTY = new TableSizes(0L, 0L, 0L);

    long relationSize;
    long tableSize;
    long indexesSize;
}
