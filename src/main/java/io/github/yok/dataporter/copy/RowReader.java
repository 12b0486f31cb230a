package io.github.yok.dataporter.copy;

import java.sql.SQLException;

/**
 * Source of rows written by {@link TableCopier#write}.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface RowReader {

    /**
     * Reads the next row.
     *
     * @return values in column order, or {@code null} when there are no more rows
     * @throws SQLException if the source fails
     */
    Object[] next() throws SQLException;
}
