package io.github.yok.dataporter.copy;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * Column of the source query as reported by JDBC metadata.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SourceColumn {
    String name;
    // java.sql.Types constant
    int jdbcType;
    String typeName;
    int precision;
    int scale;
    boolean nullable;

    /**
     * Describes every column of a result set.
     *
     * @param meta result set metadata
     * @return columns in select order
     * @throws SQLException on metadata access failure
     */
    public static List<SourceColumn> describe(ResultSetMetaData meta) throws SQLException {
        List<SourceColumn> columns = new ArrayList<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            columns.add(new SourceColumn(meta.getColumnLabel(i), meta.getColumnType(i),
                    meta.getColumnTypeName(i), meta.getPrecision(i), meta.getScale(i),
                    meta.isNullable(i) != ResultSetMetaData.columnNoNulls));
        }
        return columns;
    }
}
