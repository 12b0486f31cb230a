package io.github.yok.dataporter.dbfimport;

import com.linuxense.javadbf.DBFField;
import io.github.yok.dataporter.copy.SourceColumn;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Converts DBF field definitions and record values to their JDBC counterparts.
 *
 * @author Yasuharu.Okawauchi
 */
final class DbfColumns {

    private DbfColumns() {
    }

    /**
     * Describes the fields of a DBF file as nullable columns.
     *
     * @param fields DBF fields in record order
     * @return columns in record order
     */
    static List<SourceColumn> describe(List<DBFField> fields) {
        List<SourceColumn> columns = new ArrayList<>();
        for (DBFField field : fields) {
            columns.add(toColumn(field));
        }
        return columns;
    }

    static SourceColumn toColumn(DBFField field) {
        String name = field.getName();
        String typeName = field.getType().name();
        int length = field.getLength();
        switch (field.getType()) {
            case NUMERIC:
            case FLOATING_POINT:
                return new SourceColumn(name, Types.NUMERIC, typeName, length,
                        field.getDecimalCount(), true);
            case CURRENCY:
                return new SourceColumn(name, Types.NUMERIC, typeName, 19, 4, true);
            case LONG:
            case AUTOINCREMENT:
                return new SourceColumn(name, Types.INTEGER, typeName, 10, 0, true);
            case DOUBLE:
                return new SourceColumn(name, Types.DOUBLE, typeName, 0, 0, true);
            case DATE:
                return new SourceColumn(name, Types.DATE, typeName, 0, 0, true);
            case TIMESTAMP:
            case TIMESTAMP_DBASE7:
                return new SourceColumn(name, Types.TIMESTAMP, typeName, 0, 0, true);
            case LOGICAL:
                return new SourceColumn(name, Types.BOOLEAN, typeName, 1, 0, true);
            case MEMO:
                return new SourceColumn(name, Types.LONGVARCHAR, typeName, 0, 0, true);
            default:
                return new SourceColumn(name, Types.VARCHAR, typeName, length, 0, true);
        }
    }

    /**
     * Converts the values of one record for JDBC binding.
     *
     * @param record record values as read, or {@code null} at the end of the file
     * @param columns columns from {@link #describe(List)}
     * @return values to bind, or {@code null} when {@code record} is {@code null}
     */
    static Object[] toJdbc(Object[] record, List<SourceColumn> columns) {
        if (record == null) {
            return null;
        }
        Object[] values = new Object[columns.size()];
        for (int i = 0; i < values.length; i++) {
            Object value = i < record.length ? record[i] : null;
            if (value instanceof Date) {
                long millis = ((Date) value).getTime();
                value = columns.get(i).getJdbcType() == Types.DATE ? new java.sql.Date(millis)
                        : new Timestamp(millis);
            }
            values[i] = value;
        }
        return values;
    }
}
