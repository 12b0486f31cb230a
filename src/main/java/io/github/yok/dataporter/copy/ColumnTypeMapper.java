package io.github.yok.dataporter.copy;

import java.sql.Types;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps source column metadata to a column type of the target database.
 *
 * <p>
 * The mapping uses standard SQL types that PostgreSQL, SQL Server and H2 understand alike. Only
 * unbounded character and binary columns differ: PostgreSQL gets {@code TEXT} and {@code BYTEA},
 * other targets {@code CLOB} and {@code BLOB}. Types without a portable counterpart are copied as
 * character data.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ColumnTypeMapper {

    // Largest declared length that is kept as VARCHAR(n)
    static final int MAX_VARCHAR_LENGTH = 10_485_760;

    private final boolean postgres;

    private ColumnTypeMapper(boolean postgres) {
        this.postgres = postgres;
    }

    /**
     * Returns the mapper for a target database.
     *
     * @param databaseProductName {@link java.sql.DatabaseMetaData#getDatabaseProductName()} of
     *        the target
     * @return mapper
     */
    public static ColumnTypeMapper forProduct(String databaseProductName) {
        return new ColumnTypeMapper(databaseProductName != null
                && databaseProductName.toLowerCase(Locale.ROOT).contains("postgres"));
    }

    /**
     * Returns the column type used in {@code CREATE TABLE}.
     *
     * @param column source column
     * @return SQL type text
     */
    public String toDdl(SourceColumn column) {
        int precision = column.getPrecision();
        switch (column.getJdbcType()) {
            case Types.BIT:
            case Types.BOOLEAN:
                return "BOOLEAN";
            case Types.TINYINT:
            case Types.SMALLINT:
                return "SMALLINT";
            case Types.INTEGER:
                return "INTEGER";
            case Types.BIGINT:
                return "BIGINT";
            case Types.REAL:
                return "REAL";
            case Types.FLOAT:
            case Types.DOUBLE:
                return "DOUBLE PRECISION";
            case Types.NUMERIC:
            case Types.DECIMAL:
                if (precision <= 0 || precision > 1000) {
                    return "NUMERIC";
                }
                return "NUMERIC(" + precision + "," + Math.max(column.getScale(), 0) + ")";
            case Types.CHAR:
            case Types.NCHAR:
                return precision > 0 && precision <= MAX_VARCHAR_LENGTH ? "CHAR(" + precision + ")"
                        : unboundedText();
            case Types.VARCHAR:
            case Types.NVARCHAR:
                return boundedText(precision);
            case Types.LONGVARCHAR:
            case Types.LONGNVARCHAR:
            case Types.CLOB:
            case Types.NCLOB:
            case Types.SQLXML:
                return unboundedText();
            case Types.DATE:
                return "DATE";
            case Types.TIME:
            case Types.TIME_WITH_TIMEZONE:
                return "TIME";
            case Types.TIMESTAMP:
                return "TIMESTAMP";
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return "TIMESTAMP WITH TIME ZONE";
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return postgres ? "BYTEA" : "BLOB";
            default:
                log.warn("Column {} has type {} ({}); copied as character data",
                        column.getName(), column.getTypeName(), column.getJdbcType());
                return boundedText(precision);
        }
    }

    private String boundedText(int precision) {
        return precision > 0 && precision <= MAX_VARCHAR_LENGTH ? "VARCHAR(" + precision + ")"
                : unboundedText();
    }

    private String unboundedText() {
        return postgres ? "TEXT" : "CLOB";
    }
}
