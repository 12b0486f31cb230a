package io.github.yok.dataporter.db;

import java.util.regex.Pattern;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Optionally schema-qualified table name given on the command line, such as
 * {@code public.github_events_2023}.
 *
 * <p>
 * Table names are spliced into DDL and DML text, so each part must be a plain SQL identifier.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class TableName {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

    // Schema part, or null for an unqualified name
    String schema;

    // Table part
    String table;

    /**
     * Parses {@code [schema.]table}.
     *
     * @param qualifiedName table name as given by the user
     * @return parsed table name
     * @throws IllegalArgumentException if the name is blank or a part is not a plain identifier
     */
    public static TableName parse(String qualifiedName) {
        if (StringUtils.isBlank(qualifiedName)) {
            throw new IllegalArgumentException("Table name must not be blank.");
        }
        String trimmed = qualifiedName.trim();
        String[] parts = trimmed.split("\\.", -1);
        if (parts.length > 2) {
            throw new IllegalArgumentException("Invalid table name: " + qualifiedName);
        }
        for (String part : parts) {
            if (!IDENTIFIER.matcher(part).matches()) {
                throw new IllegalArgumentException("Invalid table name: " + qualifiedName);
            }
        }
        return parts.length == 2 ? new TableName(parts[0], parts[1])
                : new TableName(null, parts[0]);
    }

    /**
     * Returns whether the name carries a schema part.
     *
     * @return {@code true} for {@code schema.table}
     */
    public boolean isQualified() {
        return schema != null;
    }

    /**
     * Returns a table name in the same schema whose table part ends with {@code suffix}. Used to
     * address the hourly/daily partition of a partitioned table.
     *
     * @param suffix text appended to the table part
     * @return suffixed table name
     */
    public TableName withSuffix(String suffix) {
        return new TableName(schema, table + suffix);
    }

    /**
     * Returns {@code schema.table} or {@code table}.
     *
     * @return SQL text for this name
     */
    public String qualified() {
        return schema == null ? table : schema + "." + table;
    }

    @Override
    public String toString() {
        return qualified();
    }
}
