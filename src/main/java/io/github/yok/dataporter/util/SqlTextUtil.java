package io.github.yok.dataporter.util;

import com.google.common.base.Preconditions;

/**
 * Helpers for composing SQL text that cannot use bind parameters, such as {@code SET} commands.
 *
 * @author Yasuharu.Okawauchi
 */
public final class SqlTextUtil {

    private SqlTextUtil() {
        // Utility class; do not instantiate.
    }

    /**
     * Renders {@code value} as a single-quoted SQL string literal, doubling embedded quotes.
     *
     * @param value literal content
     * @return quoted literal
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static String quoteLiteral(String value) {
        Preconditions.checkNotNull(value, "value must not be null");
        return "'" + value.replace("'", "''") + "'";
    }
}
