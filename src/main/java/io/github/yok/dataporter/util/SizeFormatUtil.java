package io.github.yok.dataporter.util;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formats memory/disk sizes reported by PostgreSQL, such as {@code 4096kB}, for display.
 *
 * @author Yasuharu.Okawauchi
 */
public final class SizeFormatUtil {

    // <integer>[.<fraction>][ ]<unit>; the unit must not start with a digit
    private static final Pattern SIZE = Pattern.compile("(\\d+)(\\.\\d+)?\\s?([^\\W\\d]\\w*)");

    private SizeFormatUtil() {
        // Utility class; do not instantiate.
    }

    /**
     * Inserts thousands separators into the numeric part and separates the unit by one space.
     *
     * <p>
     * {@code "1234kB"} becomes {@code "1,234 kB"}, {@code "1234.5 MB"} becomes
     * {@code "1,234.5 MB"}. The unit is kept verbatim. Input that is not a size is returned
     * unchanged.
     * </p>
     *
     * @param size raw size text
     * @return formatted size, or {@code size} itself when it does not look like a size
     */
    public static String formatSize(String size) {
        if (size == null) {
            return null;
        }
        Matcher m = SIZE.matcher(size);
        if (!m.matches()) {
            return size;
        }
        String integral = String.format(Locale.US, "%,d", new BigInteger(m.group(1)));
        String fraction = m.group(2) == null ? "" : m.group(2);
        return integral + fraction + " " + m.group(3);
    }
}
