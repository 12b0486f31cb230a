package io.github.yok.dataporter.jsonimport;

import java.util.Locale;

/**
 * Kind of JSON source given by {@code --data-type}.
 *
 * @author Yasuharu.Okawauchi
 */
public enum SourceType {
    // Local JSON file
    FILE,
    // HTTP GET returning JSON
    API;

    /**
     * Parses the option value ({@code file} or {@code api}, case-insensitive).
     *
     * @param value option value
     * @return source type
     * @throws IllegalArgumentException for any other value
     */
    public static SourceType from(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "file":
                return FILE;
            case "api":
                return API;
            default:
                throw new IllegalArgumentException(
                        "Unsupported --data-type: " + value + " (expected file or api)");
        }
    }
}
