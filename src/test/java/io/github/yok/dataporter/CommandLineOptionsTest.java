package io.github.yok.dataporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CommandLineOptionsTest {

    @Test
    void parse_正常ケース_コマンドと値付きオプションとスイッチが解釈されること() {
        CommandLineOptions options = CommandLineOptions.parse("gharchive", "--start",
                "2023-01-01-00", "--truncate-table", "--runtime-file", "rt.csv", "--debug");

        assertEquals("gharchive", options.getCommand());
        assertEquals(Optional.of("2023-01-01-00"), options.get("start"));
        assertEquals("rt.csv", options.require("runtime-file"));
        assertTrue(options.has("truncate-table"));
        assertTrue(options.has("debug"));
        assertEquals(List.of("start", "runtime-file", "truncate-table", "debug"),
                options.names());
    }

    @Test
    void parse_正常ケース_短縮名とアンダースコア表記_正規名に変換されること() {
        CommandLineOptions options = CommandLineOptions.parse("gharchive", "-s", "2023-01-01-00",
                "-rr", "-t", "public.events", "--gin_inspection_script", "gin.sql", "-rd",
                "--config_file", "pg");

        assertEquals("2023-01-01-00", options.require("start"));
        assertTrue(options.has("rewrite-runtime-file"));
        assertEquals("public.events", options.require("table"));
        assertEquals("gin.sql", options.require("gin-inspection-script"));
        assertTrue(options.has("random-drop"));
        assertEquals("pg", options.require("connection"));
    }

    @Test
    void parse_正常ケース_table_nameは_tableの別名として扱われること() {
        CommandLineOptions options =
                CommandLineOptions.parse("json-import", "--table-name", "public.t");

        assertEquals("public.t", options.require("table"));
    }

    @Test
    void parse_正常ケース_コマンドなし_コマンドはnullになること() {
        CommandLineOptions options = CommandLineOptions.parse("--debug");

        assertNull(options.getCommand());
        assertTrue(options.has("debug"));
    }

    @Test
    void get_正常ケース_空白の値_空として扱われること() {
        CommandLineOptions options = CommandLineOptions.parse("explain", "--file", " ");

        assertFalse(options.get("file").isPresent());
        assertTrue(options.has("file"));
    }

    @Test
    void require_異常ケース_未指定_IllegalArgumentExceptionが送出されること() {
        CommandLineOptions options = CommandLineOptions.parse("explain");

        IllegalArgumentException ex =
                assertThrows(IllegalArgumentException.class, () -> options.require("file"));
        assertEquals("Missing required option --file", ex.getMessage());
    }

    @Test
    void getInt_正常ケース_未指定なら既定値_指定値は整数として返ること() {
        CommandLineOptions options = CommandLineOptions.parse("table-copy", "--batch-size", "50");

        assertEquals(50, options.getInt("batch-size", 1000));
        assertEquals(7, options.getInt("other", 7));
    }

    @Test
    void getInt_異常ケース_整数でない値_IllegalArgumentExceptionが送出されること() {
        CommandLineOptions options = CommandLineOptions.parse("table-copy", "--batch-size", "ten");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> options.getInt("batch-size", 1));
        assertEquals("Option --batch-size must be an integer: ten", ex.getMessage());
    }
}
