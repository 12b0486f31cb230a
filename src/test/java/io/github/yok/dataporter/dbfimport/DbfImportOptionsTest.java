package io.github.yok.dataporter.dbfimport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.dataporter.CommandLineOptions;
import io.github.yok.dataporter.config.DbfImportConfig;
import java.nio.charset.Charset;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

class DbfImportOptionsTest {

    private static CommandLineOptions cli(String... extra) {
        String[] base = {"dbf-import", "--file", "data/Dbase_Sample_Data.dbf", "--connection",
                "pg"};
        String[] args = new String[base.length + extra.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(extra, 0, args, base.length, extra.length);
        return CommandLineOptions.parse(args);
    }

    @Test
    void from_正常ケース_オプション省略_ファイル名と設定値が使われること() {
        DbfImportConfig config = new DbfImportConfig();
        config.setBatchSize(200);

        DbfImportOptions options = DbfImportOptions.from(cli(), config);

        assertEquals(Paths.get("data/Dbase_Sample_Data.dbf"), options.getFile());
        assertEquals("pg", options.getConnectionId());
        // 拡張子を除いたファイル名を小文字化
        assertEquals("dbase_sample_data", options.getTable().qualified());
        assertEquals(200, options.getBatchSize());
        assertNull(options.getEncoding());
    }

    @Test
    void from_正常ケース_全オプション指定_指定値が優先されること() {
        DbfImportConfig config = new DbfImportConfig();
        config.setEncoding("UTF-8");

        DbfImportOptions options = DbfImportOptions.from(cli("--table", "pg.samples",
                "--batch-size", "50", "--encoding", "windows-1252"), config);

        assertEquals("pg.samples", options.getTable().qualified());
        assertEquals(50, options.getBatchSize());
        assertEquals(Charset.forName("windows-1252"), options.getEncoding());
    }

    @Test
    void from_正常ケース_設定の文字コード_コマンド指定がない場合に使われること() {
        DbfImportConfig config = new DbfImportConfig();
        config.setEncoding(" ISO-8859-1 ");

        assertEquals(Charset.forName("ISO-8859-1"),
                DbfImportOptions.from(cli(), config).getEncoding());
    }

    @Test
    void from_異常ケース_バッチサイズが0_IllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> DbfImportOptions.from(cli("--batch-size", "0"), new DbfImportConfig()));
        assertEquals("--batch-size must be positive: 0", ex.getMessage());
    }

    @Test
    void from_異常ケース_未知の文字コード_IllegalArgumentExceptionが送出されること() {
        assertThrows(UnsupportedCharsetException.class, () -> DbfImportOptions
                .from(cli("--encoding", "no-such-charset"), new DbfImportConfig()));
    }

    @Test
    void from_異常ケース_接続先未指定_IllegalArgumentExceptionが送出されること() {
        CommandLineOptions cli = CommandLineOptions.parse("dbf-import", "--file", "a.dbf");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> DbfImportOptions.from(cli, new DbfImportConfig()));
        assertEquals("Missing required option --connection", ex.getMessage());
    }
}
