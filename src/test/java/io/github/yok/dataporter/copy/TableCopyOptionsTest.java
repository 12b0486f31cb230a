package io.github.yok.dataporter.copy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.dataporter.CommandLineOptions;
import io.github.yok.dataporter.config.TableCopyConfig;
import org.junit.jupiter.api.Test;

class TableCopyOptionsTest {

    private static CommandLineOptions cli(String... extra) {
        String[] base = {"table-copy", "--source-connection", "mssql", "--source-table",
                "dbo.orders", "--target-connection", "pg", "--target-table", "public.orders"};
        String[] args = new String[base.length + extra.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(extra, 0, args, base.length, extra.length);
        return CommandLineOptions.parse(args);
    }

    @Test
    void from_正常ケース_バッチサイズ省略_設定値が使われること() {
        TableCopyConfig config = new TableCopyConfig();
        config.setBatchSize(250);

        TableCopyOptions options = TableCopyOptions.from(cli(), config);

        assertEquals("mssql", options.getSourceConnectionId());
        assertEquals("dbo.orders", options.getSourceTable().qualified());
        assertEquals("pg", options.getTargetConnectionId());
        assertEquals("public.orders", options.getTargetTable().qualified());
        assertEquals(250, options.getBatchSize());
    }

    @Test
    void from_正常ケース_バッチサイズ指定_指定値が優先されること() {
        assertEquals(10,
                TableCopyOptions.from(cli("--batch-size", "10"), new TableCopyConfig())
                        .getBatchSize());
    }

    @Test
    void from_異常ケース_バッチサイズが0_IllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> TableCopyOptions.from(cli("--batch-size", "0"), new TableCopyConfig()));
        assertEquals("--batch-size must be positive: 0", ex.getMessage());
    }

    @Test
    void from_異常ケース_コピー先テーブル未指定_IllegalArgumentExceptionが送出されること() {
        CommandLineOptions cli = CommandLineOptions.parse("table-copy", "--source-connection",
                "a", "--source-table", "t", "--target-connection", "b");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> TableCopyOptions.from(cli, new TableCopyConfig()));
        assertEquals("Missing required option --target-table", ex.getMessage());
    }
}
