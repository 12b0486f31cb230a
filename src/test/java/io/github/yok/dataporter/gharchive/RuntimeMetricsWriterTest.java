package io.github.yok.dataporter.gharchive;

import static org.junit.jupiter.api.Assertions.assertEquals;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RuntimeMetricsWriterTest {

    private static final String HEADER = "file_name,unix_timestamp,loop_start,loop_end,runtime,"
            + "total_run_time_seconds,relation_size,table_size,index_size,rows_inserted,"
            + "rows_per_second,errors";

    private final RuntimeMetricsWriter writer = new RuntimeMetricsWriter();

    private static LoopMetrics metrics() {
        LocalDateTime start = LocalDateTime.of(2023, 1, 1, 0, 0, 0);
        return LoopMetrics.builder().fileName("2023-01-01-00").unixTimestamp(1672531200L)
                .loopStart(start).loopEnd(start.plusSeconds(2)).relationSize(1L).tableSize(2L)
                .indexSize(3L).rowsInserted(10L).errors(0L).build();
    }

    @Test
    void prepare_正常ケース_ファイルがない場合_ヘッダが書き込まれること(@TempDir Path dir)
            throws Exception {
        Path file = dir.resolve("sub/runtimes.csv");

        writer.prepare(file, false);

        assertEquals(List.of(HEADER), Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    @Test
    void prepare_正常ケース_既存ファイルで書き換えなしの場合_内容が保持されること(@TempDir Path dir)
            throws Exception {
        Path file = dir.resolve("runtimes.csv");
        Files.writeString(file, "old\n");

        writer.prepare(file, false);

        assertEquals(List.of("old"), Files.readAllLines(file));
    }

    @Test
    void prepare_正常ケース_書き換えありの場合_ヘッダのみになること(@TempDir Path dir)
            throws Exception {
        Path file = dir.resolve("runtimes.csv");
        Files.writeString(file, "old\n");

        writer.prepare(file, true);

        assertEquals(List.of(HEADER), Files.readAllLines(file));
    }

    @Test
    void append_正常ケース_行が追記されること(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("runtimes.csv");
        writer.prepare(file, false);

        writer.append(file, metrics());
        writer.append(file, metrics());

        List<String> lines = Files.readAllLines(file);
        assertEquals(3, lines.size());
        assertEquals("2023-01-01-00,1672531200,2023-01-01 00:00:00.000000,"
                + "2023-01-01 00:00:02.000000,0:00:02.000,2.000,1,2,3,10,5.000,0", lines.get(1));
    }
}
