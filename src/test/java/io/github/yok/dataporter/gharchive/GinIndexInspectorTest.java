package io.github.yok.dataporter.gharchive;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.dataporter.db.PostgresTableOperations;
import io.github.yok.dataporter.db.TableName;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

class GinIndexInspectorTest {

    private PostgresTableOperations tableOperations;
    private GinIndexInspector inspector;
    private Connection conn;
    private Statement stmt;

    @TempDir
    Path dir;

    @BeforeEach
    void setup() throws Exception {
        tableOperations = mock(PostgresTableOperations.class);
        inspector = new GinIndexInspector(tableOperations);
        conn = mock(Connection.class);
        stmt = mock(Statement.class);
        when(conn.createStatement()).thenReturn(stmt);
    }

    @Test
    void inspect_正常ケース_インデックスごとに設定とスクリプトが実行されコミットされること()
            throws Exception {
        TableName table = TableName.parse("public.events_20230101");
        when(tableOperations.ginIndexNames(conn, table))
                .thenReturn(List.of("public.idx_a", "public.\"idx'b\""));
        Path script = Files.writeString(dir.resolve("inspect.sql"), "SELECT inspect();");

        int count = inspector.inspect(conn, table, script, Duration.ofMillis(1500));

        assertEquals(2, count);
        InOrder order = inOrder(stmt, conn);
        order.verify(stmt).execute("SET inspect_gin_index.table_name = 'public.events_20230101'");
        order.verify(stmt).execute("SET inspect_gin_index.index_name = 'public.idx_a'");
        order.verify(stmt).execute("SET inspect_gin_index.result_target = 'table'");
        order.verify(stmt).execute("SET inspect_gin_index.insert_commit_runtime = '0:00:01.500'");
        order.verify(stmt).execute("SELECT inspect();");
        order.verify(conn).commit();
        // 引用符は二重化される
        order.verify(stmt).execute("SET inspect_gin_index.index_name = 'public.\"idx''b\"'");
        verify(conn, times(2)).commit();
    }

    @Test
    void inspect_正常ケース_GINインデックスがない場合_何も実行されないこと() throws Exception {
        TableName table = TableName.parse("events");
        when(tableOperations.ginIndexNames(conn, table)).thenReturn(List.of());

        // スクリプトは読み込まれない
        assertEquals(0, inspector.inspect(conn, table, dir.resolve("missing.sql"), Duration.ZERO));
        verify(stmt, never()).execute(any());
        verify(conn, never()).commit();
    }

    @Test
    void inspect_異常ケース_スクリプトが存在しない場合_IOExceptionが送出されること()
            throws Exception {
        TableName table = TableName.parse("events");
        when(tableOperations.ginIndexNames(conn, table)).thenReturn(List.of("public.idx_a"));

        assertThrows(NoSuchFileException.class,
                () -> inspector.inspect(conn, table, dir.resolve("missing.sql"), Duration.ZERO));
    }
}
