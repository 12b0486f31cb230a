package io.github.yok.dataporter.jsonimport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.dataporter.db.ConnectionFactory;
import io.github.yok.dataporter.db.PostgresTableOperations;
import io.github.yok.dataporter.db.TableName;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JsonImporterTest {

    private static final String INSERT_SQL = "INSERT INTO public.products"
            + " (jsonb_data, data_source) VALUES (CAST(? AS jsonb), ?)";

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonSourceFetcher fetcher;
    private JsonStructureAnalyzer analyzer;
    private ConnectionFactory connectionFactory;
    private PostgresTableOperations tableOperations;
    private Connection conn;
    private PreparedStatement ps;
    private JsonImporter importer;

    @BeforeEach
    void setup() throws Exception {
        fetcher = mock(JsonSourceFetcher.class);
        analyzer = mock(JsonStructureAnalyzer.class);
        connectionFactory = mock(ConnectionFactory.class);
        tableOperations = mock(PostgresTableOperations.class);
        conn = mock(Connection.class);
        ps = mock(PreparedStatement.class);
        when(connectionFactory.open("pg")).thenReturn(conn);
        when(conn.prepareStatement(INSERT_SQL)).thenReturn(ps);
        when(tableOperations.insertDocumentSql(TableName.parse("public.products"), true))
                .thenReturn(INSERT_SQL);
        importer = new JsonImporter(fetcher, analyzer, connectionFactory, tableOperations);
    }

    private JsonImportOptions.JsonImportOptionsBuilder options() {
        return JsonImportOptions.builder().source("products.json").sourceType(SourceType.FILE)
                .dataSourceName("catalog").structurePath(List.of("data"))
                .table(TableName.parse("public.products")).connectionId("pg");
    }

    @Test
    void execute_正常ケース_各行がデータソース名とともに挿入されコミットされること()
            throws Exception {
        when(fetcher.fetch("products.json", SourceType.FILE)).thenReturn(
                mapper.readTree("{\"data\":[{\"id\":1},{\"id\":2,\"s\":\"a\\u0000b\"}]}"));

        ImportResult result = importer.execute(options().build());

        assertEquals(2L, result.getInserted());
        assertEquals(0L, result.getErrors());
        verify(tableOperations).createJsonbTableIfMissing(conn,
                TableName.parse("public.products"));
        verify(ps).setString(1, "{\"id\":1}");
        // NUL のエスケープは除去される
        verify(ps).setString(1, "{\"id\":2,\"s\":\"ab\"}");
        verify(ps, times(2)).setString(2, "catalog");
        verify(conn, times(2)).commit();
        verify(conn).close();
    }

    @Test
    void execute_正常ケース_挿入失敗行_ロールバックされエラーとして数えられること()
            throws Exception {
        when(fetcher.fetch("products.json", SourceType.FILE))
                .thenReturn(mapper.readTree("{\"data\":[{\"id\":1},{\"id\":2},{\"id\":3}]}"));
        when(ps.executeUpdate()).thenReturn(1).thenThrow(new SQLException("bad")).thenReturn(1);

        ImportResult result = importer.execute(options().build());

        assertEquals(2L, result.getInserted());
        assertEquals(1L, result.getErrors());
        verify(conn).rollback();
    }

    @Test
    void execute_正常ケース_解析のみ_解析結果が返りDBには接続しないこと() throws Exception {
        JsonNode doc = mapper.readTree("[{\"id\":1}]");
        when(fetcher.fetch("products.json", SourceType.FILE)).thenReturn(doc);
        List<StructureSuggestion> suggestions =
                List.of(new StructureSuggestion("/", List.of("id")));
        when(analyzer.analyze(doc)).thenReturn(suggestions);

        ImportResult result = importer.execute(options().analyzeOnly(true).build());

        assertEquals(suggestions, result.getSuggestions());
        verifyNoInteractions(connectionFactory);
    }

    @Test
    void execute_正常ケース_接続未指定_0件で終了しDBには接続しないこと() throws Exception {
        when(fetcher.fetch("products.json", SourceType.FILE))
                .thenReturn(mapper.readTree("{\"data\":[]}"));

        ImportResult result = importer.execute(options().connectionId(null).build());

        assertEquals(0L, result.getInserted());
        verify(connectionFactory, never()).open(anyString());
    }

    @Test
    void execute_正常ケース_テーブル未指定_0件で終了しDBには接続しないこと() throws Exception {
        when(fetcher.fetch("products.json", SourceType.FILE))
                .thenReturn(mapper.readTree("{\"data\":[]}"));

        ImportResult result = importer.execute(options().table(null).build());

        assertEquals(0L, result.getErrors());
        verify(connectionFactory, never()).open(anyString());
    }

    @Test
    void rowsAt_正常ケース_数値セグメントは配列の添字として扱われること() throws Exception {
        JsonNode doc = mapper.readTree("{\"pages\":[{\"rows\":[1]},{\"rows\":[{\"a\":1},2]}]}");

        List<JsonNode> rows = JsonImporter.rowsAt(doc, List.of("pages", "1", "rows"));

        assertEquals(2, rows.size());
        assertEquals("{\"a\":1}", rows.get(0).toString());
    }

    @Test
    void rowsAt_正常ケース_オブジェクトは1行として扱われること() throws Exception {
        JsonNode doc = mapper.readTree("{\"item\":{\"id\":5}}");

        assertEquals(1, JsonImporter.rowsAt(doc, List.of("item")).size());
        assertEquals(1, JsonImporter.rowsAt(doc, List.of()).size());
    }

    @Test
    void rowsAt_異常ケース_存在しないセグメント_IllegalArgumentExceptionが送出されること()
            throws Exception {
        JsonNode doc = mapper.readTree("{\"data\":[]}");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> JsonImporter.rowsAt(doc, List.of("rows")));
        assertEquals("Structure path segment 'rows' not found", ex.getMessage());
    }

    @Test
    void rowsAt_異常ケース_スカラー値_IllegalArgumentExceptionが送出されること()
            throws Exception {
        JsonNode doc = mapper.readTree("{\"data\":{\"count\":3}}");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> JsonImporter.rowsAt(doc, List.of("data", "count")));
        assertEquals("No rows at structure path /data/count", ex.getMessage());
    }
}
