package io.github.yok.dataporter.dbfimport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.linuxense.javadbf.DBFDataType;
import com.linuxense.javadbf.DBFField;
import com.linuxense.javadbf.DBFWriter;
import io.github.yok.dataporter.config.ConnectionConfig;
import io.github.yok.dataporter.copy.TableCopier;
import io.github.yok.dataporter.db.ConnectionFactory;
import io.github.yok.dataporter.db.TableName;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DbfImporterTest {

    @TempDir
    Path tempDir;

    private ConnectionFactory factory;
    private DbfImporter importer;

    @BeforeEach
    void setup() {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId("h2");
        entry.setUrl("jdbc:h2:mem:dbf_importer;DB_CLOSE_DELAY=-1");
        entry.setUser("sa");
        entry.setPassword("");
        ConnectionConfig config = new ConnectionConfig();
        config.setConnections(List.of(entry));
        factory = new ConnectionFactory(config);
        importer = new DbfImporter(factory, new TableCopier(factory));
    }

    @AfterEach
    void teardown() throws Exception {
        try (Connection conn = factory.open("h2"); Statement stmt = conn.createStatement()) {
            stmt.execute("DROP ALL OBJECTS");
        }
    }

    private static Date date(int year, int month, int day) {
        return Date.from(
                LocalDate.of(year, month, day).atStartOfDay(ZoneId.systemDefault()).toInstant());
    }

    private Path writeSample(int records) throws Exception {
        Path file = tempDir.resolve("Sample_Data.dbf");
        try (OutputStream out = Files.newOutputStream(file)) {
            DBFWriter writer = new DBFWriter(out, StandardCharsets.ISO_8859_1);
            writer.setFields(new DBFField[] {new DBFField("NAME", DBFDataType.CHARACTER, 20),
                    new DBFField("PRICE", DBFDataType.NUMERIC, 10, 2),
                    new DBFField("BORN", DBFDataType.DATE),
                    new DBFField("ACTIVE", DBFDataType.LOGICAL)});
            for (int i = 1; i <= records; i++) {
                writer.addRecord(new Object[] {"name" + i, new BigDecimal(i + ".25"),
                        date(2020, 1, i), i % 2 == 0});
            }
            // 全項目が空のレコード
            writer.addRecord(new Object[] {null, null, null, null});
            writer.close();
        }
        return file;
    }

    private static DbfImportOptions options(Path file, String table, int batchSize) {
        return DbfImportOptions.builder().file(file).connectionId("h2")
                .table(TableName.parse(table)).batchSize(batchSize).build();
    }

    @Test
    void execute_正常ケース_テーブルが存在しない_作成され全レコードが登録されること()
            throws Exception {
        // 4レコードをバッチサイズ3で: 1バッチと残り1レコード
        long imported = importer.execute(options(writeSample(3), "sample_data", 3));

        assertEquals(4L, imported);
        try (Connection conn = factory.open("h2"); Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(
                        "SELECT NAME, PRICE, BORN, ACTIVE FROM sample_data ORDER BY NAME")) {
            // 空レコードが先頭
            assertTrue(rs.next());
            assertTrue(StringUtils.isEmpty(rs.getString("NAME")));
            assertNull(rs.getBigDecimal("PRICE"));
            assertTrue(rs.next());
            assertEquals("name1", rs.getString("NAME"));
            assertEquals(0, new BigDecimal("1.25").compareTo(rs.getBigDecimal("PRICE")));
            assertEquals(LocalDate.of(2020, 1, 1), rs.getDate("BORN").toLocalDate());
            assertFalse(rs.getBoolean("ACTIVE"));
            assertTrue(rs.next());
            assertEquals("name2", rs.getString("NAME"));
            assertTrue(rs.getBoolean("ACTIVE"));
        }
    }

    @Test
    void execute_正常ケース_テーブルが既に存在する_既存テーブルへ追加されること()
            throws Exception {
        try (Connection conn = factory.open("h2"); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE sample_data (NAME VARCHAR(50), PRICE DECIMAL(12,2),"
                    + " BORN DATE, ACTIVE BOOLEAN)");
            stmt.execute("INSERT INTO sample_data VALUES ('existing', 9.99, NULL, TRUE)");
            conn.commit();
        }

        importer.execute(options(writeSample(2), "sample_data", 100));

        try (Connection conn = factory.open("h2"); Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM sample_data")) {
            rs.next();
            assertEquals(4, rs.getInt(1));
        }
    }

    @Test
    void execute_異常ケース_ファイルが存在しない_NoSuchFileExceptionが送出されること() {
        assertThrows(NoSuchFileException.class,
                () -> importer.execute(options(tempDir.resolve("missing.dbf"), "t", 10)));
    }
}
