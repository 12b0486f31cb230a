package io.github.yok.dataporter.dbfimport;

import com.linuxense.javadbf.DBFField;
import com.linuxense.javadbf.DBFReader;
import io.github.yok.dataporter.copy.SourceColumn;
import io.github.yok.dataporter.copy.TableCopier;
import io.github.yok.dataporter.db.ConnectionFactory;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs the {@code dbf-import} command: loads every record of a dBase file into a table.
 *
 * <p>
 * The target table is created from the DBF field definitions when it does not exist. Records are
 * written through {@link TableCopier#write}, in batches committed one by one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbfImporter {

    private final ConnectionFactory connectionFactory;
    private final TableCopier tableCopier;

    /**
     * Executes the command.
     *
     * @param options command options
     * @return number of imported records
     * @throws IOException if the file cannot be opened
     * @throws SQLException on any database failure
     */
    public long execute(DbfImportOptions options) throws IOException, SQLException {
        log.info("=== dbf-import started: {} -> [{}] {} ===", options.getFile(),
                options.getConnectionId(), options.getTable());
        try (InputStream in = new BufferedInputStream(Files.newInputStream(options.getFile()));
                DBFReader reader = options.getEncoding() == null ? new DBFReader(in)
                        : new DBFReader(in, options.getEncoding());
                Connection conn = connectionFactory.open(options.getConnectionId())) {
            List<DBFField> fields = new ArrayList<>();
            for (int i = 0; i < reader.getFieldCount(); i++) {
                fields.add(reader.getField(i));
            }
            List<SourceColumn> columns = DbfColumns.describe(fields);
            log.info("DBF fields: {}, records: {}", columns.stream().map(SourceColumn::getName)
                    .collect(Collectors.toList()), reader.getRecordCount());
            long imported = tableCopier.write(conn, options.getTable(), columns,
                    () -> DbfColumns.toJdbc(reader.nextRecord(), columns),
                    options.getBatchSize());
            log.info("=== dbf-import finished: {} records imported ===", imported);
            return imported;
        }
    }
}
