package io.github.yok.dataporter.gharchive;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

/**
 * Maintains the runtime CSV file with one {@link LoopMetrics} row per processed hour.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class RuntimeMetricsWriter {

    private static final CSVFormat FORMAT =
            CSVFormat.DEFAULT.builder().setRecordSeparator("\n").get();

    /**
     * Prepares the file before the first hour: deletes it when {@code rewrite} is set and writes
     * the header when the file does not exist.
     *
     * @param file runtime CSV file
     * @param rewrite whether an existing file is discarded
     * @throws IOException on write failure
     */
    public void prepare(Path file, boolean rewrite) throws IOException {
        if (rewrite && Files.deleteIfExists(file)) {
            log.info("Runtime file {} deleted", file);
        }
        if (Files.exists(file)) {
            log.debug("Appending to runtime file {}", file);
            return;
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter printer = new CSVPrinter(w, FORMAT)) {
            printer.printRecord((Object[]) LoopMetrics.HEADER);
        }
    }

    /**
     * Appends one row.
     *
     * @param file runtime CSV file
     * @param metrics measurements of one hour
     * @throws IOException on write failure
     */
    public void append(Path file, LoopMetrics metrics) throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                CSVPrinter printer = new CSVPrinter(w, FORMAT)) {
            printer.printRecord(metrics.toRecord());
        }
    }
}
