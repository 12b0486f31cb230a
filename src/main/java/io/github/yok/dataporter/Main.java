package io.github.yok.dataporter;

import io.github.yok.dataporter.config.ConnectionConfig;
import io.github.yok.dataporter.config.DbfImportConfig;
import io.github.yok.dataporter.config.ExplainConfig;
import io.github.yok.dataporter.config.GhArchiveConfig;
import io.github.yok.dataporter.config.JsonImportConfig;
import io.github.yok.dataporter.config.TableCopyConfig;
import io.github.yok.dataporter.copy.TableCopier;
import io.github.yok.dataporter.copy.TableCopyOptions;
import io.github.yok.dataporter.dbfimport.DbfImportOptions;
import io.github.yok.dataporter.dbfimport.DbfImporter;
import io.github.yok.dataporter.explain.ExplainOptions;
import io.github.yok.dataporter.explain.ExplainPlanVisualizer;
import io.github.yok.dataporter.gharchive.GhArchiveLoader;
import io.github.yok.dataporter.gharchive.GhArchiveOptions;
import io.github.yok.dataporter.jsonimport.JsonImportOptions;
import io.github.yok.dataporter.jsonimport.JsonImporter;
import io.github.yok.dataporter.util.ErrorReporter;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

/**
 * Provides the application entry point.
 *
 * <p>
 * The first argument selects the command; the remaining arguments are its options (see
 * {@link CommandLineOptions}).
 * </p>
 * <ul>
 * <li>{@code explain --file <report> [--output <png>] [--no-chart]} analyzes an
 * {@code EXPLAIN ANALYZE} report and draws its timeline.</li>
 * <li>{@code gharchive --start <YYYY-MM-DD-HH> --end <YYYY-MM-DD-HH> --runtime-file <csv>
 * --connection <id> ...} loads GitHub Archive events into PostgreSQL.</li>
 * <li>{@code json-import --source <path|url> --data-type file|api --data-source-name <name> ...}
 * imports or analyzes a JSON document.</li>
 * <li>{@code table-copy --source-connection <id> --source-table <t> --target-connection <id>
 * --target-table <t> [--batch-size <n>]} copies a table between databases.</li>
 * <li>{@code dbf-import --file <dbf> --connection <id> [--table <t>] [--batch-size <n>]
 * [--encoding <charset>]} loads a dBase file into a table.</li>
 * </ul>
 *
 * <p>
 * {@code --debug} lowers the application log level to DEBUG. Any failure is reported through
 * {@link ErrorReporter} and ends the process with exit status 1.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, ExplainConfig.class,
        GhArchiveConfig.class, JsonImportConfig.class, TableCopyConfig.class,
        DbfImportConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    static final String USAGE =
            "Usage: dataporter <explain|gharchive|json-import|table-copy|dbf-import> [options]";

    private final ExplainConfig explainConfig;
    private final GhArchiveConfig ghArchiveConfig;
    private final TableCopyConfig tableCopyConfig;
    private final DbfImportConfig dbfImportConfig;
    private final ExplainPlanVisualizer explainPlanVisualizer;
    private final GhArchiveLoader ghArchiveLoader;
    private final JsonImporter jsonImporter;
    private final TableCopier tableCopier;
    private final DbfImporter dbfImporter;

    private int exitCode;

    /**
     * Bootstraps the application and exits with the status of the executed command.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));
        CommandLineOptions options = CommandLineOptions.parse(args);
        if (options.has("debug")) {
            LoggingSystem.get(Main.class.getClassLoader())
                    .setLogLevel(Main.class.getPackageName(), LogLevel.DEBUG);
        }
        if (options.getCommand() == null) {
            exitCode = ErrorReporter.fatal("No command given. " + USAGE);
            return;
        }

        try {
            dispatch(options);
            exitCode = 0;
        } catch (Exception e) {
            exitCode = ErrorReporter.fatal(
                    "Fatal error (command=" + options.getCommand() + "): " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void dispatch(CommandLineOptions options) throws Exception {
        switch (options.getCommand()) {
            case "explain":
                explainPlanVisualizer.execute(ExplainOptions.from(options, explainConfig));
                break;
            case "gharchive":
                ghArchiveLoader.execute(GhArchiveOptions.from(options, ghArchiveConfig));
                break;
            case "json-import":
                jsonImporter.execute(JsonImportOptions.from(options));
                break;
            case "table-copy":
                tableCopier.execute(TableCopyOptions.from(options, tableCopyConfig));
                break;
            case "dbf-import":
                dbfImporter.execute(DbfImportOptions.from(options, dbfImportConfig));
                break;
            default:
                throw new IllegalArgumentException(
                        "Unknown command: " + options.getCommand() + ". " + USAGE);
        }
    }
}
