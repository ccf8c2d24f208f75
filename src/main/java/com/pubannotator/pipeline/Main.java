package com.pubannotator.pipeline;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Main entry point for the publication annotator.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code run <input.csv>}: annotate the records of a CSV file.</li>
 *   <li>{@code browse <urls.txt>}: fetch the listed pages with a headless browser and annotate them.</li>
 *   <li>{@code db}: start the embedded PostgreSQL store only, for inspection with a DB client.</li>
 * </ul>
 * Settings come from environment variables or system properties, see {@link PipelineConfig}.
 * With no {@code DB_URL} an embedded PostgreSQL is started under {@code EMBEDDED_PG_DATA_DIR}.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);
    private static final DateTimeFormatter REPORT_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        String mode = (args != null && args.length > 0) ? args[0].trim().toLowerCase(Locale.ROOT) : "";
        PipelineConfig config = PipelineConfig.fromEnvironment();
        logger.info("Configuration: {}", config);

        int exitCode;
        try {
            switch (mode) {
                case "run" -> exitCode = runPipeline(config, new CsvAcquisitionService(inputPath(args, "run <input.csv>")));
                case "browse" -> exitCode = runPipeline(config, new BrowserAcquisitionService(inputPath(args, "browse <urls.txt>")));
                case "db" -> exitCode = databaseOnly(config);
                default -> {
                    printUsage();
                    exitCode = 2;
                }
            }
        } catch (IllegalArgumentException e) {
            logger.error("{}", e.getMessage());
            printUsage();
            exitCode = 2;
        } catch (Exception e) {
            logger.error("Fatal error: {}", e.getMessage(), e);
            exitCode = 1;
        }
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    private static Path inputPath(String[] args, String usage) {
        if (args.length < 2 || args[1].isBlank()) {
            throw new IllegalArgumentException("Missing input file. Usage: " + usage);
        }
        Path path = Paths.get(args[1].trim());
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Input file not found: " + path);
        }
        return path;
    }

    private static int runPipeline(PipelineConfig config, AcquisitionServiceInterface source) throws Exception {
        AnnotationSchema schema = AnnotationSchemas.resolve(config.schema());
        EmbeddedPostgres embedded = null;
        try {
            PostgresService store;
            if (config.dbUrl().isBlank()) {
                embedded = PostgresService.startEmbedded(config.embeddedDataDir(), config.embeddedPort());
                store = new PostgresService(embeddedUrl(config.embeddedPort()), config.dbUser(), config.dbPassword());
            } else {
                store = new PostgresService(config.dbUrl(), config.dbUser(), config.dbPassword());
            }
            store.createTables();

            PipelineCoordinator coordinator = new PipelineCoordinator(
                config, HttpAnnotationService.fromConfig(config), store, schema);

            Thread mainThread = Thread.currentThread();
            Thread hook = new Thread(() -> {
                logger.warn("Shutdown requested; cancelling run.");
                coordinator.cancel();
                try {
                    mainThread.join(config.gracePeriod().toMillis() + 5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "annotator-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            RunSummary summary = coordinator.run(source);
            writeReport(config, summary);

            if (summary.status() == RunStatus.CANCELLED) {
                return 0;
            }
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                logger.debug("JVM already shutting down: {}", e.getMessage());
                return 0;
            }
            return summary.status() == RunStatus.FAILED ? 1 : 0;
        } finally {
            if (embedded != null) {
                try {
                    embedded.close();
                } catch (IOException e) {
                    logger.warn("Failed to stop embedded PostgreSQL: {}", e.getMessage());
                }
            }
        }
    }

    private static void writeReport(PipelineConfig config, RunSummary summary) {
        CsvServiceInterface csvService = new CsvService(config.outputDir());
        String name = "run-report-" + ZonedDateTime.now(ZoneOffset.UTC).format(REPORT_STAMP) + ".csv";
        try {
            Path written = csvService.writeRunReport(summary, name);
            logger.info("Run report written to {}", written);
        } catch (IOException e) {
            logger.error("Failed to write run report '{}': {}", name, e.getMessage());
        }
    }

    private static int databaseOnly(PipelineConfig config) throws Exception {
        try (EmbeddedPostgres postgres = PostgresService.startEmbedded(config.embeddedDataDir(), config.embeddedPort())) {
            String jdbc = embeddedUrl(postgres.getPort());
            new PostgresService(jdbc, config.dbUser(), config.dbPassword()).createTables();
            System.out.println("Embedded Postgres started.");
            System.out.println("JDBC URL: " + jdbc);
            System.out.println("DB user: " + config.dbUser());
            System.out.println("Data directory: " + config.embeddedDataDir());
            System.out.println("Press Enter to stop the embedded DB and exit.");
            System.in.read();
        }
        return 0;
    }

    private static String embeddedUrl(int port) {
        return String.format("jdbc:postgresql://localhost:%d/postgres", port);
    }

    private static void printUsage() {
        System.out.println("Usage:\n"
            + "  run <input.csv>    annotate records from a CSV file (columns: url, text, optional id)\n"
            + "  browse <urls.txt>  fetch pages with a headless browser and annotate them\n"
            + "  db                 start the embedded PostgreSQL store only");
    }
}
