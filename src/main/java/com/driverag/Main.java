package com.driverag;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.driverag.error.DriveRagException;
import com.driverag.ingest.DocumentRecord;
import com.driverag.ingest.IngestionOutcome;
import com.driverag.ingest.TextExtractor;
import com.driverag.ingest.SourceDocument;
import com.driverag.ingest.SourceType;
import com.driverag.ingest.SyncReport;
import com.driverag.retrieval.ContextFormatter;
import com.driverag.retrieval.RetrievalRequest;
import com.driverag.retrieval.RetrievalResult;
import com.driverag.runtime.AppConfig;
import com.driverag.runtime.RetrievalEngine;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "drive-rag",
        mixinStandardHelpOptions = true,
        version = "drive-rag 0.1.0",
        description = "Index uploaded and Drive documents and run hybrid vector + keyword retrieval.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE_ERROR = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/drive-rag.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "retrieve")
    Mode mode;

    @Option(names = "--index-path", description = "Overrides store.indexPath")
    Path indexPath;

    @Option(names = "--registry-path", description = "Overrides store.registryPath")
    Path registryPath;

    @Option(names = "--file", description = "Document to index in ingest mode (repeatable)")
    List<Path> files;

    @Option(names = "--source-type", description = "Source of --file documents: ${COMPLETION-CANDIDATES}", defaultValue = "UPLOAD")
    SourceType sourceType;

    @Option(names = "--locator", description = "Source locator (e.g. Drive file id) for a single --file; defaults to the file path")
    String locator;

    @Option(names = "--source-dir", description = "Upload directory to synchronize in sync mode")
    Path sourceDir;

    @Option(names = "--query", description = "Query text used in retrieve mode")
    String query;

    @Option(names = "--top-k", description = "Results to return (default: retrieval.topK)")
    Integer topK;

    @Option(names = "--vector-weight", description = "Weight of the vector score (default: retrieval.vectorWeight)")
    Double vectorWeight;

    @Option(names = "--keyword-weight", description = "Weight of the keyword score (default: retrieval.keywordWeight)")
    Double keywordWeight;

    @Option(names = "--document-id", description = "Document to remove in delete mode")
    String documentId;

    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        ingest,
        sync,
        retrieve,
        delete,
        list
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = AppConfig.load(configPath);
        if (indexPath != null) {
            config.getStore().setIndexPath(indexPath.toString());
        }
        if (registryPath != null) {
            config.getStore().setRegistryPath(registryPath.toString());
        }
        String usageError = usageError();
        if (usageError != null) {
            log.error(usageError);
            return EXIT_USAGE_ERROR;
        }
        log.info("Starting drive-rag in {} mode with config {}", mode, configPath);

        try (RetrievalEngine engine = RetrievalEngine.fromConfig(config, httpClient)) {
            return switch (mode) {
                case ingest -> runIngest(engine);
                case sync -> runSync(engine);
                case retrieve -> runRetrieve(engine, config.getRetrieval());
                case delete -> runDelete(engine);
                case list -> runList(engine);
            };
        } catch (DriveRagException e) {
            log.error("{} failed: {}", mode, e.getMessage(), e);
            return EXIT_FAILURE;
        } finally {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    private String usageError() {
        switch (mode) {
            case ingest:
                if (files == null || files.isEmpty()) {
                    return "--file is required in ingest mode";
                }
                if (locator != null && files.size() > 1) {
                    return "--locator can only be used with a single --file";
                }
                return null;
            case sync:
                return sourceDir == null ? "--source-dir is required in sync mode" : null;
            case retrieve:
                return query == null || query.isBlank() ? "--query is required in retrieve mode" : null;
            case delete:
                return documentId == null || documentId.isBlank() ? "--document-id is required in delete mode" : null;
            default:
                return null;
        }
    }

    private int runIngest(RetrievalEngine engine) throws IOException {
        TextExtractor extractor = engine.extractor();
        int failures = 0;
        for (Path file : files) {
            if (!Files.isRegularFile(file) || !extractor.supports(file)) {
                log.error("Unsupported or missing file: {}", file);
                failures++;
                continue;
            }
            String text;
            try {
                text = extractor.extract(file);
            } catch (IOException e) {
                log.error("Unable to extract text from {}: {}", file, e.getMessage());
                failures++;
                continue;
            }
            String sourceLocator = locator != null ? locator : file.toAbsolutePath().normalize().toString();
            SourceDocument source = new SourceDocument(
                    sourceType,
                    sourceLocator,
                    file.getFileName().toString(),
                    text,
                    Files.getLastModifiedTime(file).toInstant());
            IngestionOutcome outcome = engine.pipeline().ingest(source);
            log.info("Ingested {} documentId={} status={} version={} chunks={} {}",
                    file, outcome.documentId(), outcome.status(), outcome.version(), outcome.chunkCount(),
                    outcome.detail());
            if (outcome.status() == IngestionOutcome.Status.FAILED) {
                failures++;
            }
        }
        return failures == 0 ? 0 : EXIT_FAILURE;
    }

    private int runSync(RetrievalEngine engine) throws IOException {
        SyncReport report = engine.directorySync().sync(sourceDir);
        log.info("Synchronized {}: indexed={}, skipped={}, stale={}, failed={}, deleted={}, total={}",
                sourceDir,
                report.indexed(),
                report.skipped(),
                report.stale(),
                report.failed(),
                report.deleted(),
                report.totalFiles());
        return report.failed() == 0 ? 0 : EXIT_FAILURE;
    }

    private int runRetrieve(RetrievalEngine engine, AppConfig.RetrievalConfig defaults) {
        RetrievalRequest request = new RetrievalRequest(
                query,
                topK != null ? topK : defaults.getTopK(),
                vectorWeight != null ? vectorWeight : defaults.getVectorWeight(),
                keywordWeight != null ? keywordWeight : defaults.getKeywordWeight());
        List<RetrievalResult> results = engine.retriever().retrieve(request);
        for (int i = 0; i < results.size(); i++) {
            RetrievalResult result = results.get(i);
            log.info("Result #{} fused={} vector={} keyword={} citation={}",
                    i + 1,
                    String.format(Locale.ROOT, "%.4f", result.fusedScore()),
                    String.format(Locale.ROOT, "%.4f", result.normalizedVectorScore()),
                    String.format(Locale.ROOT, "%.4f", result.normalizedKeywordScore()),
                    ContextFormatter.citation(result));
        }
        System.out.println(ContextFormatter.format(results));
        return 0;
    }

    private int runDelete(RetrievalEngine engine) {
        if (!engine.pipeline().delete(documentId)) {
            log.warn("No document with id {}", documentId);
            return EXIT_FAILURE;
        }
        return 0;
    }

    private int runList(RetrievalEngine engine) {
        List<DocumentRecord> records = engine.registry().all();
        for (DocumentRecord record : records) {
            System.out.printf("%s\t%s\tv%d\t%d chunks\t%s%n",
                    record.id(),
                    record.sourceType(),
                    record.version(),
                    record.chunkCount(),
                    record.displayName());
        }
        log.info("{} documents indexed, {} entries searchable", records.size(), engine.store().size());
        return 0;
    }
}
