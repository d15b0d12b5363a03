package com.driverag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DirectorySyncService {
    private static final Logger log = LoggerFactory.getLogger(DirectorySyncService.class);

    private final IngestionPipeline pipeline;
    private final DocumentRegistry registry;
    private final TextExtractor extractor;

    public DirectorySyncService(IngestionPipeline pipeline, DocumentRegistry registry, TextExtractor extractor) {
        this.pipeline = pipeline;
        this.registry = registry;
        this.extractor = extractor;
    }

    public SyncReport sync(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory.toAbsolutePath().normalize());
        }
        Path root = directory.toAbsolutePath().normalize();
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(extractor::supports)
                    .sorted()
                    .toList();
        }

        Set<String> seenLocators = new HashSet<>();
        List<CompletableFuture<IngestionOutcome>> pending = new ArrayList<>();
        int failed = 0;
        for (Path file : files) {
            String locator = file.toString();
            seenLocators.add(locator);
            try {
                String text = extractor.extract(file);
                Instant modifiedAt = Files.getLastModifiedTime(file).toInstant();
                SourceDocument source = SourceDocument.upload(locator, file.getFileName().toString(), text, modifiedAt);
                pending.add(pipeline.submit(source));
            } catch (IOException e) {
                failed++;
                log.warn("sync.extract.failed file={} reason={}", file, e.getMessage());
            }
        }

        int indexed = 0;
        int skipped = 0;
        int stale = 0;
        RuntimeException abort = null;
        for (CompletableFuture<IngestionOutcome> future : pending) {
            try {
                switch (future.join().status()) {
                    case INDEXED -> indexed++;
                    case SKIPPED -> skipped++;
                    case STALE -> stale++;
                    case FAILED -> failed++;
                }
            } catch (CompletionException e) {
                failed++;
                RuntimeException cause = unwrap(e);
                log.error("sync.ingest.aborted reason={}", cause.getMessage());
                if (abort == null) {
                    abort = cause;
                } else if (abort != cause) {
                    abort.addSuppressed(cause);
                }
            }
        }

        int deleted = 0;
        for (DocumentRecord record : registry.all()) {
            if (record.sourceType() == SourceType.UPLOAD
                    && Path.of(record.sourceLocator()).startsWith(root)
                    && !seenLocators.contains(record.sourceLocator())) {
                if (pipeline.delete(record.id())) {
                    deleted++;
                }
            }
        }

        SyncReport report = new SyncReport(indexed, skipped, stale, failed, deleted, files.size());
        log.info("sync.done directory={} indexed={} skipped={} stale={} failed={} deleted={} total={}",
                root, report.indexed(), report.skipped(), report.stale(), report.failed(), report.deleted(),
                report.totalFiles());
        if (abort != null) {
            throw abort;
        }
        return report;
    }

    // pipeline failures such as DriveRagException are rethrown as they were raised
    private static RuntimeException unwrap(CompletionException e) {
        if (e.getCause() instanceof RuntimeException cause) {
            return cause;
        }
        return e;
    }
}
