package com.driverag.ingest;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.driverag.embedding.EmbeddingGateway;
import com.driverag.error.DriveRagException;
import com.driverag.error.StoreUnavailableException;
import com.driverag.index.IndexEntry;
import com.driverag.index.KeywordAnalyzer;
import com.driverag.index.VectorIndexStore;

/**
 * Indexes one source document at a time per document id. The registry is only updated after the store
 * accepted the new entries, so after any failure the recorded version is still the searchable one.
 */
public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);
    private static final int LOCK_STRIPES = 64;

    private final Chunker chunker;
    private final EmbeddingGateway embeddingGateway;
    private final VectorIndexStore store;
    private final DocumentRegistry registry;
    private final ChangeDetector changeDetector;
    private final RetryPolicy retryPolicy;
    private final ExecutorService executor;
    private final Clock clock;
    private final ReentrantLock[] documentLocks = new ReentrantLock[LOCK_STRIPES];

    public IngestionPipeline(
            Chunker chunker,
            EmbeddingGateway embeddingGateway,
            VectorIndexStore store,
            DocumentRegistry registry,
            RetryPolicy retryPolicy,
            ExecutorService executor) {
        this(chunker, embeddingGateway, store, registry, retryPolicy, executor, Clock.systemUTC());
    }

    public IngestionPipeline(
            Chunker chunker,
            EmbeddingGateway embeddingGateway,
            VectorIndexStore store,
            DocumentRegistry registry,
            RetryPolicy retryPolicy,
            ExecutorService executor,
            Clock clock) {
        this.chunker = chunker;
        this.embeddingGateway = embeddingGateway;
        this.store = store;
        this.registry = registry;
        this.changeDetector = new ChangeDetector(registry);
        this.retryPolicy = retryPolicy;
        this.executor = executor;
        this.clock = clock;
        for (int i = 0; i < documentLocks.length; i++) {
            documentLocks[i] = new ReentrantLock();
        }
    }

    public CompletableFuture<IngestionOutcome> submit(SourceDocument source) {
        return CompletableFuture.supplyAsync(() -> ingest(source), executor);
    }

    public IngestionOutcome ingest(SourceDocument source) {
        String documentId = source.documentId();
        ReentrantLock lock = lockFor(documentId);
        lock.lock();
        try {
            return ingestLocked(documentId, source);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every index entry of the document and then its record.
     *
     * @return false if the document was unknown
     */
    public boolean delete(String documentId) {
        ReentrantLock lock = lockFor(documentId);
        lock.lock();
        try {
            boolean known = registry.find(documentId).isPresent() || store.documentVersion(documentId) > 0;
            store.delete(documentId);
            registry.remove(documentId);
            if (known) {
                log.info("ingest.deleted documentId={}", documentId);
            }
            return known;
        } finally {
            lock.unlock();
        }
    }

    // one document always maps to the same stripe, so its updates stay serialized
    ReentrantLock lockFor(String documentId) {
        return documentLocks[Math.floorMod(documentId.hashCode(), documentLocks.length)];
    }

    private IngestionOutcome ingestLocked(String documentId, SourceDocument source) {
        Optional<DocumentRecord> current = registry.find(documentId);
        long currentVersion = current.map(DocumentRecord::version).orElse(0L);

        if (current.isPresent() && isOlder(source.sourceModifiedAt(), current.get().sourceModifiedAt())) {
            log.warn("ingest.stale documentId={} sourceModifiedAt={} recordedModifiedAt={}",
                    documentId, source.sourceModifiedAt(), current.get().sourceModifiedAt());
            return IngestionOutcome.stale(documentId, currentVersion, "source revision older than recorded");
        }

        String fingerprint = ContentFingerprint.of(source.text());
        if (!changeDetector.shouldReindex(documentId, fingerprint)
                && !changeDetector.isEmbeddingStale(documentId, embeddingGateway.version())
                && store.documentVersion(documentId) == currentVersion) {
            log.debug("ingest.skip documentId={} version={} reason=unchanged", documentId, currentVersion);
            return IngestionOutcome.skipped(current.get());
        }

        long version = Math.max(currentVersion, store.documentVersion(documentId)) + 1;
        try {
            List<TextChunk> chunks = chunker.chunk(source.text());
            List<String> texts = chunks.stream().map(TextChunk::text).toList();
            List<float[]> vectors = retryPolicy.execute("embed " + documentId,
                    () -> embeddingGateway.embed(texts));
            List<IndexEntry> entries = toEntries(documentId, version, source.displayName(), chunks, vectors);

            if (!store.upsert(documentId, version, entries)) {
                return IngestionOutcome.stale(documentId, version, "index holds a newer version");
            }
            DocumentRecord next = DocumentRecord.nextVersion(current.orElse(null), source, fingerprint, version,
                    embeddingGateway.version(), chunks.size(), Instant.now(clock));
            if (!registry.commit(next, currentVersion)) {
                log.warn("ingest.commit.lost documentId={} version={}", documentId, version);
                return IngestionOutcome.stale(documentId, version, "registry moved past expected version");
            }
            log.info("ingest.indexed documentId={} source={} version={} chunks={}",
                    documentId, source.displayName(), version, chunks.size());
            return IngestionOutcome.indexed(documentId, version, chunks.size());
        } catch (StoreUnavailableException e) {
            log.error("ingest.failed documentId={} version={} reason={}", documentId, version, e.getMessage(), e);
            return IngestionOutcome.failed(documentId, currentVersion, e.getMessage());
        } catch (DriveRagException e) {
            if (!e.isRetryable()) {
                throw e;
            }
            log.error("ingest.failed documentId={} version={} attempts={} reason={}",
                    documentId, version, retryPolicy.maxAttempts(), e.getMessage());
            return IngestionOutcome.failed(documentId, currentVersion, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return IngestionOutcome.failed(documentId, currentVersion, "interrupted");
        }
    }

    private static List<IndexEntry> toEntries(
            String documentId,
            long version,
            String sourceName,
            List<TextChunk> chunks,
            List<float[]> vectors) {
        List<IndexEntry> entries = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            TextChunk chunk = chunks.get(i);
            entries.add(new IndexEntry(
                    IndexEntry.chunkId(documentId, chunk.ordinal(), version),
                    documentId,
                    version,
                    chunk.ordinal(),
                    chunk.startOffset(),
                    chunk.endOffset(),
                    sourceName,
                    chunk.text(),
                    vectors.get(i),
                    KeywordAnalyzer.termFrequencies(chunk.text())));
        }
        return entries;
    }

    private static boolean isOlder(Instant incoming, Instant recorded) {
        return incoming != null && recorded != null && incoming.isBefore(recorded);
    }
}
