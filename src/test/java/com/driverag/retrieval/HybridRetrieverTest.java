package com.driverag.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.driverag.embedding.EmbeddingGateway;
import com.driverag.embedding.ScriptedEmbeddingProvider;
import com.driverag.error.DimensionMismatchException;
import com.driverag.error.InvalidQueryException;
import com.driverag.error.StoreUnavailableException;
import com.driverag.index.IndexEntry;
import com.driverag.index.IndexView;
import com.driverag.index.KeywordAnalyzer;
import com.driverag.index.LocalJsonVectorIndexStore;
import com.driverag.index.ScoredEntry;
import com.driverag.index.VectorIndexStore;

class HybridRetrieverTest {
    private static final String QUERY = "refund policy";

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final ScriptedEmbeddingProvider provider = new ScriptedEmbeddingProvider(3)
            .withVector(QUERY, 1f, 0f, 0f);
    private final LocalJsonVectorIndexStore store = LocalJsonVectorIndexStore.inMemory(3);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void shouldBlendVectorOnlyAndKeywordOnlyMatches() {
        store.upsert("guarantee", 1, List.of(entry("guarantee", 1, 0,
                "Money back guarantee for unhappy customers.", 1f, 0f, 0f)));
        store.upsert("policy", 1, List.of(entry("policy", 1, 0,
                "Our refund policy allows returns within 30 days.", 0f, 0f, 1f)));

        List<RetrievalResult> results = retriever(store).retrieve(QUERY, 3, 0.7, 0.3);

        assertEquals(List.of("guarantee#0@v1", "policy#0@v1"), chunkIds(results));
        RetrievalResult vectorOnly = results.get(0);
        RetrievalResult keywordOnly = results.get(1);
        assertEquals(0.7, vectorOnly.fusedScore(), 1e-9);
        assertEquals(0.3, keywordOnly.fusedScore(), 1e-9);
        assertEquals(1.0, vectorOnly.normalizedVectorScore(), 1e-9);
        assertEquals(0.0, vectorOnly.keywordScore(), 1e-9);
        assertEquals(2.0, keywordOnly.keywordScore(), 1e-9);
        assertEquals(1.0, keywordOnly.normalizedKeywordScore(), 1e-9);
        assertEquals(0.0, keywordOnly.normalizedVectorScore(), 1e-9);
    }

    @Test
    void shouldBreakEqualFusedScoresByChunkId() {
        store.upsert("policy", 1, List.of(entry("policy", 1, 0,
                "Our refund policy allows returns within 30 days.", 0f, 0f, 1f)));
        store.upsert("guarantee", 1, List.of(entry("guarantee", 1, 0,
                "Money back guarantee for unhappy customers.", 1f, 0f, 0f)));

        List<RetrievalResult> results = retriever(store).retrieve(QUERY, 5, 0.5, 0.5);

        assertEquals(results.get(0).fusedScore(), results.get(1).fusedScore(), 1e-12);
        assertEquals(List.of("guarantee#0@v1", "policy#0@v1"), chunkIds(results));
    }

    @Test
    void shouldMergeChunkFoundByBothSearchesOnce() {
        store.upsert("summary", 1, List.of(entry("summary", 1, 0, "Refund policy summary.", 1f, 0f, 0f)));
        store.upsert("policy", 1, List.of(entry("policy", 1, 0, "Refund only after inspection.", 0f, 1f, 0f)));

        List<RetrievalResult> results = retriever(store).retrieve(QUERY, 5, 0.7, 0.3);

        assertEquals(List.of("summary#0@v1", "policy#0@v1"), chunkIds(results));
        assertEquals(1.0, results.get(0).fusedScore(), 1e-9);
        assertEquals(0.5, results.get(1).normalizedKeywordScore(), 1e-9);
        assertEquals(0.15, results.get(1).fusedScore(), 1e-9);
    }

    @Test
    void shouldUseWeightsAsGivenWithoutRescaling() {
        ScoredEntry hit = new ScoredEntry(entry("doc", 1, 0, "Refund policy.", 1f, 0f, 0f), 0.8);

        List<RetrievalResult> fused = HybridRetriever.fuse(List.of(hit), List.of(new ScoredEntry(hit.entry(), 3.0)),
                1.0, 1.0);

        assertEquals(1, fused.size());
        assertEquals(2.0, fused.get(0).fusedScore(), 1e-9);
        assertEquals(0.8, fused.get(0).vectorScore(), 1e-9);
        assertEquals(3.0, fused.get(0).keywordScore(), 1e-9);
    }

    @Test
    void shouldTreatNegativeSimilarityAsNoContribution() {
        ScoredEntry opposite = new ScoredEntry(entry("doc", 1, 0, "unrelated", -1f, 0f, 0f), -1.0);

        List<RetrievalResult> fused = HybridRetriever.fuse(List.of(opposite), List.of(), 0.7, 0.3);

        assertEquals(0.0, fused.get(0).fusedScore(), 1e-12);
    }

    @Test
    void shouldReturnAtMostKResults() {
        for (int i = 0; i < 6; i++) {
            String documentId = "doc-" + i;
            store.upsert(documentId, 1, List.of(entry(documentId, 1, 0, "Refund note " + i, 1f, i, 0f)));
        }

        assertEquals(2, retriever(store).retrieve(QUERY, 2, 0.7, 0.3).size());
        assertTrue(retriever(LocalJsonVectorIndexStore.inMemory(3)).retrieve(QUERY, 2, 0.7, 0.3).isEmpty());
    }

    @Test
    void shouldAskEachSearchForOverfetchedCandidates() {
        RecordingStore recording = new RecordingStore(store);
        store.upsert("policy", 1, List.of(entry("policy", 1, 0, "Refund policy.", 1f, 0f, 0f)));

        new HybridRetriever(recording, gateway(), executor, 3, Duration.ofSeconds(5)).retrieve(QUERY, 4, 0.7, 0.3);

        assertEquals(List.of(12), recording.vectorRequests);
        assertEquals(List.of(12), recording.keywordRequests);
    }

    @Test
    void shouldFillKFromDisjointCandidateSets() {
        for (int i = 0; i < 4; i++) {
            String semantic = "semantic-" + i;
            String lexical = "lexical-" + i;
            store.upsert(semantic, 1, List.of(entry(semantic, 1, 0, "Money back promise " + i, 1f, 0.1f * i, 0f)));
            store.upsert(lexical, 1, List.of(entry(lexical, 1, 0, "Refund policy clause " + i, 0f, 0f, 1f)));
        }
        RecordingStore recording = new RecordingStore(store);

        List<RetrievalResult> results = retriever(recording).retrieve(QUERY, 2, 0.5, 0.5);

        assertEquals(List.of(4), recording.vectorRequests);
        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(result -> result.fusedScore() > 0.0));
        List<RetrievalResult> wide = retriever(store).retrieve(QUERY, 5, 0.5, 0.5);
        assertEquals(5, wide.size());
    }

    @Test
    void shouldAcceptLargestKWithoutOverflow() {
        store.upsert("policy", 1, List.of(entry("policy", 1, 0, "Refund policy.", 1f, 0f, 0f)));
        RecordingStore recording = new RecordingStore(store);

        List<RetrievalResult> results = retriever(recording).retrieve(QUERY, Integer.MAX_VALUE, 0.7, 0.3);

        assertEquals(List.of("policy#0@v1"), chunkIds(results));
        assertEquals(List.of(Integer.MAX_VALUE), recording.vectorRequests);
    }

    @Test
    void shouldRejectInvalidQueries() {
        HybridRetriever retriever = retriever(store);

        assertThrows(InvalidQueryException.class, () -> retriever.retrieve("   ", 3, 0.7, 0.3));
        assertThrows(InvalidQueryException.class, () -> retriever.retrieve(null, 3, 0.7, 0.3));
        assertThrows(InvalidQueryException.class, () -> retriever.retrieve(QUERY, 0, 0.7, 0.3));
        assertThrows(InvalidQueryException.class, () -> retriever.retrieve(QUERY, 3, -0.1, 0.3));
        assertThrows(InvalidQueryException.class, () -> retriever.retrieve(QUERY, 3, 0.0, 0.0));
        assertThrows(InvalidQueryException.class, () -> retriever.retrieve(QUERY, 3, Double.NaN, 0.3));
        assertEquals(0, provider.calls());
    }

    @Test
    void shouldSurfaceDimensionMismatchBetweenProviderAndStore() {
        HybridRetriever retriever = retriever(LocalJsonVectorIndexStore.inMemory(4));

        assertThrows(DimensionMismatchException.class, () -> retriever.retrieve(QUERY, 3, 0.7, 0.3));
    }

    @Test
    void shouldTimeOutSlowSearches() {
        HybridRetriever retriever = new HybridRetriever(new SlowStore(store), gateway(), executor, 2,
                Duration.ofMillis(100));

        assertThrows(StoreUnavailableException.class, () -> retriever.retrieve(QUERY, 3, 0.7, 0.3));
    }

    @Test
    void shouldNeverMixVersionsOfOneDocumentWhileReindexing() throws Exception {
        store.upsert("manual", 1, manualVersion(1));
        HybridRetriever retriever = retriever(store);
        AtomicBoolean writing = new AtomicBoolean(true);

        CompletableFuture<Void> writer = CompletableFuture.runAsync(() -> {
            try {
                for (long version = 2; version <= 300; version++) {
                    store.upsert("manual", version, manualVersion(version));
                }
            } finally {
                writing.set(false);
            }
        }, executor);

        List<CompletableFuture<Integer>> readers = new ArrayList<>();
        for (int r = 0; r < 3; r++) {
            readers.add(CompletableFuture.supplyAsync(() -> {
                int checked = 0;
                do {
                    List<RetrievalResult> results = retriever.retrieve("alpha section", 10, 0.5, 0.5);
                    assertEquals(3, results.size());
                    assertEquals(1, results.stream().map(result -> result.entry().version())
                            .collect(Collectors.toSet()).size(), "mixed versions in " + chunkIds(results));
                    checked++;
                } while (writing.get());
                return checked;
            }, executor));
        }

        writer.get();
        for (CompletableFuture<Integer> reader : readers) {
            assertTrue(reader.get() > 0);
        }
    }

    private HybridRetriever retriever(VectorIndexStore target) {
        return new HybridRetriever(target, gateway(), executor, 2, Duration.ofSeconds(5));
    }

    private EmbeddingGateway gateway() {
        return new EmbeddingGateway(provider, executor, 16, 4, 8191, Duration.ofSeconds(5));
    }

    private static List<IndexEntry> manualVersion(long version) {
        List<IndexEntry> entries = new ArrayList<>();
        for (int ordinal = 0; ordinal < 3; ordinal++) {
            entries.add(entry("manual", version, ordinal, "Alpha section " + ordinal + " of revision " + version,
                    1f, ordinal, 0f));
        }
        return entries;
    }

    private static List<String> chunkIds(List<RetrievalResult> results) {
        return results.stream().map(RetrievalResult::chunkId).toList();
    }

    private static IndexEntry entry(String documentId, long version, int ordinal, String text, float... vector) {
        return new IndexEntry(
                IndexEntry.chunkId(documentId, ordinal, version),
                documentId,
                version,
                ordinal,
                0,
                text.length(),
                documentId + ".md",
                text,
                vector,
                KeywordAnalyzer.termFrequencies(text));
    }

    private static final class RecordingStore implements VectorIndexStore {
        private final VectorIndexStore delegate;
        private final List<Integer> vectorRequests = new CopyOnWriteArrayList<>();
        private final List<Integer> keywordRequests = new CopyOnWriteArrayList<>();

        RecordingStore(VectorIndexStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public IndexView view() {
            IndexView view = delegate.view();
            return new IndexView() {
                @Override
                public List<ScoredEntry> vectorSearch(float[] queryVector, int k) {
                    vectorRequests.add(k);
                    return view.vectorSearch(queryVector, k);
                }

                @Override
                public List<ScoredEntry> keywordSearch(String queryText, int k) {
                    keywordRequests.add(k);
                    return view.keywordSearch(queryText, k);
                }
            };
        }

        @Override
        public boolean upsert(String documentId, long version, List<IndexEntry> entries) {
            return delegate.upsert(documentId, version, entries);
        }

        @Override
        public void delete(String documentId) {
            delegate.delete(documentId);
        }

        @Override
        public List<ScoredEntry> vectorSearch(float[] queryVector, int k) {
            return view().vectorSearch(queryVector, k);
        }

        @Override
        public List<ScoredEntry> keywordSearch(String queryText, int k) {
            return view().keywordSearch(queryText, k);
        }

        @Override
        public List<IndexEntry> entries(String documentId) {
            return delegate.entries(documentId);
        }

        @Override
        public long documentVersion(String documentId) {
            return delegate.documentVersion(documentId);
        }

        @Override
        public int size() {
            return delegate.size();
        }

        @Override
        public int dimension() {
            return delegate.dimension();
        }
    }

    private static final class SlowStore implements VectorIndexStore {
        private final VectorIndexStore delegate;

        SlowStore(VectorIndexStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public IndexView view() {
            IndexView view = delegate.view();
            return new IndexView() {
                @Override
                public List<ScoredEntry> vectorSearch(float[] queryVector, int k) {
                    pause();
                    return view.vectorSearch(queryVector, k);
                }

                @Override
                public List<ScoredEntry> keywordSearch(String queryText, int k) {
                    pause();
                    return view.keywordSearch(queryText, k);
                }
            };
        }

        private static void pause() {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        @Override
        public boolean upsert(String documentId, long version, List<IndexEntry> entries) {
            return delegate.upsert(documentId, version, entries);
        }

        @Override
        public void delete(String documentId) {
            delegate.delete(documentId);
        }

        @Override
        public List<ScoredEntry> vectorSearch(float[] queryVector, int k) {
            return view().vectorSearch(queryVector, k);
        }

        @Override
        public List<ScoredEntry> keywordSearch(String queryText, int k) {
            return view().keywordSearch(queryText, k);
        }

        @Override
        public List<IndexEntry> entries(String documentId) {
            return delegate.entries(documentId);
        }

        @Override
        public long documentVersion(String documentId) {
            return delegate.documentVersion(documentId);
        }

        @Override
        public int size() {
            return delegate.size();
        }

        @Override
        public int dimension() {
            return delegate.dimension();
        }
    }
}
