package com.driverag.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.driverag.error.DimensionMismatchException;
import com.driverag.error.StoreUnavailableException;
import com.driverag.runtime.JsonFiles;
import com.fasterxml.jackson.databind.ObjectMapper;

public class LocalJsonVectorIndexStore implements VectorIndexStore {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonVectorIndexStore.class);

    static final Comparator<ScoredEntry> RANKING = Comparator
            .comparingDouble(ScoredEntry::score).reversed()
            .thenComparingInt(scored -> scored.entry().ordinal())
            .thenComparing(scored -> scored.entry().documentId())
            .thenComparing(scored -> scored.entry().chunkId());

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Path path;
    private final int dimension;
    private final Object writeLock = new Object();
    private volatile Snapshot snapshot;

    private LocalJsonVectorIndexStore(Path path, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.path = path;
        this.dimension = dimension;
        this.snapshot = Snapshot.empty(dimension);
    }

    public static LocalJsonVectorIndexStore inMemory(int dimension) {
        return new LocalJsonVectorIndexStore(null, dimension);
    }

    public static LocalJsonVectorIndexStore open(Path path, int dimension) {
        LocalJsonVectorIndexStore store = new LocalJsonVectorIndexStore(path, dimension);
        if (!Files.exists(path)) {
            return store;
        }
        PersistedIndex persisted;
        try {
            if (Files.size(path) == 0L) {
                return store;
            }
            persisted = store.objectMapper.readValue(path.toFile(), PersistedIndex.class);
        } catch (IOException e) {
            throw new StoreUnavailableException("Unable to read vector index " + path, e);
        }
        if (persisted.dimension() != dimension) {
            throw new DimensionMismatchException("Vector index " + path + " was built with dimension "
                    + persisted.dimension() + " but " + dimension + " is configured");
        }
        Map<String, List<IndexEntry>> byDocument = new HashMap<>();
        for (IndexEntry entry : persisted.entries()) {
            byDocument.computeIfAbsent(entry.documentId(), unused -> new ArrayList<>()).add(entry);
        }
        store.snapshot = Snapshot.of(dimension, byDocument, persisted.versions());
        log.info("index.loaded path={} documents={} entries={}", path, persisted.versions().size(),
                persisted.entries().size());
        return store;
    }

    @Override
    public boolean upsert(String documentId, long version, List<IndexEntry> entries) {
        for (IndexEntry entry : entries) {
            if (!entry.documentId().equals(documentId) || entry.version() != version) {
                throw new IllegalArgumentException("Entry " + entry.chunkId() + " does not belong to "
                        + documentId + " version " + version);
            }
            requireDimension(entry.vector(), dimension, "entry " + entry.chunkId());
        }
        synchronized (writeLock) {
            Snapshot current = snapshot;
            long storedVersion = current.versions().getOrDefault(documentId, 0L);
            if (version < storedVersion) {
                log.warn("index.upsert.stale documentId={} version={} storedVersion={}", documentId, version,
                        storedVersion);
                return false;
            }
            Map<String, List<IndexEntry>> byDocument = new HashMap<>(current.byDocument());
            Map<String, Long> versions = new HashMap<>(current.versions());
            byDocument.put(documentId, entries);
            versions.put(documentId, version);
            publish(Snapshot.of(dimension, byDocument, versions));
        }
        log.debug("index.upsert documentId={} version={} entries={}", documentId, version, entries.size());
        return true;
    }

    @Override
    public void delete(String documentId) {
        synchronized (writeLock) {
            Snapshot current = snapshot;
            if (!current.versions().containsKey(documentId)) {
                return;
            }
            Map<String, List<IndexEntry>> byDocument = new HashMap<>(current.byDocument());
            Map<String, Long> versions = new HashMap<>(current.versions());
            byDocument.remove(documentId);
            versions.remove(documentId);
            publish(Snapshot.of(dimension, byDocument, versions));
        }
        log.debug("index.delete documentId={}", documentId);
    }

    @Override
    public List<ScoredEntry> vectorSearch(float[] queryVector, int k) {
        return snapshot.vectorSearch(queryVector, k);
    }

    @Override
    public List<ScoredEntry> keywordSearch(String queryText, int k) {
        return snapshot.keywordSearch(queryText, k);
    }

    @Override
    public IndexView view() {
        return snapshot;
    }

    @Override
    public List<IndexEntry> entries(String documentId) {
        return snapshot.byDocument().getOrDefault(documentId, List.of());
    }

    @Override
    public long documentVersion(String documentId) {
        return snapshot.versions().getOrDefault(documentId, 0L);
    }

    @Override
    public int size() {
        return snapshot.entries().size();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private void publish(Snapshot next) {
        if (path != null) {
            try {
                JsonFiles.writeAtomically(objectMapper, path,
                        new PersistedIndex(dimension, next.versions(), next.entries()));
            } catch (IOException e) {
                throw new StoreUnavailableException("Unable to write vector index " + path, e);
            }
        }
        snapshot = next;
    }

    private static void requireDimension(float[] vector, int dimension, String what) {
        if (vector == null || vector.length != dimension) {
            throw new DimensionMismatchException("Dimension of " + what + " is "
                    + (vector == null ? 0 : vector.length) + " but the index holds " + dimension);
        }
    }

    private static double cosine(float[] query, double queryNorm, float[] candidate) {
        double candidateNorm = norm(candidate);
        if (queryNorm == 0.0 || candidateNorm == 0.0) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < query.length; i++) {
            dot += (double) query[i] * candidate[i];
        }
        return dot / (queryNorm * candidateNorm);
    }

    private static double norm(float[] vector) {
        double sum = 0.0;
        for (float value : vector) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }

    private record Snapshot(int dimension, Map<String, List<IndexEntry>> byDocument, Map<String, Long> versions,
            List<IndexEntry> entries) implements IndexView {

        static Snapshot empty(int dimension) {
            return new Snapshot(dimension, Map.of(), Map.of(), List.of());
        }

        static Snapshot of(int dimension, Map<String, List<IndexEntry>> byDocument, Map<String, Long> versions) {
            Map<String, List<IndexEntry>> frozen = new HashMap<>();
            List<IndexEntry> all = new ArrayList<>();
            byDocument.forEach((documentId, entries) -> {
                List<IndexEntry> copy = List.copyOf(entries);
                frozen.put(documentId, copy);
                all.addAll(copy);
            });
            all.sort(Comparator.comparing(IndexEntry::documentId).thenComparingInt(IndexEntry::ordinal));
            return new Snapshot(dimension, Map.copyOf(frozen), Map.copyOf(versions), List.copyOf(all));
        }

        @Override
        public List<ScoredEntry> vectorSearch(float[] queryVector, int k) {
            requireDimension(queryVector, dimension, "query vector");
            if (k <= 0) {
                return List.of();
            }
            double queryNorm = norm(queryVector);
            return entries.stream()
                    .map(entry -> new ScoredEntry(entry, cosine(queryVector, queryNorm, entry.vector())))
                    .sorted(RANKING)
                    .limit(k)
                    .toList();
        }

        @Override
        public List<ScoredEntry> keywordSearch(String queryText, int k) {
            Set<String> terms = KeywordAnalyzer.queryTerms(queryText);
            if (k <= 0 || terms.isEmpty()) {
                return List.of();
            }
            return entries.stream()
                    .map(entry -> new ScoredEntry(entry, KeywordAnalyzer.score(terms, entry.keywordFrequencies())))
                    .filter(scored -> scored.score() > 0.0)
                    .sorted(RANKING)
                    .limit(k)
                    .toList();
        }
    }

    record PersistedIndex(int dimension, Map<String, Long> versions, List<IndexEntry> entries) {
    }
}
