package com.driverag.retrieval;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.driverag.embedding.EmbeddingGateway;
import com.driverag.error.DriveRagException;
import com.driverag.error.InvalidConfigException;
import com.driverag.error.InvalidQueryException;
import com.driverag.error.RetrievalCancelledException;
import com.driverag.error.StoreUnavailableException;
import com.driverag.index.IndexEntry;
import com.driverag.index.IndexView;
import com.driverag.index.ScoredEntry;
import com.driverag.index.VectorIndexStore;

/**
 * Combines a vector search and a keyword search over one snapshot of the store into one ranking.
 *
 * <p>Both searches run concurrently and each asks for {@code k * overfetchFactor} candidates. Each list is
 * normalized by its own best score, hits are merged by chunk id, and the fused score is
 * {@code vectorWeight * vector + keywordWeight * keyword} with 0 for the search that missed a chunk.
 * Ties are broken by chunk id.
 */
public class HybridRetriever {
    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

    private static final Comparator<RetrievalResult> FUSED_RANKING = Comparator
            .comparingDouble(RetrievalResult::fusedScore).reversed()
            .thenComparing(RetrievalResult::chunkId);

    private final VectorIndexStore store;
    private final EmbeddingGateway embeddingGateway;
    private final ExecutorService executor;
    private final int overfetchFactor;
    private final long timeoutMs;

    public HybridRetriever(
            VectorIndexStore store,
            EmbeddingGateway embeddingGateway,
            ExecutorService executor,
            int overfetchFactor,
            Duration timeout) {
        if (overfetchFactor < 1) {
            throw new InvalidConfigException("overfetchFactor must be >= 1 but was " + overfetchFactor);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new InvalidConfigException("retrieval timeout must be positive");
        }
        this.store = store;
        this.embeddingGateway = embeddingGateway;
        this.executor = executor;
        this.overfetchFactor = overfetchFactor;
        this.timeoutMs = timeout.toMillis();
    }

    public List<RetrievalResult> retrieve(String query, int k, double vectorWeight, double keywordWeight) {
        return retrieve(new RetrievalRequest(query, k, vectorWeight, keywordWeight));
    }

    public List<RetrievalResult> retrieve(RetrievalRequest request) {
        validate(request);
        long t0 = System.nanoTime();
        int candidates = (int) Math.min((long) request.k() * overfetchFactor, Integer.MAX_VALUE);

        float[] queryVector = embeddingGateway.embedQuery(request.query());
        IndexView view = store.view();
        CompletableFuture<List<ScoredEntry>> vectorFuture = CompletableFuture.supplyAsync(
                () -> view.vectorSearch(queryVector, candidates), executor);
        CompletableFuture<List<ScoredEntry>> keywordFuture = CompletableFuture.supplyAsync(
                () -> view.keywordSearch(request.query(), candidates), executor);

        List<ScoredEntry> vectorHits;
        List<ScoredEntry> keywordHits;
        try {
            CompletableFuture.allOf(vectorFuture, keywordFuture).get(timeoutMs, TimeUnit.MILLISECONDS);
            vectorHits = vectorFuture.join();
            keywordHits = keywordFuture.join();
        } catch (TimeoutException e) {
            abandon(vectorFuture, keywordFuture);
            throw new StoreUnavailableException("Searches did not finish within " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            abandon(vectorFuture, keywordFuture);
            Thread.currentThread().interrupt();
            throw new RetrievalCancelledException("Retrieval interrupted", e);
        } catch (ExecutionException e) {
            abandon(vectorFuture, keywordFuture);
            if (e.getCause() instanceof DriveRagException domainFailure) {
                throw domainFailure;
            }
            throw new StoreUnavailableException("Search failed: " + e.getCause().getMessage(), e.getCause());
        }

        List<RetrievalResult> fused = fuse(vectorHits, keywordHits, request.vectorWeight(), request.keywordWeight());
        List<RetrievalResult> top = fused.size() > request.k() ? fused.subList(0, request.k()) : fused;

        log.info("retrieve.done k={} vectorWeight={} keywordWeight={} vecN={} kwN={} mergedN={} outN={} ms={}",
                request.k(), request.vectorWeight(), request.keywordWeight(), vectorHits.size(), keywordHits.size(),
                fused.size(), top.size(), (System.nanoTime() - t0) / 1_000_000);
        return List.copyOf(top);
    }

    static List<RetrievalResult> fuse(
            List<ScoredEntry> vectorHits,
            List<ScoredEntry> keywordHits,
            double vectorWeight,
            double keywordWeight) {
        double vectorBest = best(vectorHits);
        double keywordBest = best(keywordHits);

        Map<String, double[]> raw = new LinkedHashMap<>();
        Map<String, IndexEntry> entries = new LinkedHashMap<>();
        for (ScoredEntry hit : vectorHits) {
            entries.putIfAbsent(hit.entry().chunkId(), hit.entry());
            raw.computeIfAbsent(hit.entry().chunkId(), unused -> new double[2])[0] = hit.score();
        }
        for (ScoredEntry hit : keywordHits) {
            entries.putIfAbsent(hit.entry().chunkId(), hit.entry());
            raw.computeIfAbsent(hit.entry().chunkId(), unused -> new double[2])[1] = hit.score();
        }

        List<RetrievalResult> out = new ArrayList<>(raw.size());
        raw.forEach((chunkId, scores) -> {
            double vectorNorm = normalize(scores[0], vectorBest);
            double keywordNorm = normalize(scores[1], keywordBest);
            out.add(new RetrievalResult(
                    entries.get(chunkId),
                    vectorWeight * vectorNorm + keywordWeight * keywordNorm,
                    scores[0],
                    scores[1],
                    vectorNorm,
                    keywordNorm));
        });
        out.sort(FUSED_RANKING);
        return out;
    }

    private static double best(List<ScoredEntry> hits) {
        double best = 0.0;
        for (ScoredEntry hit : hits) {
            best = Math.max(best, hit.score());
        }
        return best;
    }

    // cosine can be negative; anything at or below zero contributes nothing
    private static double normalize(double score, double best) {
        if (best <= 0.0 || Double.isNaN(score) || score <= 0.0) {
            return 0.0;
        }
        return Math.min(1.0, score / best);
    }

    private static void validate(RetrievalRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            throw new InvalidQueryException("Query text must not be empty");
        }
        if (request.k() <= 0) {
            throw new InvalidQueryException("k must be > 0 but was " + request.k());
        }
        if (!Double.isFinite(request.vectorWeight()) || !Double.isFinite(request.keywordWeight())
                || request.vectorWeight() < 0.0 || request.keywordWeight() < 0.0) {
            throw new InvalidQueryException("Weights must be finite and >= 0");
        }
        if (request.vectorWeight() + request.keywordWeight() <= 0.0) {
            throw new InvalidQueryException("At least one weight must be positive");
        }
    }

    private static void abandon(CompletableFuture<?>... futures) {
        for (CompletableFuture<?> future : futures) {
            future.cancel(true);
        }
    }
}
