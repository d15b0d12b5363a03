package com.driverag.embedding;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.driverag.error.DriveRagException;
import com.driverag.error.EmbeddingMalformedException;
import com.driverag.error.EmbeddingUnavailableException;
import com.driverag.error.InvalidConfigException;

public class EmbeddingGateway {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingGateway.class);

    private final EmbeddingProvider provider;
    private final ExecutorService executor;
    private final Semaphore inFlight;
    private final int batchSize;
    private final int maxInputChars;
    private final long timeoutMs;

    public EmbeddingGateway(
            EmbeddingProvider provider,
            ExecutorService executor,
            int batchSize,
            int maxConcurrentRequests,
            int maxInputChars,
            Duration timeout) {
        if (batchSize <= 0) {
            throw new InvalidConfigException("embedding batchSize must be > 0 but was " + batchSize);
        }
        if (maxConcurrentRequests <= 0) {
            throw new InvalidConfigException("embedding maxConcurrentRequests must be > 0 but was " + maxConcurrentRequests);
        }
        if (maxInputChars <= 0) {
            throw new InvalidConfigException("embedding maxInputChars must be > 0 but was " + maxInputChars);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new InvalidConfigException("embedding timeout must be positive");
        }
        this.provider = provider;
        this.executor = executor;
        this.batchSize = batchSize;
        this.inFlight = new Semaphore(maxConcurrentRequests, true);
        this.maxInputChars = maxInputChars;
        this.timeoutMs = timeout.toMillis();
    }

    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += batchSize) {
            List<String> batch = truncate(texts.subList(start, Math.min(texts.size(), start + batchSize)));
            vectors.addAll(embedBatch(batch));
        }
        log.debug("embedding.done inputs={} batches={} provider={}",
                texts.size(), (texts.size() + batchSize - 1) / batchSize, provider.version());
        return vectors;
    }

    public float[] embedQuery(String query) {
        return embed(List.of(query)).get(0);
    }

    public int dimension() {
        return provider.dimension();
    }

    public String version() {
        return provider.version();
    }

    private List<float[]> embedBatch(List<String> batch) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        try {
            if (!inFlight.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new EmbeddingUnavailableException(
                        "Timed out after " + timeoutMs + " ms waiting for an embedding slot");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("Interrupted while waiting for an embedding slot", e);
        }
        Future<List<float[]>> future = null;
        try {
            future = executor.submit(() -> provider.embedBatch(batch));
            long remainingNs = Math.max(0L, deadline - System.nanoTime());
            List<float[]> vectors = future.get(remainingNs, TimeUnit.NANOSECONDS);
            validate(batch, vectors);
            return vectors;
        } catch (RejectedExecutionException e) {
            throw new EmbeddingUnavailableException("Embedding executor rejected the call", e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new EmbeddingUnavailableException("Embedding call timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DriveRagException domainFailure) {
                throw domainFailure;
            }
            throw new EmbeddingUnavailableException("Embedding provider failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("Interrupted while embedding", e);
        } finally {
            inFlight.release();
        }
    }

    private void validate(List<String> batch, List<float[]> vectors) {
        if (vectors == null || vectors.size() != batch.size()) {
            throw new EmbeddingMalformedException("Expected " + batch.size() + " vectors but provider returned "
                    + (vectors == null ? 0 : vectors.size()));
        }
        for (int i = 0; i < vectors.size(); i++) {
            float[] vector = vectors.get(i);
            if (vector == null || vector.length != provider.dimension()) {
                throw new EmbeddingMalformedException("Vector " + i + " has dimension "
                        + (vector == null ? 0 : vector.length) + ", expected " + provider.dimension());
            }
        }
    }

    private List<String> truncate(List<String> batch) {
        List<String> out = new ArrayList<>(batch.size());
        for (String text : batch) {
            out.add(text.length() > maxInputChars ? text.substring(0, maxInputChars) : text);
        }
        return out;
    }
}
