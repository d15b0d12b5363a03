package com.driverag.runtime;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.driverag.embedding.EmbeddingGateway;
import com.driverag.embedding.EmbeddingProvider;
import com.driverag.embedding.EmbeddingProviders;
import com.driverag.ingest.Chunker;
import com.driverag.ingest.CompositeTextExtractor;
import com.driverag.ingest.DirectorySyncService;
import com.driverag.ingest.DocumentRegistry;
import com.driverag.ingest.IngestionPipeline;
import com.driverag.ingest.RetryPolicy;
import com.driverag.ingest.TextExtractor;
import com.driverag.index.LocalJsonVectorIndexStore;
import com.driverag.index.VectorIndexStore;
import com.driverag.retrieval.HybridRetriever;

import okhttp3.OkHttpClient;

public class RetrievalEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetrievalEngine.class);

    private final ExecutorService ingestionExecutor;
    private final ExecutorService embeddingExecutor;
    private final ExecutorService searchExecutor;
    private final VectorIndexStore store;
    private final DocumentRegistry registry;
    private final EmbeddingGateway embeddingGateway;
    private final IngestionPipeline pipeline;
    private final HybridRetriever retriever;
    private final TextExtractor extractor;
    private final DirectorySyncService directorySync;

    public RetrievalEngine(AppConfig config, EmbeddingProvider provider) {
        AppConfig.EmbeddingConfig embedding = config.getEmbedding();
        AppConfig.IngestionConfig ingestion = config.getIngestion();
        AppConfig.RetrievalConfig retrieval = config.getRetrieval();
        AppConfig.ChunkingConfig chunking = config.getChunking();

        Chunker chunker = new Chunker(chunking.getMaxChunkSize(), chunking.getOverlap(), chunking.getLookbackWindow());
        RetryPolicy retryPolicy = new RetryPolicy(ingestion.getMaxAttempts(), ingestion.getInitialBackoffMs(),
                ingestion.getMaxBackoffMs());

        this.store = LocalJsonVectorIndexStore.open(Path.of(config.getStore().getIndexPath()), provider.dimension());
        this.registry = DocumentRegistry.open(Path.of(config.getStore().getRegistryPath()));
        this.ingestionExecutor = Executors.newFixedThreadPool(Math.max(1, ingestion.getWorkerThreads()));
        this.embeddingExecutor = Executors.newCachedThreadPool();
        this.searchExecutor = Executors.newCachedThreadPool();
        this.embeddingGateway = new EmbeddingGateway(
                provider,
                embeddingExecutor,
                embedding.getBatchSize(),
                embedding.getMaxConcurrentRequests(),
                embedding.getMaxInputChars(),
                Duration.ofMillis(embedding.getTimeoutMs()));
        this.pipeline = new IngestionPipeline(chunker, embeddingGateway, store, registry, retryPolicy, ingestionExecutor);
        this.retriever = new HybridRetriever(store, embeddingGateway, searchExecutor, retrieval.getOverfetchFactor(),
                Duration.ofMillis(retrieval.getTimeoutMs()));
        this.extractor = CompositeTextExtractor.defaults();
        this.directorySync = new DirectorySyncService(pipeline, registry, extractor);

        log.info("engine.ready provider={} dimension={} maxChunkSize={} overlap={} indexPath={} registryPath={}",
                provider.version(), provider.dimension(), chunking.getMaxChunkSize(), chunking.getOverlap(),
                config.getStore().getIndexPath(), config.getStore().getRegistryPath());
    }

    public static RetrievalEngine fromConfig(AppConfig config, OkHttpClient httpClient) {
        return new RetrievalEngine(config, EmbeddingProviders.fromConfig(config.getEmbedding(), httpClient));
    }

    public VectorIndexStore store() {
        return store;
    }

    public DocumentRegistry registry() {
        return registry;
    }

    public IngestionPipeline pipeline() {
        return pipeline;
    }

    public HybridRetriever retriever() {
        return retriever;
    }

    public TextExtractor extractor() {
        return extractor;
    }

    public DirectorySyncService directorySync() {
        return directorySync;
    }

    @Override
    public void close() {
        ingestionExecutor.shutdown();
        embeddingExecutor.shutdown();
        searchExecutor.shutdown();
        try {
            if (!ingestionExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("engine.close ingestion workers still running after 30s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            ingestionExecutor.shutdownNow();
            embeddingExecutor.shutdownNow();
            searchExecutor.shutdownNow();
        }
    }
}
