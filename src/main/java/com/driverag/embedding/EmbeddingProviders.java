package com.driverag.embedding;

import java.util.Locale;
import java.util.Map;

import com.driverag.error.InvalidConfigException;
import com.driverag.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private EmbeddingProviders() {
    }

    public static EmbeddingProvider fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        return fromConfig(config, httpClient, System.getenv());
    }

    static EmbeddingProvider fromConfig(
            AppConfig.EmbeddingConfig config,
            OkHttpClient httpClient,
            Map<String, String> environment) {
        if (config.getDimension() <= 0) {
            throw new InvalidConfigException("embedding dimension must be > 0 but was " + config.getDimension());
        }
        String provider = config.getProvider() == null ? "hashing" : config.getProvider().toLowerCase(Locale.ROOT);
        switch (provider) {
            case "hashing":
            case "local":
                return new HashingEmbeddingProvider(config.getDimension());
            case "openai":
                String apiKey = config.getApiKey();
                if ((apiKey == null || apiKey.isBlank()) && config.getApiKeyEnv() != null) {
                    apiKey = environment.get(config.getApiKeyEnv());
                }
                if (apiKey == null || apiKey.isBlank()) {
                    throw new InvalidConfigException("embedding provider 'openai' requires an API key in "
                            + config.getApiKeyEnv() + " or embedding.apiKey");
                }
                return new OpenAiEmbeddingProvider(
                        httpClient,
                        config.getEndpoint(),
                        config.getModel(),
                        apiKey,
                        config.getDimension());
            default:
                throw new InvalidConfigException("Unknown embedding provider: " + config.getProvider());
        }
    }
}
