package com.driverag.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.driverag.error.EmbeddingMalformedException;
import com.driverag.error.EmbeddingUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class OpenAiEmbeddingProvider implements EmbeddingProvider {
    public static final String DEFAULT_ENDPOINT = "https://api.openai.com/v1/embeddings";
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public OpenAiEmbeddingProvider(OkHttpClient httpClient, String endpoint, String model, String apiKey, int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        Request request;
        try {
            String payload = mapper.writeValueAsString(Map.of("model", model, "input", texts));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            request = requestBuilder.build();
        } catch (IOException e) {
            throw new EmbeddingUnavailableException("Unable to encode embedding request", e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new EmbeddingUnavailableException(
                        "Embedding provider answered HTTP " + response.code() + " for " + texts.size() + " inputs");
            }
            return parse(body.string());
        } catch (JsonProcessingException e) {
            throw new EmbeddingMalformedException("Embedding response is not valid JSON", e);
        } catch (IOException e) {
            throw new EmbeddingUnavailableException("Embedding request to " + endpoint + " failed", e);
        }
    }

    private List<float[]> parse(String json) throws IOException {
        JsonNode data = mapper.readTree(json).path("data");
        if (!data.isArray()) {
            throw new EmbeddingMalformedException("Embedding response has no data array");
        }
        float[][] ordered = new float[data.size()][];
        for (JsonNode item : data) {
            int index = item.path("index").asInt(-1);
            JsonNode vectorNode = item.path("embedding");
            if (index < 0 || index >= ordered.length || !vectorNode.isArray()) {
                throw new EmbeddingMalformedException("Embedding response item has a bad index or vector");
            }
            float[] vector = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                vector[i] = (float) vectorNode.get(i).asDouble();
            }
            ordered[index] = vector;
        }
        return new ArrayList<>(Arrays.asList(ordered));
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "openai-" + model;
    }
}
