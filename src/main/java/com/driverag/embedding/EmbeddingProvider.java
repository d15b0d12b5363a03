package com.driverag.embedding;

import java.util.List;

public interface EmbeddingProvider {
    List<float[]> embedBatch(List<String> texts);

    int dimension();

    String version();
}
