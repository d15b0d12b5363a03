package com.driverag.retrieval;

import com.driverag.index.IndexEntry;

public record RetrievalResult(
        IndexEntry entry,
        double fusedScore,
        double vectorScore,
        double keywordScore,
        double normalizedVectorScore,
        double normalizedKeywordScore) {

    public String chunkId() {
        return entry.chunkId();
    }

    public String sourceName() {
        return entry.sourceName();
    }
}
