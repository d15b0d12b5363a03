package com.driverag.ingest;

import java.util.Optional;

public class ChangeDetector {
    private final DocumentRegistry registry;

    public ChangeDetector(DocumentRegistry registry) {
        this.registry = registry;
    }

    public boolean shouldReindex(String documentId, String fingerprint) {
        Optional<DocumentRecord> record = registry.find(documentId);
        return record.isEmpty() || !record.get().fingerprint().equals(fingerprint);
    }

    public boolean isEmbeddingStale(String documentId, String embeddingVersion) {
        return registry.find(documentId)
                .map(record -> !embeddingVersion.equals(record.embeddingVersion()))
                .orElse(false);
    }
}
