package com.driverag.ingest;

import java.time.Instant;

public record DocumentRecord(
        String id,
        SourceType sourceType,
        String sourceLocator,
        String displayName,
        String fingerprint,
        long version,
        String embeddingVersion,
        int chunkCount,
        Instant sourceModifiedAt,
        Instant createdAt,
        Instant lastIndexedAt) {

    public static DocumentRecord nextVersion(
            DocumentRecord previous,
            SourceDocument source,
            String fingerprint,
            long version,
            String embeddingVersion,
            int chunkCount,
            Instant now) {
        return new DocumentRecord(
                source.documentId(),
                source.sourceType(),
                source.locator(),
                source.displayName(),
                fingerprint,
                version,
                embeddingVersion,
                chunkCount,
                source.sourceModifiedAt(),
                previous == null ? now : previous.createdAt(),
                now);
    }
}
