package com.driverag.ingest;

public record IngestionOutcome(String documentId, Status status, long version, int chunkCount, String detail) {

    public enum Status {
        INDEXED,
        SKIPPED,
        STALE,
        FAILED
    }

    static IngestionOutcome indexed(String documentId, long version, int chunkCount) {
        return new IngestionOutcome(documentId, Status.INDEXED, version, chunkCount, "");
    }

    static IngestionOutcome skipped(DocumentRecord record) {
        return new IngestionOutcome(record.id(), Status.SKIPPED, record.version(), record.chunkCount(), "unchanged");
    }

    static IngestionOutcome stale(String documentId, long version, String detail) {
        return new IngestionOutcome(documentId, Status.STALE, version, 0, detail);
    }

    static IngestionOutcome failed(String documentId, long version, String detail) {
        return new IngestionOutcome(documentId, Status.FAILED, version, 0, detail);
    }
}
