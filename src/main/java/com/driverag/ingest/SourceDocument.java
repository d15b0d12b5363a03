package com.driverag.ingest;

import java.time.Instant;
import java.util.Objects;

public record SourceDocument(
        SourceType sourceType,
        String locator,
        String displayName,
        String text,
        Instant sourceModifiedAt) {

    public SourceDocument {
        Objects.requireNonNull(sourceType, "sourceType");
        Objects.requireNonNull(locator, "locator");
        displayName = displayName == null || displayName.isBlank() ? locator : displayName;
        text = text == null ? "" : text;
    }

    public static SourceDocument upload(String path, String displayName, String text, Instant modifiedAt) {
        return new SourceDocument(SourceType.UPLOAD, path, displayName, text, modifiedAt);
    }

    public static SourceDocument drive(String fileId, String displayName, String text, Instant modifiedTime) {
        return new SourceDocument(SourceType.DRIVE, fileId, displayName, text, modifiedTime);
    }

    public String documentId() {
        return sourceType.documentId(locator);
    }
}
