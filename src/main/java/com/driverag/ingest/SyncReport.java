package com.driverag.ingest;

public record SyncReport(int indexed, int skipped, int stale, int failed, int deleted, int totalFiles) {
}
