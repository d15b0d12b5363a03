package com.driverag.ingest;

public record TextChunk(int ordinal, int startOffset, int endOffset, String text) {
}
