package com.driverag.index;

public record ScoredEntry(IndexEntry entry, double score) {
}
