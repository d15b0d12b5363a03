package com.driverag.retrieval;

public record RetrievalRequest(String query, int k, double vectorWeight, double keywordWeight) {
}
