package com.driverag.retrieval;

import java.util.List;
import java.util.Locale;

public final class ContextFormatter {
    static final String NO_CONTEXT = "No relevant context found.";
    private static final int SNIPPET_LENGTH = 240;

    private ContextFormatter() {
    }

    public static String format(List<RetrievalResult> results) {
        if (results.isEmpty()) {
            return NO_CONTEXT;
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < results.size(); i++) {
            RetrievalResult result = results.get(i);
            builder.append("Document ").append(i + 1).append(":\n")
                    .append("Source: ").append(result.sourceName()).append('\n')
                    .append("Reference: ").append(result.chunkId()).append('\n')
                    .append("Score: ").append(String.format(Locale.ROOT, "%.4f", result.fusedScore())).append('\n')
                    .append("Content: ").append(result.entry().text().strip()).append('\n')
                    .append("---\n");
        }
        return builder.toString();
    }

    public static String citation(RetrievalResult result) {
        String trimmed = result.entry().text().strip().replaceAll("\\s+", " ");
        if (trimmed.length() > SNIPPET_LENGTH) {
            trimmed = trimmed.substring(0, SNIPPET_LENGTH) + "...";
        }
        return "%s:%d-%d %s".formatted(
                result.sourceName(),
                result.entry().startOffset(),
                result.entry().endOffset(),
                trimmed);
    }
}
