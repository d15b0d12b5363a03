package com.driverag.index;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * The embedding is copied on the way in and on the way out, so indexed vectors cannot be changed by callers.
 */
public record IndexEntry(
        String chunkId,
        String documentId,
        long version,
        int ordinal,
        int startOffset,
        int endOffset,
        String sourceName,
        String text,
        float[] embedding,
        Map<String, Integer> keywordFrequencies) {

    public IndexEntry {
        embedding = embedding == null ? null : embedding.clone();
    }

    public static String chunkId(String documentId, int ordinal, long version) {
        return documentId + "#" + ordinal + "@v" + version;
    }

    @Override
    public float[] embedding() {
        return embedding == null ? null : embedding.clone();
    }

    // search path reads the stored vector without copying it
    float[] vector() {
        return embedding;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof IndexEntry that)) {
            return false;
        }
        return version == that.version
                && ordinal == that.ordinal
                && startOffset == that.startOffset
                && endOffset == that.endOffset
                && Objects.equals(chunkId, that.chunkId)
                && Objects.equals(documentId, that.documentId)
                && Objects.equals(sourceName, that.sourceName)
                && Objects.equals(text, that.text)
                && Arrays.equals(embedding, that.embedding)
                && Objects.equals(keywordFrequencies, that.keywordFrequencies);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(chunkId, documentId, version, ordinal, startOffset, endOffset, sourceName, text,
                keywordFrequencies) + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "IndexEntry[chunkId=" + chunkId + ", version=" + version + ", ordinal=" + ordinal
                + ", dimension=" + (embedding == null ? 0 : embedding.length) + "]";
    }
}
