package com.driverag.ingest;

import java.util.ArrayList;
import java.util.List;

import com.driverag.error.InvalidConfigException;

public class Chunker {
    private final int maxChunkSize;
    private final int overlap;
    private final int lookbackWindow;

    public Chunker(int maxChunkSize, int overlap) {
        this(maxChunkSize, overlap, maxChunkSize / 4);
    }

    public Chunker(int maxChunkSize, int overlap, int lookbackWindow) {
        validate(maxChunkSize, overlap);
        if (lookbackWindow < 0) {
            throw new InvalidConfigException("lookbackWindow must be >= 0 but was " + lookbackWindow);
        }
        this.maxChunkSize = maxChunkSize;
        this.overlap = overlap;
        this.lookbackWindow = Math.min(lookbackWindow, maxChunkSize - 1);
    }

    public static List<TextChunk> chunk(String text, int maxChunkSize, int overlap) {
        return new Chunker(maxChunkSize, overlap).chunk(text);
    }

    public List<TextChunk> chunk(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<TextChunk> chunks = new ArrayList<>();
        int length = text.length();
        int start = 0;
        int ordinal = 0;
        while (true) {
            if (length - start <= maxChunkSize) {
                chunks.add(new TextChunk(ordinal, start, length, text.substring(start)));
                break;
            }
            int cut = findCut(text, start);
            chunks.add(new TextChunk(ordinal, start, cut, text.substring(start, cut)));
            start = cut - overlap;
            ordinal++;
        }
        return chunks;
    }

    private int findCut(String text, int start) {
        int hardEnd = start + maxChunkSize;
        // a cut at or below this point would not move the next window forward
        int floor = Math.max(start + overlap + 1, hardEnd - lookbackWindow);
        for (int cut = hardEnd; cut >= floor; cut--) {
            if (isBoundaryBefore(text, cut)) {
                return cut;
            }
        }
        // keep surrogate pairs whole
        if (Character.isHighSurrogate(text.charAt(hardEnd - 1)) && hardEnd - 1 > start + overlap) {
            return hardEnd - 1;
        }
        return hardEnd;
    }

    private static boolean isBoundaryBefore(String text, int cut) {
        char previous = text.charAt(cut - 1);
        if (previous == '\n') {
            return true;
        }
        if (cut >= 2 && Character.isWhitespace(previous)) {
            char terminator = text.charAt(cut - 2);
            return terminator == '.' || terminator == '!' || terminator == '?';
        }
        return false;
    }

    private static void validate(int maxChunkSize, int overlap) {
        if (maxChunkSize <= 0) {
            throw new InvalidConfigException("maxChunkSize must be > 0 but was " + maxChunkSize);
        }
        if (overlap < 0 || overlap >= maxChunkSize) {
            throw new InvalidConfigException(
                    "overlap must be >= 0 and < maxChunkSize (" + maxChunkSize + ") but was " + overlap);
        }
    }
}
