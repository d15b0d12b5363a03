package com.driverag.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public class CompositeTextExtractor implements TextExtractor {
    private final List<TextExtractor> extractors;

    public CompositeTextExtractor(List<TextExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    public static CompositeTextExtractor defaults() {
        return new CompositeTextExtractor(List.of(
                new PlainTextExtractor(),
                new PdfTextExtractor(),
                new DocxTextExtractor()));
    }

    @Override
    public boolean supports(Path path) {
        return extractors.stream().anyMatch(extractor -> extractor.supports(path));
    }

    @Override
    public String extract(Path path) throws IOException {
        for (TextExtractor extractor : extractors) {
            if (extractor.supports(path)) {
                return extractor.extract(path);
            }
        }
        throw new IOException("Unsupported file type: " + path.getFileName());
    }
}
