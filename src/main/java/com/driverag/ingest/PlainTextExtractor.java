package com.driverag.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class PlainTextExtractor implements TextExtractor {
    private static final List<String> EXTENSIONS = List.of(".txt", ".md", ".markdown");

    @Override
    public boolean supports(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    @Override
    public String extract(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8).replace("\u0000", "");
    }
}
