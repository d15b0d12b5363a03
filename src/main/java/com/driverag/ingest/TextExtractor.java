package com.driverag.ingest;

import java.io.IOException;
import java.nio.file.Path;

public interface TextExtractor {
    boolean supports(Path path);

    String extract(Path path) throws IOException;
}
