package com.driverag.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

public class DocxTextExtractor implements TextExtractor {

    @Override
    public boolean supports(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".docx");
    }

    @Override
    public String extract(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path);
                XWPFWordExtractor extractor = new XWPFWordExtractor(new XWPFDocument(in))) {
            String text = extractor.getText();
            if (text == null) {
                return "";
            }
            return text.replace("\u0000", "").trim();
        } catch (POIXMLException | IllegalArgumentException e) {
            // POI reports empty and non-OOXML input with unchecked exceptions
            throw new IOException("Not a readable DOCX file: " + path, e);
        }
    }
}
