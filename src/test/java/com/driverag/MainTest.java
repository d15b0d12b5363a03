package com.driverag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.driverag.ingest.DocumentFixtures;
import com.driverag.ingest.DocumentRecord;
import com.driverag.ingest.DocumentRegistry;
import com.driverag.ingest.SourceType;
import com.driverag.index.LocalJsonVectorIndexStore;

import picocli.CommandLine;

class MainTest {

    @TempDir
    Path tempDir;

    private Path configPath;
    private Path indexPath;
    private Path registryPath;

    @BeforeEach
    void writeConfig() throws IOException {
        indexPath = tempDir.resolve("state").resolve("index.json");
        registryPath = tempDir.resolve("state").resolve("documents.json");
        configPath = Files.writeString(tempDir.resolve("drive-rag.yml"), """
                chunking:
                  maxChunkSize: 200
                  overlap: 40
                  lookbackWindow: 50
                embedding:
                  provider: hashing
                  dimension: 32
                  timeoutMs: 5000
                ingestion:
                  workerThreads: 2
                  maxAttempts: 1
                  initialBackoffMs: 0
                  maxBackoffMs: 0
                store:
                  indexPath: %s
                  registryPath: %s
                """.formatted(yamlPath(indexPath), yamlPath(registryPath)));
    }

    @Test
    void shouldIngestThenRetrieveAndList() throws IOException {
        Path refunds = Files.writeString(tempDir.resolve("refunds.md"),
                "# Refunds\nOur refund policy allows returns within 30 days of delivery.");
        Path shipping = Files.writeString(tempDir.resolve("shipping.txt"), "Orders ship within two business days.");

        assertEquals(0, run("--mode", "ingest", "--file", refunds.toString(), "--file", shipping.toString()));
        assertEquals(0, run("--mode", "retrieve", "--query", "refund policy", "--top-k", "2"));
        assertEquals(0, run("--mode", "list"));

        List<DocumentRecord> records = DocumentRegistry.open(registryPath).all();
        assertEquals(2, records.size());
        assertTrue(records.stream().allMatch(record -> record.version() == 1));
        LocalJsonVectorIndexStore store = LocalJsonVectorIndexStore.open(indexPath, 32);
        assertEquals(2, store.size());
        assertEquals("refunds.md", store.keywordSearch("refund", 1).get(0).entry().sourceName());
    }

    @Test
    void shouldIngestDocxAndReportCorruptPdf() throws IOException {
        Path docx = DocumentFixtures.writeDocx(tempDir.resolve("warranty.docx"),
                "Warranty covers parts for two years.");
        Path brokenPdf = Files.writeString(tempDir.resolve("broken.pdf"), "not a pdf");

        assertEquals(0, run("--mode", "ingest", "--file", docx.toString()));
        assertEquals(Main.EXIT_FAILURE, run("--mode", "ingest", "--file", brokenPdf.toString()));

        List<DocumentRecord> records = DocumentRegistry.open(registryPath).all();
        assertEquals(List.of("warranty.docx"), records.stream().map(DocumentRecord::displayName).toList());
        LocalJsonVectorIndexStore store = LocalJsonVectorIndexStore.open(indexPath, 32);
        assertEquals("Warranty covers parts for two years.", store.entries(records.get(0).id()).get(0).text());
    }

    @Test
    void shouldIngestDriveFileUnderItsLocator() throws IOException {
        Path export = Files.writeString(tempDir.resolve("export.txt"), "Quarterly pricing update.");

        assertEquals(0, run("--mode", "ingest", "--file", export.toString(), "--source-type", "DRIVE",
                "--locator", "1AbCdriveFileId"));

        DocumentRecord record = DocumentRegistry.open(registryPath).all().get(0);
        assertEquals(SourceType.DRIVE.documentId("1AbCdriveFileId"), record.id());
        assertEquals("1AbCdriveFileId", record.sourceLocator());
    }

    @Test
    void shouldSyncDirectoryAndDeleteDocument() throws IOException {
        Path uploads = Files.createDirectories(tempDir.resolve("uploads"));
        Files.writeString(uploads.resolve("a.txt"), "Alpha handbook section.");
        Files.writeString(uploads.resolve("b.txt"), "Beta handbook section.");

        assertEquals(0, run("--mode", "sync", "--source-dir", uploads.toString()));
        List<DocumentRecord> records = DocumentRegistry.open(registryPath).all();
        assertEquals(2, records.size());

        assertEquals(0, run("--mode", "delete", "--document-id", records.get(0).id()));
        assertEquals(Main.EXIT_FAILURE, run("--mode", "delete", "--document-id", records.get(0).id()));
        assertEquals(1, DocumentRegistry.open(registryPath).all().size());
    }

    @Test
    void shouldReportUsageErrors() {
        assertEquals(Main.EXIT_USAGE_ERROR, run("--mode", "retrieve"));
        assertEquals(Main.EXIT_USAGE_ERROR, run("--mode", "ingest"));
        assertEquals(Main.EXIT_USAGE_ERROR, run("--mode", "sync"));
        assertEquals(Main.EXIT_USAGE_ERROR, run("--mode", "delete"));
    }

    @Test
    void shouldFailIngestOfUnsupportedFile() throws IOException {
        Path image = Files.write(tempDir.resolve("scan.png"), new byte[] { 1, 2, 3 });

        assertEquals(Main.EXIT_FAILURE, run("--mode", "ingest", "--file", image.toString()));
    }

    @Test
    void shouldRejectInvalidQueryWeights() {
        assertEquals(Main.EXIT_FAILURE, run("--mode", "retrieve", "--query", "refund",
                "--vector-weight", "0", "--keyword-weight", "0"));
    }

    private int run(String... args) {
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = configPath.toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return new CommandLine(new Main()).execute(withConfig);
    }

    private static String yamlPath(Path path) {
        return path.toString().replace('\\', '/');
    }
}
