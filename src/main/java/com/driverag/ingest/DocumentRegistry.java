package com.driverag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.driverag.error.StoreUnavailableException;
import com.driverag.runtime.JsonFiles;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class DocumentRegistry {
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Map<String, DocumentRecord> records = new ConcurrentHashMap<>();
    private final Path path;
    private final Object writeLock = new Object();

    private DocumentRegistry(Path path) {
        this.path = path;
    }

    public static DocumentRegistry inMemory() {
        return new DocumentRegistry(null);
    }

    public static DocumentRegistry open(Path path) {
        DocumentRegistry registry = new DocumentRegistry(path);
        if (!Files.exists(path)) {
            return registry;
        }
        try {
            if (Files.size(path) == 0L) {
                return registry;
            }
            List<DocumentRecord> loaded = registry.mapper.readValue(path.toFile(),
                    new TypeReference<List<DocumentRecord>>() {
                    });
            for (DocumentRecord record : loaded) {
                registry.records.put(record.id(), record);
            }
            return registry;
        } catch (IOException e) {
            throw new StoreUnavailableException("Unable to read document registry " + path, e);
        }
    }

    public Optional<DocumentRecord> find(String documentId) {
        return Optional.ofNullable(records.get(documentId));
    }

    public List<DocumentRecord> all() {
        List<DocumentRecord> all = new ArrayList<>(records.values());
        all.sort(Comparator.comparing(DocumentRecord::id));
        return all;
    }

    /**
     * Stores {@code next} if the currently recorded version of the document equals {@code expectedVersion}
     * (0 meaning "no record yet").
     *
     * @return false when another writer got there first; nothing is changed in that case
     */
    public boolean commit(DocumentRecord next, long expectedVersion) {
        synchronized (writeLock) {
            DocumentRecord current = records.get(next.id());
            long currentVersion = current == null ? 0L : current.version();
            if (currentVersion != expectedVersion) {
                return false;
            }
            Map<String, DocumentRecord> updated = new ConcurrentHashMap<>(records);
            updated.put(next.id(), next);
            persist(updated);
            records.put(next.id(), next);
            return true;
        }
    }

    public boolean remove(String documentId) {
        synchronized (writeLock) {
            if (!records.containsKey(documentId)) {
                return false;
            }
            Map<String, DocumentRecord> updated = new ConcurrentHashMap<>(records);
            updated.remove(documentId);
            persist(updated);
            records.remove(documentId);
            return true;
        }
    }

    private void persist(Map<String, DocumentRecord> state) {
        if (path == null) {
            return;
        }
        List<DocumentRecord> sorted = new ArrayList<>(state.values());
        sorted.sort(Comparator.comparing(DocumentRecord::id));
        try {
            JsonFiles.writeAtomically(mapper, path, sorted);
        } catch (IOException e) {
            throw new StoreUnavailableException("Unable to write document registry " + path, e);
        }
    }
}
