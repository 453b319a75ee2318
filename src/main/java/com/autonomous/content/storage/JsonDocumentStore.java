package com.autonomous.content.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * One JSON file per entity, rewritten on every save. A store without a directory keeps nothing
 * on disk.
 */
public class JsonDocumentStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonDocumentStore.class);

    private final Path directory;
    private final Class<T> type;
    private final ObjectMapper mapper;

    public JsonDocumentStore(Path directory, Class<T> type, ObjectMapper mapper) {
        this.directory = directory;
        this.type = type;
        this.mapper = mapper;
    }

    public static <T> JsonDocumentStore<T> inMemory(Class<T> type) {
        return new JsonDocumentStore<>(null, type, null);
    }

    public void save(String id, T document) throws IOException {
        if (directory == null) {
            return;
        }
        Files.createDirectories(directory);
        Path target = directory.resolve(id + ".json");
        Path temp = directory.resolve(id + ".json.tmp");
        mapper.writeValue(temp.toFile(), document);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public void delete(String id) throws IOException {
        if (directory == null) {
            return;
        }
        Files.deleteIfExists(directory.resolve(id + ".json"));
    }

    public List<T> loadAll() throws IOException {
        List<T> documents = new ArrayList<>();
        if (directory == null || !Files.isDirectory(directory)) {
            return documents;
        }
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(path -> path.getFileName().toString().endsWith(".json")).forEach(path -> {
                try {
                    documents.add(mapper.readValue(path.toFile(), type));
                } catch (IOException e) {
                    log.warn("Skipping unreadable document {}: {}", path, e.getMessage());
                }
            });
        }
        return documents;
    }
}
