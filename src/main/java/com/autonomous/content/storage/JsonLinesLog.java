package com.autonomous.content.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only file of one JSON document per line. A log without a path keeps nothing on disk.
 */
public class JsonLinesLog<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesLog.class);

    private final Path file;
    private final Class<T> type;
    private final ObjectMapper mapper;

    public JsonLinesLog(Path file, Class<T> type, ObjectMapper mapper) {
        this.file = file;
        this.type = type;
        this.mapper = mapper;
    }

    public static <T> JsonLinesLog<T> inMemory(Class<T> type) {
        return new JsonLinesLog<>(null, type, null);
    }

    public boolean isPersistent() {
        return file != null;
    }

    public synchronized void append(T record) throws IOException {
        if (file == null) {
            return;
        }
        Files.createDirectories(file.toAbsolutePath().getParent());
        String json = mapper.writeValueAsString(record);
        Files.writeString(file, json + "\n", StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    /** Reads every well-formed line; malformed lines are logged and skipped. */
    public List<T> readAll() throws IOException {
        List<T> records = new ArrayList<>();
        if (file == null || !Files.exists(file)) {
            return records;
        }
        try (Stream<String> lines = Files.lines(file)) {
            lines.filter(line -> !line.isBlank()).forEach(line -> {
                try {
                    records.add(mapper.readValue(line, type));
                } catch (IOException e) {
                    log.warn("Skipping malformed line in {}: {}", file, e.getMessage());
                }
            });
        }
        return records;
    }
}
