package com.scriptohio.orchestrator.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

@Slf4j
public class JsonlRecordLog<T> {

    private final Path file;
    private final Class<T> type;
    private final ObjectMapper mapper;

    public JsonlRecordLog(Path file, Class<T> type) {
        this.file = file;
        this.type = type;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public synchronized void append(T record) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        String json = mapper.writeValueAsString(record);
        Files.writeString(file, json + "\n", StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    public synchronized List<T> readAll() throws IOException {
        List<T> records = new ArrayList<>();
        if (!Files.exists(file)) {
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
