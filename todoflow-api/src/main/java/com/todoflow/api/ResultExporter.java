package com.todoflow.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.todoflow.engine.coordinator.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes session snapshots as pretty-printed JSON files.
 */
@Component
public class ResultExporter {

    private static final Logger log = LoggerFactory.getLogger(ResultExporter.class);

    private final ObjectMapper mapper;

    public ResultExporter() {
        this(new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    @Autowired
    public ResultExporter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Export a snapshot, creating parent directories as needed.
     *
     * @return The path written
     */
    public Path export(SessionSnapshot snapshot, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), snapshot);
        log.info("Session {} exported to {}", snapshot.sessionId(), path);
        return path;
    }
}
