package com.barcache.service.backfill;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON file holding the backfill checkpoint.
 * Writes go to a temporary sibling first and are then renamed over the real file,
 * so a crash mid-write leaves the previous checkpoint intact.
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final Path file;
    private final ObjectMapper mapper;

    public CheckpointStore(Path file) {
        this.file = file;
        this.mapper = createMapper();
    }

    protected ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * The stored checkpoint, or null when there is none.
     */
    public BackfillCheckpoint load() throws IOException {
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return mapper.readValue(file.toFile(), BackfillCheckpoint.class);
        } catch (IOException e) {
            throw new IOException("Unreadable backfill checkpoint " + file + ": " + e.getMessage(), e);
        }
    }

    public void save(BackfillCheckpoint checkpoint) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(temp.toFile(), checkpoint);
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public boolean clear() throws IOException {
        boolean deleted = Files.deleteIfExists(file);
        if (deleted) {
            log.info("Cleared backfill checkpoint {}", file);
        }
        return deleted;
    }

    public boolean exists() {
        return Files.exists(file);
    }
}
