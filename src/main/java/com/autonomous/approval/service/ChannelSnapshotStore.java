package com.autonomous.approval.service;

import com.autonomous.approval.model.ChannelSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Reads and writes {@code channel-mappings.json}. Writes go to a temp file in the
 * same directory and are moved over the target, so a crash leaves either the old
 * or the new snapshot on disk.
 */
@Slf4j
@Service
public class ChannelSnapshotStore {

    static final String SNAPSHOT_FILE = "channel-mappings.json";

    @Value("${approval.data.path:data}")
    private String dataPath = "data";

    private final ObjectMapper mapper;

    public ChannelSnapshotStore() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void setDataPath(String dataPath) {
        this.dataPath = dataPath;
    }

    public Path getSnapshotPath() {
        return Paths.get(dataPath, SNAPSHOT_FILE);
    }

    /**
     * Loads the snapshot. A missing file is a cold start; an unreadable one is moved
     * aside so the next save does not silently discard it.
     */
    public Optional<ChannelSnapshot> load() {
        Path file = getSnapshotPath();
        if (!Files.exists(file)) {
            log.info("[Snapshot] No channel snapshot at {}, starting cold", file);
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), ChannelSnapshot.class));
        } catch (IOException e) {
            Path corrupt = file.resolveSibling(SNAPSHOT_FILE + ".corrupt-" + System.currentTimeMillis());
            log.error("[Snapshot] Unreadable snapshot {}, moving it to {}", file, corrupt, e);
            try {
                Files.move(file, corrupt, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                log.error("[Snapshot] Could not move corrupt snapshot aside", moveError);
            }
            return Optional.empty();
        }
    }

    public void save(ChannelSnapshot snapshot) {
        Path file = getSnapshotPath();
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, SNAPSHOT_FILE, ".tmp");
            try {
                mapper.writeValue(temp.toFile(), snapshot);
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write channel snapshot to " + file, e);
        }
    }
}
