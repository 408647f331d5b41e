package com.autonomous.approval.service;

import com.autonomous.approval.model.Channel;
import com.autonomous.approval.model.ChannelSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ChannelSnapshotStoreTest {

    @TempDir
    Path tempDir;

    private ChannelSnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new ChannelSnapshotStore();
        store.setDataPath(tempDir.resolve("data").toString());
    }

    @Test
    void shouldTreatMissingFileAsColdStart() {
        assertTrue(store.load().isEmpty());
    }

    @Test
    void shouldPersistAndReload() {
        Instant created = Instant.parse("2026-01-01T10:00:00Z");
        Channel channel = Channel.builder()
            .id("C1")
            .displayName("appr-s1-1234abcd")
            .sessionId("s1")
            .createdAt(created)
            .build();
        ChannelSnapshot snapshot = new ChannelSnapshot();
        snapshot.getChannels().add(new ChannelSnapshot.ChannelEntry("C1", channel));
        snapshot.getSessionIndex().add(new ChannelSnapshot.SessionIndexEntry("s1", "C1"));
        snapshot.setSavedAt(created);

        store.save(snapshot);
        Optional<ChannelSnapshot> loaded = store.load();

        assertTrue(loaded.isPresent());
        assertEquals(channel, loaded.get().getChannels().get(0).getChannel());
        assertEquals("s1", loaded.get().getSessionIndex().get(0).getSessionId());
        assertEquals(created, loaded.get().getSavedAt());
    }

    @Test
    void shouldWriteEntriesAsPairs() throws IOException {
        ChannelSnapshot snapshot = new ChannelSnapshot();
        snapshot.getSessionIndex().add(new ChannelSnapshot.SessionIndexEntry("s1", "C1"));
        snapshot.setSavedAt(Instant.parse("2026-01-01T10:00:00Z"));

        store.save(snapshot);
        String json = Files.readString(store.getSnapshotPath());

        assertTrue(json.replaceAll("\\s", "").contains("\"sessionIndex\":[[\"s1\",\"C1\"]]"));
        assertTrue(json.contains("2026-01-01T10:00:00Z"));
    }

    @Test
    void shouldLeaveNoTempFilesBehind() throws IOException {
        store.save(new ChannelSnapshot());
        store.save(new ChannelSnapshot());

        try (Stream<Path> files = Files.list(store.getSnapshotPath().getParent())) {
            assertEquals(List.of("channel-mappings.json"),
                files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void shouldMoveCorruptSnapshotAside() throws IOException {
        Files.createDirectories(store.getSnapshotPath().getParent());
        Files.writeString(store.getSnapshotPath(), "{ not json");

        assertTrue(store.load().isEmpty());
        assertFalse(Files.exists(store.getSnapshotPath()));
        try (Stream<Path> files = Files.list(store.getSnapshotPath().getParent())) {
            assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith("channel-mappings.json.corrupt-")));
        }
    }
}
