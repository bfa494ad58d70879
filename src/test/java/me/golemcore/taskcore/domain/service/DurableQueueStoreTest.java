package me.golemcore.taskcore.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.taskcore.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.taskcore.domain.model.DurableRecord;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import me.golemcore.taskcore.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DurableQueueStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private TaskCoreProperties properties;
    private ObjectMapper objectMapper;
    private DurableQueueStore store;

    @BeforeEach
    void setUp() {
        properties = new TaskCoreProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        store = new DurableQueueStore(storage, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    @Test
    void shouldPersistRecordBeforeProcessing() {
        String id = store.write("chat-1", "hello");

        assertNotNull(id);
        assertTrue(id.startsWith("chat-1__" + NOW.toEpochMilli() + "__"));
        assertTrue(Files.exists(tempDir.resolve("queue").resolve(DurableQueueStore.fileName(id))));

        List<DurableRecord> pending = store.loadPending();
        assertEquals(1, pending.size());
        assertEquals(id, pending.get(0).getId());
        assertEquals("chat-1", pending.get(0).getLaneId());
        assertEquals("hello", pending.get(0).getPayload());
    }

    @Test
    void completeShouldRemoveRecord() {
        String id = store.write("chat-1", "hello");

        store.complete(id);

        assertTrue(store.loadPending().isEmpty());
    }

    @Test
    void completeShouldBeIdempotent() {
        String id = store.write("chat-1", "hello");

        store.complete(id);
        assertDoesNotThrow(() -> store.complete(id));
        assertDoesNotThrow(() -> store.complete(null));
    }

    @Test
    void shouldLoadPendingInEnqueueOrderEvenWithFixedClock() {
        String first = store.write("lane-b", "1");
        String second = store.write("lane-a", "2");
        String third = store.write("lane-b", "3");

        List<String> ids = store.loadPending().stream().map(DurableRecord::getId).toList();

        assertEquals(List.of(first, second, third), ids);
    }

    @Test
    void shouldSanitizeUnsafeLaneIdsInFileNames() {
        String id = store.write("user/42:main", "x");

        String fileName = DurableQueueStore.fileName(id);
        assertFalse(fileName.contains("/"));
        assertFalse(fileName.contains(":"));
        assertEquals("user/42:main", store.loadPending().get(0).getLaneId());
    }

    @Test
    void shouldSkipCorruptedRecordFiles() throws Exception {
        store.write("chat-1", "ok");
        Files.writeString(tempDir.resolve("queue").resolve("broken.json"), "{not json");
        Files.writeString(tempDir.resolve("queue").resolve("notes.txt"), "ignored");

        List<DurableRecord> pending = store.loadPending();

        assertEquals(1, pending.size());
        assertEquals("ok", pending.get(0).getPayload());
    }

    @Test
    void writeShouldReturnNullWhenStorageFails() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.putTextAtomic(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        DurableQueueStore failingStore = new DurableQueueStore(failing, objectMapper, Clock.systemUTC(),
                properties);

        assertNull(failingStore.write("chat-1", "hello"));
    }
}
