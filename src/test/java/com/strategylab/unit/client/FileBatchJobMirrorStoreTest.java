package com.strategylab.unit.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strategylab.client.BatchJobMirror;
import com.strategylab.client.FileBatchJobMirrorStore;
import com.strategylab.domain.enums.BatchJobStatus;
import com.strategylab.domain.model.VariableDetail;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for FileBatchJobMirrorStore covering persistence across instances,
 * replacement of existing entries, ordering and tolerance of unreadable files.
 */
class FileBatchJobMirrorStoreTest {

    @TempDir
    Path directory;

    private ObjectMapper objectMapper;
    private FileBatchJobMirrorStore store;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        store = new FileBatchJobMirrorStore(directory, objectMapper);
    }

    private static BatchJobMirror mirror(String id, Instant createdAt) {
        return BatchJobMirror.builder()
                .id(id)
                .name("sweep " + id)
                .status(BatchJobStatus.RUNNING)
                .total(4)
                .completed(1)
                .detail(List.of(VariableDetail.of("w", List.of("10", "20"))))
                .createdAt(createdAt)
                .build();
    }

    @Test
    @DisplayName("a stored mirror is readable by a fresh store on the same directory")
    void survivesRestart() {
        store.put(mirror("job-1", Instant.parse("2025-03-01T10:00:00Z")));

        BatchJobMirror reloaded = new FileBatchJobMirrorStore(directory, objectMapper).get("job-1").orElseThrow();

        assertThat(reloaded.getStatus()).isEqualTo(BatchJobStatus.RUNNING);
        assertThat(reloaded.getDetail().get(0).getValues()).containsExactly("10", "20");
        assertThat(reloaded.getCreatedAt()).isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("put replaces the previous version and leaves no temporary files")
    void replaces() throws Exception {
        BatchJobMirror first = mirror("job-1", Instant.parse("2025-03-01T10:00:00Z"));
        store.put(first);
        store.put(first.toBuilder().status(BatchJobStatus.FINISHED).completed(4).build());

        assertThat(store.get("job-1").orElseThrow().getStatus()).isEqualTo(BatchJobStatus.FINISHED);
        try (Stream<Path> files = Files.list(directory)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("job-1.json");
        }
    }

    @Test
    @DisplayName("findAll lists newest first and skips unreadable files")
    void findAll() throws Exception {
        store.put(mirror("old", Instant.parse("2025-03-01T09:00:00Z")));
        store.put(mirror("new", Instant.parse("2025-03-01T11:00:00Z")));
        Files.writeString(directory.resolve("broken.json"), "{not json");

        assertThat(store.findAll()).extracting(BatchJobMirror::getId).containsExactly("new", "old");
    }

    @Test
    @DisplayName("unknown ids are empty and delete removes entries")
    void getAndDelete() {
        assertThat(store.get("missing")).isEmpty();

        store.put(mirror("job-1", Instant.parse("2025-03-01T10:00:00Z")));
        store.delete("job-1");

        assertThat(store.get("job-1")).isEmpty();
    }

    @Test
    @DisplayName("a mirror without an id is rejected")
    void missingId() {
        assertThatThrownBy(() -> store.put(BatchJobMirror.builder().build()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
