package com.strategylab.unit.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strategylab.client.BatchClientException;
import com.strategylab.client.BatchJobApiClient;
import com.strategylab.client.BatchJobListener;
import com.strategylab.client.BatchJobMirror;
import com.strategylab.client.BatchJobMirrorStore;
import com.strategylab.client.BatchJobPoller;
import com.strategylab.client.BatchJobReconciler;
import com.strategylab.domain.enums.BatchJobStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Unit tests for BatchJobPoller covering ticker bookkeeping, resume on startup, the
 * merge-and-store poll cycle, per-job serialization of mirror writes and listener
 * notification.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BatchJobPollerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:30Z");

    @Mock
    private BatchJobApiClient apiClient;

    @Mock
    private BatchJobMirrorStore mirrorStore;

    @Mock
    private ScheduledExecutorService scheduler;

    @Mock
    private ScheduledFuture<Object> ticker;

    private ObjectMapper objectMapper;
    private BatchJobPoller poller;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        doReturn(ticker).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any());
        poller = new BatchJobPoller(
                apiClient,
                mirrorStore,
                new BatchJobReconciler(objectMapper),
                scheduler,
                Duration.ofSeconds(2),
                Duration.ZERO,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static BatchJobMirror mirror(String id, BatchJobStatus status, int completed) {
        return BatchJobMirror.builder()
                .id(id)
                .status(status)
                .total(5)
                .completed(completed)
                .createdAt(Instant.parse("2025-03-01T10:00:00Z"))
                .build();
    }

    // ====== Tracking ======

    @Nested
    @DisplayName("Tracking")
    class Tracking {

        @Test
        @DisplayName("a job is scheduled once no matter how often it is tracked")
        void trackOnce() {
            assertThat(poller.track("job-1")).isTrue();
            assertThat(poller.track("job-1")).isFalse();

            verify(scheduler, times(1))
                    .scheduleWithFixedDelay(any(Runnable.class), eq(0L), eq(2000L), eq(TimeUnit.MILLISECONDS));
            assertThat(poller.isTracking("job-1")).isTrue();
            assertThat(poller.trackedJobIds()).containsExactly("job-1");
        }

        @Test
        @DisplayName("stop cancels the ticker")
        void stop() {
            poller.track("job-1");

            poller.stop("job-1");

            verify(ticker).cancel(false);
            assertThat(poller.isTracking("job-1")).isFalse();
        }

        @Test
        @DisplayName("resumeAll tracks only unfinished mirrors")
        void resumeAll() {
            when(mirrorStore.findAll()).thenReturn(List.of(
                    mirror("job-q", BatchJobStatus.QUEUED, 0),
                    mirror("job-r", BatchJobStatus.RUNNING, 2),
                    mirror("job-f", BatchJobStatus.FINISHED, 5),
                    mirror("job-x", BatchJobStatus.FAILED, 1)));

            int resumed = poller.resumeAll();

            assertThat(resumed).isEqualTo(2);
            assertThat(poller.trackedJobIds()).containsExactlyInAnyOrder("job-q", "job-r");
        }

        @Test
        @DisplayName("shutdown stops every ticker and the scheduler")
        void shutdown() {
            poller.track("job-1");
            poller.track("job-2");

            poller.shutdown();

            verify(ticker, times(2)).cancel(false);
            verify(scheduler).shutdownNow();
            assertThat(poller.trackedJobIds()).isEmpty();
        }
    }

    // ====== Poll cycle ======

    @Nested
    @DisplayName("poll")
    class Poll {

        @Test
        @DisplayName("merges the snapshot into the stored mirror")
        void mergesSnapshot() throws Exception {
            when(mirrorStore.get("job-1")).thenReturn(Optional.of(mirror("job-1", BatchJobStatus.RUNNING, 1)));
            when(apiClient.fetch("job-1"))
                    .thenReturn(objectMapper.readTree("{\"jobId\":\"job-1\",\"status\":\"running\",\"completed\":3}"));
            poller.track("job-1");

            poller.poll("job-1");

            ArgumentCaptor<BatchJobMirror> stored = ArgumentCaptor.forClass(BatchJobMirror.class);
            verify(mirrorStore).put(stored.capture());
            assertThat(stored.getValue().getCompleted()).isEqualTo(3);
            assertThat(stored.getValue().getLastSyncedAt()).isEqualTo(NOW);
            assertThat(poller.isTracking("job-1")).isTrue();
        }

        @Test
        @DisplayName("a terminal snapshot stops the ticker and notifies listeners once")
        void terminalStops() throws Exception {
            List<String> events = new ArrayList<>();
            poller.addListener(new BatchJobListener() {
                @Override
                public void onUpdate(BatchJobMirror mirror) {
                    events.add("update:" + mirror.getStatus().getValue());
                }

                @Override
                public void onTerminal(BatchJobMirror mirror) {
                    events.add("terminal:" + mirror.getStatus().getValue());
                }
            });
            when(mirrorStore.get("job-1")).thenReturn(Optional.of(mirror("job-1", BatchJobStatus.RUNNING, 4)));
            when(apiClient.fetch("job-1"))
                    .thenReturn(objectMapper.readTree("{\"status\":\"finished\",\"completed\":5}"));
            poller.track("job-1");

            poller.poll("job-1");

            verify(ticker).cancel(false);
            assertThat(poller.isTracking("job-1")).isFalse();
            assertThat(events).containsExactly("update:finished", "terminal:finished");
        }

        @Test
        @DisplayName("a job already terminal in the mirror is not reported as terminal again")
        void alreadyTerminal() throws Exception {
            BatchJobListener listener = mock(BatchJobListener.class);
            poller.addListener(listener);
            when(mirrorStore.get("job-1")).thenReturn(Optional.of(mirror("job-1", BatchJobStatus.FINISHED, 5)));
            when(apiClient.fetch("job-1")).thenReturn(objectMapper.readTree("{\"status\":\"finished\"}"));

            poller.poll("job-1");

            verify(listener).onUpdate(any());
            verify(listener, never()).onTerminal(any());
        }

        @Test
        @DisplayName("a failed fetch leaves the mirror untouched and keeps polling")
        void fetchFails() {
            when(apiClient.fetch("job-1")).thenThrow(new BatchClientException("Bad gateway", 502, null));
            poller.track("job-1");

            poller.poll("job-1");

            verify(mirrorStore, never()).put(any());
            assertThat(poller.isTracking("job-1")).isTrue();
        }

        @Test
        @DisplayName("a failing listener does not stop the others")
        void listenerFails() throws Exception {
            BatchJobListener second = mock(BatchJobListener.class);
            poller.addListener(new BatchJobListener() {
                @Override
                public void onUpdate(BatchJobMirror mirror) {
                    throw new IllegalStateException("boom");
                }
            });
            poller.addListener(second);
            when(mirrorStore.get("job-1")).thenReturn(Optional.empty());
            when(apiClient.fetch("job-1")).thenReturn(objectMapper.readTree("{\"status\":\"running\"}"));

            poller.poll("job-1");

            ArgumentCaptor<BatchJobMirror> updated = ArgumentCaptor.forClass(BatchJobMirror.class);
            verify(second).onUpdate(updated.capture());
            assertThat(updated.getValue().getId()).isEqualTo("job-1");
        }
    }

    // ====== Serialized mirror writes ======

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        @DisplayName("a cancel snapshot waits for an in-progress tick and keeps its progress")
        void cancelWaitsForTick() throws Exception {
            Map<String, BatchJobMirror> stored = new ConcurrentHashMap<>();
            stored.put("job-1", mirror("job-1", BatchJobStatus.RUNNING, 2));
            CountDownLatch tickReading = new CountDownLatch(1);
            CountDownLatch releaseTick = new CountDownLatch(1);
            AtomicBoolean firstRead = new AtomicBoolean(true);
            when(mirrorStore.get("job-1")).thenAnswer(invocation -> {
                BatchJobMirror current = stored.get("job-1");
                if (firstRead.compareAndSet(true, false)) {
                    tickReading.countDown();
                    releaseTick.await(5, TimeUnit.SECONDS);
                }
                return Optional.ofNullable(current);
            });
            doAnswer(invocation -> {
                BatchJobMirror mirror = invocation.getArgument(0);
                stored.put(mirror.getId(), mirror);
                return null;
            }).when(mirrorStore).put(any());
            when(apiClient.fetch("job-1"))
                    .thenReturn(objectMapper.readTree("{\"status\":\"running\",\"completed\":4}"));
            JsonNode cancelled = objectMapper.readTree(
                    "{\"status\":\"failed\",\"error\":\"Cancelled by user\",\"completed\":3}");
            poller.track("job-1");

            ExecutorService threads = Executors.newFixedThreadPool(2);
            try {
                Future<?> tick = threads.submit(() -> poller.poll("job-1"));
                assertThat(tickReading.await(5, TimeUnit.SECONDS)).isTrue();
                Future<BatchJobMirror> cancel = threads.submit(() -> poller.apply("job-1", cancelled));

                assertThatThrownBy(() -> cancel.get(200, TimeUnit.MILLISECONDS))
                        .isInstanceOf(TimeoutException.class);
                releaseTick.countDown();
                tick.get(5, TimeUnit.SECONDS);
                BatchJobMirror afterCancel = cancel.get(5, TimeUnit.SECONDS);

                assertThat(afterCancel.getStatus()).isEqualTo(BatchJobStatus.FAILED);
                assertThat(afterCancel.getError()).isEqualTo("Cancelled by user");
                assertThat(afterCancel.getCompleted()).isEqualTo(4);
                assertThat(stored.get("job-1")).isSameAs(afterCancel);
                assertThat(poller.isTracking("job-1")).isFalse();
            } finally {
                threads.shutdownNow();
            }
        }

        @Test
        @DisplayName("applying a snapshot stores the merge and returns it")
        void storesMerge() throws Exception {
            when(mirrorStore.get("job-1")).thenReturn(Optional.of(mirror("job-1", BatchJobStatus.RUNNING, 3)));

            BatchJobMirror merged =
                    poller.apply("job-1", objectMapper.readTree("{\"status\":\"running\",\"completed\":1}"));

            assertThat(merged.getCompleted()).isEqualTo(3);
            verify(mirrorStore).put(merged);
        }
    }
}
