package com.catalog.importer.imports.progress;

import com.catalog.importer.imports.model.ImportJobSnapshot;
import com.catalog.importer.imports.model.ImportJobStatus;
import com.catalog.importer.imports.persistence.ImportJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ImportProgressPublisherTest {
    private static final String JOB_ID = "job-42";

    @Mock
    private ImportJobRepository repository;

    private ImportProgressPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new ImportProgressPublisher(repository);
        when(repository.findById(JOB_ID)).thenReturn(Optional.of(snapshot(ImportJobStatus.RUNNING, 0)));
    }

    @Test
    void forwardsSnapshotsAndClosesAfterTerminal() {
        RecordingEmitter emitter = new RecordingEmitter();
        publisher.subscribe(JOB_ID, emitter);

        ImportJobSnapshot progress = snapshot(ImportJobStatus.RUNNING, 5);
        ImportJobSnapshot done = snapshot(ImportJobStatus.COMPLETED, 10);
        publisher.publish(progress);
        publisher.publish(done);

        assertThat(emitter.payloads).containsExactly(progress, done);
        assertThat(emitter.completed).isTrue();

        publisher.publish(snapshot(ImportJobStatus.RUNNING, 10));
        assertThat(emitter.payloads).containsExactly(progress, done);
    }

    @Test
    void updatesWithoutSubscribersAreDroppedAndNotReplayed() {
        publisher.publish(snapshot(ImportJobStatus.RUNNING, 1));

        RecordingEmitter late = new RecordingEmitter();
        publisher.subscribe(JOB_ID, late);
        assertThat(late.payloads).isEmpty();

        ImportJobSnapshot next = snapshot(ImportJobStatus.RUNNING, 2);
        publisher.publish(next);
        assertThat(late.payloads).containsExactly(next);
        assertThat(late.completed).isFalse();
    }

    @Test
    void subscriberAfterCompletionGetsTerminalSnapshotOnce() {
        ImportJobSnapshot done = snapshot(ImportJobStatus.COMPLETED, 10);
        when(repository.findById(JOB_ID)).thenReturn(Optional.of(done));

        RecordingEmitter late = new RecordingEmitter();
        publisher.subscribe(JOB_ID, late);
        publisher.publish(done);

        assertThat(late.payloads).containsExactly(done);
        assertThat(late.completed).isTrue();

        publisher.publish(snapshot(ImportJobStatus.RUNNING, 10));
        assertThat(late.payloads).containsExactly(done);
    }

    @Test
    void everySubscriberSeesTheFailedSnapshot() {
        RecordingEmitter first = new RecordingEmitter();
        RecordingEmitter second = new RecordingEmitter();
        publisher.subscribe(JOB_ID, first);
        publisher.subscribe(JOB_ID, second);

        ImportJobSnapshot failed = snapshot(ImportJobStatus.FAILED, 3);
        publisher.publish(failed);

        assertThat(first.payloads).containsExactly(failed);
        assertThat(second.payloads).containsExactly(failed);
        assertThat(first.completed).isTrue();
        assertThat(second.completed).isTrue();
    }

    @Test
    void brokenSubscriberIsDroppedWithoutAffectingOthers() {
        RecordingEmitter broken = new RecordingEmitter();
        broken.failSends = true;
        RecordingEmitter healthy = new RecordingEmitter();
        publisher.subscribe(JOB_ID, broken);
        publisher.subscribe(JOB_ID, healthy);

        ImportJobSnapshot progress = snapshot(ImportJobStatus.RUNNING, 4);
        publisher.publish(progress);

        assertThat(healthy.payloads).containsExactly(progress);

        ImportJobSnapshot next = snapshot(ImportJobStatus.RUNNING, 6);
        publisher.publish(next);
        assertThat(healthy.payloads).containsExactly(progress, next);
        assertThat(broken.sendAttempts).isEqualTo(1);
    }

    @Test
    void shutdownEndsOpenStreamsWithMarker() {
        RecordingEmitter emitter = new RecordingEmitter();
        publisher.subscribe(JOB_ID, emitter);

        publisher.shutdown();

        assertThat(emitter.payloads).hasSize(1);
        assertThat(emitter.payloads.get(0)).isEqualTo(Map.of("status", "stream_ended", "job_id", JOB_ID));
        assertThat(emitter.completed).isTrue();
    }

    private static ImportJobSnapshot snapshot(ImportJobStatus status, int processed) {
        Instant now = Instant.now();
        return new ImportJobSnapshot(
            JOB_ID, "products.csv", status, 10, processed, processed, 0, 0,
            "Processed " + processed + " of 10 rows", null, List.of(),
            now, now, status.isTerminal() ? now : null, now
        );
    }

    private static final class RecordingEmitter extends SseEmitter {
        private final List<Object> payloads = new ArrayList<>();
        private boolean completed;
        private boolean failSends;
        private int sendAttempts;

        private RecordingEmitter() {
            super(5_000L);
        }

        @Override
        public void send(SseEventBuilder builder) throws IOException {
            sendAttempts++;
            if (failSends) {
                throw new IOException("Broken pipe");
            }
            for (ResponseBodyEmitter.DataWithMediaType item : builder.build()) {
                Object data = item.getData();
                if (data instanceof ImportJobSnapshot || data instanceof Map) {
                    payloads.add(data);
                }
            }
        }

        @Override
        public void complete() {
            completed = true;
        }
    }
}
