package fr.lapetina.bulkwriter.coordinator;

import fr.lapetina.bulkwriter.domain.event.PendingWrite;
import fr.lapetina.bulkwriter.domain.model.DocumentRef;
import fr.lapetina.bulkwriter.domain.model.StatusCode;
import fr.lapetina.bulkwriter.domain.model.WriteOperation;
import fr.lapetina.bulkwriter.domain.model.WritePayload;
import fr.lapetina.bulkwriter.domain.model.WriteStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class BacklogTest {

    private Backlog backlog;
    private long nextId;

    @BeforeEach
    void setUp() {
        backlog = new Backlog();
        nextId = 0;
    }

    @Test
    @DisplayName("should serve first attempts in FIFO order")
    void shouldServeFifo() {
        PendingWrite a = fresh();
        PendingWrite b = fresh();
        PendingWrite c = fresh();
        backlog.add(a);
        backlog.add(b);
        backlog.add(c);

        assertThat(backlog.pollBatch(2, 2)).containsExactly(a, b);
        assertThat(backlog.pollBatch(2, 2)).containsExactly(c);
        assertThat(backlog.isEmpty()).isTrue();
        assertThat(backlog.size()).isZero();
    }

    @Test
    @DisplayName("should append retried writes at the tail")
    void shouldRequeueAtTail() {
        PendingWrite retried = fresh();
        PendingWrite later = fresh();
        backlog.add(later);

        retried.markRejected(WriteStatus.of(StatusCode.UNAVAILABLE, "busy"));
        backlog.requeue(retried);

        assertThat(backlog.pollBatch(10, 10)).containsExactly(later, retried);
    }

    @Test
    @DisplayName("should cap a batch at retryMaxBatchSize once it holds a retried write")
    void shouldCapBatchWithRetry() {
        for (int i = 0; i < 4; i++) {
            backlog.add(retried());
        }
        for (int i = 0; i < 6; i++) {
            backlog.add(fresh());
        }

        assertThat(backlog.nextBatchSize(8, 3)).isEqualTo(3);
        List<PendingWrite> batch = backlog.pollBatch(8, 3);
        assertThat(batch).hasSize(3).allSatisfy(w -> assertThat(w.getAttempts()).isEqualTo(1));
        assertThat(backlog.size()).isEqualTo(7);
    }

    @Test
    @DisplayName("should stop before a retried write that would exceed the retry cap")
    void shouldStopBeforeOversizedRetry() {
        for (int i = 0; i < 5; i++) {
            backlog.add(fresh());
        }
        backlog.add(retried());
        backlog.add(fresh());

        assertThat(backlog.nextBatchSize(10, 3)).isEqualTo(5);
    }

    @Test
    @DisplayName("should let fresh writes fill a batch up to maxBatchSize")
    void shouldFillWithFreshWrites() {
        for (int i = 0; i < 25; i++) {
            backlog.add(fresh());
        }

        assertThat(backlog.nextBatchSize(20, 10)).isEqualTo(20);
        assertThat(backlog.pollBatch(20, 10)).hasSize(20);
        assertThat(backlog.size()).isEqualTo(5);
    }

    private PendingWrite fresh() {
        long id = nextId++;
        WritePayload payload = new WritePayload(
                WriteOperation.DELETE, DocumentRef.of("docs", "d" + id), null, null, null);
        return new PendingWrite(id, payload, new CompletableFuture<>());
    }

    private PendingWrite retried() {
        PendingWrite write = fresh();
        write.markRejected(WriteStatus.of(StatusCode.ABORTED, "contention"));
        return write;
    }
}
