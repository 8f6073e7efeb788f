package fr.lapetina.bulkwriter.domain.event;

import fr.lapetina.bulkwriter.domain.model.WritePayload;
import fr.lapetina.bulkwriter.domain.model.WriteResult;
import fr.lapetina.bulkwriter.domain.model.WriteStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One caller-submitted write awaiting completion: the payload, its attempt counter and the
 * future handed back to the caller.
 *
 * Mutable state is only changed by the coordinator thread. The future is resolved exactly once;
 * a second resolution attempt is logged and ignored, except after a caller cancellation,
 * which is expected.
 */
public final class PendingWrite {

    private static final Logger log = LoggerFactory.getLogger(PendingWrite.class);

    private final long id;
    private final WritePayload payload;
    private final CompletableFuture<WriteResult> resultFuture;
    private final Instant enqueuedAt;

    private volatile int attempts;
    private volatile WriteState state;
    private volatile WriteStatus lastStatus;
    private volatile long queuedAtMillis;

    public PendingWrite(long id, WritePayload payload, CompletableFuture<WriteResult> resultFuture) {
        this.id = id;
        this.payload = Objects.requireNonNull(payload, "Payload is required");
        this.resultFuture = Objects.requireNonNull(resultFuture, "Result future is required");
        this.enqueuedAt = Instant.now();
        this.state = WriteState.QUEUED;
    }

    public long getId() {
        return id;
    }

    public WritePayload getPayload() {
        return payload;
    }

    public String getDocumentPath() {
        return payload.document().path();
    }

    public CompletableFuture<WriteResult> getResultFuture() {
        return resultFuture;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    /**
     * Number of attempts that were answered with a non-OK status so far.
     */
    public int getAttempts() {
        return attempts;
    }

    public WriteState getState() {
        return state;
    }

    public WriteStatus getLastStatus() {
        return lastStatus;
    }

    /**
     * Time the write last entered the backlog, on the coordinator's clock.
     */
    public long getQueuedAtMillis() {
        return queuedAtMillis;
    }

    public void markQueued(long nowMillis) {
        this.queuedAtMillis = nowMillis;
    }

    public void markInFlight() {
        this.state = WriteState.IN_FLIGHT;
    }

    /**
     * Records a non-OK answer and puts the write back in the queued state.
     *
     * @return the attempt count after the increment
     */
    public int markRejected(WriteStatus status) {
        this.lastStatus = status;
        this.state = WriteState.QUEUED;
        return ++attempts;
    }

    public boolean isCancelled() {
        return resultFuture.isCancelled();
    }

    public boolean isResolved() {
        return resultFuture.isDone();
    }

    /**
     * Resolves the caller's future with a result.
     *
     * @return true if this call resolved the future
     */
    public boolean complete(WriteResult result) {
        if (resultFuture.complete(result)) {
            state = WriteState.SUCCEEDED;
            return true;
        }
        reportLateResolution();
        return false;
    }

    /**
     * Resolves the caller's future with an error.
     *
     * @return true if this call resolved the future
     */
    public boolean fail(Throwable error) {
        if (resultFuture.completeExceptionally(error)) {
            state = WriteState.FAILED;
            return true;
        }
        reportLateResolution();
        return false;
    }

    /**
     * Marks a write whose caller cancelled before it was batched.
     */
    public void markCancelled() {
        state = WriteState.CANCELLED;
    }

    private void reportLateResolution() {
        if (resultFuture.isCancelled()) {
            log.debug("Outcome ignored for cancelled write: writeId={}, document={}", id, getDocumentPath());
        } else {
            log.warn("Write already resolved, outcome ignored: writeId={}, document={}, state={}",
                    id, getDocumentPath(), state);
        }
    }

    @Override
    public String toString() {
        return "PendingWrite{" +
                "id=" + id +
                ", operation=" + payload.operation() +
                ", document=" + payload.document() +
                ", state=" + state +
                ", attempts=" + attempts +
                '}';
    }
}
