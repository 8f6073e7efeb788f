package fr.lapetina.bulkwriter.domain.event;

import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer. Producers fill it through
 * one of the {@code prepare*} methods; the command handler reads it and clears it.
 *
 * IMPORTANT: This class is intentionally mutable for Disruptor performance.
 * It should never be accessed outside the ring buffer producers and the command handler.
 */
public final class CoordinatorCommand {

    private CommandType type;
    private PendingWrite pendingWrite;
    private BatchCompletion completion;
    private CompletableFuture<Void> drainWaiter;

    /**
     * Clears the command for reuse.
     */
    public void clear() {
        this.type = null;
        this.pendingWrite = null;
        this.completion = null;
        this.drainWaiter = null;
    }

    public void prepareEnqueue(PendingWrite write) {
        clear();
        this.type = CommandType.ENQUEUE;
        this.pendingWrite = write;
    }

    public void prepareCompletion(BatchCompletion completion) {
        clear();
        this.type = CommandType.BATCH_COMPLETED;
        this.completion = completion;
    }

    public void prepareFlush(CompletableFuture<Void> waiter) {
        clear();
        this.type = CommandType.FLUSH;
        this.drainWaiter = waiter;
    }

    public void prepareClose(CompletableFuture<Void> waiter) {
        clear();
        this.type = CommandType.CLOSE;
        this.drainWaiter = waiter;
    }

    public void prepareWake() {
        clear();
        this.type = CommandType.WAKE;
    }

    public CommandType getType() {
        return type;
    }

    public PendingWrite getPendingWrite() {
        return pendingWrite;
    }

    public BatchCompletion getCompletion() {
        return completion;
    }

    public CompletableFuture<Void> getDrainWaiter() {
        return drainWaiter;
    }

    /**
     * Fails every future this command carries. Used when the handler blew up on the command.
     */
    public void failWith(Throwable error) {
        if (pendingWrite != null) {
            pendingWrite.fail(error);
        }
        if (completion != null) {
            for (PendingWrite write : completion.batch()) {
                if (!write.isResolved()) {
                    write.fail(error);
                }
            }
        }
        if (drainWaiter != null) {
            drainWaiter.completeExceptionally(error);
        }
    }

    @Override
    public String toString() {
        return "CoordinatorCommand{" +
                "type=" + type +
                ", write=" + (pendingWrite != null ? pendingWrite.getId() : "null") +
                ", batch=" + (completion != null ? completion.batchId() : "null") +
                '}';
    }
}
