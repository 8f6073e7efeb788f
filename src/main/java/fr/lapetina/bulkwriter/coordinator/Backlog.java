package fr.lapetina.bulkwriter.coordinator;

import fr.lapetina.bulkwriter.domain.event.PendingWrite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ordered queue of writes not yet included in an outbound batch.
 *
 * First attempts are served FIFO. Retried writes go back to the tail, so they never hold up
 * fresh work, at the price of no ordering guarantee across retries.
 *
 * Mutations are confined to the coordinator thread; only {@link #size()} may be read from
 * other threads.
 */
public final class Backlog {

    private final Deque<PendingWrite> queue = new ArrayDeque<>();
    private final AtomicInteger size = new AtomicInteger(0);

    public void add(PendingWrite write) {
        queue.addLast(write);
        size.incrementAndGet();
    }

    /**
     * Returns a rejected write to the tail of the queue.
     */
    public void requeue(PendingWrite write) {
        add(write);
    }

    public int size() {
        return size.get();
    }

    /**
     * Returns the write that has waited longest, or null when the backlog is empty.
     */
    public PendingWrite peekOldest() {
        return queue.peekFirst();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Computes how many writes the next batch takes from the head.
     * A retried write caps the batch at {@code retryMaxBatchSize}; if including it would exceed
     * that cap, the batch stops right before it.
     */
    public int nextBatchSize(int maxBatchSize, int retryMaxBatchSize) {
        int limit = maxBatchSize;
        int count = 0;
        for (PendingWrite write : queue) {
            int itemLimit = write.getAttempts() > 0 ? Math.min(limit, retryMaxBatchSize) : limit;
            if (count >= itemLimit) {
                break;
            }
            limit = itemLimit;
            count++;
        }
        return count;
    }

    /**
     * Removes the next batch from the head of the queue.
     */
    public List<PendingWrite> pollBatch(int maxBatchSize, int retryMaxBatchSize) {
        int count = nextBatchSize(maxBatchSize, retryMaxBatchSize);
        List<PendingWrite> batch = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            batch.add(queue.pollFirst());
        }
        size.addAndGet(-count);
        return batch;
    }
}
