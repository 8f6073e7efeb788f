package fr.lapetina.bulkwriter.domain.event;

import fr.lapetina.bulkwriter.domain.model.BatchWriteResponse;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one transport call, handed back to the coordinator thread.
 * Exactly one of {@code response} and {@code error} is non-null.
 */
public record BatchCompletion(
        long batchId,
        List<PendingWrite> batch,
        BatchWriteResponse response,
        Throwable error,
        Duration latency
) {
    public BatchCompletion {
        batch = List.copyOf(batch);
        if ((response == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of response and error must be set");
        }
    }

    public static BatchCompletion succeeded(long batchId, List<PendingWrite> batch,
                                            BatchWriteResponse response, Duration latency) {
        return new BatchCompletion(batchId, batch, response, null, latency);
    }

    public static BatchCompletion failed(long batchId, List<PendingWrite> batch,
                                         Throwable error, Duration latency) {
        return new BatchCompletion(batchId, batch, null, error, latency);
    }

    public boolean isFailed() {
        return error != null;
    }
}
