package fr.lapetina.bulkwriter.domain.exception;

import fr.lapetina.bulkwriter.domain.model.WriteErrorType;

/**
 * Delivered when the coordinator's command ring buffer is full and cannot accept a new write.
 * The caller may resubmit once earlier writes have drained.
 */
public final class BackpressureException extends BulkWriterException {

    private final long remainingCapacity;

    public BackpressureException(long remainingCapacity) {
        super(WriteErrorType.BACKPRESSURE,
                "Backpressure: ring buffer is full, remaining capacity: " + remainingCapacity);
        this.remainingCapacity = remainingCapacity;
    }

    public long getRemainingCapacity() {
        return remainingCapacity;
    }
}
