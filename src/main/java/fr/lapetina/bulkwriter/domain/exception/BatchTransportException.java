package fr.lapetina.bulkwriter.domain.exception;

import fr.lapetina.bulkwriter.domain.model.WriteErrorType;

/**
 * The batch call failed as a whole (I/O error, timeout, malformed response).
 * Every write of the batch fails with the same instance; none is retried.
 */
public final class BatchTransportException extends BulkWriterException {

    private final long batchId;

    public BatchTransportException(long batchId, String message, Throwable cause) {
        super(WriteErrorType.TRANSPORT, message, cause);
        this.batchId = batchId;
    }

    public BatchTransportException(long batchId, String message) {
        super(WriteErrorType.TRANSPORT, message);
        this.batchId = batchId;
    }

    public long getBatchId() {
        return batchId;
    }
}
