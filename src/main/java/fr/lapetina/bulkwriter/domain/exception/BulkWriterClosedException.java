package fr.lapetina.bulkwriter.domain.exception;

import fr.lapetina.bulkwriter.domain.model.WriteErrorType;

/**
 * Raised when a write is enqueued after {@code close()}, or when the writer is torn down
 * while the write is still pending. Not retried internally.
 */
public final class BulkWriterClosedException extends BulkWriterException {

    public BulkWriterClosedException(String targetResource) {
        super(WriteErrorType.CLOSED, "BulkWriter has been closed: " + targetResource);
    }

    public BulkWriterClosedException(String targetResource, String details) {
        super(WriteErrorType.CLOSED, "BulkWriter has been closed: " + targetResource + " - " + details);
    }
}
