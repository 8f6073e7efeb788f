package fr.lapetina.bulkwriter.domain.exception;

import fr.lapetina.bulkwriter.domain.model.WriteErrorType;
import fr.lapetina.bulkwriter.domain.model.WriteStatus;

/**
 * The remote store answered a write with a non-OK status.
 */
public final class WriteRejectedException extends BulkWriterException {

    private final WriteStatus status;

    public WriteRejectedException(String documentPath, WriteStatus status) {
        super(WriteErrorType.REJECTED, "Write rejected for " + documentPath + ": " + status);
        this.status = status;
    }

    public WriteStatus getStatus() {
        return status;
    }
}
