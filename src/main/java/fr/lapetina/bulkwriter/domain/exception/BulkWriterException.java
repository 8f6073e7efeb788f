package fr.lapetina.bulkwriter.domain.exception;

import fr.lapetina.bulkwriter.domain.model.WriteErrorType;

/**
 * Base class for every error delivered through a write's future.
 */
public abstract class BulkWriterException extends RuntimeException {

    private final WriteErrorType errorType;

    protected BulkWriterException(WriteErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected BulkWriterException(WriteErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public WriteErrorType getErrorType() {
        return errorType;
    }
}
