package fr.lapetina.bulkwriter.domain.exception;

import fr.lapetina.bulkwriter.domain.model.WriteErrorType;

/**
 * The encoder could not build a payload. Raised at enqueue time; the write never enters the backlog.
 */
public final class WriteEncodingException extends BulkWriterException {

    public WriteEncodingException(String message) {
        super(WriteErrorType.ENCODING, message);
    }

    public WriteEncodingException(String message, Throwable cause) {
        super(WriteErrorType.ENCODING, message, cause);
    }
}
