package fr.lapetina.bulkwriter.domain.model;

/**
 * Error taxonomy for enqueued writes.
 * Provides clear categorization for error handling and metrics.
 */
public enum WriteErrorType {
    /** Write enqueued after the writer was closed, or writer torn down with the write pending */
    CLOSED,

    /** The batch call itself failed; applies to every write of the batch */
    TRANSPORT,

    /** The remote store rejected this write with a non-OK status */
    REJECTED,

    /** The write was rejected on every allowed attempt */
    RETRIES_EXHAUSTED,

    /** The encoder could not build a payload for the write */
    ENCODING,

    /** The command buffer was full when the write was enqueued */
    BACKPRESSURE
}
