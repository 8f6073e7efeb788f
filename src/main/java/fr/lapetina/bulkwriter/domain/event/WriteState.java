package fr.lapetina.bulkwriter.domain.event;

/**
 * Lifecycle state of a pending write inside the coordinator.
 */
public enum WriteState {
    /** Waiting in the backlog (first attempt or retry) */
    QUEUED,

    /** Part of a batch whose transport call is outstanding */
    IN_FLIGHT,

    /** Resolved with a result */
    SUCCEEDED,

    /** Resolved with an error */
    FAILED,

    /** Cancelled by the caller before it was batched */
    CANCELLED
}
