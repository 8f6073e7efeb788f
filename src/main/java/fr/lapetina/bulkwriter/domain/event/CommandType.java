package fr.lapetina.bulkwriter.domain.event;

/**
 * Commands processed by the coordinator thread.
 */
public enum CommandType {
    /** A caller enqueued a write */
    ENQUEUE,

    /** A transport call finished, successfully or not */
    BATCH_COMPLETED,

    /** A caller waits for the backlog and in-flight batches to drain */
    FLUSH,

    /** A caller closes the writer and waits for the drain */
    CLOSE,

    /** Pacing delay elapsed; try dispatching again */
    WAKE
}
