package fr.lapetina.bulkwriter.domain.model;

/**
 * Kind of document mutation a caller can enqueue.
 */
public enum WriteOperation {
    /** Creates the document; fails remotely if it already exists */
    CREATE,

    /** Replaces the whole document, creating it if needed */
    SET,

    /** Merges the given top-level fields into an existing document */
    UPDATE,

    /** Deletes the document */
    DELETE
}
