package fr.lapetina.bulkwriter.domain.model;

/**
 * Existence precondition attached to an encoded write.
 */
public enum Precondition {
    NONE,
    EXISTS,
    NOT_EXISTS
}
