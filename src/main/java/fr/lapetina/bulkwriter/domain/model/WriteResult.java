package fr.lapetina.bulkwriter.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Successful outcome of one write, as reported by the remote store.
 */
public record WriteResult(String documentPath, Instant updateTime) {

    public WriteResult {
        Objects.requireNonNull(documentPath, "Document path is required");
    }

    public static WriteResult of(DocumentRef document, Instant updateTime) {
        return new WriteResult(document.path(), updateTime);
    }
}
