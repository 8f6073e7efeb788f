package fr.lapetina.bulkwriter.domain.model;

import java.util.Objects;

/**
 * Reference to a document by its slash-separated path, relative to the database root.
 * Paths alternate collection and document ids: {@code users/alice} or
 * {@code users/alice/orders/42}.
 */
public record DocumentRef(String path) {

    public DocumentRef {
        Objects.requireNonNull(path, "Document path is required");
        if (path.startsWith("/")) {
            path = path.substring(1);
        }
        if (path.isBlank()) {
            throw new IllegalArgumentException("Document path must not be blank");
        }
        String[] segments = path.split("/", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("Document path has an empty segment: " + path);
            }
        }
        if (segments.length % 2 != 0) {
            throw new IllegalArgumentException("Document path must have an even number of segments: " + path);
        }
    }

    public static DocumentRef of(String collection, String documentId) {
        return new DocumentRef(collection + "/" + documentId);
    }

    /**
     * Returns the id of the document, i.e. the last path segment.
     */
    public String id() {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /**
     * Returns the path of the collection holding this document.
     */
    public String collectionPath() {
        return path.substring(0, path.lastIndexOf('/'));
    }

    @Override
    public String toString() {
        return path;
    }
}
