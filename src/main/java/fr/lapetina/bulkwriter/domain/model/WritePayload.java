package fr.lapetina.bulkwriter.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Encoded write, ready to be placed in a batch.
 * The coordinator never looks inside the body; only the transport interprets it.
 */
public record WritePayload(
        WriteOperation operation,
        DocumentRef document,
        Precondition precondition,
        List<String> updateMask,
        byte[] body
) {
    public WritePayload {
        Objects.requireNonNull(operation, "Operation is required");
        Objects.requireNonNull(document, "Document is required");
        if (precondition == null) {
            precondition = Precondition.NONE;
        }
        updateMask = updateMask != null ? List.copyOf(updateMask) : List.of();
        body = body != null ? body.clone() : new byte[0];
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public int bodySize() {
        return body.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WritePayload other)) return false;
        return operation == other.operation
                && document.equals(other.document)
                && precondition == other.precondition
                && updateMask.equals(other.updateMask)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(operation, document, precondition, updateMask);
        return 31 * result + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "WritePayload{" +
                "operation=" + operation +
                ", document=" + document +
                ", precondition=" + precondition +
                ", updateMask=" + updateMask +
                ", bodySize=" + body.length +
                '}';
    }
}
