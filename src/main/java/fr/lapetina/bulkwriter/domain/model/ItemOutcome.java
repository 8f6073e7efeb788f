package fr.lapetina.bulkwriter.domain.model;

import java.util.Objects;

/**
 * One (status, result) pair of a batch response. The result is only present when the status is OK.
 */
public record ItemOutcome(WriteStatus status, WriteResult result) {

    public ItemOutcome {
        Objects.requireNonNull(status, "Status is required");
        if (status.isOk() && result == null) {
            throw new IllegalArgumentException("A successful outcome requires a result");
        }
    }

    public static ItemOutcome success(WriteResult result) {
        return new ItemOutcome(WriteStatus.OK, result);
    }

    public static ItemOutcome failure(StatusCode code, String message) {
        if (code == StatusCode.OK) {
            throw new IllegalArgumentException("Failure outcome cannot carry status OK");
        }
        return new ItemOutcome(WriteStatus.of(code, message), null);
    }

    public boolean isSuccess() {
        return status.isOk();
    }
}
