package fr.lapetina.bulkwriter.domain.model;

import java.util.Objects;

/**
 * Status of a single write inside a batch response.
 */
public record WriteStatus(StatusCode code, String message) {

    public static final WriteStatus OK = new WriteStatus(StatusCode.OK, "");

    public WriteStatus {
        Objects.requireNonNull(code, "Status code is required");
        if (message == null) {
            message = "";
        }
    }

    public static WriteStatus of(StatusCode code, String message) {
        return code == StatusCode.OK && (message == null || message.isEmpty())
                ? OK
                : new WriteStatus(code, message);
    }

    public boolean isOk() {
        return code == StatusCode.OK;
    }

    @Override
    public String toString() {
        return message.isEmpty() ? code.name() : code.name() + ": " + message;
    }
}
