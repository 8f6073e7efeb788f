package fr.lapetina.bulkwriter.domain.exception;

import fr.lapetina.bulkwriter.domain.model.WriteErrorType;
import fr.lapetina.bulkwriter.domain.model.WriteStatus;

/**
 * Terminal failure of a write that was rejected on every allowed attempt.
 * The cause is the {@link WriteRejectedException} of the last attempt, when there was one.
 */
public final class RetriesExhaustedException extends BulkWriterException {

    private final int attempts;

    public RetriesExhaustedException(String documentPath, int attempts, WriteRejectedException lastRejection) {
        super(WriteErrorType.RETRIES_EXHAUSTED,
                "Write to " + documentPath + " exceeded retry attempts (" + attempts + ")",
                lastRejection);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Returns the status of the last rejection, or null if none was recorded.
     */
    public WriteStatus getLastStatus() {
        return getCause() instanceof WriteRejectedException rejected ? rejected.getStatus() : null;
    }
}
