package fr.lapetina.bulkwriter.coordinator;

/**
 * Size and retry bounds applied by the dispatcher.
 *
 * @param maxBatchSize      maximum number of writes per batch
 * @param retryMaxBatchSize maximum batch size when the batch carries at least one retried write
 * @param maxRetryAttempts  number of non-OK answers after which a write fails for good
 */
public record BatchLimits(int maxBatchSize, int retryMaxBatchSize, int maxRetryAttempts) {

    public static final int DEFAULT_MAX_BATCH_SIZE = 20;
    public static final int DEFAULT_RETRY_MAX_BATCH_SIZE = 10;
    public static final int DEFAULT_MAX_RETRY_ATTEMPTS = 10;

    public BatchLimits {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be positive: " + maxBatchSize);
        }
        if (retryMaxBatchSize < 1 || retryMaxBatchSize > maxBatchSize) {
            throw new IllegalArgumentException(
                    "retryMaxBatchSize must be in [1, " + maxBatchSize + "]: " + retryMaxBatchSize);
        }
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be positive: " + maxRetryAttempts);
        }
    }

    public static BatchLimits defaults() {
        return new BatchLimits(DEFAULT_MAX_BATCH_SIZE, DEFAULT_RETRY_MAX_BATCH_SIZE, DEFAULT_MAX_RETRY_ATTEMPTS);
    }
}
