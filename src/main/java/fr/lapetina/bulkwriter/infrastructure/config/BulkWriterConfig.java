package fr.lapetina.bulkwriter.infrastructure.config;

/**
 * Root configuration object for bulk writers.
 * Designed to be populated from YAML.
 */
public class BulkWriterConfig {

    private BatchConfig batch = new BatchConfig();
    private RetryConfig retry = new RetryConfig();
    private AdmissionConfig admission = new AdmissionConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private TransportConfig transport = new TransportConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public BatchConfig getBatch() { return batch; }
    public void setBatch(BatchConfig batch) { this.batch = batch; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public AdmissionConfig getAdmission() { return admission; }
    public void setAdmission(AdmissionConfig admission) { this.admission = admission; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public TransportConfig getTransport() { return transport; }
    public void setTransport(TransportConfig transport) { this.transport = transport; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Checks value ranges and cross-field constraints.
     *
     * @throws ConfigLoader.ConfigurationException on the first invalid value
     */
    public BulkWriterConfig validate() {
        require(batch.maxBatchSize > 0, "batch.maxBatchSize must be positive");
        require(batch.retryMaxBatchSize > 0, "batch.retryMaxBatchSize must be positive");
        require(batch.retryMaxBatchSize <= batch.maxBatchSize,
                "batch.retryMaxBatchSize must not exceed batch.maxBatchSize");
        require(batch.lingerMs >= 0, "batch.lingerMs must not be negative");
        require(retry.maxAttempts > 0, "retry.maxAttempts must be positive");
        require(admission.maxConcurrentBatches > 0, "admission.maxConcurrentBatches must be positive");
        require(admission.startingOpsPerSecond > 0, "admission.startingOpsPerSecond must be positive");
        require(admission.maxOpsPerSecond >= admission.startingOpsPerSecond,
                "admission.maxOpsPerSecond must be at least admission.startingOpsPerSecond");
        require(admission.rampMultiplier >= 1.0, "admission.rampMultiplier must be at least 1.0");
        require(admission.rampWindowMs > 0, "admission.rampWindowMs must be positive");
        require(disruptor.ringBufferSize > 0 && Integer.bitCount(disruptor.ringBufferSize) == 1,
                "disruptor.ringBufferSize must be a power of 2");
        require(disruptor.shutdownTimeoutMs > 0, "disruptor.shutdownTimeoutMs must be positive");
        require(transport.requestTimeoutMs >= 0, "transport.requestTimeoutMs must not be negative");
        require(transport.circuitBreakerFailureThreshold > 0,
                "transport.circuitBreakerFailureThreshold must be positive");
        require(transport.circuitBreakerRecoveryMs > 0, "transport.circuitBreakerRecoveryMs must be positive");
        require(metrics.prefix != null && !metrics.prefix.isBlank(), "metrics.prefix is required");
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigLoader.ConfigurationException("Invalid configuration: " + message);
        }
    }

    /**
     * Batch sizing.
     */
    public static class BatchConfig {
        private int maxBatchSize = 20;
        private int retryMaxBatchSize = 10;
        private long lingerMs = 0;

        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }

        public int getRetryMaxBatchSize() { return retryMaxBatchSize; }
        public void setRetryMaxBatchSize(int retryMaxBatchSize) { this.retryMaxBatchSize = retryMaxBatchSize; }

        /** How long a partial batch may wait for more writes; 0 sends it right away. */
        public long getLingerMs() { return lingerMs; }
        public void setLingerMs(long lingerMs) { this.lingerMs = lingerMs; }
    }

    /**
     * Retry configuration.
     */
    public static class RetryConfig {
        private int maxAttempts = 10;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    /**
     * Concurrency bound and ops/second pacing.
     */
    public static class AdmissionConfig {
        private int maxConcurrentBatches = 500;
        private boolean rateLimitingEnabled = true;
        private double startingOpsPerSecond = 500;
        private double maxOpsPerSecond = 10000;
        private double rampMultiplier = 1.5;
        private long rampWindowMs = 300000;

        public int getMaxConcurrentBatches() { return maxConcurrentBatches; }
        public void setMaxConcurrentBatches(int maxConcurrentBatches) { this.maxConcurrentBatches = maxConcurrentBatches; }

        public boolean isRateLimitingEnabled() { return rateLimitingEnabled; }
        public void setRateLimitingEnabled(boolean rateLimitingEnabled) { this.rateLimitingEnabled = rateLimitingEnabled; }

        public double getStartingOpsPerSecond() { return startingOpsPerSecond; }
        public void setStartingOpsPerSecond(double startingOpsPerSecond) { this.startingOpsPerSecond = startingOpsPerSecond; }

        public double getMaxOpsPerSecond() { return maxOpsPerSecond; }
        public void setMaxOpsPerSecond(double maxOpsPerSecond) { this.maxOpsPerSecond = maxOpsPerSecond; }

        public double getRampMultiplier() { return rampMultiplier; }
        public void setRampMultiplier(double rampMultiplier) { this.rampMultiplier = rampMultiplier; }

        public long getRampWindowMs() { return rampWindowMs; }
        public void setRampWindowMs(long rampWindowMs) { this.rampWindowMs = rampWindowMs; }
    }

    /**
     * LMAX Disruptor configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long shutdownTimeoutMs = 30000;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
        public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    }

    /**
     * Transport call settings.
     */
    public static class TransportConfig {
        private long requestTimeoutMs = 0;
        private boolean circuitBreakerEnabled = false;
        private int circuitBreakerFailureThreshold = 5;
        private long circuitBreakerRecoveryMs = 30000;

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public boolean isCircuitBreakerEnabled() { return circuitBreakerEnabled; }
        public void setCircuitBreakerEnabled(boolean enabled) { this.circuitBreakerEnabled = enabled; }

        public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
        public void setCircuitBreakerFailureThreshold(int threshold) { this.circuitBreakerFailureThreshold = threshold; }

        public long getCircuitBreakerRecoveryMs() { return circuitBreakerRecoveryMs; }
        public void setCircuitBreakerRecoveryMs(long ms) { this.circuitBreakerRecoveryMs = ms; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "bulk_writer";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
