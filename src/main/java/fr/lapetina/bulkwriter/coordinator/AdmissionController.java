package fr.lapetina.bulkwriter.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Enforces the in-flight batch ceiling and paces operations per second.
 *
 * Controls:
 * - Max concurrent batch calls (the dispatcher stops popping batches at the ceiling)
 * - Optional ramping ops/second limit
 *
 * Called from the coordinator thread only; counters are atomic so gauges can read them.
 */
public final class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    public static final int DEFAULT_MAX_CONCURRENT_BATCHES = 500;

    // Threshold for warning about approaching capacity (percentage)
    private static final double CAPACITY_WARNING_THRESHOLD = 0.8;

    private final int maxConcurrentBatches;
    private final RampingRateLimiter rateLimiter;
    private final AtomicInteger inFlightBatches = new AtomicInteger(0);
    private boolean capacityWarningLogged = false;

    /**
     * @param maxConcurrentBatches ceiling on outstanding batch calls
     * @param rateLimiter          pacing limiter, or null to disable pacing
     */
    public AdmissionController(int maxConcurrentBatches, RampingRateLimiter rateLimiter) {
        if (maxConcurrentBatches < 1) {
            throw new IllegalArgumentException("maxConcurrentBatches must be positive: " + maxConcurrentBatches);
        }
        this.maxConcurrentBatches = maxConcurrentBatches;
        this.rateLimiter = rateLimiter;
        log.info("AdmissionController initialized: maxConcurrentBatches={}, pacing={}",
                maxConcurrentBatches, rateLimiter != null ? "enabled" : "disabled");
    }

    public static AdmissionController unpaced(int maxConcurrentBatches) {
        return new AdmissionController(maxConcurrentBatches, null);
    }

    /**
     * Returns true if another batch may be put in flight.
     */
    public boolean hasCapacity() {
        int current = inFlightBatches.get();
        checkCapacityThreshold(current);
        return current < maxConcurrentBatches;
    }

    /**
     * Takes pacing tokens for {@code ops} writes.
     *
     * @return false if the caller must wait {@link #nextPermitDelayMillis(int)} first
     */
    public boolean tryAcquireOps(int ops) {
        return rateLimiter == null || rateLimiter.tryAcquire(ops);
    }

    public long nextPermitDelayMillis(int ops) {
        return rateLimiter == null ? 0 : rateLimiter.getNextRequestDelayMillis(ops);
    }

    /**
     * Counts a batch as in flight.
     */
    public int acquireSlot() {
        return inFlightBatches.incrementAndGet();
    }

    /**
     * Releases the slot of a finished batch.
     */
    public int releaseSlot() {
        int remaining = inFlightBatches.decrementAndGet();
        if (remaining < 0) {
            inFlightBatches.set(0);
            throw new IllegalStateException("In-flight batch count went negative");
        }
        log.debug("Batch slot released: inFlightBatches={}/{}", remaining, maxConcurrentBatches);
        return remaining;
    }

    public void recordSuccessfulOps(int ops) {
        if (rateLimiter != null && ops > 0) {
            rateLimiter.recordSuccess(ops);
        }
    }

    public int getInFlightBatches() {
        return inFlightBatches.get();
    }

    public int getMaxConcurrentBatches() {
        return maxConcurrentBatches;
    }

    /**
     * Returns the current ops/second ceiling, or 0 when pacing is disabled.
     */
    public double getOpsPerSecondLimit() {
        return rateLimiter == null ? 0 : rateLimiter.getCurrentOpsPerSecond();
    }

    private void checkCapacityThreshold(int current) {
        double utilization = (double) current / maxConcurrentBatches;
        if (utilization >= CAPACITY_WARNING_THRESHOLD && !capacityWarningLogged) {
            log.warn("Approaching in-flight batch ceiling: inFlightBatches={}/{} ({}%)",
                    current, maxConcurrentBatches, (int) (utilization * 100));
            capacityWarningLogged = true;
        } else if (utilization < CAPACITY_WARNING_THRESHOLD * 0.9) {
            capacityWarningLogged = false;
        }
    }
}
