package fr.lapetina.bulkwriter.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongSupplier;

/**
 * Token bucket whose refill rate ramps up while writes keep succeeding.
 *
 * The bucket holds at most one second worth of operations at the current ceiling. Every
 * {@code rampWindowMillis}, if the window recorded successful operations, the ceiling is
 * multiplied by {@code multiplier}, up to {@code maxOpsPerSecond}. It never drops below the
 * starting ceiling.
 *
 * A request larger than the whole bucket is admitted once the bucket is full, leaving it in debt.
 *
 * Not thread-safe: owned by the coordinator thread. {@link #getCurrentOpsPerSecond()} may be read
 * from any thread.
 */
public final class RampingRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RampingRateLimiter.class);

    public static final double DEFAULT_STARTING_OPS_PER_SECOND = 500;
    public static final double DEFAULT_MAX_OPS_PER_SECOND = 10_000;
    public static final double DEFAULT_MULTIPLIER = 1.5;
    public static final long DEFAULT_RAMP_WINDOW_MILLIS = 5 * 60 * 1000;

    private final double startingOpsPerSecond;
    private final double maxOpsPerSecond;
    private final double multiplier;
    private final long rampWindowMillis;
    private final LongSupplier clockMillis;

    private volatile double currentOpsPerSecond;
    private double tokens;
    private long lastRefillMillis;
    private long windowStartMillis;
    private long successfulOpsInWindow;

    public RampingRateLimiter(
            double startingOpsPerSecond,
            double maxOpsPerSecond,
            double multiplier,
            long rampWindowMillis,
            LongSupplier clockMillis
    ) {
        if (startingOpsPerSecond <= 0) {
            throw new IllegalArgumentException("startingOpsPerSecond must be positive");
        }
        if (maxOpsPerSecond < startingOpsPerSecond) {
            throw new IllegalArgumentException("maxOpsPerSecond must be >= startingOpsPerSecond");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (rampWindowMillis <= 0) {
            throw new IllegalArgumentException("rampWindowMillis must be positive");
        }
        this.startingOpsPerSecond = startingOpsPerSecond;
        this.maxOpsPerSecond = maxOpsPerSecond;
        this.multiplier = multiplier;
        this.rampWindowMillis = rampWindowMillis;
        this.clockMillis = clockMillis;

        long now = clockMillis.getAsLong();
        this.currentOpsPerSecond = startingOpsPerSecond;
        this.tokens = startingOpsPerSecond;
        this.lastRefillMillis = now;
        this.windowStartMillis = now;
    }

    public RampingRateLimiter() {
        this(DEFAULT_STARTING_OPS_PER_SECOND, DEFAULT_MAX_OPS_PER_SECOND, DEFAULT_MULTIPLIER,
                DEFAULT_RAMP_WINDOW_MILLIS, System::currentTimeMillis);
    }

    /**
     * Tries to take {@code ops} tokens.
     *
     * @return true if the operations may be sent now
     */
    public boolean tryAcquire(int ops) {
        long now = clockMillis.getAsLong();
        advance(now);
        if (tokens >= required(ops)) {
            tokens -= ops;
            return true;
        }
        return false;
    }

    /**
     * Returns how long to wait before {@code ops} tokens are available; 0 if they are now.
     */
    public long getNextRequestDelayMillis(int ops) {
        long now = clockMillis.getAsLong();
        advance(now);
        double missing = required(ops) - tokens;
        if (missing <= 0) {
            return 0;
        }
        return (long) Math.ceil(missing / currentOpsPerSecond * 1000.0);
    }

    /**
     * Records operations the remote store accepted. Only windows with successes ramp the ceiling.
     */
    public void recordSuccess(int ops) {
        successfulOpsInWindow += ops;
    }

    public double getCurrentOpsPerSecond() {
        return currentOpsPerSecond;
    }

    public double getStartingOpsPerSecond() {
        return startingOpsPerSecond;
    }

    private double required(int ops) {
        return Math.min(ops, currentOpsPerSecond);
    }

    private void advance(long now) {
        if (now - windowStartMillis >= rampWindowMillis) {
            if (successfulOpsInWindow > 0 && currentOpsPerSecond < maxOpsPerSecond) {
                double previous = currentOpsPerSecond;
                currentOpsPerSecond = Math.min(maxOpsPerSecond, currentOpsPerSecond * multiplier);
                log.info("Rate limit ramped: {} -> {} ops/s", (long) previous, (long) currentOpsPerSecond);
            }
            windowStartMillis = now;
            successfulOpsInWindow = 0;
        }

        long elapsed = now - lastRefillMillis;
        if (elapsed > 0) {
            tokens = Math.min(currentOpsPerSecond, tokens + elapsed * currentOpsPerSecond / 1000.0);
            lastRefillMillis = now;
        }
    }
}
