package fr.lapetina.bulkwriter.infrastructure.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker guarding batch calls to one target resource.
 *
 * States:
 * - CLOSED: Normal operation, batch calls pass through
 * - OPEN: Consecutive failed calls reached the threshold, calls rejected immediately
 * - HALF_OPEN: After recovery timeout, one probe call is let through
 *
 * Only transport-level failures count; per-item rejections inside a successful response are
 * the retry loop's business. Thread-safe via atomic operations.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String targetResource;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger probesInFlight = new AtomicInteger(0);
    private volatile Instant openedAt;

    public CircuitBreaker(String targetResource, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        this.targetResource = targetResource;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    public CircuitBreaker(String targetResource, int failureThreshold, Duration recoveryTimeout) {
        this(targetResource, failureThreshold, recoveryTimeout, Clock.systemUTC());
    }

    /**
     * Checks if a batch call may proceed.
     *
     * @return true if the call should be sent, false if the circuit is open
     */
    public boolean allowRequest() {
        switch (getState()) {
            case CLOSED:
                return true;

            case HALF_OPEN:
                // Single probe at a time
                return probesInFlight.compareAndSet(0, 1);

            case OPEN:
            default:
                return false;
        }
    }

    /**
     * Records a call that returned a response.
     */
    public void recordSuccess() {
        State current = state.get();
        consecutiveFailures.set(0);

        if (current == State.HALF_OPEN && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
            probesInFlight.set(0);
            log.info("Circuit breaker CLOSED after probe succeeded: target={}", targetResource);
        }
    }

    /**
     * Records a call that failed at the transport level.
     */
    public void recordFailure() {
        State current = state.get();

        if (current == State.HALF_OPEN) {
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAt = clock.instant();
                probesInFlight.set(0);
                log.warn("Circuit breaker OPENED (probe failed): target={}", targetResource);
            }
            return;
        }

        int failures = consecutiveFailures.incrementAndGet();
        if (current == State.CLOSED && failures >= failureThreshold
                && state.compareAndSet(State.CLOSED, State.OPEN)) {
            openedAt = clock.instant();
            log.warn("Circuit breaker OPENED: target={}, consecutiveFailures={}", targetResource, failures);
        }
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public void forceState(State newState) {
        State old = state.getAndSet(newState);
        probesInFlight.set(0);
        if (newState == State.CLOSED) {
            consecutiveFailures.set(0);
        }
        if (newState == State.OPEN) {
            openedAt = clock.instant();
        }
        log.info("Circuit breaker forced from {} to {}: target={}", old, newState, targetResource);
    }

    public State getState() {
        // OPEN turns into HALF_OPEN once the recovery timeout has elapsed
        if (state.get() == State.OPEN && openedAt != null
                && !clock.instant().isBefore(openedAt.plus(recoveryTimeout))
                && state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            probesInFlight.set(0);
            log.info("Circuit breaker transitioning to HALF_OPEN: target={}", targetResource);
        }
        return state.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public String getTargetResource() {
        return targetResource;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "target='" + targetResource + '\'' +
                ", state=" + state.get() +
                ", consecutiveFailures=" + consecutiveFailures.get() +
                '}';
    }
}
