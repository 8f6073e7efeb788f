package fr.lapetina.bulkwriter.infrastructure.transport;

import fr.lapetina.bulkwriter.domain.model.BatchWriteResponse;
import fr.lapetina.bulkwriter.domain.model.WritePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link BatchTransport} decorator that keeps one {@link CircuitBreaker} per target resource.
 *
 * A refused call never reaches the delegate; its future fails with
 * {@link CircuitBreakerOpenException}.
 */
public final class CircuitBreakingTransport implements BatchTransport {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakingTransport.class);

    private final BatchTransport delegate;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;
    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakingTransport(BatchTransport delegate, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        this.delegate = delegate;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    public CircuitBreakingTransport(BatchTransport delegate, int failureThreshold, Duration recoveryTimeout) {
        this(delegate, failureThreshold, recoveryTimeout, Clock.systemUTC());
    }

    @Override
    public CompletableFuture<BatchWriteResponse> sendBatch(String targetResource, List<WritePayload> writes) {
        CircuitBreaker breaker = breakerFor(targetResource);
        if (!breaker.allowRequest()) {
            log.debug("Batch refused by open circuit: target={}, size={}", targetResource, writes.size());
            return CompletableFuture.failedFuture(new CircuitBreakerOpenException(targetResource));
        }

        CompletableFuture<BatchWriteResponse> call;
        try {
            call = delegate.sendBatch(targetResource, writes);
        } catch (RuntimeException e) {
            breaker.recordFailure();
            return CompletableFuture.failedFuture(e);
        }
        if (call == null) {
            breaker.recordFailure();
            return CompletableFuture.failedFuture(new IllegalStateException("Transport returned no future"));
        }

        return call.whenComplete((response, error) -> {
            if (error != null) {
                breaker.recordFailure();
            } else {
                breaker.recordSuccess();
            }
        });
    }

    /**
     * Returns the breaker of a target resource, creating it on first use.
     */
    public CircuitBreaker breakerFor(String targetResource) {
        return breakers.computeIfAbsent(targetResource,
                target -> new CircuitBreaker(target, failureThreshold, recoveryTimeout, clock));
    }
}
