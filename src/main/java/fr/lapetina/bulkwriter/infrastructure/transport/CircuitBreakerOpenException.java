package fr.lapetina.bulkwriter.infrastructure.transport;

/**
 * Thrown (through the returned future) when a batch call is refused by an open circuit.
 * The coordinator reports it to every write of the batch as a transport failure.
 */
public class CircuitBreakerOpenException extends RuntimeException {

    public CircuitBreakerOpenException(String targetResource) {
        super("Circuit breaker open for target: " + targetResource);
    }
}
