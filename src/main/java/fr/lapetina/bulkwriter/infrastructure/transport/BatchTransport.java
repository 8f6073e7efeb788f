package fr.lapetina.bulkwriter.infrastructure.transport;

import fr.lapetina.bulkwriter.domain.model.BatchWriteResponse;
import fr.lapetina.bulkwriter.domain.model.WritePayload;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Sends one batch of encoded writes to the remote store.
 *
 * <p>Contract:
 * <ul>
 *   <li>On success the response holds exactly one outcome per payload, in request order.</li>
 *   <li>A failure of the call itself is reported once, by failing the returned future
 *       (or throwing), never per item.</li>
 *   <li>Timeouts are the transport's business; a timed-out call is a failed call.</li>
 * </ul>
 *
 * <p>Implementations may block inside {@code sendBatch}; the coordinator always calls it from a
 * transport thread, never from its own event loop.
 */
@FunctionalInterface
public interface BatchTransport {

    /**
     * @param targetResource resource name of the database, e.g. {@code projects/p/databases/d}
     * @param writes         ordered payloads of the batch
     * @return future completing with positionally aligned outcomes
     */
    CompletableFuture<BatchWriteResponse> sendBatch(String targetResource, List<WritePayload> writes);
}
