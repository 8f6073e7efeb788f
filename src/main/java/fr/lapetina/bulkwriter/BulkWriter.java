package fr.lapetina.bulkwriter;

import fr.lapetina.bulkwriter.disruptor.CoordinatorPipeline;
import fr.lapetina.bulkwriter.domain.exception.BulkWriterClosedException;
import fr.lapetina.bulkwriter.domain.exception.WriteEncodingException;
import fr.lapetina.bulkwriter.domain.model.DocumentRef;
import fr.lapetina.bulkwriter.domain.model.WriteErrorType;
import fr.lapetina.bulkwriter.domain.model.WriteOperation;
import fr.lapetina.bulkwriter.domain.model.WritePayload;
import fr.lapetina.bulkwriter.domain.model.WriteResult;
import fr.lapetina.bulkwriter.infrastructure.encoding.WriteEncoder;
import fr.lapetina.bulkwriter.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Batches individually submitted writes against one database.
 *
 * <p>Each write returns a future that is resolved exactly once: with the {@link WriteResult}
 * on success, or with a {@link fr.lapetina.bulkwriter.domain.exception.BulkWriterException}
 * subclass. No error is ever thrown by the enqueue methods themselves.
 *
 * <p>Usage:
 * <pre>{@code
 * try (BulkWriter writer = factory.newBulkWriter("projects/p/databases/(default)")) {
 *     writer.set(DocumentRef.of("users", "alice"), Map.of("name", "Alice"));
 *     writer.delete(DocumentRef.of("users", "bob"));
 *     writer.flush();
 * }
 * }</pre>
 *
 * <p>Do not call {@link #flush()} or {@link #close()} from a non-async callback attached to a
 * write future; those callbacks run on the coordinator thread and the call is rejected.
 */
public final class BulkWriter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BulkWriter.class);

    private final CoordinatorPipeline pipeline;
    private final WriteEncoder encoder;
    private final MetricsRegistry metrics;
    private final Consumer<BulkWriter> closeListener;

    public BulkWriter(CoordinatorPipeline pipeline, WriteEncoder encoder, MetricsRegistry metrics) {
        this(pipeline, encoder, metrics, writer -> { });
    }

    /**
     * @param closeListener called once the writer has drained and shut down
     */
    public BulkWriter(CoordinatorPipeline pipeline, WriteEncoder encoder, MetricsRegistry metrics,
                      Consumer<BulkWriter> closeListener) {
        this.pipeline = pipeline;
        this.encoder = encoder;
        this.metrics = metrics;
        this.closeListener = closeListener;
    }

    /**
     * Creates a document that must not exist yet.
     */
    public CompletableFuture<WriteResult> create(DocumentRef document, Object data) {
        return enqueue(WriteOperation.CREATE, document, data);
    }

    /**
     * Overwrites a document, creating it if needed.
     */
    public CompletableFuture<WriteResult> set(DocumentRef document, Object data) {
        return enqueue(WriteOperation.SET, document, data);
    }

    /**
     * Updates the given fields of an existing document.
     */
    public CompletableFuture<WriteResult> update(DocumentRef document, Map<String, ?> fields) {
        return enqueue(WriteOperation.UPDATE, document, fields);
    }

    public CompletableFuture<WriteResult> delete(DocumentRef document) {
        return enqueue(WriteOperation.DELETE, document, null);
    }

    /**
     * Encodes and enqueues a write. An encoding failure fails the returned future and the write
     * never enters the backlog.
     */
    public CompletableFuture<WriteResult> enqueue(WriteOperation operation, DocumentRef document, Object data) {
        if (!pipeline.isOpen()) {
            return rejectClosed();
        }

        WritePayload payload;
        try {
            payload = encoder.encode(operation, document, data);
        } catch (WriteEncodingException e) {
            log.warn("Write not enqueued, encoding failed: target={}, operation={}, document={}, error={}",
                    pipeline.getTargetResource(), operation, document, e.getMessage());
            return rejectEncoding(e);
        }
        return pipeline.submit(payload);
    }

    /**
     * Enqueues an already encoded write. A null payload fails the returned future with a
     * {@link WriteEncodingException}.
     */
    public CompletableFuture<WriteResult> enqueue(WritePayload payload) {
        if (payload == null) {
            log.warn("Write not enqueued, payload is null: target={}", pipeline.getTargetResource());
            return rejectEncoding(new WriteEncodingException("Payload is required"));
        }
        return pipeline.submit(payload);
    }

    /**
     * Blocks until every write enqueued before this call is resolved.
     *
     * @throws IllegalStateException if called from the coordinator thread
     */
    public void flush() {
        pipeline.flush();
    }

    /**
     * Non-blocking variant of {@link #flush()}.
     */
    public CompletableFuture<Void> flushAsync() {
        return pipeline.flushAsync();
    }

    /**
     * Stops accepting writes and waits until every pending write is resolved.
     * Safe to call more than once.
     *
     * @throws IllegalStateException if called from the coordinator thread
     */
    @Override
    public void close() {
        try {
            pipeline.close();
        } finally {
            closeListener.accept(this);
        }
    }

    public boolean isOpen() {
        return pipeline.isOpen();
    }

    public String getTargetResource() {
        return pipeline.getTargetResource();
    }

    public int getBacklogSize() {
        return pipeline.getBacklogSize();
    }

    public int getInFlightBatches() {
        return pipeline.getInFlightBatches();
    }

    private CompletableFuture<WriteResult> rejectEncoding(WriteEncodingException error) {
        metrics.incrementFailed(pipeline.getTargetResource(), WriteErrorType.ENCODING);
        return CompletableFuture.failedFuture(error);
    }

    private CompletableFuture<WriteResult> rejectClosed() {
        metrics.incrementFailed(pipeline.getTargetResource(), WriteErrorType.CLOSED);
        return CompletableFuture.failedFuture(new BulkWriterClosedException(pipeline.getTargetResource()));
    }
}
