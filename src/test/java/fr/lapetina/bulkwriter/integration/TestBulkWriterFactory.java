package fr.lapetina.bulkwriter.integration;

import fr.lapetina.bulkwriter.BulkWriterFactory;
import fr.lapetina.bulkwriter.domain.model.BatchWriteResponse;
import fr.lapetina.bulkwriter.domain.model.ItemOutcome;
import fr.lapetina.bulkwriter.domain.model.WritePayload;
import fr.lapetina.bulkwriter.domain.model.WriteResult;
import fr.lapetina.bulkwriter.infrastructure.config.BulkWriterConfig;
import fr.lapetina.bulkwriter.infrastructure.config.ConfigLoader;
import fr.lapetina.bulkwriter.infrastructure.transport.BatchTransport;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Test extension of BulkWriterFactory wired to a stub transport.
 */
public final class TestBulkWriterFactory extends BulkWriterFactory {

    private final StubTransport stubTransport;

    private TestBulkWriterFactory(BulkWriterConfig config, StubTransport stubTransport) {
        super(config, stubTransport, null);
        this.stubTransport = stubTransport;
    }

    /**
     * Creates a test factory from the default test configuration.
     */
    public static TestBulkWriterFactory create() {
        return create(new ConfigLoader("test-config.yaml").load());
    }

    /**
     * Creates a test factory from a custom configuration.
     */
    public static TestBulkWriterFactory create(BulkWriterConfig config) {
        return new TestBulkWriterFactory(config, new StubTransport());
    }

    public StubTransport getStubTransport() {
        return stubTransport;
    }

    /**
     * Stub transport: answers OK for every write unless a responder is set, and records what it saw.
     */
    public static final class StubTransport implements BatchTransport {
        private final List<Integer> batchSizes = new CopyOnWriteArrayList<>();
        private final ConcurrentHashMap<String, AtomicInteger> sendsPerDocument = new ConcurrentHashMap<>();
        private volatile Function<List<WritePayload>, CompletableFuture<BatchWriteResponse>> responder;

        public void setResponder(Function<List<WritePayload>, CompletableFuture<BatchWriteResponse>> responder) {
            this.responder = responder;
        }

        @Override
        public CompletableFuture<BatchWriteResponse> sendBatch(String targetResource, List<WritePayload> writes) {
            batchSizes.add(writes.size());
            for (WritePayload write : writes) {
                sendsPerDocument.computeIfAbsent(write.document().path(), k -> new AtomicInteger()).incrementAndGet();
            }
            Function<List<WritePayload>, CompletableFuture<BatchWriteResponse>> current = responder;
            return current != null ? current.apply(writes) : CompletableFuture.completedFuture(allOk(writes));
        }

        public List<Integer> getBatchSizes() {
            return batchSizes;
        }

        public int sendsFor(String documentPath) {
            AtomicInteger count = sendsPerDocument.get(documentPath);
            return count != null ? count.get() : 0;
        }

        public int totalSends() {
            return batchSizes.stream().mapToInt(Integer::intValue).sum();
        }

        public static BatchWriteResponse allOk(List<WritePayload> writes) {
            List<ItemOutcome> outcomes = new ArrayList<>(writes.size());
            for (WritePayload write : writes) {
                outcomes.add(ItemOutcome.success(WriteResult.of(write.document(), Instant.now())));
            }
            return new BatchWriteResponse(outcomes);
        }
    }
}
