package fr.lapetina.bulkwriter.coordinator;

import fr.lapetina.bulkwriter.domain.event.BatchCompletion;
import fr.lapetina.bulkwriter.domain.event.PendingWrite;
import fr.lapetina.bulkwriter.domain.exception.BatchTransportException;
import fr.lapetina.bulkwriter.domain.exception.BulkWriterClosedException;
import fr.lapetina.bulkwriter.domain.exception.BulkWriterException;
import fr.lapetina.bulkwriter.domain.exception.RetriesExhaustedException;
import fr.lapetina.bulkwriter.domain.exception.WriteRejectedException;
import fr.lapetina.bulkwriter.domain.model.BatchWriteResponse;
import fr.lapetina.bulkwriter.domain.model.ItemOutcome;
import fr.lapetina.bulkwriter.domain.model.WriteErrorType;
import fr.lapetina.bulkwriter.domain.model.WritePayload;
import fr.lapetina.bulkwriter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.bulkwriter.infrastructure.transport.BatchTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

/**
 * Drains the backlog into batches, calls the transport, routes per-item outcomes back to the
 * callers and requeues rejected writes.
 *
 * All {@code on*} methods must be called from a single thread (the coordinator thread). The
 * transport call itself runs on {@code transportExecutor}; its completion comes back through
 * {@code completionSink}, which must re-enter this class on the coordinator thread via
 * {@link #onBatchCompleted(BatchCompletion)}.
 *
 * Batch fill policy: a batch takes up to {@code maxBatchSize} writes from the head of the backlog,
 * fewer when the backlog holds fewer. With a positive {@code lingerMs}, a partial batch is held
 * until its oldest write has waited that long, so writes arriving in a burst share a call. A
 * flush or close sends partial batches immediately.
 */
public final class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final String targetResource;
    private final BatchTransport transport;
    private final Executor transportExecutor;
    private final Consumer<BatchCompletion> completionSink;
    private final WakeScheduler wakeScheduler;
    private final AdmissionController admission;
    private final BatchLimits limits;
    private final long requestTimeoutMs;
    private final long lingerMs;
    private final LongSupplier clockMillis;
    private final MetricsRegistry metrics;

    private final Backlog backlog = new Backlog();
    private final List<CompletableFuture<Void>> drainWaiters = new ArrayList<>();
    private final AtomicLong batchIds = new AtomicLong(0);

    private volatile boolean open = true;
    // -1 when no wake-up is pending
    private long wakeDueAtMillis = -1;

    private Dispatcher(Builder builder) {
        this.targetResource = builder.targetResource;
        this.transport = builder.transport;
        this.transportExecutor = builder.transportExecutor;
        this.completionSink = builder.completionSink;
        this.wakeScheduler = builder.wakeScheduler;
        this.admission = builder.admission;
        this.limits = builder.limits;
        this.requestTimeoutMs = builder.requestTimeoutMs;
        this.lingerMs = builder.lingerMs;
        this.clockMillis = builder.clockMillis;
        this.metrics = builder.metrics;
    }

    /**
     * Schedules a {@link #onWake()} call after a pacing delay.
     */
    @FunctionalInterface
    public interface WakeScheduler {
        void scheduleWake(long delayMillis);
    }

    public void onEnqueue(PendingWrite write) {
        if (!open) {
            log.debug("Write rejected, writer closed: writeId={}, document={}", write.getId(), write.getDocumentPath());
            failWrite(write, new BulkWriterClosedException(targetResource));
            return;
        }
        write.markQueued(clockMillis.getAsLong());
        backlog.add(write);
        log.debug("Write queued: writeId={}, operation={}, document={}, backlogSize={}",
                write.getId(), write.getPayload().operation(), write.getDocumentPath(), backlog.size());
        dispatchAvailable();
        releaseDrainWaitersIfIdle();
    }

    public void onBatchCompleted(BatchCompletion completion) {
        admission.releaseSlot();
        try {
            if (completion.isFailed()) {
                failBatch(completion.batchId(), completion.batch(), completion.error());
            } else if (completion.response().size() != completion.batch().size()) {
                failBatch(completion.batchId(), completion.batch(), new BatchTransportException(
                        completion.batchId(),
                        "Transport returned " + completion.response().size()
                                + " outcomes for " + completion.batch().size() + " writes"));
            } else {
                routeOutcomes(completion);
            }
            metrics.recordBatch(targetResource, completion.batch().size(), completion.latency(),
                    completion.isFailed());
        } finally {
            dispatchAvailable();
            releaseDrainWaitersIfIdle();
        }
    }

    public void onFlush(CompletableFuture<Void> waiter) {
        drainWaiters.add(waiter);
        log.debug("Flush requested: backlogSize={}, inFlightBatches={}",
                backlog.size(), admission.getInFlightBatches());
        dispatchAvailable();
        releaseDrainWaitersIfIdle();
    }

    public void onClose(CompletableFuture<Void> waiter) {
        if (open) {
            open = false;
            log.info("BulkWriter closing: target={}, backlogSize={}, inFlightBatches={}",
                    targetResource, backlog.size(), admission.getInFlightBatches());
        }
        onFlush(waiter);
    }

    public void onWake() {
        wakeDueAtMillis = -1;
        dispatchAvailable();
        releaseDrainWaitersIfIdle();
    }

    /**
     * Runs dispatch attempts until one makes no progress.
     */
    void dispatchAvailable() {
        while (attemptDispatch()) {
            // keep going
        }
    }

    /**
     * Single attempt to move one batch from the backlog to the transport.
     *
     * @return true if the backlog changed
     */
    boolean attemptDispatch() {
        if (!admission.hasCapacity()) {
            return false;
        }
        if (backlog.isEmpty()) {
            return false;
        }
        if (!isDraining() && backlog.size() < limits.maxBatchSize() && lingerMs > 0) {
            long waited = clockMillis.getAsLong() - backlog.peekOldest().getQueuedAtMillis();
            if (waited < lingerMs) {
                scheduleWake(lingerMs - waited);
                return false;
            }
        }

        int candidates = backlog.nextBatchSize(limits.maxBatchSize(), limits.retryMaxBatchSize());
        if (!admission.tryAcquireOps(candidates)) {
            scheduleWake(admission.nextPermitDelayMillis(candidates));
            return false;
        }

        List<PendingWrite> polled = backlog.pollBatch(limits.maxBatchSize(), limits.retryMaxBatchSize());
        List<PendingWrite> batch = new ArrayList<>(polled.size());
        for (PendingWrite write : polled) {
            if (write.isCancelled()) {
                write.markCancelled();
                log.debug("Cancelled write dropped before dispatch: writeId={}", write.getId());
            } else if (write.getAttempts() >= limits.maxRetryAttempts()) {
                exhaust(write);
            } else {
                batch.add(write);
            }
        }
        if (batch.isEmpty()) {
            return true;
        }

        long batchId = batchIds.incrementAndGet();
        int inFlight = admission.acquireSlot();
        batch.forEach(PendingWrite::markInFlight);
        log.info("Dispatching batch: batchId={}, target={}, size={}, inFlightBatches={}/{}, backlogSize={}",
                batchId, targetResource, batch.size(), inFlight, admission.getMaxConcurrentBatches(), backlog.size());

        try {
            transportExecutor.execute(() -> send(batchId, batch));
        } catch (RejectedExecutionException e) {
            admission.releaseSlot();
            failBatch(batchId, batch, new BatchTransportException(batchId, "Transport executor rejected batch", e));
        }
        return true;
    }

    /**
     * Runs on a transport thread.
     */
    private void send(long batchId, List<PendingWrite> batch) {
        MDC.put("batchId", String.valueOf(batchId));
        MDC.put("targetResource", targetResource);
        try {
            List<WritePayload> payloads = batch.stream()
                    .map(PendingWrite::getPayload)
                    .collect(Collectors.toList());
            long startNanos = System.nanoTime();

            CompletableFuture<BatchWriteResponse> call;
            try {
                call = transport.sendBatch(targetResource, payloads);
                if (call == null) {
                    call = CompletableFuture.failedFuture(new IllegalStateException("Transport returned no future"));
                }
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }
            if (requestTimeoutMs > 0) {
                call = call.orTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS);
            }

            call.whenComplete((response, error) -> {
                Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
                BatchCompletion completion;
                if (error != null) {
                    completion = BatchCompletion.failed(batchId, batch, error, latency);
                } else if (response == null) {
                    completion = BatchCompletion.failed(batchId, batch,
                            new IllegalStateException("Transport completed without a response"), latency);
                } else {
                    completion = BatchCompletion.succeeded(batchId, batch, response, latency);
                }
                try {
                    completionSink.accept(completion);
                } catch (RuntimeException e) {
                    log.error("Batch completion could not be handed back: batchId={}", batchId, e);
                    BulkWriterClosedException closed = new BulkWriterClosedException(
                            targetResource, "batch " + batchId + " completed after teardown");
                    batch.forEach(write -> write.fail(closed));
                }
            });
        } finally {
            MDC.remove("batchId");
            MDC.remove("targetResource");
        }
    }

    private void routeOutcomes(BatchCompletion completion) {
        List<PendingWrite> batch = completion.batch();
        BatchWriteResponse response = completion.response();
        int succeeded = 0;
        int retried = 0;
        int failed = 0;

        for (int i = 0; i < batch.size(); i++) {
            PendingWrite write = batch.get(i);
            ItemOutcome outcome = response.get(i);

            if (outcome.isSuccess()) {
                if (write.complete(outcome.result())) {
                    metrics.incrementSucceeded(targetResource);
                }
                succeeded++;
                continue;
            }

            int attempts = write.markRejected(outcome.status());
            if (attempts >= limits.maxRetryAttempts()) {
                exhaust(write);
                failed++;
            } else {
                write.markQueued(clockMillis.getAsLong());
                backlog.requeue(write);
                metrics.incrementRetried(targetResource);
                retried++;
                log.debug("Write requeued: writeId={}, document={}, attempt={}, status={}",
                        write.getId(), write.getDocumentPath(), attempts, outcome.status());
            }
        }

        admission.recordSuccessfulOps(succeeded);
        log.info("Batch completed: batchId={}, target={}, size={}, succeeded={}, retried={}, failed={}, latencyMs={}",
                completion.batchId(), targetResource, batch.size(), succeeded, retried, failed,
                completion.latency().toMillis());
    }

    private void failBatch(long batchId, List<PendingWrite> batch, Throwable error) {
        BatchTransportException failure = toTransportException(batchId, error);
        log.error("Batch failed: batchId={}, target={}, size={}, error={}",
                batchId, targetResource, batch.size(), failure.getMessage());
        for (PendingWrite write : batch) {
            failWrite(write, failure);
        }
    }

    private BatchTransportException toTransportException(long batchId, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof BatchTransportException transportException) {
            return transportException;
        }
        if (cause instanceof TimeoutException) {
            return new BatchTransportException(batchId,
                    "Batch " + batchId + " timed out after " + requestTimeoutMs + "ms", cause);
        }
        return new BatchTransportException(batchId, "Batch " + batchId + " failed: " + cause.getMessage(), cause);
    }

    private void exhaust(PendingWrite write) {
        WriteRejectedException lastRejection = write.getLastStatus() != null
                ? new WriteRejectedException(write.getDocumentPath(), write.getLastStatus())
                : null;
        log.warn("Write exceeded retry attempts: writeId={}, document={}, attempts={}, lastStatus={}",
                write.getId(), write.getDocumentPath(), write.getAttempts(), write.getLastStatus());
        failWrite(write, new RetriesExhaustedException(write.getDocumentPath(), write.getAttempts(), lastRejection));
    }

    private void failWrite(PendingWrite write, BulkWriterException error) {
        if (write.fail(error)) {
            metrics.incrementFailed(targetResource, error.getErrorType());
        }
    }

    /**
     * Schedules a wake-up unless one is already due no later than the requested time.
     */
    private void scheduleWake(long delayMillis) {
        long delay = Math.max(1, delayMillis);
        long dueAt = clockMillis.getAsLong() + delay;
        if (wakeDueAtMillis >= 0 && wakeDueAtMillis <= dueAt) {
            return;
        }
        wakeDueAtMillis = dueAt;
        log.debug("Next dispatch attempt in {}ms: backlogSize={}", delay, backlog.size());
        try {
            wakeScheduler.scheduleWake(delay);
        } catch (RejectedExecutionException e) {
            wakeDueAtMillis = -1;
            log.warn("Could not schedule dispatch wake-up: target={}", targetResource, e);
        }
    }

    private void releaseDrainWaitersIfIdle() {
        if (drainWaiters.isEmpty() || !backlog.isEmpty() || admission.getInFlightBatches() > 0) {
            return;
        }
        log.debug("Backlog drained, releasing {} waiter(s)", drainWaiters.size());
        List<CompletableFuture<Void>> waiters = new ArrayList<>(drainWaiters);
        drainWaiters.clear();
        waiters.forEach(waiter -> waiter.complete(null));
    }

    private boolean isDraining() {
        return !open || !drainWaiters.isEmpty();
    }

    public boolean isOpen() {
        return open;
    }

    public int getBacklogSize() {
        return backlog.size();
    }

    public int getInFlightBatches() {
        return admission.getInFlightBatches();
    }

    public double getOpsPerSecondLimit() {
        return admission.getOpsPerSecondLimit();
    }

    public String getTargetResource() {
        return targetResource;
    }

    public BatchLimits getLimits() {
        return limits;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Dispatcher.
     */
    public static final class Builder {
        private String targetResource;
        private BatchTransport transport;
        private Executor transportExecutor;
        private Consumer<BatchCompletion> completionSink;
        private WakeScheduler wakeScheduler;
        private AdmissionController admission;
        private BatchLimits limits = BatchLimits.defaults();
        private long requestTimeoutMs = 0;
        private long lingerMs = 0;
        private LongSupplier clockMillis = System::currentTimeMillis;
        private MetricsRegistry metrics;

        public Builder targetResource(String targetResource) {
            this.targetResource = targetResource;
            return this;
        }

        public Builder transport(BatchTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder transportExecutor(Executor executor) {
            this.transportExecutor = executor;
            return this;
        }

        public Builder completionSink(Consumer<BatchCompletion> sink) {
            this.completionSink = sink;
            return this;
        }

        public Builder wakeScheduler(WakeScheduler scheduler) {
            this.wakeScheduler = scheduler;
            return this;
        }

        public Builder admission(AdmissionController admission) {
            this.admission = admission;
            return this;
        }

        public Builder limits(BatchLimits limits) {
            this.limits = limits;
            return this;
        }

        public Builder requestTimeoutMs(long timeoutMs) {
            this.requestTimeoutMs = timeoutMs;
            return this;
        }

        public Builder lingerMs(long lingerMs) {
            this.lingerMs = lingerMs;
            return this;
        }

        public Builder clockMillis(LongSupplier clockMillis) {
            this.clockMillis = clockMillis;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Dispatcher build() {
            if (targetResource == null || targetResource.isBlank()) {
                throw new IllegalStateException("Target resource is required");
            }
            if (transport == null) {
                throw new IllegalStateException("BatchTransport is required");
            }
            if (transportExecutor == null) {
                throw new IllegalStateException("Transport executor is required");
            }
            if (completionSink == null) {
                throw new IllegalStateException("Completion sink is required");
            }
            if (wakeScheduler == null) {
                throw new IllegalStateException("WakeScheduler is required");
            }
            if (admission == null) {
                throw new IllegalStateException("AdmissionController is required");
            }
            if (metrics == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (lingerMs < 0) {
                throw new IllegalStateException("Linger must not be negative");
            }
            return new Dispatcher(this);
        }
    }
}
