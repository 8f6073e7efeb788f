package fr.lapetina.bulkwriter.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.bulkwriter.coordinator.AdmissionController;
import fr.lapetina.bulkwriter.coordinator.BatchLimits;
import fr.lapetina.bulkwriter.coordinator.Dispatcher;
import fr.lapetina.bulkwriter.coordinator.RampingRateLimiter;
import fr.lapetina.bulkwriter.disruptor.handlers.CoordinatorCommandHandler;
import fr.lapetina.bulkwriter.domain.event.CoordinatorCommand;
import fr.lapetina.bulkwriter.domain.event.CoordinatorCommandFactory;
import fr.lapetina.bulkwriter.domain.event.PendingWrite;
import fr.lapetina.bulkwriter.domain.exception.BackpressureException;
import fr.lapetina.bulkwriter.domain.exception.BulkWriterClosedException;
import fr.lapetina.bulkwriter.domain.model.WriteErrorType;
import fr.lapetina.bulkwriter.domain.model.WritePayload;
import fr.lapetina.bulkwriter.domain.model.WriteResult;
import fr.lapetina.bulkwriter.infrastructure.config.BulkWriterConfig;
import fr.lapetina.bulkwriter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.bulkwriter.infrastructure.transport.BatchTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Disruptor-backed event loop of one bulk writer.
 *
 * SINGLE OWNER: one consumer thread applies every command, so the backlog, the in-flight counter
 * and the open flag are never touched concurrently. Producers only publish commands.
 *
 * PRODUCER TYPE CHOICE: MULTI
 *
 * Writes are enqueued from any caller thread and completions arrive from transport threads,
 * so the ring buffer has many producers.
 *
 * BACKPRESSURE: enqueue claims a slot with {@code tryNext()} and fails the write's future with
 * {@link BackpressureException} when the ring is full; callers never block. Internal commands
 * (completions, flush, close, wake-ups) wait for a slot instead, since they must not be lost.
 *
 * DEADLOCK HAZARD: write futures are completed on the coordinator thread. Calling
 * {@link #flush()} or {@link #close()} from that thread, e.g. from a non-async callback on a
 * write future, would wait on itself; both methods throw {@link IllegalStateException} instead.
 */
public final class CoordinatorPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorPipeline.class);

    private final String targetResource;
    private final Disruptor<CoordinatorCommand> disruptor;
    private final RingBuffer<CoordinatorCommand> ringBuffer;
    private final Dispatcher dispatcher;
    private final ExecutorService transportExecutor;
    private final ScheduledExecutorService pacingScheduler;
    private final MetricsRegistry metrics;
    private final CoordinatorThreadFactory coordinatorThreads;
    private final long shutdownTimeoutMs;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong writeIds = new AtomicLong(0);
    private final ReentrantReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private boolean closing = false;

    private CoordinatorPipeline(Builder builder) {
        this.targetResource = builder.targetResource;
        this.metrics = builder.metricsRegistry;
        this.shutdownTimeoutMs = builder.shutdownTimeoutMs;

        this.coordinatorThreads = new CoordinatorThreadFactory("bulk-writer-coordinator");
        this.transportExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("bulk-writer-transport"));
        this.pacingScheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("bulk-writer-pacer"));

        RampingRateLimiter rateLimiter = builder.rateLimitingEnabled
                ? new RampingRateLimiter(
                        builder.startingOpsPerSecond,
                        builder.maxOpsPerSecond,
                        builder.rampMultiplier,
                        builder.rampWindowMs,
                        builder.clockMillis)
                : null;
        AdmissionController admission = new AdmissionController(builder.maxConcurrentBatches, rateLimiter);

        this.dispatcher = Dispatcher.builder()
                .targetResource(builder.targetResource)
                .transport(builder.transport)
                .transportExecutor(transportExecutor)
                .completionSink(completion -> publish(command -> command.prepareCompletion(completion)))
                .wakeScheduler(delayMillis -> pacingScheduler.schedule(
                        () -> publish(CoordinatorCommand::prepareWake), delayMillis, TimeUnit.MILLISECONDS))
                .admission(admission)
                .limits(builder.limits)
                .lingerMs(builder.lingerMs)
                .clockMillis(builder.clockMillis)
                .requestTimeoutMs(builder.requestTimeoutMs)
                .metrics(builder.metricsRegistry)
                .build();

        this.disruptor = new Disruptor<>(
                new CoordinatorCommandFactory(),
                builder.ringBufferSize,
                coordinatorThreads,
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );
        disruptor.handleEventsWith(new CoordinatorCommandHandler(dispatcher));
        disruptor.setDefaultExceptionHandler(new CoordinatorExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        metrics.registerWriterGauges(
                targetResource,
                dispatcher::getBacklogSize,
                dispatcher::getInFlightBatches,
                dispatcher::getOpsPerSecondLimit
        );

        log.info("CoordinatorPipeline created: target={}, ringBufferSize={}, waitStrategy={}, limits={}, lingerMs={}, maxConcurrentBatches={}",
                targetResource, builder.ringBufferSize, builder.waitStrategy, builder.limits, builder.lingerMs,
                builder.maxConcurrentBatches);
    }

    /**
     * Starts the coordinator thread.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("CoordinatorPipeline started: target={}", targetResource);
        }
    }

    /**
     * Enqueues an encoded write.
     *
     * @return future resolved exactly once with the write's result or error
     */
    public CompletableFuture<WriteResult> submit(WritePayload payload) {
        CompletableFuture<WriteResult> future = new CompletableFuture<>();

        lifecycleLock.readLock().lock();
        try {
            if (closing || !running.get()) {
                future.completeExceptionally(new BulkWriterClosedException(targetResource));
                metrics.incrementFailed(targetResource, WriteErrorType.CLOSED);
                return future;
            }

            PendingWrite write = new PendingWrite(writeIds.incrementAndGet(), payload, future);
            long sequence;
            try {
                sequence = ringBuffer.tryNext();
            } catch (InsufficientCapacityException e) {
                log.warn("Write rejected, ring buffer full: target={}, document={}",
                        targetResource, payload.document());
                future.completeExceptionally(new BackpressureException(ringBuffer.remainingCapacity()));
                metrics.incrementFailed(targetResource, WriteErrorType.BACKPRESSURE);
                return future;
            }

            try {
                ringBuffer.get(sequence).prepareEnqueue(write);
            } finally {
                ringBuffer.publish(sequence);
            }
            metrics.incrementEnqueued(targetResource);

            log.debug("Write submitted: writeId={}, operation={}, document={}, sequence={}",
                    write.getId(), payload.operation(), payload.document(), sequence);
        } finally {
            lifecycleLock.readLock().unlock();
        }
        return future;
    }

    /**
     * Requests a drain and returns a future completed once the backlog is empty and no batch
     * is in flight.
     */
    public CompletableFuture<Void> flushAsync() {
        ensureNotCoordinatorThread("flush");
        lifecycleLock.readLock().lock();
        try {
            if (closing) {
                return terminated;
            }
            if (!running.get()) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            publish(command -> command.prepareFlush(waiter));
            return waiter;
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    /**
     * Blocks until every write enqueued so far is resolved, including retries it triggers.
     */
    public void flush() {
        flushAsync().join();
    }

    /**
     * Stops accepting writes, drains the backlog and in-flight batches, then stops all threads.
     * Idempotent; concurrent callers all wait for the same termination.
     */
    @Override
    public void close() {
        ensureNotCoordinatorThread("close");

        boolean first;
        lifecycleLock.writeLock().lock();
        try {
            first = !closing;
            closing = true;
        } finally {
            lifecycleLock.writeLock().unlock();
        }

        if (!first) {
            terminated.join();
            return;
        }

        log.info("Shutting down CoordinatorPipeline: target={}", targetResource);
        CompletionException drainFailure = null;
        if (running.get()) {
            CompletableFuture<Void> drained = new CompletableFuture<>();
            publish(command -> command.prepareClose(drained));
            try {
                drained.join();
            } catch (CompletionException e) {
                log.error("Drain failed during close: target={}", targetResource, e);
                drainFailure = e;
            }
        }

        shutdownThreads();
        metrics.removeWriterGauges(targetResource);
        terminated.complete(null);
        log.info("CoordinatorPipeline shut down: target={}", targetResource);

        if (drainFailure != null) {
            throw drainFailure;
        }
    }

    private void shutdownThreads() {
        pacingScheduler.shutdownNow();

        if (running.compareAndSet(true, false)) {
            try {
                disruptor.shutdown(shutdownTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("CoordinatorPipeline shutdown timed out, halting: target={}", targetResource);
                disruptor.halt();
            }
        }

        transportExecutor.shutdown();
        try {
            if (!transportExecutor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Transport threads still busy after {}ms: target={}", shutdownTimeoutMs, targetResource);
                transportExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transportExecutor.shutdownNow();
        }
    }

    private void publish(Consumer<CoordinatorCommand> translator) {
        long sequence = ringBuffer.next();
        try {
            translator.accept(ringBuffer.get(sequence));
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    private void ensureNotCoordinatorThread(String operation) {
        if (coordinatorThreads.owns(Thread.currentThread())) {
            throw new IllegalStateException(operation + "() must not be called from the coordinator thread; "
                    + "use an async callback on the write future");
        }
    }

    public boolean isOpen() {
        return running.get() && dispatcher.isOpen() && !isClosing();
    }

    private boolean isClosing() {
        lifecycleLock.readLock().lock();
        try {
            return closing;
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    public String getTargetResource() {
        return targetResource;
    }

    public int getBacklogSize() {
        return dispatcher.getBacklogSize();
    }

    public int getInFlightBatches() {
        return dispatcher.getInFlightBatches();
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for the coordinator thread; remembers the threads it created.
     */
    private static final class CoordinatorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);
        private volatile Thread current;

        CoordinatorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            current = t;
            return t;
        }

        boolean owns(Thread thread) {
            return thread == current;
        }
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DaemonThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor. The command handler already fails the futures of a
     * command it could not apply; this only covers errors thrown outside of it.
     */
    private static class CoordinatorExceptionHandler
            implements com.lmax.disruptor.ExceptionHandler<CoordinatorCommand> {

        private static final Logger log = LoggerFactory.getLogger(CoordinatorExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, CoordinatorCommand command) {
            log.error("Exception in command handler: sequence={}, command={}", sequence, command, ex);
            command.failWith(ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during coordinator start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during coordinator shutdown", ex);
        }
    }

    /**
     * Builder for CoordinatorPipeline.
     */
    public static final class Builder {
        private String targetResource;
        private BatchTransport transport;
        private MetricsRegistry metricsRegistry;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private BatchLimits limits = BatchLimits.defaults();
        private long lingerMs = 0;
        private int maxConcurrentBatches = AdmissionController.DEFAULT_MAX_CONCURRENT_BATCHES;
        private boolean rateLimitingEnabled = true;
        private double startingOpsPerSecond = RampingRateLimiter.DEFAULT_STARTING_OPS_PER_SECOND;
        private double maxOpsPerSecond = RampingRateLimiter.DEFAULT_MAX_OPS_PER_SECOND;
        private double rampMultiplier = RampingRateLimiter.DEFAULT_MULTIPLIER;
        private long rampWindowMs = RampingRateLimiter.DEFAULT_RAMP_WINDOW_MILLIS;
        private LongSupplier clockMillis = System::currentTimeMillis;
        private long requestTimeoutMs = 0;
        private long shutdownTimeoutMs = 30_000;

        public Builder targetResource(String targetResource) {
            this.targetResource = targetResource;
            return this;
        }

        public Builder transport(BatchTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder limits(BatchLimits limits) {
            this.limits = limits;
            return this;
        }

        public Builder lingerMs(long lingerMs) {
            this.lingerMs = lingerMs;
            return this;
        }

        public Builder maxConcurrentBatches(int max) {
            this.maxConcurrentBatches = max;
            return this;
        }

        public Builder rateLimitingEnabled(boolean enabled) {
            this.rateLimitingEnabled = enabled;
            return this;
        }

        public Builder startingOpsPerSecond(double opsPerSecond) {
            this.startingOpsPerSecond = opsPerSecond;
            return this;
        }

        public Builder maxOpsPerSecond(double opsPerSecond) {
            this.maxOpsPerSecond = opsPerSecond;
            return this;
        }

        public Builder rampMultiplier(double multiplier) {
            this.rampMultiplier = multiplier;
            return this;
        }

        public Builder rampWindowMs(long windowMs) {
            this.rampWindowMs = windowMs;
            return this;
        }

        public Builder clockMillis(LongSupplier clockMillis) {
            this.clockMillis = clockMillis;
            return this;
        }

        public Builder requestTimeoutMs(long timeoutMs) {
            this.requestTimeoutMs = timeoutMs;
            return this;
        }

        public Builder shutdownTimeoutMs(long timeoutMs) {
            this.shutdownTimeoutMs = timeoutMs;
            return this;
        }

        public Builder fromConfig(BulkWriterConfig config) {
            ringBufferSize(config.getDisruptor().getRingBufferSize());
            this.waitStrategy = config.getDisruptor().getWaitStrategy();
            this.shutdownTimeoutMs = config.getDisruptor().getShutdownTimeoutMs();
            this.limits = new BatchLimits(
                    config.getBatch().getMaxBatchSize(),
                    config.getBatch().getRetryMaxBatchSize(),
                    config.getRetry().getMaxAttempts());
            this.lingerMs = config.getBatch().getLingerMs();
            this.maxConcurrentBatches = config.getAdmission().getMaxConcurrentBatches();
            this.rateLimitingEnabled = config.getAdmission().isRateLimitingEnabled();
            this.startingOpsPerSecond = config.getAdmission().getStartingOpsPerSecond();
            this.maxOpsPerSecond = config.getAdmission().getMaxOpsPerSecond();
            this.rampMultiplier = config.getAdmission().getRampMultiplier();
            this.rampWindowMs = config.getAdmission().getRampWindowMs();
            this.requestTimeoutMs = config.getTransport().getRequestTimeoutMs();
            return this;
        }

        public CoordinatorPipeline build() {
            if (targetResource == null || targetResource.isBlank()) {
                throw new IllegalStateException("Target resource is required");
            }
            if (transport == null) {
                throw new IllegalStateException("BatchTransport is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new CoordinatorPipeline(this);
        }
    }
}
