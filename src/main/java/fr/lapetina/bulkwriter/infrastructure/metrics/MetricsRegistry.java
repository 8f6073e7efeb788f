package fr.lapetina.bulkwriter.infrastructure.metrics;

import fr.lapetina.bulkwriter.domain.model.WriteErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Write counters by outcome and error type
 * - Batch counters, size distribution and latency per target resource
 * - Backlog, in-flight and pacing gauges
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> batchSizes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> batchTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Meter>> writerGauges = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix, boolean enabled) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (!enabled) {
            // Meters still accept calls but record nothing
            registry.config().meterFilter(MeterFilter.deny());
        }
        log.info("MetricsRegistry initialized: prefix={}, enabled={}", prefix, enabled);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, true);
    }

    public MetricsRegistry() {
        this("bulk_writer");
    }

    public void incrementEnqueued(String target) {
        counter("_writes_enqueued_total", "Writes accepted for batching", target, "outcome", "enqueued")
                .increment();
    }

    public void incrementSucceeded(String target) {
        counter("_writes_completed_total", "Writes resolved", target, "outcome", "success")
                .increment();
    }

    public void incrementFailed(String target, WriteErrorType errorType) {
        counter("_writes_completed_total", "Writes resolved", target, "outcome", "failure")
                .increment();
        counter("_errors_total", "Write errors by type", target, "type", errorType.name())
                .increment();
    }

    public void incrementRetried(String target) {
        counter("_writes_retried_total", "Writes requeued after a non-OK status", target, "outcome", "retried")
                .increment();
    }

    /**
     * Records one finished batch call.
     */
    public void recordBatch(String target, int size, Duration latency, boolean transportFailed) {
        String result = transportFailed ? "transport_error" : "completed";
        counter("_batches_total", "Batch calls", target, "result", result).increment();

        batchSizes.computeIfAbsent(target, k ->
                DistributionSummary.builder(prefix + "_batch_size")
                        .description("Writes per batch call")
                        .tag("target", target)
                        .register(registry)
        ).record(size);

        batchTimers.computeIfAbsent(target, k ->
                Timer.builder(prefix + "_batch_latency")
                        .description("Batch call latency")
                        .tag("target", target)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Registers the state gauges of one writer.
     */
    public void registerWriterGauges(
            String target,
            Supplier<Number> backlogSize,
            Supplier<Number> inFlightBatches,
            Supplier<Number> opsPerSecondLimit
    ) {
        List<Meter> gauges = List.of(
                Gauge.builder(prefix + "_backlog_size", backlogSize, s -> s.get().doubleValue())
                        .description("Writes waiting to be batched")
                        .tag("target", target)
                        .strongReference(true)
                        .register(registry),
                Gauge.builder(prefix + "_inflight_batches", inFlightBatches, s -> s.get().doubleValue())
                        .description("Batch calls in flight")
                        .tag("target", target)
                        .strongReference(true)
                        .register(registry),
                Gauge.builder(prefix + "_ops_per_second_limit", opsPerSecondLimit, s -> s.get().doubleValue())
                        .description("Current pacing ceiling (0 = disabled)")
                        .tag("target", target)
                        .strongReference(true)
                        .register(registry));
        writerGauges.put(target, gauges);
    }

    /**
     * Unregisters the state gauges of a closed writer.
     */
    public void removeWriterGauges(String target) {
        List<Meter> gauges = writerGauges.remove(target);
        if (gauges != null) {
            gauges.forEach(registry::remove);
        }
    }

    /**
     * Returns the count of a counter, or 0 if it was never incremented. Mostly for tests.
     */
    public double count(String suffix, String target, String tagKey, String tagValue) {
        Counter counter = counters.get(suffix + ":" + target + ":" + tagKey + ":" + tagValue);
        return counter != null ? counter.count() : 0;
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    private Counter counter(String suffix, String description, String target, String tagKey, String tagValue) {
        String key = suffix + ":" + target + ":" + tagKey + ":" + tagValue;
        return counters.computeIfAbsent(key, k ->
                Counter.builder(prefix + suffix)
                        .description(description)
                        .tag("target", target)
                        .tag(tagKey, tagValue)
                        .register(registry)
        );
    }

    @Override
    public void close() {
        registry.close();
    }
}
