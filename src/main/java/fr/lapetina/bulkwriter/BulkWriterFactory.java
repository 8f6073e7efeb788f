package fr.lapetina.bulkwriter;

import fr.lapetina.bulkwriter.disruptor.CoordinatorPipeline;
import fr.lapetina.bulkwriter.infrastructure.config.BulkWriterConfig;
import fr.lapetina.bulkwriter.infrastructure.config.ConfigLoader;
import fr.lapetina.bulkwriter.infrastructure.encoding.JsonWriteEncoder;
import fr.lapetina.bulkwriter.infrastructure.encoding.WriteEncoder;
import fr.lapetina.bulkwriter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.bulkwriter.infrastructure.transport.BatchTransport;
import fr.lapetina.bulkwriter.infrastructure.transport.CircuitBreakingTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Factory for creating fully-wired bulk writers from configuration.
 * This is the primary entry point for obtaining a {@link BulkWriter}.
 *
 * <p>Writers created by one factory share its metrics registry, encoder and transport.
 *
 * <p>Usage:
 * <pre>{@code
 * try (BulkWriterFactory factory = BulkWriterFactory.create("bulk-writer.yaml", transport)) {
 *     BulkWriter writer = factory.newBulkWriter("projects/p/databases/(default)");
 *     // use writer...
 * }
 * }</pre>
 */
public class BulkWriterFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BulkWriterFactory.class);

    private final BulkWriterConfig config;
    private final MetricsRegistry metricsRegistry;
    private final WriteEncoder encoder;
    private final BatchTransport transport;
    private final List<BulkWriter> writers = new CopyOnWriteArrayList<>();

    protected BulkWriterFactory(BulkWriterConfig config, BatchTransport transport, WriteEncoder encoder) {
        if (transport == null) {
            throw new IllegalArgumentException("BatchTransport is required");
        }
        this.config = config.validate();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix(), config.getMetrics().isEnabled());

        this.encoder = encoder != null ? encoder : new JsonWriteEncoder();

        BulkWriterConfig.TransportConfig transportConfig = config.getTransport();
        if (transportConfig.isCircuitBreakerEnabled()) {
            this.transport = new CircuitBreakingTransport(
                    transport,
                    transportConfig.getCircuitBreakerFailureThreshold(),
                    Duration.ofMillis(transportConfig.getCircuitBreakerRecoveryMs()));
            log.info("Circuit breaker enabled: failureThreshold={}, recoveryMs={}",
                    transportConfig.getCircuitBreakerFailureThreshold(), transportConfig.getCircuitBreakerRecoveryMs());
        } else {
            this.transport = transport;
        }

        log.info("BulkWriterFactory initialized: maxBatchSize={}, maxAttempts={}, maxConcurrentBatches={}, rateLimiting={}",
                config.getBatch().getMaxBatchSize(), config.getRetry().getMaxAttempts(),
                config.getAdmission().getMaxConcurrentBatches(), config.getAdmission().isRateLimitingEnabled());
    }

    /**
     * Creates a factory from the specified configuration file (file system, then classpath).
     */
    public static BulkWriterFactory create(String configPath, BatchTransport transport) {
        log.info("Initializing BulkWriterFactory from config: {}", configPath);
        return new BulkWriterFactory(new ConfigLoader(configPath).load(), transport, null);
    }

    /**
     * Creates a factory from an already built configuration.
     */
    public static BulkWriterFactory create(BulkWriterConfig config, BatchTransport transport) {
        return new BulkWriterFactory(config, transport, null);
    }

    /**
     * Creates a factory with the default configuration.
     */
    public static BulkWriterFactory create(BatchTransport transport) {
        return create(ConfigLoader.createDefault(), transport);
    }

    /**
     * Builds and starts a writer for one target resource.
     */
    public BulkWriter newBulkWriter(String targetResource) {
        CoordinatorPipeline pipeline = CoordinatorPipeline.builder()
                .fromConfig(config)
                .targetResource(targetResource)
                .transport(transport)
                .metricsRegistry(metricsRegistry)
                .build();
        pipeline.start();

        BulkWriter writer = new BulkWriter(pipeline, encoder, metricsRegistry, writers::remove);
        writers.add(writer);
        log.info("BulkWriter created: target={}", targetResource);
        return writer;
    }

    public BulkWriterConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public BatchTransport getTransport() {
        return transport;
    }

    /**
     * Writers created by this factory and not closed yet.
     */
    public List<BulkWriter> getOpenWriters() {
        return List.copyOf(writers);
    }

    @Override
    public void close() {
        log.info("Shutting down BulkWriterFactory...");

        for (BulkWriter writer : writers) {
            try {
                writer.close();
            } catch (Exception e) {
                log.warn("Error closing writer: target={}", writer.getTargetResource(), e);
            }
        }
        writers.clear();

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("BulkWriterFactory shut down");
    }
}
