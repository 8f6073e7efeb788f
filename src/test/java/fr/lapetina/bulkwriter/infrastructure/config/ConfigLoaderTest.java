package fr.lapetina.bulkwriter.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @Test
    @DisplayName("should load configuration from the classpath")
    void shouldLoadFromClasspath() {
        BulkWriterConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getBatch().getMaxBatchSize()).isEqualTo(5);
        assertThat(config.getBatch().getRetryMaxBatchSize()).isEqualTo(3);
        assertThat(config.getBatch().getLingerMs()).isEqualTo(1000);
        assertThat(config.getRetry().getMaxAttempts()).isEqualTo(3);
        assertThat(config.getAdmission().isRateLimitingEnabled()).isFalse();
        assertThat(config.getDisruptor().getRingBufferSize()).isEqualTo(256);
        assertThat(config.getMetrics().getPrefix()).isEqualTo("bulk_writer_test");
    }

    @Test
    @DisplayName("should prefer a file on disk")
    void shouldLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("bulk-writer.yaml");
        Files.writeString(file, "batch:\n  maxBatchSize: 50\n  retryMaxBatchSize: 25\n");

        BulkWriterConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getBatch().getMaxBatchSize()).isEqualTo(50);
        assertThat(config.getBatch().getRetryMaxBatchSize()).isEqualTo(25);
    }

    @Test
    @DisplayName("should keep defaults for absent keys")
    void shouldApplyDefaults() {
        BulkWriterConfig config = new ConfigLoader("unused").loadFromStream(yaml("retry:\n  maxAttempts: 4\n"));

        assertThat(config.getRetry().getMaxAttempts()).isEqualTo(4);
        assertThat(config.getBatch().getMaxBatchSize()).isEqualTo(20);
        assertThat(config.getBatch().getRetryMaxBatchSize()).isEqualTo(10);
        assertThat(config.getBatch().getLingerMs()).isZero();
        assertThat(config.getAdmission().getMaxConcurrentBatches()).isEqualTo(500);
        assertThat(config.getAdmission().getStartingOpsPerSecond()).isEqualTo(500);
        assertThat(config.getAdmission().getMaxOpsPerSecond()).isEqualTo(10000);
        assertThat(config.getAdmission().getRampMultiplier()).isEqualTo(1.5);
        assertThat(config.getAdmission().getRampWindowMs()).isEqualTo(300000);
        assertThat(config.getDisruptor().getWaitStrategy()).isEqualTo("blocking");
        assertThat(config.getTransport().getRequestTimeoutMs()).isZero();
        assertThat(config.getTransport().isCircuitBreakerEnabled()).isFalse();
    }

    @Test
    @DisplayName("should treat an empty document as all defaults")
    void shouldAcceptEmptyDocument() {
        BulkWriterConfig config = new ConfigLoader("unused").loadFromStream(yaml(""));

        assertThat(config.getBatch().getMaxBatchSize()).isEqualTo(20);
    }

    @Test
    @DisplayName("should reject invalid values")
    void shouldRejectInvalidValues() {
        ConfigLoader loader = new ConfigLoader("unused");

        assertThatThrownBy(() -> loader.loadFromStream(yaml("disruptor:\n  ringBufferSize: 1000\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("ringBufferSize");
        assertThatThrownBy(() -> loader.loadFromStream(yaml("batch:\n  maxBatchSize: 5\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("retryMaxBatchSize");
        assertThatThrownBy(() -> loader.loadFromStream(yaml("retry:\n  maxAttempts: 0\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class);
        assertThatThrownBy(() -> loader.loadFromStream(yaml("batch:\n  lingerMs: -1\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("lingerMs");
    }

    @Test
    @DisplayName("should reject unknown keys")
    void shouldRejectUnknownKeys() {
        assertThatThrownBy(() -> new ConfigLoader("unused").loadFromStream(yaml("batch:\n  maxBatchSzie: 5\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class);
    }

    @Test
    @DisplayName("should fail when the configuration cannot be found")
    void shouldFailWhenMissing() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
