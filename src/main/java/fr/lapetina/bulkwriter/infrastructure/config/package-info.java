/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing into a bean tree; absent keys keep their
 * defaults and every loaded configuration is validated before use.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.bulkwriter.infrastructure.config.BulkWriterConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.bulkwriter.infrastructure.config.ConfigLoader} - YAML loading from file, classpath or stream</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code batch} - Batch size and retried-batch size caps</li>
 *   <li>{@code retry} - Attempts before a write is given up</li>
 *   <li>{@code admission} - In-flight batch bound and ramping ops/second pacing</li>
 *   <li>{@code disruptor} - Ring buffer and wait strategy settings</li>
 *   <li>{@code transport} - Request timeout and circuit breaker</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.bulkwriter.infrastructure.config.BulkWriterConfig
 * @see fr.lapetina.bulkwriter.infrastructure.config.ConfigLoader
 */
package fr.lapetina.bulkwriter.infrastructure.config;
