/**
 * Bulk Writer - batched write coordinator for remote document stores.
 *
 * <p>Writes submitted one by one are grouped into bounded batches, each sent as a single remote
 * call; per-item outcomes are routed back to the callers, rejected items are retried up to a
 * bound, and the number of concurrent batch calls is capped. All coordinator state lives on one
 * LMAX Disruptor consumer thread.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.bulkwriter.BulkWriterFactory} - Main entry point for creating writers
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.bulkwriter.BulkWriter} - Per-database facade: create, set, update,
 *       delete, flush, close</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (BulkWriterFactory factory = BulkWriterFactory.create("bulk-writer.yaml", transport)) {
 *     BulkWriter writer = factory.newBulkWriter("projects/p/databases/(default)");
 *
 *     CompletableFuture<WriteResult> future =
 *             writer.set(DocumentRef.of("users", "alice"), Map.of("name", "Alice"));
 *
 *     writer.flush();
 *     System.out.println(future.join().updateTime());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Batches of up to maxBatchSize writes, with an optional linger for partial ones</li>
 *   <li>Per-item retry with a bounded number of attempts</li>
 *   <li>In-flight batch cap and ramping ops/second pacing</li>
 *   <li>Optional circuit breaker around the transport</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 *   <li>Backpressure handling via ring buffer</li>
 * </ul>
 *
 * @see fr.lapetina.bulkwriter.BulkWriterFactory
 * @see fr.lapetina.bulkwriter.disruptor.CoordinatorPipeline
 */
package fr.lapetina.bulkwriter;
