/**
 * Value types exchanged between callers, the coordinator, the encoder and the transport.
 *
 * <p>All types in this package are immutable records or enums and safe to share between threads.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.bulkwriter.domain.model.DocumentRef} - Slash-separated document path</li>
 *   <li>{@link fr.lapetina.bulkwriter.domain.model.WritePayload} - Encoded write, opaque to the coordinator</li>
 *   <li>{@link fr.lapetina.bulkwriter.domain.model.BatchWriteResponse} - Positionally aligned per-item outcomes</li>
 *   <li>{@link fr.lapetina.bulkwriter.domain.model.WriteResult} - Result delivered to the caller on success</li>
 * </ul>
 */
package fr.lapetina.bulkwriter.domain.model;
