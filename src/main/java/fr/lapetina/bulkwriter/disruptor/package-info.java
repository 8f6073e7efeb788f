/**
 * LMAX Disruptor event loop that serializes every state change of a bulk writer.
 *
 * <p>Callers and transport threads publish commands on a multi-producer ring buffer; a single
 * consumer thread applies them. That thread owns the backlog, the in-flight counter and the
 * open flag, so no lock is needed and none is held across a transport call.
 *
 * <h2>Commands</h2>
 * <pre>
 * ENQUEUE | BATCH_COMPLETED | FLUSH | CLOSE | WAKE  →  CoordinatorCommandHandler  →  Dispatcher
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.bulkwriter.disruptor.CoordinatorPipeline} - Ring buffer, threads and lifecycle</li>
 *   <li>{@link fr.lapetina.bulkwriter.disruptor.handlers.CoordinatorCommandHandler} - The single consumer</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.bulkwriter.disruptor;
