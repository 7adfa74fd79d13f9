/**
 * LMAX Disruptor-based pool of selection workers.
 *
 * <p>Requests are published to a multi-producer ring buffer and consumed by a
 * {@code WorkerPool}: each event goes to exactly one
 * {@link fr.lapetina.hashlb.disruptor.handlers.WorkerSelectionHandler}, and each handler owns
 * the {@code WorkerSelector} of its thread.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.hashlb.disruptor.SelectionPipeline} - Ring buffer and worker pool</li>
 *   <li>{@link fr.lapetina.hashlb.disruptor.exception.BackpressureException} - Thrown when ring buffer is full</li>
 * </ul>
 *
 * @see com.lmax.disruptor.WorkerPool
 */
package fr.lapetina.hashlb.disruptor;
