/**
 * Domain model classes representing core concepts of the session pool.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.sessionpool.domain.model.GenerationRequest} - Submitted work and its status lifecycle</li>
 *   <li>{@link fr.lapetina.sessionpool.domain.model.GenerationResult} - Immutable outcome of a completed request</li>
 *   <li>{@link fr.lapetina.sessionpool.domain.model.WorkerSession} - One authenticated browser session with its local queue</li>
 *   <li>{@link fr.lapetina.sessionpool.domain.model.PoolSnapshot} - Read-only view of the pool for status reporting</li>
 *   <li>{@link fr.lapetina.sessionpool.domain.model.ErrorType} - Categorized failure reasons</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <ul>
 *   <li>{@code GenerationRequest} guards its lifecycle with its own monitor</li>
 *   <li>{@code WorkerSession} mutable state is only written under the pool lock</li>
 *   <li>Snapshots and results are immutable records</li>
 * </ul>
 */
package fr.lapetina.sessionpool.domain.model;
