/**
 * Worker pool, request queues and the scheduling tick.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.sessionpool.pool.SessionPool} - Bounded worker registry and statistics</li>
 *   <li>{@link fr.lapetina.sessionpool.pool.JobQueue} - Request admission, index and cancellation</li>
 *   <li>{@link fr.lapetina.sessionpool.pool.GlobalQueue} - FIFO overflow queue used when no worker can take work</li>
 *   <li>{@link fr.lapetina.sessionpool.pool.Scheduler} - Periodic drain, dispatch, growth and cleanup</li>
 *   <li>{@link fr.lapetina.sessionpool.pool.GrowthPolicy} - Soft and hard worker caps</li>
 * </ul>
 *
 * <h2>Locking</h2>
 * Locks are always taken in the order pool, global queue, request. No lock is held while
 * a session driver is in use.
 */
package fr.lapetina.sessionpool.pool;
