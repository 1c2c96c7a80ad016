/**
 * Persistent-session worker pool running generation jobs through browser sessions.
 *
 * <h2>Architecture</h2>
 * <pre>
 * SessionManager.submit()
 *        |
 *        v
 *    JobQueue ----> worker local queue (least loaded)
 *        |                  or
 *        +-------> global queue (no worker can take work)
 *                           |
 *   Scheduler tick: drain global queue, grow pool, dispatch, clean up idle workers
 *                           |
 *                           v
 *   JobExecutor on a worker thread: prompt, submit, export, await artifact, upload, record
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.sessionpool.SessionManagerFactory} - Wires everything from configuration</li>
 *   <li>{@link fr.lapetina.sessionpool.api.SessionManager} - Caller-facing API</li>
 *   <li>{@link fr.lapetina.sessionpool.pool.SessionPool} - Worker registry</li>
 *   <li>{@link fr.lapetina.sessionpool.execution.JobExecutor} - Single job flow</li>
 * </ul>
 */
package fr.lapetina.sessionpool;
