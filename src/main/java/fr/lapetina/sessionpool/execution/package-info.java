/**
 * Execution of a single generation job on a worker's session.
 *
 * <h2>Job Flow</h2>
 * <ol>
 *   <li>Verify the session, re-authenticating if needed</li>
 *   <li>Enter the prompt and submit it</li>
 *   <li>Wait for the working indicator, reloading if the session looks stuck</li>
 *   <li>Export the artifact and wait for its delivery</li>
 *   <li>Save, upload and catalog the artifact</li>
 * </ol>
 *
 * The completion callback runs whatever the outcome.
 */
package fr.lapetina.sessionpool.execution;
