/**
 * Hand-off of generated artifacts to storage and to the catalog.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.sessionpool.infrastructure.storage.Uploader} - Durable storage, with a file-system default</li>
 *   <li>{@link fr.lapetina.sessionpool.infrastructure.storage.PersistenceRecorder} - Best-effort catalog entry</li>
 *   <li>{@link fr.lapetina.sessionpool.infrastructure.storage.DestinationKeys} - Storage key layout</li>
 * </ul>
 */
package fr.lapetina.sessionpool.infrastructure.storage;
