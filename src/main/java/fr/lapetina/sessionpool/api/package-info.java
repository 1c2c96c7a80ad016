/**
 * Caller-facing API of the session pool.
 *
 * {@link fr.lapetina.sessionpool.api.SessionManager} exposes submission (queued or direct),
 * request and pool status, cancellation and shutdown. Request and response shapes live in
 * {@code api.dto} and serialize to snake_case JSON with Jackson.
 */
package fr.lapetina.sessionpool.api;
