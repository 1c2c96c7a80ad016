/**
 * Retry with a recovery action between attempts.
 */
package fr.lapetina.sessionpool.infrastructure.retry;
