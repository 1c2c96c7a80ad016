/**
 * Exceptions raised by the session pool.
 *
 * <p>All extend {@link fr.lapetina.sessionpool.domain.exception.SessionPoolException}
 * and carry the {@link fr.lapetina.sessionpool.domain.model.ErrorType} recorded on a failed request.
 */
package fr.lapetina.sessionpool.domain.exception;
