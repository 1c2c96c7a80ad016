/**
 * Worker selection strategies.
 *
 * <p>{@link fr.lapetina.sessionpool.domain.strategy.LeastLoadedStrategy} is the only
 * strategy in use; the interface is the seam for alternatives.
 */
package fr.lapetina.sessionpool.domain.strategy;
