/**
 * Micrometer metrics with Prometheus exposition.
 */
package fr.lapetina.sessionpool.infrastructure.metrics;
