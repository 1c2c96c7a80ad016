/**
 * Session authentication: the identity flow and the cached "still authenticated" probe.
 */
package fr.lapetina.sessionpool.infrastructure.auth;
