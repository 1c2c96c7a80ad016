/**
 * Rate shaping of interactions with the target surface.
 */
package fr.lapetina.sessionpool.infrastructure.pacing;
