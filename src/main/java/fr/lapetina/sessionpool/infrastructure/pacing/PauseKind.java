package fr.lapetina.sessionpool.infrastructure.pacing;

/**
 * Kind of interaction a pause follows.
 */
public enum PauseKind {
    CLICK,
    KEYSTROKE,
    NAVIGATION
}
