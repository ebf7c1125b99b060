package com.dcruver.cultivation.session;

/**
 * Kinds of entries in a session's event log.
 */
public enum EventKind {
    SESSION_STARTED,
    ACTION_APPLIED,
    ACTION_REJECTED,
    BREAKTHROUGH,
    ACHIEVEMENT,
    GAME_OVER,
    ASCENDED
}
