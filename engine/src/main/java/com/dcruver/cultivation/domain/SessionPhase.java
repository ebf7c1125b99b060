package com.dcruver.cultivation.domain;

/**
 * Life-cycle of one game session.
 * Phases only move forward; GAME_OVER and ASCENDED are terminal.
 */
public enum SessionPhase {
    /**
     * The only phase in which actions are applied
     */
    ACTIVE,

    /**
     * Health reached zero
     */
    GAME_OVER,

    /**
     * The terminal stage was reached
     */
    ASCENDED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
