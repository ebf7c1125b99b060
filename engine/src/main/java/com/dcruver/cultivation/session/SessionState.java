package com.dcruver.cultivation.session;

import com.dcruver.cultivation.domain.Achievement;
import com.dcruver.cultivation.domain.DifficultySettings;
import com.dcruver.cultivation.domain.SessionPhase;
import com.dcruver.cultivation.domain.character.CharacterAggregate;
import com.dcruver.cultivation.domain.character.CharacterStatus;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * One game session. Exclusively owns its character and event log.
 *
 * Only {@link SessionManager} reaches the mutable parts; callers get copies.
 */
@Getter
public class SessionState {

    private final String sessionId;
    private final DifficultySettings difficulty;
    private final Instant startedAt;

    @Getter(AccessLevel.NONE)
    private final CharacterAggregate character;
    @Getter(AccessLevel.NONE)
    private final EventLog eventLog;

    @Getter(AccessLevel.NONE)
    private final EnumSet<Achievement> achievements = EnumSet.noneOf(Achievement.class);

    private SessionPhase phase = SessionPhase.ACTIVE;

    SessionState(String sessionId, DifficultySettings difficulty, Instant startedAt,
                 CharacterAggregate character, EventLog eventLog) {
        this.sessionId = sessionId;
        this.difficulty = difficulty;
        this.startedAt = startedAt;
        this.character = character;
        this.eventLog = eventLog;
    }

    CharacterAggregate character() {
        return character;
    }

    EventLog eventLog() {
        return eventLog;
    }

    /**
     * Move from ACTIVE into a terminal phase. Terminal phases never change again.
     */
    void transitionTo(SessionPhase next) {
        if (phase.isTerminal()) {
            throw new IllegalStateException("Session " + sessionId + " is already " + phase);
        }
        if (!next.isTerminal()) {
            throw new IllegalStateException("Cannot transition back to " + next);
        }
        phase = next;
    }

    /**
     * @return false if it was already unlocked
     */
    boolean unlock(Achievement achievement) {
        return achievements.add(achievement);
    }

    public Set<Achievement> getAchievements() {
        return Collections.unmodifiableSet(EnumSet.copyOf(achievements));
    }

    public boolean isTerminal() {
        return phase.isTerminal();
    }

    public CharacterStatus characterStatus() {
        return character.snapshot();
    }

    public List<LogEntry> logEntries() {
        return eventLog.getEntries();
    }
}
