package com.dcruver.cultivation.session;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only, ordered record of what happened in one session.
 * Lives and dies with its session; a restart starts a new log.
 */
public class EventLog {

    private final Clock clock;
    private final List<LogEntry> entries = new ArrayList<>();
    private long lastSequence;

    public EventLog(Clock clock) {
        this.clock = clock;
    }

    public LogEntry append(EventKind kind, String message) {
        return append(kind, message, Map.of());
    }

    public LogEntry append(EventKind kind, String message, Map<String, Object> payload) {
        LogEntry entry = LogEntry.builder()
            .sequence(++lastSequence)
            .timestamp(clock.instant())
            .kind(kind)
            .message(message)
            .payload(Map.copyOf(payload))
            .build();
        entries.add(entry);
        return entry;
    }

    public List<LogEntry> getEntries() {
        return List.copyOf(entries);
    }

    /**
     * The last {@code count} entries, oldest first.
     */
    public List<LogEntry> recent(int count) {
        if (count <= 0) {
            return List.of();
        }
        int from = Math.max(0, entries.size() - count);
        return List.copyOf(entries.subList(from, entries.size()));
    }

    /**
     * Entries appended after the given sequence number.
     */
    public List<LogEntry> since(long sequence) {
        return entries.stream()
            .filter(e -> e.getSequence() > sequence)
            .toList();
    }

    public long getLastSequence() {
        return lastSequence;
    }

    public int size() {
        return entries.size();
    }
}
