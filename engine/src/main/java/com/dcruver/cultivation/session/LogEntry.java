package com.dcruver.cultivation.session;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One immutable event log line. {@code sequence} gives the causal order within a session.
 */
@Value
@Builder
public class LogEntry {
    long sequence;
    Instant timestamp;
    EventKind kind;
    String message;
    @Builder.Default
    Map<String, Object> payload = Map.of();

    @Override
    public String toString() {
        return String.format("#%d [%s] %s", sequence, kind, message);
    }
}
