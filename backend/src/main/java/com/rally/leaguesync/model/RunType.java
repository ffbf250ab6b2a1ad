package com.rally.leaguesync.model;

import java.util.Locale;

public enum RunType {
    PLAYERS, SCHEDULES, MATCHES, STATS, FULL, VALIDATE;

    public boolean includesPlayers() { return this == PLAYERS || this == FULL; }
    public boolean includesSchedule() { return this == SCHEDULES || this == FULL; }
    public boolean includesMatches() { return this == MATCHES || this == FULL; }
    public boolean includesStats() { return this == STATS || this == FULL; }

    /** Runs that can create or repoint series-bearing rows need consolidation first. */
    public boolean needsConsolidation() { return includesPlayers() || includesStats(); }

    public static RunType parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("Run type is required");
        try {
            return RunType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown run type: " + raw);
        }
    }
}
