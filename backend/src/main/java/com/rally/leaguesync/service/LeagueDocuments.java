package com.rally.leaguesync.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The parsed input documents of one league-run. Documents not needed by the run type are empty. */
public record LeagueDocuments(List<SourceRecord> players,
                              List<SourceRecord> schedule,
                              List<SourceRecord> matches,
                              List<SourceRecord> stats,
                              List<SourceRecord> playerHistory) {

    public static LeagueDocuments empty() {
        return new LeagueDocuments(List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public Map<String, Integer> counts() {
        Map<String, Integer> m = new LinkedHashMap<>();
        m.put("players", players.size());
        m.put("schedule", schedule.size());
        m.put("matches", matches.size());
        m.put("stats", stats.size());
        m.put("playerHistory", playerHistory.size());
        return m;
    }
}
