package com.rally.leaguesync.service;

import com.rally.leaguesync.dto.MatchRow;
import com.rally.leaguesync.dto.PlayerHistoryRow;
import com.rally.leaguesync.dto.PlayerRow;
import com.rally.leaguesync.dto.ScheduleRow;
import com.rally.leaguesync.dto.StatRow;

import java.util.List;
import java.util.Map;

public record ResolvedRecords(List<PlayerRow> players,
                              List<ScheduleRow> schedule,
                              List<MatchRow> matches,
                              List<StatRow> stats,
                              List<PlayerHistoryRow> playerHistory) {

    /** Re-points series ids merged away by consolidation to their survivors. */
    public ResolvedRecords remapSeries(Map<Long, Long> survivorBySeriesId) {
        if (survivorBySeriesId.isEmpty()) return this;
        List<PlayerRow> p = players.stream()
                .map(r -> r.withSeriesId(survivorBySeriesId.getOrDefault(r.seriesId(), r.seriesId())))
                .toList();
        List<StatRow> s = stats.stream()
                .map(r -> r.withSeriesId(survivorBySeriesId.getOrDefault(r.seriesId(), r.seriesId())))
                .toList();
        return new ResolvedRecords(p, schedule, matches, s, playerHistory);
    }
}
