package com.rally.leaguesync.dto;

public record StatRow(int rowNumber,
                      String payload,
                      Long leagueId,
                      Long seriesId,
                      String series,
                      String team,
                      Long teamId,
                      Integer points,
                      Integer matchesWon,
                      Integer matchesLost,
                      Integer matchesTied,
                      Integer linesWon,
                      Integer linesLost,
                      Integer setsWon,
                      Integer setsLost,
                      Integer gamesWon,
                      Integer gamesLost) implements SourceRow {

    public StatRow withSeriesId(Long newSeriesId) {
        return new StatRow(rowNumber, payload, leagueId, newSeriesId, series, team, teamId, points,
                matchesWon, matchesLost, matchesTied, linesWon, linesLost, setsWon, setsLost, gamesWon, gamesLost);
    }
}
