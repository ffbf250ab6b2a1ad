package com.rally.leaguesync.dto;

import java.time.LocalDate;

public record MatchRow(int rowNumber,
                       String payload,
                       Long leagueId,
                       String matchKey,
                       LocalDate matchDate,
                       String homeTeam,
                       String awayTeam,
                       Long homeTeamId,
                       Long awayTeamId,
                       String line,
                       String homePlayer1Id,
                       String homePlayer2Id,
                       String awayPlayer1Id,
                       String awayPlayer2Id,
                       String scores,
                       String winner) implements SourceRow {
}
