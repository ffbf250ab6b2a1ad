package com.rally.leaguesync.dto;

import java.time.LocalDate;

public record ScheduleRow(int rowNumber,
                          String payload,
                          Long leagueId,
                          LocalDate matchDate,
                          String matchTime,
                          String homeTeam,
                          String awayTeam,
                          Long homeTeamId,
                          Long awayTeamId,
                          String location) implements SourceRow {
}
