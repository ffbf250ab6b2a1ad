package com.rally.leaguesync.dto;

public record PlayerRow(int rowNumber,
                        String payload,
                        Long leagueId,
                        String externalId,
                        String firstName,
                        String lastName,
                        Long clubId,
                        Long seriesId,
                        Long teamId,
                        Double pti,
                        Integer wins,
                        Integer losses,
                        Integer careerWins,
                        Integer careerLosses,
                        Double careerWinPct) implements SourceRow {

    public PlayerRow withSeriesId(Long newSeriesId) {
        return new PlayerRow(rowNumber, payload, leagueId, externalId, firstName, lastName, clubId, newSeriesId,
                teamId, pti, wins, losses, careerWins, careerLosses, careerWinPct);
    }
}
