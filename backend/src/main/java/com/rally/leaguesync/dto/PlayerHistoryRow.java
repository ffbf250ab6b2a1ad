package com.rally.leaguesync.dto;

import java.time.LocalDate;
import java.util.List;

/** Career totals and dated rating points of one player, keyed by the player's external id. */
public record PlayerHistoryRow(int rowNumber,
                               String payload,
                               Long leagueId,
                               String externalId,
                               Integer careerWins,
                               Integer careerLosses,
                               List<RatingPoint> ratings) implements SourceRow {

    public record RatingPoint(LocalDate date, Double endPti, String series) {}

    public boolean hasCareerTotals() { return careerWins != null || careerLosses != null; }
}
