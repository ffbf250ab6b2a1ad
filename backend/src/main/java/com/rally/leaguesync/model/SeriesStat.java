package com.rally.leaguesync.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "series_stats", indexes = {
        @Index(name = "idx_series_stats_natural", columnList = "league_id, team_id")
})
public class SeriesStat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "league_id", nullable = false)
    private Long leagueId;

    @Column(name = "series_id")
    private Long seriesId;

    @Column(name = "series")
    private String series;

    @Column(name = "team", nullable = false)
    private String team;

    @Column(name = "team_id")
    private Long teamId;

    private Integer points;

    @Column(name = "matches_won") private Integer matchesWon;
    @Column(name = "matches_lost") private Integer matchesLost;
    @Column(name = "matches_tied") private Integer matchesTied;
    @Column(name = "lines_won") private Integer linesWon;
    @Column(name = "lines_lost") private Integer linesLost;
    @Column(name = "sets_won") private Integer setsWon;
    @Column(name = "sets_lost") private Integer setsLost;
    @Column(name = "games_won") private Integer gamesWon;
    @Column(name = "games_lost") private Integer gamesLost;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    private void touch() {
        updatedAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getLeagueId() { return leagueId; }
    public void setLeagueId(Long leagueId) { this.leagueId = leagueId; }
    public Long getSeriesId() { return seriesId; }
    public void setSeriesId(Long seriesId) { this.seriesId = seriesId; }
    public String getSeries() { return series; }
    public void setSeries(String series) { this.series = series; }
    public String getTeam() { return team; }
    public void setTeam(String team) { this.team = team; }
    public Long getTeamId() { return teamId; }
    public void setTeamId(Long teamId) { this.teamId = teamId; }
    public Integer getPoints() { return points; }
    public void setPoints(Integer points) { this.points = points; }
    public Integer getMatchesWon() { return matchesWon; }
    public void setMatchesWon(Integer matchesWon) { this.matchesWon = matchesWon; }
    public Integer getMatchesLost() { return matchesLost; }
    public void setMatchesLost(Integer matchesLost) { this.matchesLost = matchesLost; }
    public Integer getMatchesTied() { return matchesTied; }
    public void setMatchesTied(Integer matchesTied) { this.matchesTied = matchesTied; }
    public Integer getLinesWon() { return linesWon; }
    public void setLinesWon(Integer linesWon) { this.linesWon = linesWon; }
    public Integer getLinesLost() { return linesLost; }
    public void setLinesLost(Integer linesLost) { this.linesLost = linesLost; }
    public Integer getSetsWon() { return setsWon; }
    public void setSetsWon(Integer setsWon) { this.setsWon = setsWon; }
    public Integer getSetsLost() { return setsLost; }
    public void setSetsLost(Integer setsLost) { this.setsLost = setsLost; }
    public Integer getGamesWon() { return gamesWon; }
    public void setGamesWon(Integer gamesWon) { this.gamesWon = gamesWon; }
    public Integer getGamesLost() { return gamesLost; }
    public void setGamesLost(Integer gamesLost) { this.gamesLost = gamesLost; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
