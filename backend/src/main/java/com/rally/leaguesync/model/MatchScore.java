package com.rally.leaguesync.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "match_scores", indexes = {
        @Index(name = "idx_match_scores_natural", columnList = "league_id, match_key")
})
public class MatchScore {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "league_id", nullable = false)
    private Long leagueId;

    // Source match id, or a checksum of date/teams/line/players when the source has none
    @Column(name = "match_key", nullable = false, length = 128)
    private String matchKey;

    @Column(name = "match_date", nullable = false)
    private LocalDate matchDate;

    @Column(name = "home_team", nullable = false)
    private String homeTeam;

    @Column(name = "away_team", nullable = false)
    private String awayTeam;

    @Column(name = "home_team_id")
    private Long homeTeamId;

    @Column(name = "away_team_id")
    private Long awayTeamId;

    @Column(length = 64)
    private String line;

    @Column(name = "home_player_1_id", length = 64)
    private String homePlayer1Id;

    @Column(name = "home_player_2_id", length = 64)
    private String homePlayer2Id;

    @Column(name = "away_player_1_id", length = 64)
    private String awayPlayer1Id;

    @Column(name = "away_player_2_id", length = 64)
    private String awayPlayer2Id;

    @Column(nullable = false)
    private String scores;

    @Column(length = 16)
    private String winner;

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
    public String getMatchKey() { return matchKey; }
    public void setMatchKey(String matchKey) { this.matchKey = matchKey; }
    public LocalDate getMatchDate() { return matchDate; }
    public void setMatchDate(LocalDate matchDate) { this.matchDate = matchDate; }
    public String getHomeTeam() { return homeTeam; }
    public void setHomeTeam(String homeTeam) { this.homeTeam = homeTeam; }
    public String getAwayTeam() { return awayTeam; }
    public void setAwayTeam(String awayTeam) { this.awayTeam = awayTeam; }
    public Long getHomeTeamId() { return homeTeamId; }
    public void setHomeTeamId(Long homeTeamId) { this.homeTeamId = homeTeamId; }
    public Long getAwayTeamId() { return awayTeamId; }
    public void setAwayTeamId(Long awayTeamId) { this.awayTeamId = awayTeamId; }
    public String getLine() { return line; }
    public void setLine(String line) { this.line = line; }
    public String getHomePlayer1Id() { return homePlayer1Id; }
    public void setHomePlayer1Id(String homePlayer1Id) { this.homePlayer1Id = homePlayer1Id; }
    public String getHomePlayer2Id() { return homePlayer2Id; }
    public void setHomePlayer2Id(String homePlayer2Id) { this.homePlayer2Id = homePlayer2Id; }
    public String getAwayPlayer1Id() { return awayPlayer1Id; }
    public void setAwayPlayer1Id(String awayPlayer1Id) { this.awayPlayer1Id = awayPlayer1Id; }
    public String getAwayPlayer2Id() { return awayPlayer2Id; }
    public void setAwayPlayer2Id(String awayPlayer2Id) { this.awayPlayer2Id = awayPlayer2Id; }
    public String getScores() { return scores; }
    public void setScores(String scores) { this.scores = scores; }
    public String getWinner() { return winner; }
    public void setWinner(String winner) { this.winner = winner; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
