package com.rally.leaguesync.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "teams", uniqueConstraints = {
        @UniqueConstraint(name = "uk_teams_name_league", columnNames = {"team_name", "league_id"})
})
public class Team {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "team_name", nullable = false)
    private String teamName;

    @Column(name = "display_name")
    private String displayName;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "club_id", nullable = false, foreignKey = @ForeignKey(name = "fk_teams_club"))
    private Club club;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "series_id", nullable = false, foreignKey = @ForeignKey(name = "fk_teams_series"))
    private Series series;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "league_id", nullable = false, foreignKey = @ForeignKey(name = "fk_teams_league"))
    private League league;

    @Column(name = "created_at")
    private Instant createdAt;

    public Team() {}

    public Team(String teamName, Club club, Series series, League league) {
        this.teamName = teamName;
        this.displayName = teamName;
        this.club = club;
        this.series = series;
        this.league = league;
    }

    @PrePersist
    private void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getTeamName() { return teamName; }
    public void setTeamName(String teamName) { this.teamName = teamName; }
    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }
    public Club getClub() { return club; }
    public void setClub(Club club) { this.club = club; }
    public Series getSeries() { return series; }
    public void setSeries(Series series) { this.series = series; }
    public League getLeague() { return league; }
    public void setLeague(League league) { this.league = league; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
