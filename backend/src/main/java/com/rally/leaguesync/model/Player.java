package com.rally.leaguesync.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "players", uniqueConstraints = {
        @UniqueConstraint(name = "uk_players_external_league", columnNames = {"external_id", "league_id"})
})
public class Player {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_id", nullable = false, length = 64)
    private String externalId;

    @Column(name = "first_name", nullable = false)
    private String firstName;

    @Column(name = "last_name", nullable = false)
    private String lastName;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "league_id", nullable = false, foreignKey = @ForeignKey(name = "fk_players_league"))
    private League league;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "club_id", nullable = false, foreignKey = @ForeignKey(name = "fk_players_club"))
    private Club club;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "series_id", nullable = false, foreignKey = @ForeignKey(name = "fk_players_series"))
    private Series series;

    // Nullable: scraped players are not always tied to a team
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id", foreignKey = @ForeignKey(name = "fk_players_team"))
    private Team team;

    @Column(name = "pti")
    private Double pti;

    @Column(name = "wins")
    private Integer wins;

    @Column(name = "losses")
    private Integer losses;

    @Column(name = "career_wins")
    private Integer careerWins;

    @Column(name = "career_losses")
    private Integer careerLosses;

    @Column(name = "career_win_pct")
    private Double careerWinPct;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    private void touch() {
        updatedAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }
    public String getFirstName() { return firstName; }
    public void setFirstName(String firstName) { this.firstName = firstName; }
    public String getLastName() { return lastName; }
    public void setLastName(String lastName) { this.lastName = lastName; }
    public League getLeague() { return league; }
    public void setLeague(League league) { this.league = league; }
    public Club getClub() { return club; }
    public void setClub(Club club) { this.club = club; }
    public Series getSeries() { return series; }
    public void setSeries(Series series) { this.series = series; }
    public Team getTeam() { return team; }
    public void setTeam(Team team) { this.team = team; }
    public Double getPti() { return pti; }
    public void setPti(Double pti) { this.pti = pti; }
    public Integer getWins() { return wins; }
    public void setWins(Integer wins) { this.wins = wins; }
    public Integer getLosses() { return losses; }
    public void setLosses(Integer losses) { this.losses = losses; }
    public Integer getCareerWins() { return careerWins; }
    public void setCareerWins(Integer careerWins) { this.careerWins = careerWins; }
    public Integer getCareerLosses() { return careerLosses; }
    public void setCareerLosses(Integer careerLosses) { this.careerLosses = careerLosses; }
    public Double getCareerWinPct() { return careerWinPct; }
    public void setCareerWinPct(Double careerWinPct) { this.careerWinPct = careerWinPct; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
