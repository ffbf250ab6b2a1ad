package com.rally.leaguesync.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

/** One dated rating (PTI) point of a player. */
@Entity
@Table(name = "player_history", indexes = {
        @Index(name = "idx_player_history_natural", columnList = "league_id, player_id, record_date")
})
public class PlayerHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    @Column(name = "league_id", nullable = false)
    private Long leagueId;

    @Column(name = "series")
    private String series;

    @Column(name = "record_date", nullable = false)
    private LocalDate recordDate;

    @Column(name = "end_pti")
    private Double endPti;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    private void touch() {
        updatedAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getPlayerId() { return playerId; }
    public void setPlayerId(Long playerId) { this.playerId = playerId; }
    public Long getLeagueId() { return leagueId; }
    public void setLeagueId(Long leagueId) { this.leagueId = leagueId; }
    public String getSeries() { return series; }
    public void setSeries(String series) { this.series = series; }
    public LocalDate getRecordDate() { return recordDate; }
    public void setRecordDate(LocalDate recordDate) { this.recordDate = recordDate; }
    public Double getEndPti() { return endPti; }
    public void setEndPti(Double endPti) { this.endPti = endPti; }
    public Instant getUpdatedAt() { return updatedAt; }
}
