package com.rally.leaguesync.model;

import jakarta.persistence.*;

@Entity
@Table(name = "orphan_mapping", uniqueConstraints = {
        @UniqueConstraint(name = "uk_orphan_mapping_orphan", columnNames = {"orphan_league_id"})
})
public class OrphanMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "orphan_league_id", nullable = false)
    private Long orphanLeagueId;

    @Column(name = "current_league_id", nullable = false)
    private Long currentLeagueId;

    @Column(nullable = false)
    private Integer version = 1;

    private String note;

    public OrphanMapping() {}

    public OrphanMapping(Long orphanLeagueId, Long currentLeagueId, Integer version, String note) {
        this.orphanLeagueId = orphanLeagueId;
        this.currentLeagueId = currentLeagueId;
        this.version = version;
        this.note = note;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getOrphanLeagueId() { return orphanLeagueId; }
    public void setOrphanLeagueId(Long orphanLeagueId) { this.orphanLeagueId = orphanLeagueId; }
    public Long getCurrentLeagueId() { return currentLeagueId; }
    public void setCurrentLeagueId(Long currentLeagueId) { this.currentLeagueId = currentLeagueId; }
    public Integer getVersion() { return version; }
    public void setVersion(Integer version) { this.version = version; }
    public String getNote() { return note; }
    public void setNote(String note) { this.note = note; }
}
