package com.rally.leaguesync.model;

import jakarta.persistence.*;

@Entity
@Table(name = "leagues", uniqueConstraints = {
        @UniqueConstraint(name = "uk_leagues_key", columnNames = {"league_key"})
})
public class League {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "league_key", nullable = false, length = 64)
    private String leagueKey;

    @Column(name = "league_name", nullable = false)
    private String leagueName;

    public League() {}

    public League(String leagueKey, String leagueName) {
        this.leagueKey = leagueKey;
        this.leagueName = leagueName;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getLeagueKey() { return leagueKey; }
    public void setLeagueKey(String leagueKey) { this.leagueKey = leagueKey; }
    public String getLeagueName() { return leagueName; }
    public void setLeagueName(String leagueName) { this.leagueName = leagueName; }
}
