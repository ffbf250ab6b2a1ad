package com.rally.leaguesync.model;

import jakarta.persistence.*;

@Entity
@Table(name = "series_leagues", uniqueConstraints = {
        @UniqueConstraint(name = "uk_series_leagues", columnNames = {"series_id", "league_id"})
})
public class SeriesLeague {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "series_id", nullable = false, foreignKey = @ForeignKey(name = "fk_series_leagues_series"))
    private Series series;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "league_id", nullable = false, foreignKey = @ForeignKey(name = "fk_series_leagues_league"))
    private League league;

    public SeriesLeague() {}

    public SeriesLeague(Series series, League league) {
        this.series = series;
        this.league = league;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Series getSeries() { return series; }
    public void setSeries(Series series) { this.series = series; }
    public League getLeague() { return league; }
    public void setLeague(League league) { this.league = league; }
}
