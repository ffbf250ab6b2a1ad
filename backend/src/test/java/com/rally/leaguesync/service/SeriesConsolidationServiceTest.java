package com.rally.leaguesync.service;

import com.rally.leaguesync.TestData;
import com.rally.leaguesync.model.League;
import com.rally.leaguesync.repository.LeagueRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class SeriesConsolidationServiceTest {

    @Autowired private SeriesConsolidationService service;
    @Autowired private LeagueRepository leagueRepository;
    @Autowired private JdbcTemplate jdbc;

    private TestData data;
    private League league;
    private long clubId;

    @BeforeEach
    void setUp() {
        data = new TestData(jdbc);
        data.wipe();
        league = leagueRepository.findByLeagueKey("NSTF").orElseThrow();
        clubId = data.club("Glencoe");
    }

    private void populate(long seriesId, String prefix, int players, int teams) {
        for (int i = 0; i < teams; i++) data.team(league.getId(), prefix + " team " + i, clubId, seriesId);
        for (int i = 0; i < players; i++) data.player(league.getId(), prefix + "-p" + i, clubId, seriesId, null);
    }

    private int playersIn(long seriesId) {
        return data.count("select count(*) from players where series_id = ?", seriesId);
    }

    private int teamsIn(long seriesId) {
        return data.count("select count(*) from teams where series_id = ?", seriesId);
    }

    @Test
    void canonicallyNamedSeriesSurvivesAndKeepsEveryRow() {
        long legacy = data.series(league.getId(), "Series 3");
        long canonical = data.series(league.getId(), "S3");
        populate(legacy, "legacy", 4, 2);
        populate(canonical, "canon", 1, 1);
        jdbc.update("insert into series_stats (league_id, series_id, series, team) values (?, ?, ?, ?)",
                league.getId(), legacy, "Series 3", "legacy team 0");

        ConsolidationResult result = service.consolidate(league, false);

        assertThat(result.getConflictGroups()).isEqualTo(1);
        assertThat(result.getSurvivorBySeriesId()).containsEntry(legacy, canonical);
        assertThat(playersIn(canonical)).isEqualTo(5);
        assertThat(teamsIn(canonical)).isEqualTo(3);
        assertThat(data.count("select count(*) from series_stats where series_id = ?", canonical)).isEqualTo(1);
        assertThat(data.count("select count(*) from series where id = ?", legacy)).isZero();
        assertThat(jdbc.queryForList("select series_id from series_leagues where league_id = ?", Long.class, league.getId()))
                .containsExactly(canonical);
    }

    @Test
    void largestMemberSurvivesAndIsRenamedWhenNoneIsCanonical() {
        long big = data.series(league.getId(), "Series 5");
        long small = data.series(league.getId(), "SERIES 5");
        populate(big, "big", 3, 1);
        populate(small, "small", 1, 0);

        service.consolidate(league, false);

        assertThat(jdbc.queryForObject("select name from series where id = ?", String.class, big)).isEqualTo("S5");
        assertThat(playersIn(big) + teamsIn(big)).isEqualTo(5);
        assertThat(data.count("select count(*) from series where league_id = ?", league.getId())).isEqualTo(1);
    }

    @Test
    void equallySizedGroupFailsBeforeAnythingIsMerged() {
        long first = data.series(league.getId(), "Series 4");
        long second = data.series(league.getId(), "series 4");
        populate(first, "first", 2, 0);
        populate(second, "second", 2, 0);
        long other = data.series(league.getId(), "Series 6");
        data.series(league.getId(), "S6");
        populate(other, "other", 1, 0);

        assertThatThrownBy(() -> service.consolidate(league, false))
                .isInstanceOf(ConsolidationException.class)
                .hasMessageContaining("S4");

        assertThat(data.count("select count(*) from series where league_id = ?", league.getId())).isEqualTo(4);
        assertThat(playersIn(other)).isEqualTo(1);
    }

    @Test
    void dryRunOnlyDescribesConflicts() {
        long legacy = data.series(league.getId(), "Series 2");
        data.series(league.getId(), "S2");
        populate(legacy, "legacy", 2, 1);

        ConsolidationResult result = service.consolidate(league, true);

        assertThat(result.isDryRun()).isTrue();
        assertThat(result.getSamples()).singleElement().asString().contains("Series 2");
        assertThat(result.getSeriesMerged()).isZero();
        assertThat(playersIn(legacy)).isEqualTo(2);
    }

    @Test
    void distinctSeriesAreLeftAlone() {
        data.series(league.getId(), "S1");
        data.series(league.getId(), "S2");

        ConsolidationResult result = service.consolidate(league, false);

        assertThat(result.getConflictGroups()).isZero();
        assertThat(data.count("select count(*) from series where league_id = ?", league.getId())).isEqualTo(2);
    }

    @Test
    void otherLeaguesAreUntouched() {
        long apta = data.leagueId("APTA_CHICAGO");
        data.series(apta, "Series 3");
        data.series(apta, "S3");

        service.consolidate(league, false);

        assertThat(data.count("select count(*) from series where league_id = ?", apta)).isEqualTo(2);
    }
}
