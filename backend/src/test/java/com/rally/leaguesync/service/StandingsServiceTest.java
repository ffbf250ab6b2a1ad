package com.rally.leaguesync.service;

import com.rally.leaguesync.TestData;
import com.rally.leaguesync.dto.StatRow;
import com.rally.leaguesync.model.League;
import com.rally.leaguesync.repository.LeagueRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class StandingsServiceTest {

    @Autowired private StandingsService service;
    @Autowired private LeagueRepository leagueRepository;
    @Autowired private JdbcTemplate jdbc;

    private TestData data;
    private League league;
    private long seriesId;
    private long teamA;
    private long teamB;
    private long teamC;

    @BeforeEach
    void setUp() {
        data = new TestData(jdbc);
        data.wipe();
        league = leagueRepository.findByLeagueKey("NSTF").orElseThrow();
        long clubId = data.club("Winnetka");
        seriesId = data.series(league.getId(), "S1");
        teamA = data.team(league.getId(), "Winnetka S1", clubId, seriesId);
        teamB = data.team(league.getId(), "Winnetka S1b", clubId, seriesId);
        teamC = data.team(league.getId(), "Winnetka S1c", clubId, seriesId);

        LocalDate week1 = LocalDate.of(2025, 1, 5);
        data.line(league.getId(), week1, teamA, teamB, "6-4, 6-4", "home");
        // third set is a super tiebreak in this league, so it counts as a set but not as games
        data.line(league.getId(), week1, teamA, teamB, "6-3, 4-6, 10-6", "home");
        data.line(league.getId(), week1, teamA, teamB, "2-6, 3-6", "away");

        LocalDate week2 = LocalDate.of(2025, 1, 12);
        data.line(league.getId(), week2, teamB, teamC, "6-0, 6-0", "home");
        data.line(league.getId(), week2, teamB, teamC, "0-6, 0-6", "away");
        data.line(league.getId(), week2, teamB, null, "6-0, 6-0", "home");
    }

    @Test
    void derivesOneRowPerTeamFromTheLines() {
        List<StatRow> rows = service.deriveFromMatches(league);

        assertThat(rows).extracting(StatRow::teamId).containsExactly(teamA, teamB, teamC);
        assertThat(rows).allSatisfy(r -> {
            assertThat(r.seriesId()).isEqualTo(seriesId);
            assertThat(r.series()).isEqualTo("S1");
            assertThat(r.leagueId()).isEqualTo(league.getId());
        });

        StatRow a = rows.get(0);
        assertThat(a.team()).isEqualTo("Winnetka S1");
        assertThat(List.of(a.matchesWon(), a.matchesLost(), a.matchesTied())).containsExactly(1, 0, 0);
        assertThat(List.of(a.linesWon(), a.linesLost())).containsExactly(2, 1);
        assertThat(List.of(a.setsWon(), a.setsLost())).containsExactly(4, 3);
        assertThat(List.of(a.gamesWon(), a.gamesLost())).containsExactly(27, 29);
        assertThat(a.points()).isEqualTo(6);

        StatRow b = rows.get(1);
        assertThat(List.of(b.matchesWon(), b.matchesLost(), b.matchesTied())).containsExactly(0, 1, 1);
        assertThat(List.of(b.linesWon(), b.linesLost())).containsExactly(2, 3);
        assertThat(List.of(b.setsWon(), b.setsLost())).containsExactly(5, 6);
        assertThat(List.of(b.gamesWon(), b.gamesLost())).containsExactly(41, 39);
        assertThat(b.points()).isEqualTo(7);

        StatRow c = rows.get(2);
        assertThat(List.of(c.matchesWon(), c.matchesLost(), c.matchesTied())).containsExactly(0, 0, 1);
        assertThat(c.points()).isEqualTo(3);
    }

    @Test
    void fillsOnlyMissingOrZeroPoints() {
        long a = data.stats(league.getId(), "Winnetka S1", teamA, null);
        long b = data.stats(league.getId(), "Winnetka S1b", teamB, 5);
        long c = data.stats(league.getId(), "Winnetka S1c", teamC, 0);

        int filled = service.fillMissingPoints(league);

        assertThat(filled).isEqualTo(2);
        assertThat(points(a)).isEqualTo(6);
        assertThat(points(b)).isEqualTo(5);
        assertThat(points(c)).isEqualTo(3);
    }

    @Test
    void leagueWithoutLinesDerivesNothing() {
        League apta = leagueRepository.findByLeagueKey("APTA_CHICAGO").orElseThrow();
        assertThat(service.deriveFromMatches(apta)).isEmpty();
        assertThat(service.fillMissingPoints(apta)).isZero();
    }

    private Integer points(long statsId) {
        return jdbc.queryForObject("select points from series_stats where id = ?", Integer.class, statsId);
    }
}
