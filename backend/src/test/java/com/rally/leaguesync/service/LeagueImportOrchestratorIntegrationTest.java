package com.rally.leaguesync.service;

import com.rally.leaguesync.TestData;
import com.rally.leaguesync.model.ImportError;
import com.rally.leaguesync.model.ImportRun;
import com.rally.leaguesync.model.RunState;
import com.rally.leaguesync.model.RunType;
import com.rally.leaguesync.model.SyncTable;
import com.rally.leaguesync.repository.ImportErrorRepository;
import com.rally.leaguesync.repository.ImportRunRepository;
import com.rally.leaguesync.service.write.WriteStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the NSTF fixture documents end to end against the in-memory database.
 */
@SpringBootTest
@ActiveProfiles("test")
class LeagueImportOrchestratorIntegrationTest {

    @Autowired private LeagueImportOrchestrator orchestrator;
    @Autowired private ImportRunRepository importRunRepository;
    @Autowired private ImportErrorRepository importErrorRepository;
    @Autowired private JdbcTemplate jdbc;

    private TestData data;

    @BeforeEach
    void setUp() {
        data = new TestData(jdbc);
        data.wipe();
    }

    private int rows(String table) {
        return data.count("select count(*) from " + table + " where league_id = ?", data.leagueId("NSTF"));
    }

    private static WriteStats writesFor(RunReport report, SyncTable table) {
        return report.getWrites().stream().filter(w -> w.getTable() == table).findFirst().orElseThrow();
    }

    @Test
    void fullRunImportsTheLeagueAndIsIdempotent() {
        RunReport first = orchestrator.run("NSTF", RunType.FULL, true, "test");

        assertThat(first.getState()).isEqualTo(RunState.CLEAN);
        assertThat(first.getStages()).containsExactly(RunState.LOADED, RunState.RESOLVED, RunState.CONSOLIDATED,
                RunState.WRITTEN, RunState.VALIDATED, RunState.CLEAN);
        assertThat(first.isPartial()).isFalse();
        assertThat(writesFor(first, SyncTable.PLAYERS).getInserted()).isEqualTo(4);
        assertThat(first.getResolution().getSkipped()).isEqualTo(4);

        RunReport second = orchestrator.run("NSTF", RunType.FULL, true, "test");

        assertThat(second.getState()).isEqualTo(RunState.CLEAN);
        assertThat(writesFor(second, SyncTable.PLAYERS).getInserted()).isZero();
        assertThat(writesFor(second, SyncTable.PLAYERS).getUpdated()).isEqualTo(4);
        assertThat(writesFor(second, SyncTable.SCHEDULE).getInserted()).isZero();
        assertThat(writesFor(second, SyncTable.MATCH_SCORES).getInserted()).isZero();

        assertThat(rows("players")).isEqualTo(4);
        assertThat(rows("teams")).isEqualTo(3);
        assertThat(rows("series")).isEqualTo(1);
        assertThat(data.count("select count(*) from clubs")).isEqualTo(3);
        assertThat(rows("schedule")).isEqualTo(2);
        assertThat(rows("match_scores")).isEqualTo(2);
        assertThat(rows("series_stats")).isEqualTo(2);
        assertThat(jdbc.queryForObject("select name from series", String.class)).isEqualTo("S2");
    }

    @Test
    void playerHistoryFillsCareerColumnsAndRatingPoints() {
        RunReport first = orchestrator.run("NSTF", RunType.PLAYERS, true, "test");

        assertThat(first.getState()).isEqualTo(RunState.CLEAN);
        WriteStats history = writesFor(first, SyncTable.PLAYER_HISTORY);
        assertThat(history.getTotal()).isEqualTo(3);
        assertThat(history.getInserted()).isEqualTo(1);
        assertThat(history.getUpdated()).isEqualTo(1);
        assertThat(history.getSkipped()).isEqualTo(1);

        assertThat(rows("player_history")).isEqualTo(2);
        assertThat(jdbc.queryForList("select h.end_pti from player_history h join players p on p.id = h.player_id " +
                "where p.external_id = 'nstf-p1' order by h.record_date", Double.class)).containsExactly(43.1, 41.5);
        assertThat(jdbc.queryForObject("select h.series from player_history h where h.record_date = '2025-01-05'",
                String.class)).isEqualTo("Series 2");

        assertThat(jdbc.queryForMap("select career_wins, career_losses, career_win_pct from players where external_id = 'nstf-p1'"))
                .containsEntry("career_wins", 30).containsEntry("career_losses", 10).containsEntry("career_win_pct", 75.0);
        assertThat(jdbc.queryForObject("select career_win_pct from players where external_id = 'nstf-p2'", Double.class))
                .isEqualTo(0.0);

        RunReport second = orchestrator.run("NSTF", RunType.PLAYERS, true, "test");

        assertThat(writesFor(second, SyncTable.PLAYER_HISTORY).getInserted()).isZero();
        assertThat(rows("player_history")).isEqualTo(2);
        assertThat(jdbc.queryForObject("select career_win_pct from players where external_id = 'nstf-p1'", Double.class))
                .isEqualTo(75.0);
    }

    @Test
    void recordedWinnerIsCorrectedFromTheScore() {
        orchestrator.run("NSTF", RunType.MATCHES, true, "test");

        assertThat(jdbc.queryForObject("select winner from match_scores where line = 'Line 2'", String.class))
                .isEqualTo("home");
        assertThat(jdbc.queryForObject("select winner from match_scores where match_key = 'nstf-m1'", String.class))
                .isEqualTo("home");
    }

    @Test
    void scheduleNamesWithSeriesSuffixResolveToExistingTeams() {
        orchestrator.run("NSTF", RunType.FULL, true, "test");

        Long wilmette = jdbc.queryForObject("select id from teams where team_name = 'Wilmette S2'", Long.class);
        assertThat(jdbc.queryForObject("select home_team_id from schedule where match_date = '2025-01-12'", Long.class))
                .isEqualTo(wilmette);
        assertThat(jdbc.queryForObject("select c.name from teams t join clubs c on c.id = t.club_id " +
                "where t.team_name = 'Glencoe S2'", String.class)).isEqualTo("Glencoe");
    }

    @Test
    void runIsRecordedWithItsSkippedRows() {
        RunReport report = orchestrator.run("NSTF", RunType.FULL, true, "cli");

        ImportRun run = importRunRepository.findById(report.getRunId()).orElseThrow();
        assertThat(run.getStatus()).isEqualTo("CLEAN");
        assertThat(run.getCreatedBy()).isEqualTo("cli");
        assertThat(run.getRowsFailed()).isEqualTo(4);
        assertThat(run.getParams()).contains("\"repair\":true");
        assertThat(run.getFinishedAt()).isNotNull();

        List<ImportError> errors = importErrorRepository.findByImportRunId(run.getId());
        assertThat(errors).hasSize(4);
        assertThat(errors).extracting(ImportError::getReason)
                .anyMatch(r -> r.contains("Club"))
                .anyMatch(r -> r.contains("Bye"))
                .anyMatch(r -> r.contains("Unparseable date"))
                .anyMatch(r -> r.contains("Scores"));
    }

    @Test
    void leagueWithoutDocumentsFailsWithoutWriting() {
        RunReport report = orchestrator.run("CITA", RunType.FULL, true, "test");

        assertThat(report.getState()).isEqualTo(RunState.FAILED);
        assertThat(report.getFailureReason()).contains("not found");
        assertThat(report.getWrites()).isEmpty();
        assertThat(importRunRepository.findById(report.getRunId()).orElseThrow().getStatus()).isEqualTo("FAILED");
    }

    @Test
    void unknownLeagueFails() {
        RunReport report = orchestrator.run("NOPE", RunType.FULL, true, "test");

        assertThat(report.getState()).isEqualTo(RunState.FAILED);
        assertThat(report.getFailureReason()).contains("Unknown league");
    }

    @Test
    void validateOnlyRunLeavesDocumentsUnread() {
        RunReport report = orchestrator.run("NSTF", RunType.VALIDATE, true, "test");

        assertThat(report.getState()).isEqualTo(RunState.CLEAN);
        assertThat(report.getStages()).containsExactly(RunState.LOADED, RunState.VALIDATED, RunState.CLEAN);
        assertThat(rows("players")).isZero();
    }
}
