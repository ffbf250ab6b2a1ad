package com.rally.leaguesync;

import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Date;
import java.time.LocalDate;

/**
 * Plain SQL fixtures for tests that run against the shared in-memory database.
 * Leagues and the orphan mapping seed are left in place by {@link #wipe()}.
 */
public class TestData {

    private final JdbcTemplate jdbc;

    public TestData(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void wipe() {
        jdbc.update("delete from import_error");
        jdbc.update("delete from import_run");
        jdbc.update("delete from player_history");
        jdbc.update("delete from players");
        jdbc.update("delete from teams");
        jdbc.update("delete from series_leagues");
        jdbc.update("delete from series");
        jdbc.update("delete from clubs");
        jdbc.update("delete from schedule");
        jdbc.update("delete from match_scores");
        jdbc.update("delete from series_stats");
    }

    public long leagueId(String leagueKey) {
        return jdbc.queryForObject("select id from leagues where league_key = ?", Long.class, leagueKey);
    }

    public long club(String name) {
        jdbc.update("insert into clubs (name) values (?)", name);
        return lastId("clubs");
    }

    public long series(long leagueId, String name) {
        jdbc.update("insert into series (name, display_name, league_id) values (?, ?, ?)", name, name, leagueId);
        long id = lastId("series");
        jdbc.update("insert into series_leagues (series_id, league_id) values (?, ?)", id, leagueId);
        return id;
    }

    public long team(long leagueId, String name, long clubId, long seriesId) {
        jdbc.update("insert into teams (team_name, display_name, club_id, series_id, league_id) values (?, ?, ?, ?, ?)",
                name, name, clubId, seriesId, leagueId);
        return lastId("teams");
    }

    public long player(long leagueId, String externalId, long clubId, long seriesId, Long teamId) {
        jdbc.update("insert into players (external_id, first_name, last_name, league_id, club_id, series_id, team_id, is_active) " +
                        "values (?, ?, ?, ?, ?, ?, ?, true)",
                externalId, "First " + externalId, "Last " + externalId, leagueId, clubId, seriesId, teamId);
        return lastId("players");
    }

    public long schedule(long leagueId, LocalDate date, String home, String away, Long homeId, Long awayId) {
        jdbc.update("insert into schedule (league_id, match_date, home_team, away_team, home_team_id, away_team_id) " +
                        "values (?, ?, ?, ?, ?, ?)",
                leagueId, Date.valueOf(date), home, away, homeId, awayId);
        return lastId("schedule");
    }

    /** Match line with {@code playerId} as first home player (home side) or first away player. */
    public long match(long leagueId, String matchKey, long homeTeamId, long awayTeamId, String playerId, boolean home) {
        jdbc.update("insert into match_scores (league_id, match_key, match_date, home_team, away_team, home_team_id, " +
                        "away_team_id, home_player_1_id, away_player_1_id, scores, winner) values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                leagueId, matchKey, Date.valueOf(LocalDate.of(2025, 1, 5)), "Home " + homeTeamId, "Away " + awayTeamId,
                homeTeamId, awayTeamId, home ? playerId : "other-" + matchKey, home ? "other-" + matchKey : playerId,
                "6-4, 6-4", "home");
        return lastId("match_scores");
    }

    /** Match line between two teams with the given score and stored winner. */
    public long line(long leagueId, LocalDate date, Long homeTeamId, Long awayTeamId, String scores, String winner) {
        jdbc.update("insert into match_scores (league_id, match_key, match_date, home_team, away_team, home_team_id, " +
                        "away_team_id, scores, winner) values (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                leagueId, "line-" + System.nanoTime(), Date.valueOf(date), "Home " + homeTeamId, "Away " + awayTeamId,
                homeTeamId, awayTeamId, scores, winner);
        return lastId("match_scores");
    }

    public long stats(long leagueId, String team, long teamId, Integer points) {
        jdbc.update("insert into series_stats (league_id, team, team_id, points) values (?, ?, ?, ?)",
                leagueId, team, teamId, points);
        return lastId("series_stats");
    }

    public int count(String sql, Object... args) {
        Integer n = jdbc.queryForObject(sql, Integer.class, args);
        return n == null ? 0 : n;
    }

    // table is always a literal from the callers above
    private long lastId(String table) {
        return jdbc.queryForObject("select max(id) from " + table, Long.class);
    }
}
