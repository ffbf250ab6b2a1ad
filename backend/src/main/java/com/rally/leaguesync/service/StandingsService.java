package com.rally.leaguesync.service;

import com.rally.leaguesync.config.LeagueSyncProperties;
import com.rally.leaguesync.dto.StatRow;
import com.rally.leaguesync.model.League;
import com.rally.leaguesync.score.LeagueScoringRules;
import com.rally.leaguesync.score.ScoreParser;
import com.rally.leaguesync.score.ScoreResult;
import com.rally.leaguesync.score.Winner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Date;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Team standings computed from the league's stored match scores.
 *
 * Each match_scores row is one line. A team match is every line two teams played on one date;
 * the side winning more lines wins it, equal lines make a tie. A team earns one point per line
 * won and one per set won.
 */
@Service
public class StandingsService {
    private static final Logger log = LoggerFactory.getLogger(StandingsService.class);

    private static final String LINES = "select m.match_date, m.home_team_id, m.away_team_id, m.scores, m.winner\n" +
            "from match_scores m\n" +
            "where m.league_id = :leagueId and m.home_team_id is not null and m.away_team_id is not null\n" +
            "order by m.match_date, m.id";

    private static final String TEAMS = "select t.id, t.team_name, s.id as series_id, s.name as series_name\n" +
            "from teams t join series s on s.id = t.series_id\n" +
            "where t.league_id = :leagueId";

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final LeagueSyncProperties properties;

    public StandingsService(NamedParameterJdbcTemplate jdbc,
                            PlatformTransactionManager transactionManager,
                            LeagueSyncProperties properties) {
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
    }

    static final class Tally {
        int matchesWon, matchesLost, matchesTied;
        int linesWon, linesLost;
        int setsWon, setsLost;
        int gamesWon, gamesLost;

        int points() { return linesWon + setsWon; }
    }

    private record TeamMatch(LocalDate date, long homeId, long awayId) {}

    private record TeamInfo(String name, Long seriesId, String seriesName) {}

    /** One stats row per team that played at least one line, in team id order. */
    public List<StatRow> deriveFromMatches(League league) {
        Map<Long, Tally> tallies = tally(league);
        Map<Long, TeamInfo> teams = new LinkedHashMap<>();
        jdbc.query(TEAMS, new MapSqlParameterSource("leagueId", league.getId()), rs -> {
            teams.put(rs.getLong("id"), new TeamInfo(rs.getString("team_name"),
                    rs.getLong("series_id"), rs.getString("series_name")));
        });

        List<StatRow> rows = new ArrayList<>();
        int rowNumber = 0;
        for (Map.Entry<Long, Tally> e : tallies.entrySet()) {
            TeamInfo team = teams.get(e.getKey());
            if (team == null) continue;
            Tally t = e.getValue();
            rowNumber++;
            rows.add(new StatRow(rowNumber, "derived from match_scores for team " + e.getKey(), league.getId(),
                    team.seriesId(), team.seriesName(), team.name(), e.getKey(), t.points(),
                    t.matchesWon, t.matchesLost, t.matchesTied, t.linesWon, t.linesLost,
                    t.setsWon, t.setsLost, t.gamesWon, t.gamesLost));
        }
        log.info("[IMPORT][STANDINGS] {} derived stats for {} teams from match scores", league.getLeagueKey(), rows.size());
        return rows;
    }

    /** Sets points on the league's stats rows that have none, from the match scores. */
    public int fillMissingPoints(League league) {
        Map<Long, Tally> tallies = tally(league);
        List<Map<String, Object>> missing = jdbc.queryForList("select id, team_id from series_stats " +
                        "where league_id = :leagueId and team_id is not null and (points is null or points = 0)",
                new MapSqlParameterSource("leagueId", league.getId()));
        int filled = 0;
        for (Map<String, Object> row : missing) {
            Tally t = tallies.get(((Number) row.get("team_id")).longValue());
            if (t == null || t.points() == 0) continue;
            long id = ((Number) row.get("id")).longValue();
            int points = t.points();
            Integer n = transactionTemplate.execute(status -> jdbc.update(
                    "update series_stats set points = :points where id = :id",
                    new MapSqlParameterSource("points", points).addValue("id", id)));
            if (n != null) filled += n;
        }
        if (filled > 0) log.info("[IMPORT][STANDINGS] {} filled points on {} stats rows", league.getLeagueKey(), filled);
        return filled;
    }

    Map<Long, Tally> tally(League league) {
        LeagueScoringRules scoring = properties.rulesFor(league.getLeagueKey()).scoringRules();
        Map<Long, Tally> tallies = new TreeMap<>();
        // home lines won minus away lines won, per team match
        Map<TeamMatch, Integer> lineBalance = new LinkedHashMap<>();

        jdbc.query(LINES, new MapSqlParameterSource("leagueId", league.getId()), rs -> {
            long homeId = rs.getLong("home_team_id");
            long awayId = rs.getLong("away_team_id");
            Date date = rs.getDate("match_date");
            Tally home = tallies.computeIfAbsent(homeId, id -> new Tally());
            Tally away = tallies.computeIfAbsent(awayId, id -> new Tally());
            TeamMatch match = new TeamMatch(date.toLocalDate(), homeId, awayId);
            lineBalance.putIfAbsent(match, 0);

            Winner winner = Winner.fromRecorded(rs.getString("winner"));
            if (winner == Winner.HOME) {
                home.linesWon++;
                away.linesLost++;
                lineBalance.merge(match, 1, Integer::sum);
            } else if (winner == Winner.AWAY) {
                away.linesWon++;
                home.linesLost++;
                lineBalance.merge(match, -1, Integer::sum);
            }

            ScoreResult score = ScoreParser.parse(rs.getString("scores"), scoring);
            home.setsWon += score.homeSetsWon();
            home.setsLost += score.awaySetsWon();
            away.setsWon += score.awaySetsWon();
            away.setsLost += score.homeSetsWon();
            List<ScoreResult.SetScore> sets = score.sets();
            for (int i = 0; i < sets.size(); i++) {
                // a super tiebreak is scored in points, not games
                if (score.superTiebreak() && i == 2) continue;
                home.gamesWon += sets.get(i).home();
                home.gamesLost += sets.get(i).away();
                away.gamesWon += sets.get(i).away();
                away.gamesLost += sets.get(i).home();
            }
        });

        for (Map.Entry<TeamMatch, Integer> e : lineBalance.entrySet()) {
            Tally home = tallies.get(e.getKey().homeId());
            Tally away = tallies.get(e.getKey().awayId());
            int balance = e.getValue();
            if (balance > 0) {
                home.matchesWon++;
                away.matchesLost++;
            } else if (balance < 0) {
                away.matchesWon++;
                home.matchesLost++;
            } else {
                home.matchesTied++;
                away.matchesTied++;
            }
        }
        return tallies;
    }
}
