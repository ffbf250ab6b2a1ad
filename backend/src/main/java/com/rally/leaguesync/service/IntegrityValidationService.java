package com.rally.leaguesync.service;

import com.rally.leaguesync.config.LeagueSyncProperties;
import com.rally.leaguesync.model.League;
import com.rally.leaguesync.model.SyncTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Post-import integrity sweep for one league, with optional auto-repair.
 *
 * Checks, in order: active players without a team who appear in match history, league and team
 * ids pointing nowhere, duplicate natural keys, and schedule/match rows whose team id is still
 * missing. Each repairing check commits in its own transaction.
 */
@Service
public class IntegrityValidationService {
    private static final Logger log = LoggerFactory.getLogger(IntegrityValidationService.class);

    static final String CHECK_UNASSIGNED = "unassigned-players";
    static final String CHECK_ORPHAN_LEAGUE = "orphan-league";
    static final String CHECK_ORPHAN_TEAM = "orphan-team";
    static final String CHECK_DUPLICATES = "duplicates";
    static final String CHECK_TEAM_REFS = "team-refs";

    private static final String UNASSIGNED_APPEARANCES = "select p.id as player_id, p.external_id, t.id as team_id, count(*) as appearances\n" +
            "from players p\n" +
            "join (\n" +
            "  select league_id, home_team_id as team_id, home_player_1_id as external_id from match_scores\n" +
            "  union all select league_id, home_team_id, home_player_2_id from match_scores\n" +
            "  union all select league_id, away_team_id, away_player_1_id from match_scores\n" +
            "  union all select league_id, away_team_id, away_player_2_id from match_scores\n" +
            ") m on m.external_id = p.external_id and m.league_id = p.league_id\n" +
            "left join teams t on t.id = m.team_id\n" +
            "where p.league_id = :leagueId and p.team_id is null and p.is_active = true\n" +
            "group by p.id, p.external_id, t.id\n" +
            "order by p.id";

    private static final List<SyncTable> ORPHAN_TABLES = List.of(SyncTable.SCHEDULE, SyncTable.MATCH_SCORES, SyncTable.SERIES_STATS);
    private static final List<SyncTable> TEAM_REF_TABLES = List.of(SyncTable.SCHEDULE, SyncTable.MATCH_SCORES);

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final EntityResolver entityResolver;
    private final LeagueSyncProperties properties;

    public IntegrityValidationService(NamedParameterJdbcTemplate jdbc,
                                      PlatformTransactionManager transactionManager,
                                      EntityResolver entityResolver,
                                      LeagueSyncProperties properties) {
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.entityResolver = entityResolver;
        this.properties = properties;
    }

    public ValidationReport validate(League league, boolean repair) {
        ValidationReport report = new ValidationReport(repair, properties.getSampleLimit());
        String tag = repair ? "" : "[DRY_RUN]";

        checkUnassignedPlayers(league, repair, report);
        checkOrphanLeagues(league, repair, report);
        checkOrphanTeams(league, report);
        checkDuplicates(league, repair, report);
        checkMissingTeamRefs(league, repair, report);

        log.info("[IMPORT][VALIDATE]{} {} outcome={} assigned={} flagged={} remapped={} unmapped={} orphanTeams={} " +
                        "duplicatesRemoved={} duplicatesLeft={} teamRefsRepaired={} teamRefsUnresolved={}",
                tag, league.getLeagueKey(), report.outcome(), report.getPlayersAssigned(), report.getPlayersFlagged(),
                report.getOrphanRowsRemapped(), report.getUnmappedOrphanRows(), report.getOrphanTeamRefs(),
                report.getDuplicatesRemoved(), report.getDuplicatesRemaining(),
                report.getTeamRefsRepaired(), report.getTeamRefsUnresolved());
        return report;
    }

    private static final class Appearances {
        final String externalId;
        int total;
        final Map<Long, Integer> byTeam = new TreeMap<>();

        Appearances(String externalId) { this.externalId = externalId; }
    }

    void checkUnassignedPlayers(League league, boolean repair, ValidationReport report) {
        Map<Long, Appearances> byPlayer = new LinkedHashMap<>();
        jdbc.query(UNASSIGNED_APPEARANCES, new MapSqlParameterSource("leagueId", league.getId()), rs -> {
            long playerId = rs.getLong("player_id");
            String externalId = rs.getString("external_id");
            Appearances a = byPlayer.computeIfAbsent(playerId, id -> new Appearances(externalId));
            int n = rs.getInt("appearances");
            a.total += n;
            long teamId = rs.getLong("team_id");
            if (!rs.wasNull()) a.byTeam.merge(teamId, n, Integer::sum);
        });

        double threshold = properties.getAssignmentThreshold();
        for (Map.Entry<Long, Appearances> e : byPlayer.entrySet()) {
            Appearances a = e.getValue();
            // TreeMap order makes the lowest id win a tie on count
            Map.Entry<Long, Integer> best = null;
            for (Map.Entry<Long, Integer> t : a.byTeam.entrySet()) {
                if (best == null || t.getValue() > best.getValue()) best = t;
            }
            double share = best == null ? 0.0 : (double) best.getValue() / a.total;
            if (best != null && share >= threshold) {
                if (repair) {
                    Long teamId = best.getKey();
                    transactionTemplate.executeWithoutResult(status -> jdbc.update(
                            "update players set team_id = :teamId where id = :playerId and team_id is null",
                            new MapSqlParameterSource("teamId", teamId).addValue("playerId", e.getKey())));
                    report.playerAssigned();
                } else {
                    report.playerFlagged();
                    report.error(CHECK_UNASSIGNED, "Player " + a.externalId + " can be assigned to team " + best.getKey()
                            + " (" + best.getValue() + "/" + a.total + "), repair disabled");
                }
            } else {
                report.playerFlagged();
                report.error(CHECK_UNASSIGNED, "Player " + a.externalId + " needs manual review: best team share "
                        + String.format(Locale.ROOT, "%.2f", share) + " of " + a.total + " matches");
            }
        }
    }

    /**
     * Only orphans mapped onto this league are moved. Orphans mapped to another league are left for
     * that league's sweep; orphans with no usable mapping are reported.
     */
    void checkOrphanLeagues(League league, boolean repair, ValidationReport report) {
        for (SyncTable table : ORPHAN_TABLES) {
            Map<Long, Integer> orphans = new LinkedHashMap<>();
            Map<Long, Long> targets = new LinkedHashMap<>();
            jdbc.query("select x.league_id, count(*) as row_count, max(ml.id) as current_league_id from " + table.tableName() + " x " +
                            "left join orphan_mapping m on m.orphan_league_id = x.league_id " +
                            "left join leagues ml on ml.id = m.current_league_id " +
                            "where not exists (select 1 from leagues l where l.id = x.league_id) " +
                            "group by x.league_id order by x.league_id",
                    new MapSqlParameterSource(),
                    rs -> {
                        long orphanId = rs.getLong("league_id");
                        orphans.put(orphanId, rs.getInt("row_count"));
                        long current = rs.getLong("current_league_id");
                        if (!rs.wasNull()) targets.put(orphanId, current);
                    });

            for (Map.Entry<Long, Integer> orphan : orphans.entrySet()) {
                Long current = targets.get(orphan.getKey());
                if (current == null) {
                    report.unmappedOrphanRows(orphan.getValue());
                    report.error(CHECK_ORPHAN_LEAGUE, orphan.getValue() + " " + table.tableName() + " rows reference league "
                            + orphan.getKey() + " with no mapping");
                } else if (!current.equals(league.getId())) {
                    log.debug("[IMPORT][VALIDATE] {} {} rows of league {} belong to league {}, not {}",
                            orphan.getValue(), table.tableName(), orphan.getKey(), current, league.getLeagueKey());
                } else if (repair) {
                    Integer moved = transactionTemplate.execute(status -> jdbc.update(
                            "update " + table.tableName() + " set league_id = :leagueId where league_id in (" +
                                    "select m.orphan_league_id from orphan_mapping m " +
                                    "where m.orphan_league_id = :orphanId and m.current_league_id = :leagueId)",
                            new MapSqlParameterSource("leagueId", league.getId()).addValue("orphanId", orphan.getKey())));
                    report.orphanRowsRemapped(moved == null ? 0 : moved);
                    log.info("[IMPORT][VALIDATE] Remapped {} {} rows from league {} to {}",
                            moved, table.tableName(), orphan.getKey(), league.getLeagueKey());
                } else {
                    report.unmappedOrphanRows(orphan.getValue());
                    report.error(CHECK_ORPHAN_LEAGUE, orphan.getValue() + " " + table.tableName() + " rows reference league "
                            + orphan.getKey() + " (mapped to " + league.getLeagueKey() + "), repair disabled");
                }
            }
        }
    }

    void checkOrphanTeams(League league, ValidationReport report) {
        MapSqlParameterSource params = new MapSqlParameterSource("leagueId", league.getId());
        for (SyncTable table : TEAM_REF_TABLES) {
            Integer n = jdbc.queryForObject("select count(*) from " + table.tableName() + " x where x.league_id = :leagueId and (" +
                            "(x.home_team_id is not null and not exists (select 1 from teams t where t.id = x.home_team_id)) or " +
                            "(x.away_team_id is not null and not exists (select 1 from teams t where t.id = x.away_team_id)))",
                    params, Integer.class);
            recordOrphanTeams(table, n, report);
        }
        Integer stats = jdbc.queryForObject("select count(*) from series_stats x where x.league_id = :leagueId " +
                        "and x.team_id is not null and not exists (select 1 from teams t where t.id = x.team_id)",
                params, Integer.class);
        recordOrphanTeams(SyncTable.SERIES_STATS, stats, report);
    }

    private void recordOrphanTeams(SyncTable table, Integer count, ValidationReport report) {
        if (count == null || count == 0) return;
        report.orphanTeamRefs(count);
        report.error(CHECK_ORPHAN_TEAM, count + " " + table.tableName() + " rows reference missing teams");
    }

    void checkDuplicates(League league, boolean repair, ValidationReport report) {
        MapSqlParameterSource params = new MapSqlParameterSource("leagueId", league.getId());
        for (SyncTable table : SyncTable.values()) {
            String keys = table.naturalKeyColumns();
            Integer surplus = jdbc.queryForObject("select coalesce(sum(c - 1), 0) from (select count(*) as c from "
                            + table.tableName() + " where league_id = :leagueId group by " + keys
                            + " having count(*) > 1) d",
                    params, Integer.class);
            if (surplus == null || surplus == 0) continue;

            if (repair && table.isVolatile()) {
                // Derived table wrapped twice so MySQL accepts the self-reference
                Integer removed = transactionTemplate.execute(status -> jdbc.update("delete from " + table.tableName()
                        + " where league_id = :leagueId and id not in (select keep_id from (select max(id) as keep_id from "
                        + table.tableName() + " where league_id = :leagueId group by " + keys + ") k)", params));
                report.duplicatesRemoved(removed == null ? 0 : removed);
                log.info("[IMPORT][VALIDATE] {} removed {} duplicate {} rows", league.getLeagueKey(), removed, table.tableName());
            } else {
                report.duplicatesRemaining(surplus);
                report.error(CHECK_DUPLICATES, surplus + " duplicate " + table.tableName() + " rows by (" + keys + ")");
            }
        }
    }

    private record MissingRef(long id, String homeTeam, String awayTeam, boolean homeMissing, boolean awayMissing) {}

    void checkMissingTeamRefs(League league, boolean repair, ValidationReport report) {
        TeamIndex index = null;
        for (SyncTable table : TEAM_REF_TABLES) {
            List<MissingRef> rows = jdbc.query("select id, home_team, away_team, home_team_id, away_team_id from "
                            + table.tableName() + " where league_id = :leagueId and (home_team_id is null or away_team_id is null) order by id",
                    new MapSqlParameterSource("leagueId", league.getId()),
                    (rs, i) -> new MissingRef(rs.getLong("id"), rs.getString("home_team"), rs.getString("away_team"),
                            rs.getObject("home_team_id") == null, rs.getObject("away_team_id") == null));
            if (rows.isEmpty()) continue;
            if (index == null) index = entityResolver.indexTeams(league);

            for (MissingRef row : rows) {
                if (row.homeMissing()) repairSide(league, index, table, row.id(), "home_team_id", row.homeTeam(), repair, report);
                if (row.awayMissing()) repairSide(league, index, table, row.id(), "away_team_id", row.awayTeam(), repair, report);
            }
        }
    }

    private void repairSide(League league, TeamIndex index, SyncTable table, long rowId, String column, String teamName,
                            boolean repair, ValidationReport report) {
        Resolution r = entityResolver.resolveTeam(league, index, teamName);
        if (r.resolved() && repair) {
            // column is one of two constants chosen above
            transactionTemplate.executeWithoutResult(status -> jdbc.update(
                    "update " + table.tableName() + " set " + column + " = :teamId where id = :id",
                    new MapSqlParameterSource("teamId", r.id()).addValue("id", rowId)));
            report.teamRefRepaired();
        } else {
            report.teamRefUnresolved();
            report.warn(CHECK_TEAM_REFS, table.tableName() + " row " + rowId + " team '" + teamName + "' "
                    + (r.resolved() ? "resolves to " + r.id() + " (repair disabled)" : "is still unresolved"));
        }
    }
}
