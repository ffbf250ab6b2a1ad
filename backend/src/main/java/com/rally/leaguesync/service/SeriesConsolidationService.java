package com.rally.leaguesync.service;

import com.rally.leaguesync.config.LeagueSyncProperties;
import com.rally.leaguesync.config.LeagueSyncProperties.LeagueRule;
import com.rally.leaguesync.model.League;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Merges series of one league that differ only by naming convention ("Series 2" and "S2")
 * into a single survivor.
 *
 * The survivor is the member already named in canonical form, otherwise the member with the
 * most players plus teams. All groups are planned before anything is merged, so an ambiguous
 * group fails the run with nothing changed.
 */
@Service
public class SeriesConsolidationService {
    private static final Logger log = LoggerFactory.getLogger(SeriesConsolidationService.class);

    private static final String SERIES_WITH_SIZES = "select s.id, s.name,\n" +
            "  (select count(*) from players p where p.series_id = s.id) as player_count,\n" +
            "  (select count(*) from teams t where t.series_id = s.id) as team_count\n" +
            "from series s\n" +
            "where s.league_id = :leagueId\n" +
            "order by s.id";

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final LeagueSyncProperties properties;

    public SeriesConsolidationService(NamedParameterJdbcTemplate jdbc,
                                      PlatformTransactionManager transactionManager,
                                      LeagueSyncProperties properties) {
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
    }

    record SeriesSize(long id, String name, int playerCount, int teamCount) {
        int size() { return playerCount + teamCount; }
    }

    record MergePlan(String canonicalName, SeriesSize survivor, List<SeriesSize> merged) {}

    public ConsolidationResult consolidate(League league, boolean dryRun) {
        LeagueRule rule = properties.rulesFor(league.getLeagueKey());
        List<SeriesSize> all = jdbc.query(SERIES_WITH_SIZES,
                new MapSqlParameterSource("leagueId", league.getId()),
                (rs, i) -> new SeriesSize(rs.getLong("id"), rs.getString("name"),
                        rs.getInt("player_count"), rs.getInt("team_count")));

        Map<String, List<SeriesSize>> groups = new LinkedHashMap<>();
        for (SeriesSize s : all) {
            String key = rule.canonicalSeriesName(s.name()).toLowerCase(Locale.ROOT);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(s);
        }

        List<MergePlan> plans = new ArrayList<>();
        for (List<SeriesSize> members : groups.values()) {
            if (members.size() < 2) continue;
            plans.add(plan(rule.canonicalSeriesName(members.get(0).name()), members, league));
        }

        ConsolidationResult result = new ConsolidationResult(plans.size(), dryRun);
        for (MergePlan plan : plans) {
            result.describe(plan.canonicalName() + ": " + plan.merged().stream().map(SeriesSize::name).toList()
                    + " -> " + plan.survivor().name() + " (id " + plan.survivor().id() + ")");
            if (dryRun) continue;
            transactionTemplate.executeWithoutResult(status -> merge(league, plan));
            for (SeriesSize old : plan.merged()) result.remap(old.id(), plan.survivor().id());
        }
        if (!plans.isEmpty()) {
            log.info("[IMPORT][CONSOLIDATE]{} {} conflict groups in {}: {}",
                    dryRun ? "[DRY_RUN]" : "", plans.size(), league.getLeagueKey(), result.getSamples());
        }
        return result;
    }

    private MergePlan plan(String canonical, List<SeriesSize> members, League league) {
        SeriesSize survivor = members.stream().filter(s -> s.name().equals(canonical)).findFirst().orElse(null);
        if (survivor == null) {
            List<SeriesSize> bySize = new ArrayList<>(members);
            bySize.sort(Comparator.comparingInt(SeriesSize::size).reversed());
            if (bySize.get(0).size() == bySize.get(1).size()) {
                throw new ConsolidationException("Cannot choose survivor for series '" + canonical + "' in "
                        + league.getLeagueKey() + ": " + members.stream().map(SeriesSize::name).toList()
                        + " are equally sized and none uses the canonical name");
            }
            survivor = bySize.get(0);
        }
        SeriesSize keep = survivor;
        List<SeriesSize> merged = members.stream().filter(s -> s.id() != keep.id()).toList();
        return new MergePlan(canonical, keep, merged);
    }

    private void merge(League league, MergePlan plan) {
        List<Long> oldIds = plan.merged().stream().map(SeriesSize::id).toList();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("survivorId", plan.survivor().id())
                .addValue("oldIds", oldIds)
                .addValue("leagueId", league.getId())
                .addValue("name", plan.canonicalName());

        int players = jdbc.update("update players set series_id = :survivorId where series_id in (:oldIds)", params);
        int teams = jdbc.update("update teams set series_id = :survivorId where series_id in (:oldIds)", params);
        int stats = jdbc.update("update series_stats set series_id = :survivorId where series_id in (:oldIds)", params);

        Integer links = jdbc.queryForObject(
                "select count(*) from series_leagues where series_id = :survivorId and league_id = :leagueId",
                params, Integer.class);
        if (links == null || links == 0) {
            jdbc.update("insert into series_leagues (series_id, league_id) values (:survivorId, :leagueId)", params);
        }
        jdbc.update("delete from series_leagues where series_id in (:oldIds)", params);
        jdbc.update("delete from series where id in (:oldIds)", params);
        jdbc.update("update series set name = :name, display_name = :name where id = :survivorId", params);

        log.info("[IMPORT][CONSOLIDATE] {} merged {} into {} (players={}, teams={}, stats={})",
                league.getLeagueKey(), oldIds, plan.survivor().id(), players, teams, stats);
    }
}
