package com.rally.leaguesync.service;

import com.rally.leaguesync.config.LeagueSyncProperties;
import com.rally.leaguesync.dto.MatchRow;
import com.rally.leaguesync.dto.PlayerHistoryRow;
import com.rally.leaguesync.dto.PlayerRow;
import com.rally.leaguesync.dto.ScheduleRow;
import com.rally.leaguesync.dto.StatRow;
import com.rally.leaguesync.model.League;
import com.rally.leaguesync.score.LeagueScoringRules;
import com.rally.leaguesync.score.ScoreParser;
import com.rally.leaguesync.score.ScoreResult;
import com.rally.leaguesync.score.WinnerReconciler;
import com.rally.leaguesync.util.Checksums;
import com.rally.leaguesync.util.ClubNameNormalizer;
import com.rally.leaguesync.util.DateParsers;
import com.rally.leaguesync.util.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a league's source records into resolved rows for the writer.
 *
 * Records missing required fields or carrying unparseable dates are skipped and sampled.
 * Players are resolved first, then stats, so teams they create are visible to the schedule
 * and match records resolved afterwards.
 */
@Service
public class SourceRecordResolver {
    private static final Logger log = LoggerFactory.getLogger(SourceRecordResolver.class);

    private static final String BYE = "BYE";

    private final EntityResolver entityResolver;
    private final LeagueSyncProperties properties;

    public SourceRecordResolver(EntityResolver entityResolver, LeagueSyncProperties properties) {
        this.entityResolver = entityResolver;
        this.properties = properties;
    }

    public ResolvedRecords resolve(League league, LeagueDocuments docs, TeamIndex index, ResolutionStats stats) {
        Map<String, ResolvedRef> seriesCache = new HashMap<>();
        Map<String, ResolvedRef> clubCache = new HashMap<>();

        List<PlayerRow> players = new ArrayList<>();
        for (SourceRecord rec : docs.players()) {
            try {
                players.add(resolvePlayer(league, rec, index, stats, seriesCache, clubCache));
                stats.resolvedRecord();
            } catch (InvalidRecordException e) {
                stats.skip("players", rec, e.getMessage());
            }
        }

        List<StatRow> statRows = new ArrayList<>();
        for (SourceRecord rec : docs.stats()) {
            try {
                statRows.add(resolveStat(league, rec, index, stats, seriesCache, clubCache));
                stats.resolvedRecord();
            } catch (InvalidRecordException e) {
                stats.skip("series_stats", rec, e.getMessage());
            }
        }

        List<ScheduleRow> schedule = new ArrayList<>();
        for (SourceRecord rec : docs.schedule()) {
            try {
                ScheduleRow row = resolveScheduleEntry(league, rec, index, stats);
                if (row != null) {
                    schedule.add(row);
                    stats.resolvedRecord();
                }
            } catch (InvalidRecordException e) {
                stats.skip("schedule", rec, e.getMessage());
            }
        }

        LeagueScoringRules scoring = properties.rulesFor(league.getLeagueKey()).scoringRules();
        List<MatchRow> matches = new ArrayList<>();
        for (SourceRecord rec : docs.matches()) {
            try {
                matches.add(resolveMatch(league, rec, index, scoring, stats));
                stats.resolvedRecord();
            } catch (InvalidRecordException e) {
                stats.skip("match_scores", rec, e.getMessage());
            }
        }

        List<PlayerHistoryRow> history = new ArrayList<>();
        for (SourceRecord rec : docs.playerHistory()) {
            try {
                history.add(resolvePlayerHistory(league, rec));
                stats.resolvedRecord();
            } catch (InvalidRecordException e) {
                stats.skip("player_history", rec, e.getMessage());
            }
        }

        log.info("[IMPORT][RESOLVE] {} resolved={} skipped={} unresolvedTeamRefs={} created series={} clubs={} teams={}",
                league.getLeagueKey(), stats.getResolved(), stats.getSkipped(), stats.getUnresolvedTeamRefs(),
                stats.getSeriesCreated(), stats.getClubsCreated(), stats.getTeamsCreated());
        return new ResolvedRecords(players, schedule, matches, statRows, history);
    }

    private PlayerRow resolvePlayer(League league, SourceRecord rec, TeamIndex index, ResolutionStats stats,
                                    Map<String, ResolvedRef> seriesCache, Map<String, ResolvedRef> clubCache) {
        String externalId = rec.require("Player ID");
        String firstName = rec.require("First Name");
        String lastName = rec.require("Last Name");
        ResolvedRef club = club(rec.require("Club"), stats, clubCache);
        ResolvedRef series = series(league, rec.require("Series"), stats, seriesCache);

        Long teamId = null;
        String teamName = rec.firstText("Team", "Series Mapping ID");
        if (teamName != null) {
            Resolution r = entityResolver.resolveTeam(league, index, teamName);
            if (r.resolved()) {
                stats.teamLookup(r, teamName);
                teamId = r.id();
            } else {
                // The player's own club and series complete the triple a new team needs
                ResolvedRef team = entityResolver.findOrCreateTeam(league, teamName, club.id(), series.id());
                stats.team(team);
                index.add(team.id(), NameNormalizer.collapse(teamName));
                teamId = team.id();
            }
        }

        return new PlayerRow(rec.getRowNumber(), rec.payload(), league.getId(), externalId, firstName, lastName,
                club.id(), series.id(), teamId,
                rec.decimal("PTI"),
                rec.integer("Wins"),
                rec.integer("Losses"),
                rec.integer("Career Wins"),
                rec.integer("Career Losses"),
                rec.decimal("Career Win %"));
    }

    // Rating points with an unparseable date are dropped on their own; the record survives
    private PlayerHistoryRow resolvePlayerHistory(League league, SourceRecord rec) {
        String externalId = rec.require("player_id");
        String recordSeries = rec.text("series");
        List<PlayerHistoryRow.RatingPoint> ratings = new ArrayList<>();
        for (SourceRecord point : rec.records("matches")) {
            LocalDate date = DateParsers.parse(point.text("date")).orElse(null);
            if (date == null) {
                log.debug("[IMPORT][RESOLVE] Player {} rating point dropped, unparseable date '{}'", externalId, point.text("date"));
                continue;
            }
            String series = point.text("series");
            ratings.add(new PlayerHistoryRow.RatingPoint(date, point.decimal("end_pti"), series != null ? series : recordSeries));
        }
        Integer wins = rec.integer("wins");
        Integer losses = rec.integer("losses");
        if (ratings.isEmpty() && wins == null && losses == null) {
            throw new InvalidRecordException("No rating history or career totals for player " + externalId);
        }
        return new PlayerHistoryRow(rec.getRowNumber(), rec.payload(), league.getId(), externalId, wins, losses, ratings);
    }

    private StatRow resolveStat(League league, SourceRecord rec, TeamIndex index, ResolutionStats stats,
                                Map<String, ResolvedRef> seriesCache, Map<String, ResolvedRef> clubCache) {
        String seriesName = rec.require("series");
        String teamName = NameNormalizer.collapse(rec.require("team"));
        ResolvedRef series = series(league, seriesName, stats, seriesCache);

        Long teamId;
        Resolution r = entityResolver.resolveTeam(league, index, teamName);
        if (r.resolved()) {
            stats.teamLookup(r, teamName);
            teamId = r.id();
        } else {
            ResolvedRef club = club(teamName, stats, clubCache);
            ResolvedRef team = entityResolver.findOrCreateTeam(league, teamName, club.id(), series.id());
            stats.team(team);
            index.add(team.id(), teamName);
            teamId = team.id();
        }

        return new StatRow(rec.getRowNumber(), rec.payload(), league.getId(), series.id(), seriesName, teamName, teamId,
                rec.integer("points"),
                rec.integer("matches", "won"),
                rec.integer("matches", "lost"),
                rec.integer("matches", "tied"),
                rec.integer("lines", "won"),
                rec.integer("lines", "lost"),
                rec.integer("sets", "won"),
                rec.integer("sets", "lost"),
                rec.integer("games", "won"),
                rec.integer("games", "lost"));
    }

    private ScheduleRow resolveScheduleEntry(League league, SourceRecord rec, TeamIndex index, ResolutionStats stats) {
        LocalDate date = date(rec.require("date"));
        String home = NameNormalizer.collapse(rec.require("home_team"));
        String away = NameNormalizer.collapse(rec.require("away_team"));
        if (BYE.equalsIgnoreCase(home) || BYE.equalsIgnoreCase(away)) {
            stats.skip("schedule", rec, "Bye week");
            return null;
        }
        Long homeId = lookup(league, index, home, stats);
        Long awayId = lookup(league, index, away, stats);
        return new ScheduleRow(rec.getRowNumber(), rec.payload(), league.getId(), date,
                rec.text("time"), home, away, homeId, awayId, rec.text("location"));
    }

    private MatchRow resolveMatch(League league, SourceRecord rec, TeamIndex index, LeagueScoringRules scoring,
                                  ResolutionStats stats) {
        LocalDate date = date(rec.require("Date"));
        String home = NameNormalizer.collapse(rec.require("Home Team"));
        String away = NameNormalizer.collapse(rec.require("Away Team"));
        String scores = rec.require("Scores");

        ScoreResult result = ScoreParser.parse(scores, scoring);
        WinnerReconciler.Reconciliation winner = WinnerReconciler.reconcile(result, rec.text("Winner"));
        stats.winner(winner.outcome(), result.issues());
        if (winner.outcome() == WinnerReconciler.Outcome.CORRECTED) {
            log.debug("[IMPORT][SCORES] Row {} recorded winner '{}' corrected to {} from '{}'",
                    rec.getRowNumber(), rec.text("Winner"), winner.winner(), scores);
        }

        String line = rec.text("Line");
        String hp1 = rec.text("Home Player 1 ID");
        String hp2 = rec.text("Home Player 2 ID");
        String ap1 = rec.text("Away Player 1 ID");
        String ap2 = rec.text("Away Player 2 ID");
        String matchKey = rec.text("match_id");
        if (matchKey == null) {
            matchKey = Checksums.sha256Hex(String.join("|", String.valueOf(date), home, away,
                    String.valueOf(line), String.valueOf(hp1), String.valueOf(hp2), String.valueOf(ap1), String.valueOf(ap2)));
        }

        return new MatchRow(rec.getRowNumber(), rec.payload(), league.getId(), matchKey, date, home, away,
                lookup(league, index, home, stats), lookup(league, index, away, stats),
                line, hp1, hp2, ap1, ap2, result.display(), winner.winner().storageValue());
    }

    private Long lookup(League league, TeamIndex index, String name, ResolutionStats stats) {
        Resolution r = entityResolver.resolveTeam(league, index, name);
        stats.teamLookup(r, name);
        if (!r.resolved()) log.debug("[IMPORT][RESOLVE] Unresolved team '{}' in {}", name, league.getLeagueKey());
        return r.id();
    }

    private ResolvedRef series(League league, String name, ResolutionStats stats, Map<String, ResolvedRef> cache) {
        String key = NameNormalizer.normalize(name);
        ResolvedRef cached = cache.get(key);
        if (cached != null) return cached;
        ResolvedRef ref = entityResolver.resolveSeries(league, name);
        stats.series(ref);
        cache.put(key, new ResolvedRef(ref.id(), false));
        return ref;
    }

    private ResolvedRef club(String rawName, ResolutionStats stats, Map<String, ResolvedRef> cache) {
        String key = ClubNameNormalizer.normalize(rawName);
        ResolvedRef cached = cache.get(key);
        if (cached != null) return cached;
        ResolvedRef ref = entityResolver.resolveClub(rawName);
        stats.club(ref);
        cache.put(key, new ResolvedRef(ref.id(), false));
        return ref;
    }

    private static LocalDate date(String raw) {
        return DateParsers.parse(raw).orElseThrow(() -> new InvalidRecordException("Unparseable date: " + raw));
    }
}
