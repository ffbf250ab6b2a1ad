package com.rally.leaguesync.service;

import com.rally.leaguesync.config.LeagueSyncProperties;
import com.rally.leaguesync.config.LeagueSyncProperties.LeagueRule;
import com.rally.leaguesync.model.Club;
import com.rally.leaguesync.model.League;
import com.rally.leaguesync.model.Series;
import com.rally.leaguesync.model.SeriesLeague;
import com.rally.leaguesync.model.Team;
import com.rally.leaguesync.repository.ClubRepository;
import com.rally.leaguesync.repository.LeagueRepository;
import com.rally.leaguesync.repository.SeriesLeagueRepository;
import com.rally.leaguesync.repository.SeriesRepository;
import com.rally.leaguesync.repository.TeamRepository;
import com.rally.leaguesync.util.ClubNameNormalizer;
import com.rally.leaguesync.util.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * Maps scrape-source names to database ids: leagues (must exist), series and clubs (created on
 * demand) and teams (matched through a {@link TeamIndex}, created only from a full
 * club/series/league triple).
 */
@Service
public class EntityResolver {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    private final LeagueRepository leagueRepository;
    private final SeriesRepository seriesRepository;
    private final SeriesLeagueRepository seriesLeagueRepository;
    private final ClubRepository clubRepository;
    private final TeamRepository teamRepository;
    private final LeagueSyncProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate newTransactionTemplate;

    public EntityResolver(LeagueRepository leagueRepository,
                          SeriesRepository seriesRepository,
                          SeriesLeagueRepository seriesLeagueRepository,
                          ClubRepository clubRepository,
                          TeamRepository teamRepository,
                          LeagueSyncProperties properties,
                          PlatformTransactionManager transactionManager) {
        this.leagueRepository = leagueRepository;
        this.seriesRepository = seriesRepository;
        this.seriesLeagueRepository = seriesLeagueRepository;
        this.clubRepository = clubRepository;
        this.teamRepository = teamRepository;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.newTransactionTemplate = new TransactionTemplate(transactionManager);
        this.newTransactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public League resolveLeague(String leagueKey) {
        if (leagueKey == null || leagueKey.isBlank()) throw new LeagueDataException("League key is required");
        String key = leagueKey.trim();
        return leagueRepository.findByLeagueKey(key)
                .or(() -> leagueRepository.findByLeagueKeyIgnoreCase(key))
                .or(() -> leagueRepository.findFirstByLeagueNameIgnoreCase(key))
                .orElseThrow(() -> new LeagueDataException("Unknown league: " + key));
    }

    public TeamIndex indexTeams(League league) {
        TeamIndex index = new TeamIndex();
        for (Team t : teamRepository.findByLeagueId(league.getId())) {
            index.add(t.getId(), t.getTeamName());
        }
        log.debug("[IMPORT][RESOLVE] Indexed {} teams for {}", index.size(), league.getLeagueKey());
        return index;
    }

    public Resolution resolveTeam(League league, TeamIndex index, String sourceName) {
        LeagueRule rule = properties.rulesFor(league.getLeagueKey());
        return TeamNameMatcher.resolve(index, sourceName, rule.getAliases());
    }

    /**
     * Finds the league's series by exact name, then by case-insensitive or canonical-form match;
     * otherwise creates it under its canonical name and links it to the league.
     */
    public ResolvedRef resolveSeries(League league, String rawName) {
        String name = NameNormalizer.collapse(rawName);
        if (name == null || name.isEmpty()) throw new InvalidRecordException("Series name is empty");
        LeagueRule rule = properties.rulesFor(league.getLeagueKey());
        String canonical = rule.canonicalSeriesName(name);
        return transactionTemplate.execute(status -> {
            Optional<Series> exact = seriesRepository.findByNameAndLeagueId(name, league.getId());
            if (exact.isPresent()) return new ResolvedRef(exact.get().getId(), false);
            for (Series s : seriesRepository.findByLeagueIdOrderByIdAsc(league.getId())) {
                if (s.getName().equalsIgnoreCase(name)
                        || rule.canonicalSeriesName(s.getName()).equalsIgnoreCase(canonical)) {
                    return new ResolvedRef(s.getId(), false);
                }
            }
            League leagueRef = leagueRepository.getReferenceById(league.getId());
            Series created = seriesRepository.save(new Series(canonical, name, leagueRef));
            seriesLeagueRepository.save(new SeriesLeague(created, leagueRef));
            log.info("[IMPORT][RESOLVE] Created series '{}' (source '{}') in {}", canonical, name, league.getLeagueKey());
            return new ResolvedRef(created.getId(), true);
        });
    }

    /**
     * Upserts a club on its normalized name. Clubs are shared across leagues, so a concurrent
     * run may insert the same name first; the unique key violation is recovered by re-reading.
     */
    public ResolvedRef resolveClub(String rawName) {
        String name = ClubNameNormalizer.normalize(rawName);
        if (name.isEmpty()) throw new InvalidRecordException("Club name is empty: " + rawName);
        Optional<Club> existing = clubRepository.findByName(name);
        if (existing.isPresent()) return new ResolvedRef(existing.get().getId(), false);
        try {
            Club saved = newTransactionTemplate.execute(status -> clubRepository.saveAndFlush(new Club(name)));
            log.info("[IMPORT][RESOLVE] Created club '{}'", name);
            return new ResolvedRef(saved.getId(), true);
        } catch (DataIntegrityViolationException e) {
            log.debug("[IMPORT][RESOLVE] Club '{}' inserted concurrently, re-reading", name);
            return clubRepository.findByName(name)
                    .map(c -> new ResolvedRef(c.getId(), false))
                    .orElseThrow(() -> e);
        }
    }

    /** Finds or creates a team; callers must already hold resolved club and series ids. */
    public ResolvedRef findOrCreateTeam(League league, String teamName, Long clubId, Long seriesId) {
        String name = NameNormalizer.collapse(teamName);
        if (name == null || name.isEmpty()) throw new InvalidRecordException("Team name is empty");
        if (clubId == null || seriesId == null) {
            throw new InvalidRecordException("Team '" + name + "' needs a resolved club and series");
        }
        return transactionTemplate.execute(status -> {
            Optional<Team> existing = teamRepository.findByTeamNameAndLeagueId(name, league.getId());
            if (existing.isPresent()) return new ResolvedRef(existing.get().getId(), false);
            Team team = new Team(name,
                    clubRepository.getReferenceById(clubId),
                    seriesRepository.getReferenceById(seriesId),
                    leagueRepository.getReferenceById(league.getId()));
            Team saved = teamRepository.save(team);
            log.info("[IMPORT][RESOLVE] Created team '{}' in {}", name, league.getLeagueKey());
            return new ResolvedRef(saved.getId(), true);
        });
    }
}
