package com.rally.leaguesync.config;

import com.rally.leaguesync.model.League;
import com.rally.leaguesync.model.OrphanMapping;
import com.rally.leaguesync.repository.LeagueRepository;
import com.rally.leaguesync.repository.OrphanMappingRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Loads the versioned orphan league mapping into {@code orphan_mapping} before any run starts.
 * A row only replaces a stored mapping when its version is at least the stored one.
 */
@Component
@Order(0)
public class OrphanMappingSeeder implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(OrphanMappingSeeder.class);

    private final OrphanMappingRepository orphanMappingRepository;
    private final LeagueRepository leagueRepository;
    private final ResourceLoader resourceLoader;
    private final LeagueSyncProperties properties;

    public OrphanMappingSeeder(OrphanMappingRepository orphanMappingRepository,
                               LeagueRepository leagueRepository,
                               ResourceLoader resourceLoader,
                               LeagueSyncProperties properties) {
        this.orphanMappingRepository = orphanMappingRepository;
        this.leagueRepository = leagueRepository;
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        String location = properties.getOrphanMappingLocation();
        if (location == null || location.isBlank()) return;
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("[ORPHAN_MAPPING] Seed {} not found, mapping table left as is", location);
            return;
        }
        try (Reader reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            int applied = seed(reader);
            log.info("[ORPHAN_MAPPING] Applied {} mappings from {}", applied, location);
        }
    }

    /** @return number of rows inserted or refreshed */
    public int seed(Reader reader) throws IOException {
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .setCommentMarker('#')
                .build();
        int applied = 0;
        try (CSVParser parser = new CSVParser(reader, fmt)) {
            for (CSVRecord rec : parser) {
                Long orphanId;
                int version;
                try {
                    orphanId = Long.valueOf(rec.get("orphan_league_id"));
                    version = rec.isSet("version") && !rec.get("version").isBlank() ? Integer.parseInt(rec.get("version")) : 1;
                } catch (NumberFormatException e) {
                    log.warn("[ORPHAN_MAPPING] Line {} skipped, not a number: {}", rec.getRecordNumber(), e.getMessage());
                    continue;
                }
                String leagueKey = rec.get("league_key");
                Optional<League> league = leagueRepository.findByLeagueKeyIgnoreCase(leagueKey);
                if (league.isEmpty()) {
                    log.warn("[ORPHAN_MAPPING] Line {} skipped, unknown league '{}'", rec.getRecordNumber(), leagueKey);
                    continue;
                }
                String note = rec.isSet("note") ? rec.get("note") : null;
                if (apply(orphanId, league.get().getId(), version, note)) applied++;
            }
        }
        return applied;
    }

    private boolean apply(Long orphanId, Long currentLeagueId, int version, String note) {
        Optional<OrphanMapping> existing = orphanMappingRepository.findByOrphanLeagueId(orphanId);
        if (existing.isEmpty()) {
            orphanMappingRepository.save(new OrphanMapping(orphanId, currentLeagueId, version, note));
            return true;
        }
        OrphanMapping m = existing.get();
        if (m.getVersion() != null && m.getVersion() > version) return false;
        if (currentLeagueId.equals(m.getCurrentLeagueId()) && Integer.valueOf(version).equals(m.getVersion())) return false;
        m.setCurrentLeagueId(currentLeagueId);
        m.setVersion(version);
        m.setNote(note);
        orphanMappingRepository.save(m);
        return true;
    }
}
