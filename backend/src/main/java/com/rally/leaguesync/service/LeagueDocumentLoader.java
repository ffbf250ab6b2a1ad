package com.rally.leaguesync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rally.leaguesync.config.LeagueSyncProperties;
import com.rally.leaguesync.model.RunType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the scraped JSON documents of a league from {@code {data-dir}/{LEAGUE_KEY}/}.
 * Any problem here is structural and fails the run before anything is written.
 */
@Component
public class LeagueDocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(LeagueDocumentLoader.class);

    static final String PLAYERS_FILE = "players.json";
    static final String SCHEDULE_FILE = "schedules.json";
    static final String MATCHES_FILE = "match_history.json";
    static final String STATS_FILE = "series_stats.json";
    static final String PLAYER_HISTORY_FILE = "player_history.json";

    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final LeagueSyncProperties properties;

    public LeagueDocumentLoader(ObjectMapper objectMapper, LeagueSyncProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public LeagueDocuments load(String leagueKey, RunType type) {
        Path dir = Path.of(properties.getDataDir()).resolve(leagueKey);
        if (type == RunType.VALIDATE) return LeagueDocuments.empty();
        if (!Files.isDirectory(dir)) {
            throw new LeagueDataException("League data directory not found: " + dir.toAbsolutePath());
        }
        List<SourceRecord> players = type.includesPlayers() ? read(dir.resolve(PLAYERS_FILE), true) : List.of();
        List<SourceRecord> schedule = type.includesSchedule() ? read(dir.resolve(SCHEDULE_FILE), true) : List.of();
        List<SourceRecord> matches = type.includesMatches() ? read(dir.resolve(MATCHES_FILE), true) : List.of();
        // Stats are optional in a full run, required when imported on their own
        List<SourceRecord> stats = type.includesStats() ? read(dir.resolve(STATS_FILE), type == RunType.STATS) : List.of();
        List<SourceRecord> playerHistory = type.includesPlayers() ? read(dir.resolve(PLAYER_HISTORY_FILE), false) : List.of();
        LeagueDocuments docs = new LeagueDocuments(players, schedule, matches, stats, playerHistory);
        log.info("[IMPORT][LOAD] {} {} from {}", leagueKey, docs.counts(), dir);
        return docs;
    }

    private List<SourceRecord> read(Path file, boolean required) {
        if (!Files.isRegularFile(file)) {
            if (required) throw new LeagueDataException("Required document missing: " + file.toAbsolutePath());
            log.info("[IMPORT][LOAD] Optional document {} not present, skipping", file.getFileName());
            return List.of();
        }
        List<Map<String, Object>> raw;
        try {
            raw = objectMapper.readValue(file.toFile(), RECORDS);
        } catch (JsonProcessingException e) {
            throw new LeagueDataException("Malformed JSON in " + file.getFileName() + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new LeagueDataException("Cannot read " + file.toAbsolutePath(), e);
        }
        List<SourceRecord> records = new ArrayList<>();
        if (raw == null) return records;
        int rowNum = 0;
        for (Map<String, Object> fields : raw) {
            rowNum++;
            if (fields != null) records.add(new SourceRecord(rowNum, fields));
        }
        return records;
    }
}
