package com.rally.leaguesync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rally.leaguesync.config.LeagueSyncProperties;
import com.rally.leaguesync.model.RunType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LeagueDocumentLoaderTest {

    @TempDir Path dataDir;

    private LeagueDocumentLoader loader;
    private Path leagueDir;

    @BeforeEach
    void setUp() throws IOException {
        LeagueSyncProperties properties = new LeagueSyncProperties();
        properties.setDataDir(dataDir.toString());
        loader = new LeagueDocumentLoader(new ObjectMapper(), properties);
        leagueDir = Files.createDirectories(dataDir.resolve("NSTF"));
    }

    private void write(String file, String json) throws IOException {
        Files.writeString(leagueDir.resolve(file), json);
    }

    private void writeRequiredDocuments() throws IOException {
        write(LeagueDocumentLoader.PLAYERS_FILE, "[{\"Player ID\": \"p1\"}, null, {\"Player ID\": 7}]");
        write(LeagueDocumentLoader.SCHEDULE_FILE, "[]");
        write(LeagueDocumentLoader.MATCHES_FILE, "[{\"Scores\": \"6-4, 6-4\"}]");
    }

    @Test
    void fullRunWithoutStatsDocumentStillLoads() throws IOException {
        writeRequiredDocuments();

        LeagueDocuments docs = loader.load("NSTF", RunType.FULL);

        assertThat(docs.players()).extracting(r -> r.text("Player ID")).containsExactly("p1", "7");
        assertThat(docs.players()).extracting(SourceRecord::getRowNumber).containsExactly(1, 3);
        assertThat(docs.matches()).hasSize(1);
        assertThat(docs.stats()).isEmpty();
    }

    @Test
    void statsRunRequiresTheStatsDocument() {
        assertThatThrownBy(() -> loader.load("NSTF", RunType.STATS))
                .isInstanceOf(LeagueDataException.class)
                .hasMessageContaining(LeagueDocumentLoader.STATS_FILE);
    }

    @Test
    void missingRequiredDocumentFails() throws IOException {
        write(LeagueDocumentLoader.PLAYERS_FILE, "[]");

        assertThatThrownBy(() -> loader.load("NSTF", RunType.FULL))
                .isInstanceOf(LeagueDataException.class)
                .hasMessageContaining(LeagueDocumentLoader.SCHEDULE_FILE);
    }

    @Test
    void malformedJsonIsStructural() throws IOException {
        write(LeagueDocumentLoader.PLAYERS_FILE, "[{\"Player ID\": \"p1\",");

        assertThatThrownBy(() -> loader.load("NSTF", RunType.PLAYERS))
                .isInstanceOf(LeagueDataException.class)
                .hasMessageContaining("Malformed JSON");
    }

    @Test
    void singleTypeRunReadsOnlyItsDocument() throws IOException {
        write(LeagueDocumentLoader.MATCHES_FILE, "[{\"Scores\": \"6-4, 6-4\"}, {\"Scores\": \"7-5\"}]");

        LeagueDocuments docs = loader.load("NSTF", RunType.MATCHES);

        assertThat(docs.matches()).hasSize(2);
        assertThat(docs.players()).isEmpty();
    }

    @Test
    void missingLeagueDirectoryFails() {
        assertThatThrownBy(() -> loader.load("CITA", RunType.FULL))
                .isInstanceOf(LeagueDataException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void validateRunReadsNothing() {
        assertThat(loader.load("CITA", RunType.VALIDATE).counts().values()).allMatch(n -> n == 0);
    }

    @Test
    void playerHistoryIsOptionalAndReadWithPlayers() throws IOException {
        write(LeagueDocumentLoader.PLAYERS_FILE, "[]");
        assertThat(loader.load("NSTF", RunType.PLAYERS).playerHistory()).isEmpty();

        write(LeagueDocumentLoader.PLAYER_HISTORY_FILE,
                "[{\"player_id\": \"p1\", \"matches\": [{\"date\": \"2025-01-05\", \"end_pti\": 41.5}]}]");
        LeagueDocuments docs = loader.load("NSTF", RunType.PLAYERS);

        assertThat(docs.playerHistory()).hasSize(1);
        assertThat(docs.playerHistory().get(0).records("matches")).hasSize(1);
        assertThat(docs.counts()).containsEntry("playerHistory", 1);
    }
}
