package com.rally.leaguesync.config;

import com.rally.leaguesync.model.OrphanMapping;
import com.rally.leaguesync.repository.LeagueRepository;
import com.rally.leaguesync.repository.OrphanMappingRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class OrphanMappingSeederTest {

    private static final String HEADER = "orphan_league_id,league_key,version,note\n";

    @Autowired private OrphanMappingSeeder seeder;
    @Autowired private OrphanMappingRepository orphanMappingRepository;
    @Autowired private LeagueRepository leagueRepository;
    @Autowired private JdbcTemplate jdbc;

    @AfterEach
    void cleanUp() {
        jdbc.update("delete from orphan_mapping where orphan_league_id between 8800 and 8899");
    }

    private Long leagueId(String key) {
        return leagueRepository.findByLeagueKey(key).orElseThrow().getId();
    }

    private OrphanMapping mapping(long orphanId) {
        return orphanMappingRepository.findByOrphanLeagueId(orphanId).orElseThrow();
    }

    @Test
    void bundledMappingIsLoadedAtStartup() {
        assertThat(mapping(9001L).getCurrentLeagueId()).isEqualTo(leagueId("APTA_CHICAGO"));
        assertThat(mapping(9002L).getCurrentLeagueId()).isEqualTo(leagueId("NSTF"));
    }

    @Test
    void skipsUnknownLeaguesAndMalformedLines() throws Exception {
        String csv = HEADER
                + "# legacy CITA ids\n"
                + "8801,CITA,1,first\n"
                + "8802,NOT_A_LEAGUE,1,\n"
                + "abc,NSTF,1,\n"
                + "\n"
                + "8803,nstf,,lower-case key\n";

        int applied = seeder.seed(new StringReader(csv));

        assertThat(applied).isEqualTo(2);
        assertThat(mapping(8801L).getCurrentLeagueId()).isEqualTo(leagueId("CITA"));
        assertThat(mapping(8803L).getVersion()).isEqualTo(1);
        assertThat(orphanMappingRepository.findByOrphanLeagueId(8802L)).isEmpty();
    }

    @Test
    void onlySameOrNewerVersionsReplaceAMapping() throws Exception {
        seeder.seed(new StringReader(HEADER + "8810,NSTF,2,current\n"));

        assertThat(seeder.seed(new StringReader(HEADER + "8810,CITA,1,stale\n"))).isZero();
        assertThat(mapping(8810L).getCurrentLeagueId()).isEqualTo(leagueId("NSTF"));

        assertThat(seeder.seed(new StringReader(HEADER + "8810,NSTF,2,current\n"))).isZero();

        assertThat(seeder.seed(new StringReader(HEADER + "8810,CNSWPL,3,moved\n"))).isEqualTo(1);
        OrphanMapping moved = mapping(8810L);
        assertThat(moved.getCurrentLeagueId()).isEqualTo(leagueId("CNSWPL"));
        assertThat(moved.getVersion()).isEqualTo(3);
        assertThat(moved.getNote()).isEqualTo("moved");
    }
}
