package com.rally.leaguesync.repository;

import com.rally.leaguesync.model.League;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface LeagueRepository extends JpaRepository<League, Long> {
    Optional<League> findByLeagueKey(String leagueKey);
    Optional<League> findByLeagueKeyIgnoreCase(String leagueKey);
    Optional<League> findFirstByLeagueNameIgnoreCase(String leagueName);
}
