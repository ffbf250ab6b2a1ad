package com.rally.leaguesync.repository;

import com.rally.leaguesync.model.SeriesStat;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SeriesStatRepository extends JpaRepository<SeriesStat, Long> {
    Optional<SeriesStat> findFirstByLeagueIdAndTeamIdOrderByIdDesc(Long leagueId, Long teamId);
}
