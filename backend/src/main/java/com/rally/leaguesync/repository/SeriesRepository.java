package com.rally.leaguesync.repository;

import com.rally.leaguesync.model.Series;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SeriesRepository extends JpaRepository<Series, Long> {
    Optional<Series> findByNameAndLeagueId(String name, Long leagueId);
    List<Series> findByLeagueIdOrderByIdAsc(Long leagueId);
}
