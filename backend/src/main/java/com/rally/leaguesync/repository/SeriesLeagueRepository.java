package com.rally.leaguesync.repository;

import com.rally.leaguesync.model.SeriesLeague;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SeriesLeagueRepository extends JpaRepository<SeriesLeague, Long> {
    boolean existsBySeriesIdAndLeagueId(Long seriesId, Long leagueId);
}
