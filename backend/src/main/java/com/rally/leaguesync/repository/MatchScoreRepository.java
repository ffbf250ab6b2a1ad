package com.rally.leaguesync.repository;

import com.rally.leaguesync.model.MatchScore;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface MatchScoreRepository extends JpaRepository<MatchScore, Long> {
    Optional<MatchScore> findFirstByLeagueIdAndMatchKeyOrderByIdDesc(Long leagueId, String matchKey);
}
