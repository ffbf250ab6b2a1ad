package com.rally.leaguesync.repository;

import com.rally.leaguesync.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TeamRepository extends JpaRepository<Team, Long> {
    Optional<Team> findByTeamNameAndLeagueId(String teamName, Long leagueId);
    List<Team> findByLeagueId(Long leagueId);
}
