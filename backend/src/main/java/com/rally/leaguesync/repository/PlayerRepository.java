package com.rally.leaguesync.repository;

import com.rally.leaguesync.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PlayerRepository extends JpaRepository<Player, Long> {
    Optional<Player> findByExternalIdAndLeagueId(String externalId, Long leagueId);
}
