package com.rally.leaguesync.repository;

import com.rally.leaguesync.model.OrphanMapping;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface OrphanMappingRepository extends JpaRepository<OrphanMapping, Long> {
    Optional<OrphanMapping> findByOrphanLeagueId(Long orphanLeagueId);
}
