package com.rally.leaguesync.repository;

import com.rally.leaguesync.model.PlayerHistory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface PlayerHistoryRepository extends JpaRepository<PlayerHistory, Long> {
    Optional<PlayerHistory> findFirstByPlayerIdAndRecordDateOrderByIdDesc(Long playerId, LocalDate recordDate);

    List<PlayerHistory> findByPlayerIdOrderByRecordDateAsc(Long playerId);
}
