package com.rally.leaguesync.repository;

import com.rally.leaguesync.model.ScheduleEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Optional;

public interface ScheduleEntryRepository extends JpaRepository<ScheduleEntry, Long> {
    // Newest row wins while legacy duplicates are still present
    Optional<ScheduleEntry> findFirstByLeagueIdAndMatchDateAndHomeTeamAndAwayTeamOrderByIdDesc(
            Long leagueId, LocalDate matchDate, String homeTeam, String awayTeam);
}
