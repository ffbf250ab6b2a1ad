package com.rally.leaguesync.service.write;

import com.rally.leaguesync.dto.ScheduleRow;
import com.rally.leaguesync.model.ScheduleEntry;
import com.rally.leaguesync.model.SyncTable;
import com.rally.leaguesync.repository.ScheduleEntryRepository;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

@Component
public class ScheduleRowWriter implements RowWriter<ScheduleRow> {

    private final ScheduleEntryRepository scheduleEntryRepository;

    public ScheduleRowWriter(ScheduleEntryRepository scheduleEntryRepository) {
        this.scheduleEntryRepository = scheduleEntryRepository;
    }

    @Override
    public SyncTable table() { return SyncTable.SCHEDULE; }

    @Override
    public RowOutcome write(ScheduleRow row) {
        Optional<ScheduleEntry> existing = scheduleEntryRepository
                .findFirstByLeagueIdAndMatchDateAndHomeTeamAndAwayTeamOrderByIdDesc(
                        row.leagueId(), row.matchDate(), row.homeTeam(), row.awayTeam());
        if (existing.isPresent()) {
            ScheduleEntry e = existing.get();
            boolean changed = !Objects.equals(e.getMatchTime(), row.matchTime())
                    || !Objects.equals(e.getLocation(), row.location())
                    || (row.homeTeamId() != null && !Objects.equals(e.getHomeTeamId(), row.homeTeamId()))
                    || (row.awayTeamId() != null && !Objects.equals(e.getAwayTeamId(), row.awayTeamId()));
            if (changed) {
                apply(e, row);
                scheduleEntryRepository.save(e);
            }
            return RowOutcome.UPDATED;
        }
        ScheduleEntry e = new ScheduleEntry();
        e.setLeagueId(row.leagueId());
        e.setMatchDate(row.matchDate());
        e.setHomeTeam(row.homeTeam());
        e.setAwayTeam(row.awayTeam());
        apply(e, row);
        scheduleEntryRepository.save(e);
        return RowOutcome.INSERTED;
    }

    private static void apply(ScheduleEntry e, ScheduleRow row) {
        e.setMatchTime(row.matchTime());
        e.setLocation(row.location());
        // An unresolved name never wipes an id repaired by the integrity sweep
        if (row.homeTeamId() != null) e.setHomeTeamId(row.homeTeamId());
        if (row.awayTeamId() != null) e.setAwayTeamId(row.awayTeamId());
    }
}
