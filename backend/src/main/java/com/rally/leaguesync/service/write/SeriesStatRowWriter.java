package com.rally.leaguesync.service.write;

import com.rally.leaguesync.dto.StatRow;
import com.rally.leaguesync.model.SeriesStat;
import com.rally.leaguesync.model.SyncTable;
import com.rally.leaguesync.repository.SeriesStatRepository;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

@Component
public class SeriesStatRowWriter implements RowWriter<StatRow> {

    private final SeriesStatRepository seriesStatRepository;

    public SeriesStatRowWriter(SeriesStatRepository seriesStatRepository) {
        this.seriesStatRepository = seriesStatRepository;
    }

    @Override
    public SyncTable table() { return SyncTable.SERIES_STATS; }

    @Override
    public RowOutcome write(StatRow row) {
        if (row.teamId() == null) return RowOutcome.SKIPPED;
        Optional<SeriesStat> existing = seriesStatRepository.findFirstByLeagueIdAndTeamIdOrderByIdDesc(row.leagueId(), row.teamId());
        if (existing.isPresent()) {
            SeriesStat s = existing.get();
            if (changed(s, row)) {
                apply(s, row);
                seriesStatRepository.save(s);
            }
            return RowOutcome.UPDATED;
        }
        SeriesStat s = new SeriesStat();
        s.setLeagueId(row.leagueId());
        s.setTeamId(row.teamId());
        apply(s, row);
        seriesStatRepository.save(s);
        return RowOutcome.INSERTED;
    }

    private static boolean changed(SeriesStat s, StatRow row) {
        return !Objects.equals(s.getSeriesId(), row.seriesId())
                || !Objects.equals(s.getSeries(), row.series())
                || !Objects.equals(s.getTeam(), row.team())
                || !Objects.equals(s.getPoints(), row.points())
                || !Objects.equals(s.getMatchesWon(), row.matchesWon())
                || !Objects.equals(s.getMatchesLost(), row.matchesLost())
                || !Objects.equals(s.getMatchesTied(), row.matchesTied())
                || !Objects.equals(s.getLinesWon(), row.linesWon())
                || !Objects.equals(s.getLinesLost(), row.linesLost())
                || !Objects.equals(s.getSetsWon(), row.setsWon())
                || !Objects.equals(s.getSetsLost(), row.setsLost())
                || !Objects.equals(s.getGamesWon(), row.gamesWon())
                || !Objects.equals(s.getGamesLost(), row.gamesLost());
    }

    private static void apply(SeriesStat s, StatRow row) {
        s.setSeriesId(row.seriesId());
        s.setSeries(row.series());
        s.setTeam(row.team());
        s.setPoints(row.points());
        s.setMatchesWon(row.matchesWon());
        s.setMatchesLost(row.matchesLost());
        s.setMatchesTied(row.matchesTied());
        s.setLinesWon(row.linesWon());
        s.setLinesLost(row.linesLost());
        s.setSetsWon(row.setsWon());
        s.setSetsLost(row.setsLost());
        s.setGamesWon(row.gamesWon());
        s.setGamesLost(row.gamesLost());
    }
}
