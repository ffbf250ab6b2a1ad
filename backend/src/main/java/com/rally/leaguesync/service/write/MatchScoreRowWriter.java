package com.rally.leaguesync.service.write;

import com.rally.leaguesync.dto.MatchRow;
import com.rally.leaguesync.model.MatchScore;
import com.rally.leaguesync.model.SyncTable;
import com.rally.leaguesync.repository.MatchScoreRepository;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

@Component
public class MatchScoreRowWriter implements RowWriter<MatchRow> {

    private final MatchScoreRepository matchScoreRepository;

    public MatchScoreRowWriter(MatchScoreRepository matchScoreRepository) {
        this.matchScoreRepository = matchScoreRepository;
    }

    @Override
    public SyncTable table() { return SyncTable.MATCH_SCORES; }

    @Override
    public RowOutcome write(MatchRow row) {
        Optional<MatchScore> existing = matchScoreRepository.findFirstByLeagueIdAndMatchKeyOrderByIdDesc(row.leagueId(), row.matchKey());
        if (existing.isPresent()) {
            MatchScore m = existing.get();
            if (changed(m, row)) {
                apply(m, row);
                matchScoreRepository.save(m);
            }
            return RowOutcome.UPDATED;
        }
        MatchScore m = new MatchScore();
        m.setLeagueId(row.leagueId());
        m.setMatchKey(row.matchKey());
        apply(m, row);
        matchScoreRepository.save(m);
        return RowOutcome.INSERTED;
    }

    private static boolean changed(MatchScore m, MatchRow row) {
        return !Objects.equals(m.getMatchDate(), row.matchDate())
                || !Objects.equals(m.getHomeTeam(), row.homeTeam())
                || !Objects.equals(m.getAwayTeam(), row.awayTeam())
                || (row.homeTeamId() != null && !Objects.equals(m.getHomeTeamId(), row.homeTeamId()))
                || (row.awayTeamId() != null && !Objects.equals(m.getAwayTeamId(), row.awayTeamId()))
                || !Objects.equals(m.getLine(), row.line())
                || !Objects.equals(m.getHomePlayer1Id(), row.homePlayer1Id())
                || !Objects.equals(m.getHomePlayer2Id(), row.homePlayer2Id())
                || !Objects.equals(m.getAwayPlayer1Id(), row.awayPlayer1Id())
                || !Objects.equals(m.getAwayPlayer2Id(), row.awayPlayer2Id())
                || !Objects.equals(m.getScores(), row.scores())
                || !Objects.equals(m.getWinner(), row.winner());
    }

    private static void apply(MatchScore m, MatchRow row) {
        m.setMatchDate(row.matchDate());
        m.setHomeTeam(row.homeTeam());
        m.setAwayTeam(row.awayTeam());
        if (row.homeTeamId() != null) m.setHomeTeamId(row.homeTeamId());
        if (row.awayTeamId() != null) m.setAwayTeamId(row.awayTeamId());
        m.setLine(row.line());
        m.setHomePlayer1Id(row.homePlayer1Id());
        m.setHomePlayer2Id(row.homePlayer2Id());
        m.setAwayPlayer1Id(row.awayPlayer1Id());
        m.setAwayPlayer2Id(row.awayPlayer2Id());
        m.setScores(row.scores());
        m.setWinner(row.winner());
    }
}
