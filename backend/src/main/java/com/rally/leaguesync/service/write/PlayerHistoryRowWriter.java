package com.rally.leaguesync.service.write;

import com.rally.leaguesync.dto.PlayerHistoryRow;
import com.rally.leaguesync.model.Player;
import com.rally.leaguesync.model.PlayerHistory;
import com.rally.leaguesync.model.SyncTable;
import com.rally.leaguesync.repository.PlayerHistoryRepository;
import com.rally.leaguesync.repository.PlayerRepository;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Applies a player's career totals and upserts the rating points by (player, date).
 * Rows for players not in the league are skipped, so players must be written first.
 */
@Component
public class PlayerHistoryRowWriter implements RowWriter<PlayerHistoryRow> {

    private final PlayerRepository playerRepository;
    private final PlayerHistoryRepository playerHistoryRepository;

    public PlayerHistoryRowWriter(PlayerRepository playerRepository, PlayerHistoryRepository playerHistoryRepository) {
        this.playerRepository = playerRepository;
        this.playerHistoryRepository = playerHistoryRepository;
    }

    @Override
    public SyncTable table() { return SyncTable.PLAYER_HISTORY; }

    @Override
    public RowOutcome write(PlayerHistoryRow row) {
        Optional<Player> found = playerRepository.findByExternalIdAndLeagueId(row.externalId(), row.leagueId());
        if (found.isEmpty()) return RowOutcome.SKIPPED;
        Player player = found.get();

        if (row.hasCareerTotals()) applyCareer(player, row);

        boolean inserted = false;
        for (PlayerHistoryRow.RatingPoint point : row.ratings()) {
            Optional<PlayerHistory> existing = playerHistoryRepository
                    .findFirstByPlayerIdAndRecordDateOrderByIdDesc(player.getId(), point.date());
            if (existing.isPresent()) {
                PlayerHistory h = existing.get();
                if (!Objects.equals(h.getEndPti(), point.endPti()) || !Objects.equals(h.getSeries(), point.series())) {
                    h.setEndPti(point.endPti());
                    h.setSeries(point.series());
                    playerHistoryRepository.save(h);
                }
                continue;
            }
            PlayerHistory h = new PlayerHistory();
            h.setPlayerId(player.getId());
            h.setLeagueId(row.leagueId());
            h.setRecordDate(point.date());
            h.setEndPti(point.endPti());
            h.setSeries(point.series());
            playerHistoryRepository.save(h);
            inserted = true;
        }
        return inserted ? RowOutcome.INSERTED : RowOutcome.UPDATED;
    }

    private void applyCareer(Player player, PlayerHistoryRow row) {
        int wins = row.careerWins() != null ? row.careerWins() : 0;
        int losses = row.careerLosses() != null ? row.careerLosses() : 0;
        Double pct = careerWinPct(wins, losses);
        if (Objects.equals(player.getCareerWins(), wins)
                && Objects.equals(player.getCareerLosses(), losses)
                && Objects.equals(player.getCareerWinPct(), pct)) {
            return;
        }
        player.setCareerWins(wins);
        player.setCareerLosses(losses);
        player.setCareerWinPct(pct);
        playerRepository.save(player);
    }

    /** Percentage rounded to two decimals, 0 for a player with no matches. */
    static double careerWinPct(int wins, int losses) {
        int total = wins + losses;
        if (total <= 0) return 0.0;
        return Math.round(wins * 10000.0 / total) / 100.0;
    }
}
