package com.rally.leaguesync.service.write;

import com.rally.leaguesync.dto.PlayerHistoryRow;
import com.rally.leaguesync.model.Player;
import com.rally.leaguesync.model.PlayerHistory;
import com.rally.leaguesync.repository.PlayerHistoryRepository;
import com.rally.leaguesync.repository.PlayerRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PlayerHistoryRowWriterTest {

    @Mock private PlayerRepository playerRepository;
    @Mock private PlayerHistoryRepository playerHistoryRepository;

    private static final LocalDate DAY = LocalDate.of(2025, 1, 5);

    private PlayerHistoryRow row(Integer wins, Integer losses, List<PlayerHistoryRow.RatingPoint> ratings) {
        return new PlayerHistoryRow(1, "{}", 7L, "nstf-p1", wins, losses, ratings);
    }

    private Player player() {
        Player p = new Player();
        p.setId(42L);
        return p;
    }

    @Test
    void careerWinPctIsRoundedToTwoDecimals() {
        assertThat(PlayerHistoryRowWriter.careerWinPct(2, 1)).isEqualTo(66.67);
        assertThat(PlayerHistoryRowWriter.careerWinPct(1, 2)).isEqualTo(33.33);
        assertThat(PlayerHistoryRowWriter.careerWinPct(3, 0)).isEqualTo(100.0);
        assertThat(PlayerHistoryRowWriter.careerWinPct(0, 0)).isEqualTo(0.0);
    }

    @Test
    void unknownPlayerIsSkipped() {
        when(playerRepository.findByExternalIdAndLeagueId("nstf-p1", 7L)).thenReturn(Optional.empty());
        PlayerHistoryRowWriter writer = new PlayerHistoryRowWriter(playerRepository, playerHistoryRepository);

        RowOutcome outcome = writer.write(row(3, 1, List.of(new PlayerHistoryRow.RatingPoint(DAY, 41.5, "S2"))));

        assertThat(outcome).isEqualTo(RowOutcome.SKIPPED);
        verify(playerHistoryRepository, never()).save(any());
    }

    @Test
    void newRatingPointIsInsertedAndCareerTotalsApplied() {
        Player player = player();
        when(playerRepository.findByExternalIdAndLeagueId("nstf-p1", 7L)).thenReturn(Optional.of(player));
        when(playerHistoryRepository.findFirstByPlayerIdAndRecordDateOrderByIdDesc(42L, DAY)).thenReturn(Optional.empty());
        PlayerHistoryRowWriter writer = new PlayerHistoryRowWriter(playerRepository, playerHistoryRepository);

        RowOutcome outcome = writer.write(row(3, 1, List.of(new PlayerHistoryRow.RatingPoint(DAY, 41.5, "S2"))));

        assertThat(outcome).isEqualTo(RowOutcome.INSERTED);
        assertThat(player.getCareerWins()).isEqualTo(3);
        assertThat(player.getCareerLosses()).isEqualTo(1);
        assertThat(player.getCareerWinPct()).isEqualTo(75.0);
        ArgumentCaptor<PlayerHistory> saved = ArgumentCaptor.forClass(PlayerHistory.class);
        verify(playerHistoryRepository).save(saved.capture());
        assertThat(saved.getValue().getPlayerId()).isEqualTo(42L);
        assertThat(saved.getValue().getLeagueId()).isEqualTo(7L);
        assertThat(saved.getValue().getEndPti()).isEqualTo(41.5);
    }

    @Test
    void unchangedRatingPointIsLeftAsIs() {
        Player player = player();
        PlayerHistory existing = new PlayerHistory();
        existing.setEndPti(41.5);
        existing.setSeries("S2");
        when(playerRepository.findByExternalIdAndLeagueId("nstf-p1", 7L)).thenReturn(Optional.of(player));
        when(playerHistoryRepository.findFirstByPlayerIdAndRecordDateOrderByIdDesc(42L, DAY)).thenReturn(Optional.of(existing));
        PlayerHistoryRowWriter writer = new PlayerHistoryRowWriter(playerRepository, playerHistoryRepository);

        RowOutcome outcome = writer.write(row(null, null, List.of(new PlayerHistoryRow.RatingPoint(DAY, 41.5, "S2"))));

        assertThat(outcome).isEqualTo(RowOutcome.UPDATED);
        verify(playerHistoryRepository, never()).save(any());
        verify(playerRepository, never()).save(any());
        assertThat(player.getCareerWins()).isNull();
    }
}
