package com.rally.leaguesync.service.write;

import com.rally.leaguesync.dto.PlayerRow;
import com.rally.leaguesync.model.Player;
import com.rally.leaguesync.model.SyncTable;
import com.rally.leaguesync.repository.ClubRepository;
import com.rally.leaguesync.repository.LeagueRepository;
import com.rally.leaguesync.repository.PlayerRepository;
import com.rally.leaguesync.repository.SeriesRepository;
import com.rally.leaguesync.repository.TeamRepository;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

@Component
public class PlayerRowWriter implements RowWriter<PlayerRow> {

    private final PlayerRepository playerRepository;
    private final LeagueRepository leagueRepository;
    private final ClubRepository clubRepository;
    private final SeriesRepository seriesRepository;
    private final TeamRepository teamRepository;

    public PlayerRowWriter(PlayerRepository playerRepository,
                           LeagueRepository leagueRepository,
                           ClubRepository clubRepository,
                           SeriesRepository seriesRepository,
                           TeamRepository teamRepository) {
        this.playerRepository = playerRepository;
        this.leagueRepository = leagueRepository;
        this.clubRepository = clubRepository;
        this.seriesRepository = seriesRepository;
        this.teamRepository = teamRepository;
    }

    @Override
    public SyncTable table() { return SyncTable.PLAYERS; }

    @Override
    public RowOutcome write(PlayerRow row) {
        Optional<Player> existing = playerRepository.findByExternalIdAndLeagueId(row.externalId(), row.leagueId());
        if (existing.isPresent()) {
            Player p = existing.get();
            if (changed(p, row)) {
                apply(p, row);
                playerRepository.save(p);
            }
            return RowOutcome.UPDATED;
        }
        Player p = new Player();
        p.setExternalId(row.externalId());
        p.setLeague(leagueRepository.getReferenceById(row.leagueId()));
        apply(p, row);
        playerRepository.save(p);
        return RowOutcome.INSERTED;
    }

    private void apply(Player p, PlayerRow row) {
        p.setFirstName(row.firstName());
        p.setLastName(row.lastName());
        p.setClub(clubRepository.getReferenceById(row.clubId()));
        p.setSeries(seriesRepository.getReferenceById(row.seriesId()));
        // Keep a team assigned earlier (e.g. by the integrity sweep) when the source names none
        if (row.teamId() != null) p.setTeam(teamRepository.getReferenceById(row.teamId()));
        p.setPti(row.pti());
        p.setWins(row.wins());
        p.setLosses(row.losses());
        // Career columns may come from player_history.json instead
        if (row.careerWins() != null) p.setCareerWins(row.careerWins());
        if (row.careerLosses() != null) p.setCareerLosses(row.careerLosses());
        if (row.careerWinPct() != null) p.setCareerWinPct(row.careerWinPct());
        p.setActive(true);
    }

    private static boolean changed(Player p, PlayerRow row) {
        return !Objects.equals(p.getFirstName(), row.firstName())
                || !Objects.equals(p.getLastName(), row.lastName())
                || !Objects.equals(p.getClub() == null ? null : p.getClub().getId(), row.clubId())
                || !Objects.equals(p.getSeries() == null ? null : p.getSeries().getId(), row.seriesId())
                || (row.teamId() != null && !Objects.equals(p.getTeam() == null ? null : p.getTeam().getId(), row.teamId()))
                || !Objects.equals(p.getPti(), row.pti())
                || !Objects.equals(p.getWins(), row.wins())
                || !Objects.equals(p.getLosses(), row.losses())
                || (row.careerWins() != null && !Objects.equals(p.getCareerWins(), row.careerWins()))
                || (row.careerLosses() != null && !Objects.equals(p.getCareerLosses(), row.careerLosses()))
                || (row.careerWinPct() != null && !Objects.equals(p.getCareerWinPct(), row.careerWinPct()))
                || !p.isActive();
    }
}
