package com.rally.leaguesync.controller;

import com.rally.leaguesync.dto.ImportErrorDTO;
import com.rally.leaguesync.dto.ImportRunSummaryDTO;
import com.rally.leaguesync.model.ImportRun;
import com.rally.leaguesync.model.RunType;
import com.rally.leaguesync.repository.ImportErrorRepository;
import com.rally.leaguesync.repository.ImportRunRepository;
import com.rally.leaguesync.service.LeagueImportOrchestrator;
import com.rally.leaguesync.service.RunInProgressException;
import com.rally.leaguesync.service.RunReport;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class ImportRunController {

    private final LeagueImportOrchestrator orchestrator;
    private final ImportRunRepository importRunRepository;
    private final ImportErrorRepository importErrorRepository;

    public ImportRunController(LeagueImportOrchestrator orchestrator,
                               ImportRunRepository importRunRepository,
                               ImportErrorRepository importErrorRepository) {
        this.orchestrator = orchestrator;
        this.importRunRepository = importRunRepository;
        this.importErrorRepository = importErrorRepository;
    }

    @PostMapping("/leagues/{leagueKey}/runs")
    public RunReport startRun(@PathVariable("leagueKey") String leagueKey,
                              @RequestParam(value = "type", defaultValue = "FULL") String type,
                              @RequestParam(value = "repair", defaultValue = "true") boolean repair) {
        RunType runType;
        try {
            runType = RunType.parse(type);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        try {
            return orchestrator.run(leagueKey, runType, repair, "api");
        } catch (RunInProgressException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @PostMapping("/leagues/{leagueKey}/runs/cancel")
    public Map<String, Object> cancelRun(@PathVariable("leagueKey") String leagueKey) {
        return Map.of("leagueKey", leagueKey, "cancellationRequested", orchestrator.cancel(leagueKey));
    }

    @GetMapping("/runs")
    public List<ImportRunSummaryDTO> listRuns(@RequestParam(value = "page", defaultValue = "0") int page,
                                              @RequestParam(value = "size", defaultValue = "20") int size) {
        if (page < 0 || size <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "page must be >= 0 and size must be > 0");
        }
        Page<ImportRun> p = importRunRepository.findAllByOrderByStartedAtDesc(PageRequest.of(page, size));
        return p.map(this::toDto).getContent();
    }

    @GetMapping("/runs/{id}/errors")
    public List<ImportErrorDTO> listErrors(@PathVariable("id") Long id) {
        if (!importRunRepository.existsById(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Import run " + id + " not found");
        }
        return importErrorRepository.findByImportRunId(id).stream().map(e -> new ImportErrorDTO(
                e.getId(),
                e.getTableName(),
                e.getRowNumber(),
                e.getReason(),
                e.getPayload()
        )).toList();
    }

    private ImportRunSummaryDTO toDto(ImportRun run) {
        return new ImportRunSummaryDTO(
                run.getId(),
                run.getLeagueKey(),
                run.getRunType(),
                run.getStatus(),
                run.isPartialRun(),
                run.getRowsTotal(),
                run.getRowsSuccess(),
                run.getRowsFailed(),
                run.getFailureReason(),
                run.getCreatedBy(),
                run.getStartedAt(),
                run.getFinishedAt()
        );
    }
}
