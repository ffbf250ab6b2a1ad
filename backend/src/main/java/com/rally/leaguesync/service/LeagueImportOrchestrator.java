package com.rally.leaguesync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rally.leaguesync.config.LeagueSyncProperties;
import com.rally.leaguesync.dto.MatchRow;
import com.rally.leaguesync.dto.PlayerHistoryRow;
import com.rally.leaguesync.dto.PlayerRow;
import com.rally.leaguesync.dto.RowProblem;
import com.rally.leaguesync.dto.ScheduleRow;
import com.rally.leaguesync.dto.SourceRow;
import com.rally.leaguesync.dto.StatRow;
import com.rally.leaguesync.model.ImportError;
import com.rally.leaguesync.model.ImportRun;
import com.rally.leaguesync.model.League;
import com.rally.leaguesync.model.RunState;
import com.rally.leaguesync.model.RunType;
import com.rally.leaguesync.repository.ImportErrorRepository;
import com.rally.leaguesync.repository.ImportRunRepository;
import com.rally.leaguesync.service.write.RowWriter;
import com.rally.leaguesync.service.write.UpsertBatchWriter;
import com.rally.leaguesync.service.write.WriteStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * Drives one league through load, resolve, consolidate, write and validate, recording the run
 * in {@code import_run}. A run for a league that is already running is rejected.
 */
@Service
public class LeagueImportOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(LeagueImportOrchestrator.class);

    private static final int MAX_PAYLOAD = 4000;
    private static final int MAX_REASON = 1000;

    private final LeagueRunRegistry registry;
    private final LeagueDocumentLoader documentLoader;
    private final EntityResolver entityResolver;
    private final SourceRecordResolver recordResolver;
    private final SeriesConsolidationService consolidationService;
    private final UpsertBatchWriter batchWriter;
    private final RowWriter<PlayerRow> playerWriter;
    private final RowWriter<ScheduleRow> scheduleWriter;
    private final RowWriter<MatchRow> matchWriter;
    private final RowWriter<StatRow> statWriter;
    private final RowWriter<PlayerHistoryRow> playerHistoryWriter;
    private final StandingsService standingsService;
    private final IntegrityValidationService validationService;
    private final ImportRunRepository importRunRepository;
    private final ImportErrorRepository importErrorRepository;
    private final ObjectMapper objectMapper;
    private final LeagueSyncProperties properties;
    private final TaskExecutor executor;

    public LeagueImportOrchestrator(LeagueRunRegistry registry,
                                    LeagueDocumentLoader documentLoader,
                                    EntityResolver entityResolver,
                                    SourceRecordResolver recordResolver,
                                    SeriesConsolidationService consolidationService,
                                    UpsertBatchWriter batchWriter,
                                    RowWriter<PlayerRow> playerWriter,
                                    RowWriter<ScheduleRow> scheduleWriter,
                                    RowWriter<MatchRow> matchWriter,
                                    RowWriter<StatRow> statWriter,
                                    RowWriter<PlayerHistoryRow> playerHistoryWriter,
                                    StandingsService standingsService,
                                    IntegrityValidationService validationService,
                                    ImportRunRepository importRunRepository,
                                    ImportErrorRepository importErrorRepository,
                                    ObjectMapper objectMapper,
                                    LeagueSyncProperties properties,
                                    @Qualifier("leagueImportExecutor") TaskExecutor executor) {
        this.registry = registry;
        this.documentLoader = documentLoader;
        this.entityResolver = entityResolver;
        this.recordResolver = recordResolver;
        this.consolidationService = consolidationService;
        this.batchWriter = batchWriter;
        this.playerWriter = playerWriter;
        this.scheduleWriter = scheduleWriter;
        this.matchWriter = matchWriter;
        this.statWriter = statWriter;
        this.playerHistoryWriter = playerHistoryWriter;
        this.standingsService = standingsService;
        this.validationService = validationService;
        this.importRunRepository = importRunRepository;
        this.importErrorRepository = importErrorRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Runs one league to a terminal state.
     *
     * @throws RunInProgressException when the league already has a run in progress
     */
    public RunReport run(String leagueKey, RunType type, boolean repair, String createdBy) {
        RunReport report = new RunReport(leagueKey, type);
        try (LeagueRunRegistry.RunHandle handle = registry.acquire(leagueKey)) {
            ImportRun run = startRun(leagueKey, type, repair, createdBy);
            report.setRunId(run.getId());
            log.info("[IMPORT][RUN] Started run {} type={} league={} repair={}", run.getId(), type, leagueKey, repair);
            try {
                execute(leagueKey, type, repair, handle::isCancelRequested, report);
            } catch (LeagueDataException | ConsolidationException e) {
                log.error("[IMPORT][RUN] Run {} for {} failed: {}", run.getId(), leagueKey, e.getMessage());
                report.fail(e.getMessage());
            } catch (RuntimeException e) {
                log.error("[IMPORT][RUN] Run {} for {} failed unexpectedly", run.getId(), leagueKey, e);
                report.fail("Unexpected error: " + e.getMessage());
            }
            report.finish();
            finishRun(run, report);
        }
        log.info("[IMPORT][RUN] Run {} for {} ended {} partial={} rows total={} success={} failed={}",
                report.getRunId(), leagueKey, report.getState(), report.isPartial(),
                report.getRowsTotal(), report.getRowsSuccess(), report.getRowsFailed());
        return report;
    }

    /**
     * Runs several leagues in parallel on the league executor. A league that is already running
     * yields a FAILED report instead of an exception.
     */
    public List<RunReport> runAll(List<String> leagueKeys, RunType type, boolean repair, String createdBy) {
        List<CompletableFuture<RunReport>> futures = new ArrayList<>();
        for (String key : leagueKeys) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return run(key, type, repair, createdBy);
                } catch (RunInProgressException e) {
                    RunReport rejected = new RunReport(key, type);
                    rejected.fail(e.getMessage());
                    rejected.finish();
                    return rejected;
                }
            }, executor));
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    public boolean cancel(String leagueKey) {
        boolean requested = registry.cancel(leagueKey);
        if (requested) log.info("[IMPORT][RUN] Cancellation requested for {}", leagueKey);
        return requested;
    }

    private void execute(String leagueKey, RunType type, boolean repair, BooleanSupplier cancelled, RunReport report) {
        League league = entityResolver.resolveLeague(leagueKey);
        LeagueDocuments docs = documentLoader.load(league.getLeagueKey(), type);
        report.setDocumentCounts(docs.counts());
        report.advance(RunState.LOADED);

        if (type != RunType.VALIDATE) {
            ResolutionStats resolution = new ResolutionStats(properties.getSampleLimit());
            TeamIndex index = entityResolver.indexTeams(league);
            ResolvedRecords records = recordResolver.resolve(league, docs, index, resolution);
            report.setResolution(resolution);
            report.advance(RunState.RESOLVED);

            ConsolidationResult consolidation = type.needsConsolidation()
                    ? consolidationService.consolidate(league, false)
                    : ConsolidationResult.skipped();
            records = records.remapSeries(consolidation.getSurvivorBySeriesId());
            report.setConsolidation(consolidation);
            report.advance(RunState.CONSOLIDATED);

            if (!writeAll(league, type, records, cancelled, report)) return;
            report.advance(RunState.WRITTEN);
        }

        ValidationReport validation = validationService.validate(league, repair);
        report.setValidation(validation);
        report.advance(RunState.VALIDATED);
        report.advance(validation.outcome());
    }

    /** @return false when the writer halted and the run has failed */
    private boolean writeAll(League league, RunType type, ResolvedRecords records, BooleanSupplier cancelled, RunReport report) {
        if (type.includesPlayers() && !write(records.players(), playerWriter, cancelled, report)) return false;
        if (type.includesPlayers() && !write(records.playerHistory(), playerHistoryWriter, cancelled, report)) return false;
        if (type.includesSchedule() && !write(records.schedule(), scheduleWriter, cancelled, report)) return false;
        if (type.includesMatches() && !write(records.matches(), matchWriter, cancelled, report)) return false;
        if (type.includesStats()) {
            if (!write(records.stats(), statWriter, cancelled, report)) return false;
            if (!writeStandings(league, type, records, cancelled, report)) return false;
        }
        return true;
    }

    // No scraped stats: derive them from the match scores just written. Otherwise fill missing points.
    private boolean writeStandings(League league, RunType type, ResolvedRecords records, BooleanSupplier cancelled,
                                   RunReport report) {
        if (report.isPartial()) return true;
        if (records.stats().isEmpty()) {
            if (!type.includesMatches()) return true;
            log.info("[IMPORT][STANDINGS] {} has no series stats, deriving them from match scores", league.getLeagueKey());
            return write(standingsService.deriveFromMatches(league), statWriter, cancelled, report);
        }
        report.setPointsFilled(standingsService.fillMissingPoints(league));
        return true;
    }

    private <T extends SourceRow> boolean write(List<T> rows, RowWriter<T> writer, BooleanSupplier cancelled, RunReport report) {
        if (report.isPartial()) return true;
        WriteStats stats = batchWriter.write(rows, writer, cancelled, report.getWriteErrors());
        report.addWrite(stats);
        if (stats.isHalted()) {
            report.fail("Write errors reached " + writer.table().tableName() + " and exceeded the run ceiling of "
                    + properties.getErrorCeiling() + " (" + report.getWriteErrors() + " errored, "
                    + stats.getErrored() + " on " + writer.table().tableName() + ")");
            return false;
        }
        if (stats.isCancelled()) report.markPartial();
        return true;
    }

    private ImportRun startRun(String leagueKey, RunType type, boolean repair, String createdBy) {
        ImportRun run = new ImportRun();
        run.setLeagueKey(leagueKey);
        run.setRunType(type.name());
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("repair", repair);
        params.put("batchSize", properties.getBatchSize());
        params.put("errorCeiling", properties.getErrorCeiling());
        params.put("dataDir", properties.getDataDir());
        run.setParams(toJson(params));
        run.setStatus(RunState.IN_PROGRESS.name());
        run.setCreatedBy(createdBy != null ? createdBy : "system");
        run.setStartedAt(Instant.now());
        return importRunRepository.save(run);
    }

    private void finishRun(ImportRun run, RunReport report) {
        run.setStatus(report.getState().name());
        run.setPartialRun(report.isPartial());
        run.setRowsTotal(report.getRowsTotal());
        run.setRowsSuccess(report.getRowsSuccess());
        run.setRowsFailed(report.getRowsFailed());
        run.setFailureReason(truncate(report.getFailureReason(), MAX_REASON));
        run.setFinishedAt(report.getFinishedAt());
        importRunRepository.save(run);

        List<RowProblem> problems = new ArrayList<>();
        if (report.getResolution() != null) problems.addAll(report.getResolution().getSkippedSamples());
        for (WriteStats w : report.getWrites()) problems.addAll(w.getErrorSamples());
        if (problems.isEmpty()) return;

        List<ImportError> errors = new ArrayList<>();
        for (RowProblem p : problems) {
            ImportError ie = new ImportError();
            ie.setImportRun(run);
            ie.setTableName(p.table());
            ie.setRowNumber(p.rowNumber());
            ie.setPayload(truncate(p.payload(), MAX_PAYLOAD));
            ie.setReason(truncate(p.reason(), MAX_REASON));
            ie.setCreatedAt(Instant.now());
            errors.add(ie);
        }
        importErrorRepository.saveAll(errors);
    }

    private String toJson(Map<String, Object> params) {
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize run params", e);
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max);
    }
}
