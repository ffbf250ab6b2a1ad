package com.rally.leaguesync.service;

import com.rally.leaguesync.model.RunState;
import com.rally.leaguesync.model.RunType;
import com.rally.leaguesync.service.write.WriteStats;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one league run. Always produced, whatever stage the run stopped at.
 */
public class RunReport {
    private final String leagueKey;
    private final RunType runType;
    private Long runId;
    private RunState state = RunState.IN_PROGRESS;
    private final List<RunState> stages = new ArrayList<>();
    private boolean partial;
    private String failureReason;
    private final Instant startedAt = Instant.now();
    private Instant finishedAt;

    private Map<String, Integer> documentCounts = new LinkedHashMap<>();
    private ResolutionStats resolution;
    private ConsolidationResult consolidation;
    private final List<WriteStats> writes = new ArrayList<>();
    private ValidationReport validation;
    private int pointsFilled;

    public RunReport(String leagueKey, RunType runType) {
        this.leagueKey = leagueKey;
        this.runType = runType;
    }

    void advance(RunState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run for " + leagueKey + " already ended in " + state);
        }
        stages.add(next);
        state = next;
    }

    void fail(String reason) {
        if (state.isTerminal()) return;
        failureReason = reason;
        stages.add(RunState.FAILED);
        state = RunState.FAILED;
    }

    void finish() { finishedAt = Instant.now(); }
    void markPartial() { partial = true; }
    void setRunId(Long runId) { this.runId = runId; }
    void setDocumentCounts(Map<String, Integer> documentCounts) { this.documentCounts = documentCounts; }
    void setResolution(ResolutionStats resolution) { this.resolution = resolution; }
    void setConsolidation(ConsolidationResult consolidation) { this.consolidation = consolidation; }
    void addWrite(WriteStats stats) { writes.add(stats); }
    void setValidation(ValidationReport validation) { this.validation = validation; }
    void setPointsFilled(int pointsFilled) { this.pointsFilled = pointsFilled; }

    public int getRowsTotal() { return writes.stream().mapToInt(WriteStats::getTotal).sum(); }
    public int getRowsSuccess() { return writes.stream().mapToInt(w -> w.getInserted() + w.getUpdated()).sum(); }
    public int getWriteErrors() { return writes.stream().mapToInt(WriteStats::getErrored).sum(); }
    public int getRowsFailed() {
        int skippedRecords = resolution == null ? 0 : resolution.getSkipped();
        return skippedRecords + getWriteErrors();
    }

    public String getLeagueKey() { return leagueKey; }
    public RunType getRunType() { return runType; }
    public Long getRunId() { return runId; }
    public RunState getState() { return state; }
    public List<RunState> getStages() { return stages; }
    public boolean isPartial() { return partial; }
    public String getFailureReason() { return failureReason; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public Map<String, Integer> getDocumentCounts() { return documentCounts; }
    public ResolutionStats getResolution() { return resolution; }
    public ConsolidationResult getConsolidation() { return consolidation; }
    public List<WriteStats> getWrites() { return writes; }
    public ValidationReport getValidation() { return validation; }
    /** Series stats rows whose missing points were computed from match scores. */
    public int getPointsFilled() { return pointsFilled; }
}
