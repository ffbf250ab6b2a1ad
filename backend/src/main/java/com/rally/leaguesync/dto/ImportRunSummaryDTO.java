package com.rally.leaguesync.dto;

import java.time.Instant;

public class ImportRunSummaryDTO {
    private Long id;
    private String leagueKey;
    private String runType;
    private String status;
    private boolean partial;
    private Integer rowsTotal;
    private Integer rowsSuccess;
    private Integer rowsFailed;
    private String failureReason;
    private String createdBy;
    private Instant startedAt;
    private Instant finishedAt;

    public ImportRunSummaryDTO() {}

    public ImportRunSummaryDTO(Long id, String leagueKey, String runType, String status, boolean partial,
                               Integer rowsTotal, Integer rowsSuccess, Integer rowsFailed, String failureReason,
                               String createdBy, Instant startedAt, Instant finishedAt) {
        this.id = id;
        this.leagueKey = leagueKey;
        this.runType = runType;
        this.status = status;
        this.partial = partial;
        this.rowsTotal = rowsTotal;
        this.rowsSuccess = rowsSuccess;
        this.rowsFailed = rowsFailed;
        this.failureReason = failureReason;
        this.createdBy = createdBy;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getLeagueKey() { return leagueKey; }
    public void setLeagueKey(String leagueKey) { this.leagueKey = leagueKey; }
    public String getRunType() { return runType; }
    public void setRunType(String runType) { this.runType = runType; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public boolean isPartial() { return partial; }
    public void setPartial(boolean partial) { this.partial = partial; }
    public Integer getRowsTotal() { return rowsTotal; }
    public void setRowsTotal(Integer rowsTotal) { this.rowsTotal = rowsTotal; }
    public Integer getRowsSuccess() { return rowsSuccess; }
    public void setRowsSuccess(Integer rowsSuccess) { this.rowsSuccess = rowsSuccess; }
    public Integer getRowsFailed() { return rowsFailed; }
    public void setRowsFailed(Integer rowsFailed) { this.rowsFailed = rowsFailed; }
    public String getFailureReason() { return failureReason; }
    public void setFailureReason(String failureReason) { this.failureReason = failureReason; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
}
