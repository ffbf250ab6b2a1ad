package com.rally.leaguesync.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "import_run", indexes = {
        @Index(name = "idx_import_run_started", columnList = "started_at")
})
public class ImportRun {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "league_key", length = 64, nullable = false)
    private String leagueKey;

    @Column(name = "run_type", length = 32, nullable = false)
    private String runType; // PLAYERS, SCHEDULES, MATCHES, STATS, FULL, VALIDATE

    @Column(length = 32, nullable = false)
    private String status = "IN_PROGRESS";

    @Column(name = "partial_run", nullable = false)
    private boolean partialRun;

    @Column(name = "rows_total")
    private Integer rowsTotal = 0;

    @Column(name = "rows_success")
    private Integer rowsSuccess = 0;

    @Column(name = "rows_failed")
    private Integer rowsFailed = 0;

    @Column(length = 2000)
    private String params;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "created_by", length = 100)
    private String createdBy; // cli, api or scheduler

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getLeagueKey() { return leagueKey; }
    public void setLeagueKey(String leagueKey) { this.leagueKey = leagueKey; }
    public String getRunType() { return runType; }
    public void setRunType(String runType) { this.runType = runType; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public boolean isPartialRun() { return partialRun; }
    public void setPartialRun(boolean partialRun) { this.partialRun = partialRun; }
    public Integer getRowsTotal() { return rowsTotal; }
    public void setRowsTotal(Integer rowsTotal) { this.rowsTotal = rowsTotal; }
    public Integer getRowsSuccess() { return rowsSuccess; }
    public void setRowsSuccess(Integer rowsSuccess) { this.rowsSuccess = rowsSuccess; }
    public Integer getRowsFailed() { return rowsFailed; }
    public void setRowsFailed(Integer rowsFailed) { this.rowsFailed = rowsFailed; }
    public String getParams() { return params; }
    public void setParams(String params) { this.params = params; }
    public String getFailureReason() { return failureReason; }
    public void setFailureReason(String failureReason) { this.failureReason = failureReason; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
}
