package com.rally.leaguesync.service.write;

import com.rally.leaguesync.dto.RowProblem;
import com.rally.leaguesync.model.SyncTable;

import java.util.ArrayList;
import java.util.List;

public class WriteStats {
    private final SyncTable table;
    private final int sampleLimit;
    private int total;
    private int inserted;
    private int updated;
    private int skipped;
    private int errored;
    private boolean halted;
    private boolean cancelled;
    private final List<RowProblem> errorSamples = new ArrayList<>();

    public WriteStats(SyncTable table, int sampleLimit) {
        this.table = table;
        this.sampleLimit = sampleLimit;
    }

    void count(RowOutcome outcome) {
        switch (outcome) {
            case INSERTED -> inserted++;
            case UPDATED -> updated++;
            case SKIPPED -> skipped++;
        }
    }

    void error(int rowNumber, String payload, String reason) {
        errored++;
        if (errorSamples.size() < sampleLimit) {
            errorSamples.add(new RowProblem(table.tableName(), rowNumber, payload, reason));
        }
    }

    void setTotal(int total) { this.total = total; }
    void markHalted() { this.halted = true; }
    void markCancelled() { this.cancelled = true; }

    public SyncTable getTable() { return table; }
    public int getTotal() { return total; }
    public int getInserted() { return inserted; }
    public int getUpdated() { return updated; }
    public int getSkipped() { return skipped; }
    public int getErrored() { return errored; }
    public boolean isHalted() { return halted; }
    public boolean isCancelled() { return cancelled; }
    public List<RowProblem> getErrorSamples() { return errorSamples; }
}
