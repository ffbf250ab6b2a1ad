package com.rally.leaguesync.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class ConsolidationResult {
    private final int conflictGroups;
    private final boolean dryRun;
    private int seriesMerged;
    private final Map<Long, Long> survivorBySeriesId = new HashMap<>();
    private final List<String> samples = new ArrayList<>();

    public ConsolidationResult(int conflictGroups, boolean dryRun) {
        this.conflictGroups = conflictGroups;
        this.dryRun = dryRun;
    }

    public static ConsolidationResult skipped() {
        return new ConsolidationResult(0, false);
    }

    void remap(Long oldId, Long survivorId) {
        survivorBySeriesId.put(oldId, survivorId);
        seriesMerged++;
    }

    void describe(String sample) { samples.add(sample); }

    public int getConflictGroups() { return conflictGroups; }
    public boolean isDryRun() { return dryRun; }
    public int getSeriesMerged() { return seriesMerged; }
    public Map<Long, Long> getSurvivorBySeriesId() { return survivorBySeriesId; }
    public List<String> getSamples() { return samples; }
}
