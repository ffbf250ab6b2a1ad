package com.rally.leaguesync.service;

import com.rally.leaguesync.model.RunState;

import java.util.ArrayList;
import java.util.List;

/**
 * Findings of one integrity sweep. Counters are exact, the issue list is capped at the sample limit.
 */
public class ValidationReport {

    public static class ValidationIssue {
        public enum Level { ERROR, WARNING }
        private final Level level;
        private final String check;
        private final String message;

        public ValidationIssue(Level level, String check, String message) {
            this.level = level;
            this.check = check;
            this.message = message;
        }
        public Level getLevel() { return level; }
        public String getCheck() { return check; }
        public String getMessage() { return message; }

        @Override
        public String toString() { return level + " [" + check + "] " + message; }
    }

    private final boolean repairEnabled;
    private final int sampleLimit;
    private final List<ValidationIssue> issues = new ArrayList<>();
    private int errorCount;
    private int warningCount;

    private int playersAssigned;
    private int playersFlagged;
    private int orphanRowsRemapped;
    private int unmappedOrphanRows;
    private int orphanTeamRefs;
    private int duplicatesRemoved;
    private int duplicatesRemaining;
    private int teamRefsRepaired;
    private int teamRefsUnresolved;

    public ValidationReport(boolean repairEnabled, int sampleLimit) {
        this.repairEnabled = repairEnabled;
        this.sampleLimit = sampleLimit;
    }

    void error(String check, String message) {
        errorCount++;
        add(new ValidationIssue(ValidationIssue.Level.ERROR, check, message));
    }

    void warn(String check, String message) {
        warningCount++;
        add(new ValidationIssue(ValidationIssue.Level.WARNING, check, message));
    }

    private void add(ValidationIssue issue) {
        if (issues.size() < sampleLimit) issues.add(issue);
    }

    void playerAssigned() { playersAssigned++; }
    void playerFlagged() { playersFlagged++; }
    void orphanRowsRemapped(int n) { orphanRowsRemapped += n; }
    void unmappedOrphanRows(int n) { unmappedOrphanRows += n; }
    void orphanTeamRefs(int n) { orphanTeamRefs += n; }
    void duplicatesRemoved(int n) { duplicatesRemoved += n; }
    void duplicatesRemaining(int n) { duplicatesRemaining += n; }
    void teamRefRepaired() { teamRefsRepaired++; }
    void teamRefUnresolved() { teamRefsUnresolved++; }

    /** CLEAN only when no error-level finding is left in the data. */
    public RunState outcome() {
        return errorCount == 0 ? RunState.CLEAN : RunState.NEEDS_REPAIR;
    }

    public List<String> errorsAsStrings() {
        return issues.stream().filter(i -> i.getLevel() == ValidationIssue.Level.ERROR).map(ValidationIssue::toString).toList();
    }

    public List<String> warningsAsStrings() {
        return issues.stream().filter(i -> i.getLevel() == ValidationIssue.Level.WARNING).map(ValidationIssue::toString).toList();
    }

    public boolean isRepairEnabled() { return repairEnabled; }
    public List<ValidationIssue> getIssues() { return issues; }
    public int getErrorCount() { return errorCount; }
    public int getWarningCount() { return warningCount; }
    public int getPlayersAssigned() { return playersAssigned; }
    public int getPlayersFlagged() { return playersFlagged; }
    public int getOrphanRowsRemapped() { return orphanRowsRemapped; }
    public int getUnmappedOrphanRows() { return unmappedOrphanRows; }
    public int getOrphanTeamRefs() { return orphanTeamRefs; }
    public int getDuplicatesRemoved() { return duplicatesRemoved; }
    public int getDuplicatesRemaining() { return duplicatesRemaining; }
    public int getTeamRefsRepaired() { return teamRefsRepaired; }
    public int getTeamRefsUnresolved() { return teamRefsUnresolved; }
}
