package com.rally.leaguesync.service;

import com.rally.leaguesync.dto.RowProblem;
import com.rally.leaguesync.score.ScoreIssue;
import com.rally.leaguesync.score.WinnerReconciler;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Counts and bounded samples gathered while resolving one league's records. */
public class ResolutionStats {
    private final int sampleLimit;
    private int resolved;
    private int skipped;
    private int unresolvedTeamRefs;
    private int seriesCreated;
    private int clubsCreated;
    private int teamsCreated;
    private final Map<MatchStrategy, Integer> strategies = new EnumMap<>(MatchStrategy.class);
    private final Map<WinnerReconciler.Outcome, Integer> winnerOutcomes = new EnumMap<>(WinnerReconciler.Outcome.class);
    private final Map<ScoreIssue, Integer> scoreIssues = new EnumMap<>(ScoreIssue.class);
    private final List<RowProblem> skippedSamples = new ArrayList<>();
    private final List<String> unresolvedSamples = new ArrayList<>();

    public ResolutionStats(int sampleLimit) {
        this.sampleLimit = sampleLimit;
    }

    public void resolvedRecord() { resolved++; }

    public void skip(String document, SourceRecord record, String reason) {
        skipped++;
        if (skippedSamples.size() < sampleLimit) {
            skippedSamples.add(new RowProblem(document, record.getRowNumber(), record.payload(), reason));
        }
    }

    public void teamLookup(Resolution resolution, String sourceName) {
        strategies.merge(resolution.strategy(), 1, Integer::sum);
        if (!resolution.resolved()) {
            unresolvedTeamRefs++;
            if (unresolvedSamples.size() < sampleLimit && !unresolvedSamples.contains(sourceName)) {
                unresolvedSamples.add(sourceName);
            }
        }
    }

    public void series(ResolvedRef ref) { if (ref.created()) seriesCreated++; }
    public void club(ResolvedRef ref) { if (ref.created()) clubsCreated++; }
    public void team(ResolvedRef ref) { if (ref.created()) teamsCreated++; }

    public void winner(WinnerReconciler.Outcome outcome, List<ScoreIssue> issues) {
        winnerOutcomes.merge(outcome, 1, Integer::sum);
        for (ScoreIssue issue : issues) scoreIssues.merge(issue, 1, Integer::sum);
    }

    public int getResolved() { return resolved; }
    public int getSkipped() { return skipped; }
    public int getUnresolvedTeamRefs() { return unresolvedTeamRefs; }
    public int getSeriesCreated() { return seriesCreated; }
    public int getClubsCreated() { return clubsCreated; }
    public int getTeamsCreated() { return teamsCreated; }
    public Map<MatchStrategy, Integer> getStrategies() { return strategies; }
    public Map<WinnerReconciler.Outcome, Integer> getWinnerOutcomes() { return winnerOutcomes; }
    public Map<ScoreIssue, Integer> getScoreIssues() { return scoreIssues; }
    public List<RowProblem> getSkippedSamples() { return skippedSamples; }
    public List<String> getUnresolvedSamples() { return unresolvedSamples; }
}
