package com.rally.leaguesync.score;

import java.util.List;

public record ScoreResult(String display,
                          List<SetScore> sets,
                          boolean superTiebreak,
                          Winner winner,
                          int homeSetsWon,
                          int awaySetsWon,
                          List<ScoreIssue> issues) {

    public record SetScore(int home, int away) {
        public boolean tied() { return home == away; }
    }

    public int setCount() { return sets.size(); }

    public boolean hasIssue(ScoreIssue issue) { return issues.contains(issue); }

    public boolean determined() { return winner != Winner.UNDETERMINED; }
}
