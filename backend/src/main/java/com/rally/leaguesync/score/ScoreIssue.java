package com.rally.leaguesync.score;

public enum ScoreIssue {
    EMPTY_SCORE,
    INVALID_SET_FORMAT,
    IMPOSSIBLE_SCORE,
    TIED_SET,
    INCOMPLETE_SET,
    UNUSUAL_SET_COUNT,
    SUSPECTED_INCOMPLETE_MATCH
}
