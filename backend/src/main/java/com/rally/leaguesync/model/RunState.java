package com.rally.leaguesync.model;

public enum RunState {
    IN_PROGRESS,
    LOADED,
    RESOLVED,
    CONSOLIDATED,
    WRITTEN,
    VALIDATED,
    CLEAN,
    NEEDS_REPAIR,
    FAILED;

    public boolean isTerminal() {
        return this == CLEAN || this == NEEDS_REPAIR || this == FAILED;
    }
}
