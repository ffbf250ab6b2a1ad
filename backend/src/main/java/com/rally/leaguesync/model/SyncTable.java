package com.rally.leaguesync.model;

/**
 * Tables the engine writes or sweeps. SQL built by the engine only ever names these constants.
 */
public enum SyncTable {
    PLAYERS("players", "external_id", false),
    SCHEDULE("schedule", "match_date, home_team, away_team", true),
    MATCH_SCORES("match_scores", "match_key", true),
    SERIES_STATS("series_stats", "team_id", true),
    PLAYER_HISTORY("player_history", "player_id, record_date", true);

    private final String tableName;
    private final String naturalKeyColumns;
    private final boolean volatileRows;

    SyncTable(String tableName, String naturalKeyColumns, boolean volatileRows) {
        this.tableName = tableName;
        this.naturalKeyColumns = naturalKeyColumns;
        this.volatileRows = volatileRows;
    }

    public String tableName() { return tableName; }

    /** Natural key within a league, as a column list. */
    public String naturalKeyColumns() { return naturalKeyColumns; }

    /** Rows re-imported every run, so surplus copies of a natural key can simply be deleted. */
    public boolean isVolatile() { return volatileRows; }
}
