package com.rally.leaguesync.score;

import java.util.Locale;

public enum Winner {
    HOME, AWAY, UNDETERMINED;

    /** Value stored in {@code match_scores.winner}; null when undetermined. */
    public String storageValue() {
        return this == UNDETERMINED ? null : name().toLowerCase(Locale.ROOT);
    }

    public static Winner fromRecorded(String recorded) {
        if (recorded == null) return UNDETERMINED;
        String v = recorded.trim().toLowerCase(Locale.ROOT);
        if ("home".equals(v)) return HOME;
        if ("away".equals(v)) return AWAY;
        return UNDETERMINED;
    }
}
