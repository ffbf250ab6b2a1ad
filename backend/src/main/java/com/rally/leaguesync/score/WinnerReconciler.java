package com.rally.leaguesync.score;

/**
 * Settles the winner to store for a match given the calculated result and the winner the
 * source recorded. A determined calculation always wins; the recorded value is only a fallback.
 */
public final class WinnerReconciler {

    public enum Outcome { CONSISTENT, IMPROVED, CORRECTED, RECORDED_FALLBACK, UNDETERMINED }

    public record Reconciliation(Winner winner, Outcome outcome) {}

    private WinnerReconciler() {}

    public static Reconciliation reconcile(ScoreResult result, String recordedWinner) {
        Winner recorded = Winner.fromRecorded(recordedWinner);
        if (result != null && result.determined()) {
            Winner calculated = result.winner();
            if (recorded == Winner.UNDETERMINED) return new Reconciliation(calculated, Outcome.IMPROVED);
            if (recorded == calculated) return new Reconciliation(calculated, Outcome.CONSISTENT);
            return new Reconciliation(calculated, Outcome.CORRECTED);
        }
        if (recorded != Winner.UNDETERMINED) return new Reconciliation(recorded, Outcome.RECORDED_FALLBACK);
        return new Reconciliation(Winner.UNDETERMINED, Outcome.UNDETERMINED);
    }
}
