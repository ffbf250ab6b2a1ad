package com.rally.leaguesync.score;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses comma separated set scores ("6-4, 3-6, 10-7") and decides the winner.
 *
 * Never throws: malformed input yields an {@link Winner#UNDETERMINED} result with the
 * problems listed as {@link ScoreIssue}s.
 */
public final class ScoreParser {

    private static final Pattern TIEBREAK_ANNOTATION = Pattern.compile("\\s*\\[[^\\]]*\\]");
    private static final int SUPER_TIEBREAK_MIN_POINTS = 10;
    private static final int FULL_SET_GAMES = 6;

    private ScoreParser() {}

    public static ScoreResult parse(String raw, LeagueScoringRules rules) {
        LeagueScoringRules r = rules != null ? rules : LeagueScoringRules.standard();
        Set<ScoreIssue> issues = new LinkedHashSet<>();
        if (raw == null || raw.isBlank()) {
            issues.add(ScoreIssue.EMPTY_SCORE);
            return new ScoreResult("", List.of(), false, Winner.UNDETERMINED, 0, 0, List.copyOf(issues));
        }
        String display = raw.trim();
        String cleaned = TIEBREAK_ANNOTATION.matcher(display).replaceAll("");

        List<ScoreResult.SetScore> sets = new ArrayList<>();
        for (String token : cleaned.split(",")) {
            String t = token.trim();
            if (t.isEmpty()) continue;
            ScoreResult.SetScore set = parseSet(t);
            if (set == null) {
                issues.add(ScoreIssue.INVALID_SET_FORMAT);
            } else {
                sets.add(set);
            }
        }
        if (sets.isEmpty()) {
            issues.add(ScoreIssue.INVALID_SET_FORMAT);
            return new ScoreResult(display, List.of(), false, Winner.UNDETERMINED, 0, 0, List.copyOf(issues));
        }
        if (sets.size() != 2 && sets.size() != 3) issues.add(ScoreIssue.UNUSUAL_SET_COUNT);

        boolean superTiebreak = sets.size() == 3 && (r.superTiebreakAlways()
                || sets.get(2).home() >= SUPER_TIEBREAK_MIN_POINTS
                || sets.get(2).away() >= SUPER_TIEBREAK_MIN_POINTS);

        boolean suspectedIncomplete = r.lowDataQuality() && sets.stream().anyMatch(s -> looksUnfinished(s, r));

        int homeSets = 0;
        int awaySets = 0;
        for (int i = 0; i < sets.size(); i++) {
            ScoreResult.SetScore s = sets.get(i);
            boolean deciding = superTiebreak && i == 2;
            if (s.tied()) {
                issues.add(s.home() == FULL_SET_GAMES ? ScoreIssue.IMPOSSIBLE_SCORE : ScoreIssue.TIED_SET);
                continue;
            }
            if (!deciding && s.home() < FULL_SET_GAMES && s.away() < FULL_SET_GAMES) {
                issues.add(ScoreIssue.INCOMPLETE_SET);
            }
            if (s.home() > s.away()) homeSets++;
            else awaySets++;
        }

        Winner winner;
        if (suspectedIncomplete) {
            issues.add(ScoreIssue.SUSPECTED_INCOMPLETE_MATCH);
            winner = Winner.UNDETERMINED;
        } else if (homeSets > awaySets) {
            winner = Winner.HOME;
        } else if (awaySets > homeSets) {
            winner = Winner.AWAY;
        } else {
            winner = Winner.UNDETERMINED;
        }
        return new ScoreResult(display, List.copyOf(sets), superTiebreak, winner, homeSets, awaySets, List.copyOf(issues));
    }

    private static ScoreResult.SetScore parseSet(String token) {
        String[] parts = token.split("-", -1);
        if (parts.length != 2) return null;
        try {
            int home = Integer.parseInt(parts[0].trim());
            int away = Integer.parseInt(parts[1].trim());
            return new ScoreResult.SetScore(home, away);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // Both sides short of a full set and close together, but not an untouched 0-0.
    private static boolean looksUnfinished(ScoreResult.SetScore s, LeagueScoringRules r) {
        if (s.home() == 0 && s.away() == 0) return false;
        return s.home() < r.incompleteMaxGames()
                && s.away() < r.incompleteMaxGames()
                && Math.abs(s.home() - s.away()) <= r.incompleteMaxDifferential();
    }
}
