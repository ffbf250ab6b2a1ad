package com.rally.leaguesync.score;

/**
 * Scoring conventions of a league.
 *
 * @param superTiebreakAlways       a third set is always a match tiebreak, whatever its values
 * @param lowDataQuality            the league's score data is unreliable; short sets suppress the winner
 * @param incompleteMaxGames        sets with both sides below this many games count as short
 * @param incompleteMaxDifferential short sets with at most this game differential look unfinished
 */
public record LeagueScoringRules(boolean superTiebreakAlways,
                                 boolean lowDataQuality,
                                 int incompleteMaxGames,
                                 int incompleteMaxDifferential) {

    public static LeagueScoringRules standard() {
        return new LeagueScoringRules(false, false, 6, 2);
    }
}
