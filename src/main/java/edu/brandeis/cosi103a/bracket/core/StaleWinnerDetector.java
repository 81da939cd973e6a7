package edu.brandeis.cosi103a.bracket.core;

import com.google.common.collect.ImmutableList;

import java.util.Optional;

/**
 * Finds matches left out of date by a re-decided earlier match.
 *
 * <p>{@link Propagator} refreshes only the immediate parent of a changed match, so a
 * grandparent can keep a slot (and a winner) taken from the old result. A match is
 * reported when a slot differs from the winner of the match feeding it, or when its
 * winner is neither of its slot competitors. Nothing is modified.
 */
public final class StaleWinnerDetector {

    private StaleWinnerDetector() {}

    /**
     * @return ids of out-of-date matches, in round then position order
     */
    public static ImmutableList<String> findStaleMatches(Bracket bracket) {
        ImmutableList.Builder<String> stale = ImmutableList.builder();
        ImmutableList<Round> rounds = bracket.rounds();
        for (int r = 0; r < rounds.size(); r++) {
            ImmutableList<Match> matches = rounds.get(r).matches();
            for (int m = 0; m < matches.size(); m++) {
                Match match = matches.get(m);
                boolean feedersMoved = r > 0 && feedersMoved(match, rounds.get(r - 1).matches(), m);
                if (feedersMoved || !winnerInSlots(match)) {
                    stale.add(match.id());
                }
            }
        }
        return stale.build();
    }

    private static boolean feedersMoved(Match match, ImmutableList<Match> previousRound, int matchIndex) {
        for (int feeder = 2 * matchIndex; feeder <= 2 * matchIndex + 1; feeder++) {
            if (!match.slot(SlotPosition.feedingFrom(feeder)).equals(previousRound.get(feeder).winner())) {
                return true;
            }
        }
        return false;
    }

    private static boolean winnerInSlots(Match match) {
        Optional<Competitor> winner = match.winner();
        return winner.isEmpty() || winner.equals(match.first()) || winner.equals(match.second());
    }
}
