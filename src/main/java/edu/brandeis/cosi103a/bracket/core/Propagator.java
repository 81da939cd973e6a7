package edu.brandeis.cosi103a.bracket.core;

import com.google.common.collect.ImmutableList;

import java.util.Optional;

/**
 * Records match results and advances winners into the next round.
 *
 * <p>Malformed references are no-ops rather than errors: an unknown match id or a match
 * against a bye returns the input bracket itself. Only the immediate parent match is
 * invalidated when its input changes; see {@link StaleWinnerDetector} for finding
 * later-round winners that no longer fit their slots.
 */
public final class Propagator {

    private Propagator() {}

    /**
     * Declares {@code winnerId} the winner of {@code matchId}.
     *
     * <p>A {@code winnerId} naming neither slot competitor clears the winner (and the
     * parent slot it fed).
     *
     * @return the updated bracket, or {@code bracket} itself when nothing changes
     */
    public static Bracket applyWinner(Bracket bracket, String matchId, String winnerId) {
        for (int r = 0; r < bracket.rounds().size(); r++) {
            ImmutableList<Match> matches = bracket.rounds().get(r).matches();
            for (int m = 0; m < matches.size(); m++) {
                if (matches.get(m).id().equals(matchId)) {
                    return applyAt(bracket, r, m, winnerId);
                }
            }
        }
        return bracket;
    }

    private static Bracket applyAt(Bracket bracket, int roundIndex, int matchIndex, String winnerId) {
        Match match = bracket.rounds().get(roundIndex).matches().get(matchIndex);

        // Byes are settled at build time
        if (match.hasBye()) {
            return bracket;
        }

        Optional<Competitor> winner = resolve(match, winnerId);
        Bracket updated = bracket.withMatchAt(roundIndex, matchIndex, match.withWinner(winner));

        if (roundIndex < bracket.roundCount() - 1) {
            int parentIndex = matchIndex / 2;
            Match parent = updated.rounds().get(roundIndex + 1).matches().get(parentIndex);
            Match refreshed = parent
                .withSlot(SlotPosition.feedingFrom(matchIndex), winner)
                .withWinner(Optional.empty());
            updated = updated.withMatchAt(roundIndex + 1, parentIndex, refreshed);
        }
        return updated;
    }

    private static Optional<Competitor> resolve(Match match, String winnerId) {
        for (SlotPosition position : SlotPosition.values()) {
            Optional<Competitor> candidate = match.slot(position);
            if (candidate.map(c -> c.id().equals(winnerId)).orElse(false)) {
                return candidate;
            }
        }
        return Optional.empty();
    }
}
