package edu.brandeis.cosi103a.bracket.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.Optional;

/**
 * Immutable single-elimination tree, rounds ordered from first round to final.
 *
 * <p>The structure (number of rounds and matches) is fixed at construction; only
 * winners, later-round slots and annotations change, and each change produces a new value.
 */
public record Bracket(
    @JsonProperty("rounds") ImmutableList<Round> rounds
) {

    public int roundCount() {
        return rounds.size();
    }

    /**
     * Number of first-round slots: twice the first-round match count.
     */
    public int slotCount() {
        return rounds.isEmpty() ? 0 : rounds.get(0).matches().size() * 2;
    }

    public int totalMatches() {
        return rounds.stream().mapToInt(r -> r.matches().size()).sum();
    }

    public int decidedMatches() {
        return (int) rounds.stream()
            .flatMap(r -> r.matches().stream())
            .filter(Match::hasWinner)
            .count();
    }

    /**
     * Share of matches with a winner, as a whole percentage.
     */
    public int completionPercentage() {
        int total = totalMatches();
        if (total == 0) {
            return 0;
        }
        return (int) Math.round(100.0 * decidedMatches() / total);
    }

    public Optional<Match> findMatch(String matchId) {
        return rounds.stream()
            .flatMap(r -> r.matches().stream())
            .filter(m -> m.id().equals(matchId))
            .findFirst();
    }

    /**
     * Winner of the final match, once decided.
     */
    public Optional<Competitor> champion() {
        if (rounds.isEmpty()) {
            return Optional.empty();
        }
        ImmutableList<Match> last = rounds.get(rounds.size() - 1).matches();
        return last.isEmpty() ? Optional.empty() : last.get(0).winner();
    }

    /**
     * Returns a bracket with the match of the same id replaced, or this bracket if no such match exists.
     */
    public Bracket withMatch(Match updated) {
        for (int r = 0; r < rounds.size(); r++) {
            ImmutableList<Match> matches = rounds.get(r).matches();
            for (int m = 0; m < matches.size(); m++) {
                if (matches.get(m).id().equals(updated.id())) {
                    return withMatchAt(r, m, updated);
                }
            }
        }
        return this;
    }

    Bracket withMatchAt(int roundIndex, int matchIndex, Match updated) {
        Round round = rounds.get(roundIndex);
        ImmutableList.Builder<Match> matches = ImmutableList.builderWithExpectedSize(round.matches().size());
        for (int m = 0; m < round.matches().size(); m++) {
            matches.add(m == matchIndex ? updated : round.matches().get(m));
        }
        ImmutableList.Builder<Round> newRounds = ImmutableList.builderWithExpectedSize(rounds.size());
        for (int r = 0; r < rounds.size(); r++) {
            newRounds.add(r == roundIndex ? new Round(round.number(), matches.build()) : rounds.get(r));
        }
        return new Bracket(newRounds.build());
    }
}
