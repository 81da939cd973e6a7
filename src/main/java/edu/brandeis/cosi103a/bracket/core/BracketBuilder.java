package edu.brandeis.cosi103a.bracket.core;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * Builds the full round tree from a padded slot list.
 *
 * <p>Every round is created up front. First-round matches against a bye are decided
 * immediately, and those winners already occupy their second-round slots; everything
 * else stays empty until results are propagated.
 */
public final class BracketBuilder {

    private BracketBuilder() {}

    /**
     * @param slots padded slot order, as produced by {@link Seeder#seed(List)}
     * @return a bracket with {@code log2(slots.size())} rounds
     * @throws InvalidInputException if the slot count is not a power of two of at least 2
     */
    public static Bracket build(List<Competitor> slots) {
        if (slots == null || slots.size() < 2 || Integer.bitCount(slots.size()) != 1) {
            throw new InvalidInputException(
                "Slot count must be a power of two >= 2, got " + (slots == null ? 0 : slots.size()));
        }

        int slotCount = slots.size();
        int roundCount = Integer.numberOfTrailingZeros(slotCount);
        ImmutableList.Builder<Round> rounds = ImmutableList.builderWithExpectedSize(roundCount);

        ImmutableList.Builder<Match> firstRound = ImmutableList.builderWithExpectedSize(slotCount / 2);
        for (int i = 0; i < slotCount / 2; i++) {
            Competitor first = slots.get(2 * i);
            Competitor second = slots.get(2 * i + 1);
            Match match = Match.of(1, i + 1, Optional.of(first), Optional.of(second));
            firstRound.add(match.withWinner(walkoverWinner(first, second)));
        }
        ImmutableList<Match> previous = firstRound.build();
        rounds.add(new Round(1, previous));

        for (int round = 2; round <= roundCount; round++) {
            int matchCount = slotCount >> round;
            ImmutableList.Builder<Match> matches = ImmutableList.builderWithExpectedSize(matchCount);
            for (int i = 0; i < matchCount; i++) {
                matches.add(Match.of(round, i + 1,
                    previous.get(2 * i).winner(),
                    previous.get(2 * i + 1).winner()));
            }
            previous = matches.build();
            rounds.add(new Round(round, previous));
        }

        return new Bracket(rounds.build());
    }

    /**
     * The competitor advancing without play: the non-bye side when exactly one side is a bye.
     */
    private static Optional<Competitor> walkoverWinner(Competitor first, Competitor second) {
        if (first.bye() && !second.bye()) {
            return Optional.of(second);
        }
        if (second.bye() && !first.bye()) {
            return Optional.of(first);
        }
        return Optional.empty();
    }
}
