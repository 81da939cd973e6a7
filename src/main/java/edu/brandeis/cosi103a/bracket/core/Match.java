package edu.brandeis.cosi103a.bracket.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * A single match of the elimination tree.
 *
 * <p>Slots and winner are explicit optionals; an absent value means "not yet known".
 * The winner, when present, is always one of the two slot competitors at the time
 * it was recorded.
 *
 * @param id         {@code r{round}-m{position}}, position 1-based within its round
 * @param round      round number, 1 for the first round
 * @param first      competitor in the first slot
 * @param second     competitor in the second slot
 * @param winner     declared (or automatic, for byes) winner
 * @param annotation free-text note attached by the operator
 */
public record Match(
    @JsonProperty("id") String id,
    @JsonProperty("round") int round,
    @JsonProperty("first") Optional<Competitor> first,
    @JsonProperty("second") Optional<Competitor> second,
    @JsonProperty("winner") Optional<Competitor> winner,
    @JsonProperty("annotation") Optional<String> annotation
) {

    public static String idFor(int round, int position) {
        return "r" + round + "-m" + position;
    }

    /**
     * Creates an undecided match with the given slot contents.
     */
    public static Match of(int round, int position, Optional<Competitor> first, Optional<Competitor> second) {
        return new Match(idFor(round, position), round, first, second, Optional.empty(), Optional.empty());
    }

    public Optional<Competitor> slot(SlotPosition position) {
        return position == SlotPosition.FIRST ? first : second;
    }

    public boolean hasBye() {
        return first.map(Competitor::bye).orElse(false) || second.map(Competitor::bye).orElse(false);
    }

    public boolean hasWinner() {
        return winner.isPresent();
    }

    public Match withWinner(Optional<Competitor> newWinner) {
        return new Match(id, round, first, second, newWinner, annotation);
    }

    public Match withSlot(SlotPosition position, Optional<Competitor> competitor) {
        return position == SlotPosition.FIRST
            ? new Match(id, round, competitor, second, winner, annotation)
            : new Match(id, round, first, competitor, winner, annotation);
    }

    public Match withAnnotation(Optional<String> newAnnotation) {
        return new Match(id, round, first, second, winner, newAnnotation);
    }
}
