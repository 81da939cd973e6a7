package edu.brandeis.cosi103a.bracket.core;

/**
 * One of the two competitor positions in a match.
 */
public enum SlotPosition {
    FIRST,
    SECOND;

    /**
     * The slot of the parent match that the winner of the match at {@code matchIndex}
     * (0-based within its round) feeds into.
     */
    public static SlotPosition feedingFrom(int matchIndex) {
        return matchIndex % 2 == 0 ? FIRST : SECOND;
    }
}
