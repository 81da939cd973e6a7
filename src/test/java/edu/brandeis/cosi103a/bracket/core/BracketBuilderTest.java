package edu.brandeis.cosi103a.bracket.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static edu.brandeis.cosi103a.bracket.core.SeederTest.competitors;
import static org.junit.jupiter.api.Assertions.*;

class BracketBuilderTest {

    @Test
    void build_createsLog2RoundsWithHalvingMatchCounts() {
        for (int k = 1; k <= 6; k++) {
            int slotCount = 1 << k;
            Bracket bracket = BracketBuilder.build(competitors(slotCount));

            assertEquals(k, bracket.roundCount(), "Rounds for " + slotCount + " slots");
            assertEquals(slotCount, bracket.slotCount());
            for (int r = 1; r <= k; r++) {
                Round round = bracket.rounds().get(r - 1);
                assertEquals(r, round.number());
                assertEquals(1 << (k - r), round.matches().size(), "Matches in round " + r);
            }
            assertEquals(slotCount - 1, bracket.totalMatches());
        }
    }

    @Test
    void build_pairsConsecutiveSlotsAndNumbersMatches() {
        Bracket bracket = BracketBuilder.build(competitors(4));

        Match first = bracket.rounds().get(0).matches().get(0);
        Match second = bracket.rounds().get(0).matches().get(1);
        Match last = bracket.rounds().get(1).matches().get(0);

        assertEquals("r1-m1", first.id());
        assertEquals("a", first.first().orElseThrow().id());
        assertEquals("b", first.second().orElseThrow().id());
        assertEquals("r1-m2", second.id());
        assertEquals("c", second.first().orElseThrow().id());
        assertEquals("d", second.second().orElseThrow().id());
        assertEquals("r2-m1", last.id());
        assertEquals(2, last.round());
    }

    @Test
    void build_withoutByes_decidesNothing() {
        Bracket bracket = BracketBuilder.build(competitors(8));

        assertEquals(0, bracket.decidedMatches());
        for (Match match : bracket.rounds().get(1).matches()) {
            assertTrue(match.first().isEmpty());
            assertTrue(match.second().isEmpty());
        }
    }

    @Test
    void build_byeMatchesAreDecidedAndAdvanced() {
        // Slots: bye-1 a | b c | bye-2 d | bye-3 e
        Bracket bracket = BracketBuilder.build(Seeder.seed(competitors(5)));

        assertEquals("a", winnerId(bracket, "r1-m1"));
        assertTrue(bracket.findMatch("r1-m2").orElseThrow().winner().isEmpty());
        assertEquals("d", winnerId(bracket, "r1-m3"));
        assertEquals("e", winnerId(bracket, "r1-m4"));

        Match semiOne = bracket.findMatch("r2-m1").orElseThrow();
        assertEquals("a", semiOne.first().orElseThrow().id());
        assertTrue(semiOne.second().isEmpty());
        assertTrue(semiOne.winner().isEmpty());

        Match semiTwo = bracket.findMatch("r2-m2").orElseThrow();
        assertEquals("d", semiTwo.first().orElseThrow().id());
        assertEquals("e", semiTwo.second().orElseThrow().id());

        Match finalMatch = bracket.findMatch("r3-m1").orElseThrow();
        assertTrue(finalMatch.first().isEmpty());
        assertTrue(finalMatch.second().isEmpty());

        assertEquals(3, bracket.decidedMatches());
        assertEquals(43, bracket.completionPercentage());
    }

    @Test
    void build_matchOfTwoByesHasNoWinner() {
        Bracket bracket = BracketBuilder.build(Seeder.seed(competitors(9)));

        Match doubleBye = bracket.findMatch("r1-m8").orElseThrow();
        assertTrue(doubleBye.first().orElseThrow().bye());
        assertTrue(doubleBye.second().orElseThrow().bye());
        assertTrue(doubleBye.winner().isEmpty());

        Match parent = bracket.findMatch("r2-m4").orElseThrow();
        assertEquals("i", parent.first().orElseThrow().id());
        assertTrue(parent.second().isEmpty());
    }

    @Test
    void build_rejectsSlotCountsThatAreNotPowersOfTwo() {
        assertThrows(InvalidInputException.class, () -> BracketBuilder.build(competitors(3)));
        assertThrows(InvalidInputException.class, () -> BracketBuilder.build(competitors(6)));
        assertThrows(InvalidInputException.class, () -> BracketBuilder.build(competitors(1)));
        assertThrows(InvalidInputException.class, () -> BracketBuilder.build(List.of()));
    }

    @Test
    void build_isDeterministic() {
        List<Competitor> slots = Seeder.seed(competitors(13));
        assertEquals(BracketBuilder.build(slots), BracketBuilder.build(slots));
    }

    @Test
    void champion_emptyUntilFinalDecided() {
        Bracket bracket = BracketBuilder.build(competitors(2));
        assertEquals(Optional.empty(), bracket.champion());
    }

    private static String winnerId(Bracket bracket, String matchId) {
        return bracket.findMatch(matchId).orElseThrow().winner().orElseThrow().id();
    }
}
