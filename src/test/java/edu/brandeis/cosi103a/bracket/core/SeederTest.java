package edu.brandeis.cosi103a.bracket.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SeederTest {

    @Test
    void seed_padsToSmallestPowerOfTwo() {
        for (int n = 2; n <= 40; n++) {
            List<Competitor> slots = Seeder.seed(competitors(n));
            int expected = Integer.highestOneBit(n) == n ? n : Integer.highestOneBit(n) * 2;

            assertEquals(expected, slots.size(), "Slot count for " + n + " competitors");
            long byes = slots.stream().filter(Competitor::bye).count();
            assertEquals(expected - n, byes, "Bye count for " + n + " competitors");
        }
    }

    @Test
    void seed_keepsEveryRealCompetitorOnceAndInOrder() {
        for (int n = 2; n <= 40; n++) {
            List<Competitor> input = competitors(n);
            List<Competitor> real = Seeder.seed(input).stream().filter(c -> !c.bye()).toList();
            assertEquals(input, real, "Real competitors for " + n);
        }
    }

    @Test
    void seed_byesAreDistinctAndFlagged() {
        List<Competitor> slots = Seeder.seed(competitors(11));

        Set<String> byeIds = new HashSet<>();
        for (Competitor slot : slots) {
            if (slot.bye()) {
                assertTrue(Competitor.isReservedId(slot.id()), "Bye id should use the reserved prefix: " + slot.id());
                assertEquals(Competitor.BYE_NAME, slot.name());
                assertTrue(byeIds.add(slot.id()), "Duplicate bye " + slot.id());
            }
        }
        assertEquals(5, byeIds.size());
    }

    // Pinned slot orders: any change to bye placement must update these deliberately

    @Test
    void seed_fiveCompetitors_pinnedOrder() {
        assertEquals(
            List.of("bye-1", "a", "b", "c", "bye-2", "d", "bye-3", "e"),
            ids(Seeder.seed(competitors(5))));
    }

    @Test
    void seed_threeCompetitors_pinnedOrder() {
        assertEquals(List.of("a", "b", "bye-1", "c"), ids(Seeder.seed(competitors(3))));
    }

    @Test
    void seed_sixCompetitors_pinnedOrder() {
        assertEquals(
            List.of("bye-1", "a", "b", "c", "bye-2", "d", "e", "f"),
            ids(Seeder.seed(competitors(6))));
    }

    @Test
    void seed_sevenCompetitors_pinnedOrder() {
        assertEquals(
            List.of("a", "b", "c", "d", "bye-1", "e", "f", "g"),
            ids(Seeder.seed(competitors(7))));
    }

    @Test
    void seed_nineCompetitors_pinnedOrder() {
        // The lower half ends with two trailing byes, which pair up in the last match
        assertEquals(
            List.of("bye-1", "a", "b", "c", "d", "bye-2", "e", "bye-3",
                    "bye-4", "f", "g", "h", "bye-5", "i", "bye-6", "bye-7"),
            ids(Seeder.seed(competitors(9))));
    }

    @Test
    void seed_tenCompetitors_pinnedOrder() {
        assertEquals(
            List.of("bye-1", "a", "b", "c", "d", "bye-2", "e", "bye-3",
                    "bye-4", "f", "g", "h", "i", "bye-5", "j", "bye-6"),
            ids(Seeder.seed(competitors(10))));
    }

    @Test
    void seed_powerOfTwoNeedsNoByes() {
        assertEquals(List.of("a", "b"), ids(Seeder.seed(competitors(2))));
        assertEquals(List.of("a", "b", "c", "d", "e", "f", "g", "h"), ids(Seeder.seed(competitors(8))));
    }

    @Test
    void seed_rejectsEmptyList() {
        assertThrows(InvalidInputException.class, () -> Seeder.seed(List.of()));
        assertThrows(InvalidInputException.class, () -> Seeder.seed(null));
    }

    @Test
    void nextPowerOfTwo_values() {
        assertEquals(1, Seeder.nextPowerOfTwo(1));
        assertEquals(2, Seeder.nextPowerOfTwo(2));
        assertEquals(4, Seeder.nextPowerOfTwo(3));
        assertEquals(8, Seeder.nextPowerOfTwo(5));
        assertEquals(16, Seeder.nextPowerOfTwo(16));
        assertEquals(32, Seeder.nextPowerOfTwo(17));
    }

    @Test
    void byeCount_values() {
        assertEquals(0, Seeder.byeCount(4));
        assertEquals(3, Seeder.byeCount(5));
        assertEquals(7, Seeder.byeCount(9));
    }

    static List<Competitor> competitors(int count) {
        List<Competitor> result = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String id = i < 26 ? String.valueOf((char) ('a' + i)) : "p" + i;
            result.add(Competitor.of(id, id.toUpperCase()));
        }
        return result;
    }

    static List<String> ids(List<Competitor> slots) {
        return slots.stream().map(Competitor::id).toList();
    }
}
