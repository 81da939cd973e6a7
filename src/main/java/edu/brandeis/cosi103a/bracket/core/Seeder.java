package edu.brandeis.cosi103a.bracket.core;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Pads a competitor list with byes up to the next power of two and fixes the slot order.
 *
 * Placement rules:
 * - The list is split into an upper and a lower half (upper takes the extra entry when odd)
 * - Byes are split between the halves, the odd one going to the smaller half
 * - Inside a half, byes go right before its first and last entries, any surplus after its end
 *
 * Input order is respected as-is; ordering by seed is up to the caller.
 */
public final class Seeder {

    private Seeder() {}

    /**
     * Produces the padded first-round slot order.
     *
     * @param competitors real competitors in the order seeding should respect
     * @return slots whose length is the smallest power of two not below the competitor count
     * @throws InvalidInputException if {@code competitors} is null or empty
     */
    public static ImmutableList<Competitor> seed(List<Competitor> competitors) {
        if (competitors == null || competitors.isEmpty()) {
            throw new InvalidInputException("Cannot seed an empty competitor list");
        }

        int n = competitors.size();
        int byeCount = byeCount(n);
        boolean oddCount = n % 2 != 0;

        int upperHalfSize = oddCount ? (n + 1) / 2 : n / 2;

        int upperByes;
        if (byeCount % 2 == 0) {
            upperByes = byeCount / 2;
        } else if (oddCount) {
            upperByes = byeCount / 2;
        } else {
            upperByes = byeCount - byeCount / 2;
        }

        List<Competitor> upperHalf = competitors.subList(0, upperHalfSize);
        List<Competitor> lowerHalf = competitors.subList(upperHalfSize, n);

        List<Competitor> byes = new ArrayList<>(byeCount);
        for (int i = 0; i < byeCount; i++) {
            byes.add(Competitor.bye(i + 1));
        }

        ImmutableList.Builder<Competitor> slots = ImmutableList.builderWithExpectedSize(n + byeCount);
        int byeIndex = placeHalf(upperHalf, byes, 0, upperByes, slots);
        // The lower half may draw on whatever remains of the pool
        placeHalf(lowerHalf, byes, byeIndex, byeCount, slots);
        return slots.build();
    }

    /**
     * Writes one half into {@code slots}, drawing byes from {@code byes} until {@code byeLimit}.
     *
     * @return the index of the next unused bye
     */
    private static int placeHalf(List<Competitor> half, List<Competitor> byes, int byeIndex, int byeLimit,
                                 ImmutableList.Builder<Competitor> slots) {
        int last = half.size() - 1;
        for (int i = 0; i < half.size(); i++) {
            if ((i == 0 || i == last) && byeIndex < byeLimit) {
                slots.add(byes.get(byeIndex++));
            }
            slots.add(half.get(i));
        }
        while (byeIndex < byeLimit) {
            slots.add(byes.get(byeIndex++));
        }
        return byeIndex;
    }

    /**
     * Number of byes needed to pad {@code competitorCount} to a power of two.
     */
    public static int byeCount(int competitorCount) {
        return nextPowerOfTwo(competitorCount) - competitorCount;
    }

    /**
     * Smallest power of two greater than or equal to {@code n} (1 for {@code n <= 1}).
     */
    public static int nextPowerOfTwo(int n) {
        if (n <= 1) {
            return 1;
        }
        return Integer.highestOneBit(n - 1) << 1;
    }
}
