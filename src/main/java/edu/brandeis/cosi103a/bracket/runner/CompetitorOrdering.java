package edu.brandeis.cosi103a.bracket.runner;

import edu.brandeis.cosi103a.bracket.core.Competitor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders competitors before seeding. The seeder itself never reorders.
 */
public final class CompetitorOrdering {

    private static final Comparator<Competitor> SEED_ORDER =
        Comparator.comparing((Competitor c) -> c.seed().orElse(null), Comparator.nullsLast(Comparator.naturalOrder()));

    private CompetitorOrdering() {}

    /**
     * Sorts by seed, lowest first; unseeded competitors keep their relative order at the end.
     */
    public static List<Competitor> bySeed(List<Competitor> competitors) {
        List<Competitor> ordered = new ArrayList<>(competitors);
        ordered.sort(SEED_ORDER);
        return ordered;
    }
}
