package edu.brandeis.cosi103a.bracket.runner;

import edu.brandeis.cosi103a.bracket.core.Competitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a competitor list into consecutive pools sized by a threshold table.
 */
public final class PoolDistributor {

    private PoolDistributor() {}

    /**
     * Pool count for a field size: up to 8 competitors share one pool, up to 16 use 2,
     * up to 32 use 4, anything larger uses 8.
     */
    public static int poolCount(int competitorCount) {
        if (competitorCount <= 8) {
            return 1;
        } else if (competitorCount <= 16) {
            return 2;
        } else if (competitorCount <= 32) {
            return 4;
        }
        return 8;
    }

    /**
     * Distributes competitors in order, {@code ceil(n / pools)} per pool.
     * Trailing pools may be short or empty; every competitor is copied with its pool id set.
     */
    public static List<Pool> distribute(List<Competitor> competitors) {
        int n = competitors.size();
        int pools = poolCount(n);
        int perPool = (n + pools - 1) / pools;

        List<Pool> result = new ArrayList<>(pools);
        for (int p = 0; p < pools; p++) {
            String poolId = "pool-" + (p + 1);
            int from = Math.min(n, p * perPool);
            int to = Math.min(n, (p + 1) * perPool);
            List<Competitor> members = new ArrayList<>(to - from);
            for (Competitor c : competitors.subList(from, to)) {
                members.add(c.withPool(poolId));
            }
            result.add(new Pool(poolId, "Pool " + (p + 1), List.copyOf(members)));
        }
        return result;
    }
}
