package edu.brandeis.cosi103a.bracket.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Optional;

/**
 * A competitor occupying one bracket slot.
 *
 * @param id     unique, stable identifier
 * @param name   display name
 * @param seed   optional pre-assigned ranking (lower is stronger)
 * @param poolId optional pool the competitor was assigned to
 * @param bye    true for synthetic walkover entries created by the {@link Seeder}
 */
public record Competitor(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("seed") Optional<Integer> seed,
    @JsonProperty("poolId") Optional<String> poolId,
    @JsonProperty("bye") boolean bye
) {

    /**
     * Id prefix reserved for byes. Real competitors must not use it.
     */
    public static final String BYE_ID_PREFIX = "bye-";

    public static final String BYE_NAME = "BYE";

    /**
     * Creates an unseeded real competitor.
     */
    public static Competitor of(String id, String name) {
        return new Competitor(id, name, Optional.empty(), Optional.empty(), false);
    }

    /**
     * Creates a seeded real competitor.
     */
    public static Competitor seeded(String id, String name, int seed) {
        return new Competitor(id, name, Optional.of(seed), Optional.empty(), false);
    }

    /**
     * Creates the bye with the given 1-based generation number.
     */
    public static Competitor bye(int number) {
        return new Competitor(BYE_ID_PREFIX + number, BYE_NAME, Optional.empty(), Optional.empty(), true);
    }

    /**
     * Derives an id from a display name: lowercased (root locale), non-alphanumerics replaced by '-'.
     */
    public static String idFromName(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "-");
    }

    public static boolean isReservedId(String id) {
        return id != null && id.startsWith(BYE_ID_PREFIX);
    }

    public Competitor withPool(String newPoolId) {
        return new Competitor(id, name, seed, Optional.of(newPoolId), bye);
    }
}
