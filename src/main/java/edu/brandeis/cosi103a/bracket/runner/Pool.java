package edu.brandeis.cosi103a.bracket.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.bracket.core.Competitor;

import java.util.List;

/**
 * A group of competitors split off before bracket generation.
 */
public record Pool(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("competitors") List<Competitor> competitors
) {}
