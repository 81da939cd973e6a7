package edu.brandeis.cosi103a.bracket.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * One layer of the elimination tree, matches in bracket order.
 */
public record Round(
    @JsonProperty("number") int number,
    @JsonProperty("matches") ImmutableList<Match> matches
) {}
