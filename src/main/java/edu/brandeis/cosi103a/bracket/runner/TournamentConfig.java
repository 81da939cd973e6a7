package edu.brandeis.cosi103a.bracket.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.bracket.core.Competitor;

import java.util.List;

/**
 * Top-level bracket configuration parsed from CLI args.
 *
 * @param name        tournament name, also the output subdirectory
 * @param competitors real competitors in input order
 * @param winners     results to apply after building, in order
 * @param pools       whether to split competitors into pools and record them
 */
public record TournamentConfig(
    @JsonProperty("name") String name,
    @JsonProperty("competitors") List<Competitor> competitors,
    @JsonProperty("winners") List<WinnerDeclaration> winners,
    @JsonProperty("pools") boolean pools
) {

    /**
     * A declared result: {@code competitorId} won {@code matchId}.
     */
    public record WinnerDeclaration(
        @JsonProperty("matchId") String matchId,
        @JsonProperty("competitorId") String competitorId
    ) {}
}
