package edu.brandeis.cosi103a.bracket.viewer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * DTO for tournament creation requests.
 */
public record CreateTournamentRequest(
    @JsonProperty("tournamentName") @NotBlank String tournamentName,
    @JsonProperty("competitors") @NotNull @Valid List<CompetitorRequest> competitors
) {}
