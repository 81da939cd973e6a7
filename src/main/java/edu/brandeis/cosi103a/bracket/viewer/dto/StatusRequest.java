package edu.brandeis.cosi103a.bracket.viewer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.bracket.viewer.TournamentStatus;
import jakarta.validation.constraints.NotNull;

public record StatusRequest(
    @JsonProperty("status") @NotNull TournamentStatus status
) {}
