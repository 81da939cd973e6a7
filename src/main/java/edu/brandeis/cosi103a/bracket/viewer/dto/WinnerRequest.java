package edu.brandeis.cosi103a.bracket.viewer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * DTO declaring the winner of a match by competitor id.
 */
public record WinnerRequest(
    @JsonProperty("competitorId") @NotBlank String competitorId
) {}
