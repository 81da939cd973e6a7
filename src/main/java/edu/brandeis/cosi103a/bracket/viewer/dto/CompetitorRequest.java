package edu.brandeis.cosi103a.bracket.viewer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * DTO for a competitor in tournament requests. The id is derived from the name when omitted.
 */
public record CompetitorRequest(
    @JsonProperty("id") String id,
    @JsonProperty("name") @NotBlank String name,
    @JsonProperty("seed") @Min(1) Integer seed
) {}
