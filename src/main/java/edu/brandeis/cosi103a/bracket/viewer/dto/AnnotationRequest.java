package edu.brandeis.cosi103a.bracket.viewer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for match annotations; blank text clears the annotation.
 */
public record AnnotationRequest(
    @JsonProperty("text") String text
) {}
