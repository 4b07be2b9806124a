package eu.virtualparadox.docassist.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * @param query         research question
 * @param maxIterations optional per-call cap on tool calls; the configured default when absent
 */
public record ResearchRequest(@NotBlank String query, @Min(1) @Max(10) Integer maxIterations) {
}
