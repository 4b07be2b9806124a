package eu.virtualparadox.docassist.api.dto;

public record SummaryResponse(String summary) {
}
