package eu.virtualparadox.docassist.api.dto;

import jakarta.validation.constraints.NotBlank;

public record QuestionRequest(@NotBlank String question) {
}
