package eu.virtualparadox.docassist.api.dto;

import java.time.Instant;

public record SessionResponse(String sessionId, Instant createdAt) {
}
