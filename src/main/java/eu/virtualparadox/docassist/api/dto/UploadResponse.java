package eu.virtualparadox.docassist.api.dto;

public record UploadResponse(String fileName, int chunks, String message) {
}
