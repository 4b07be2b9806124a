package eu.virtualparadox.docassist.api;

import eu.virtualparadox.docassist.exception.ConfigException;
import eu.virtualparadox.docassist.exception.DocAssistException;
import eu.virtualparadox.docassist.exception.EmbeddingException;
import eu.virtualparadox.docassist.exception.GatewayException;
import eu.virtualparadox.docassist.exception.NotReadyException;
import eu.virtualparadox.docassist.exception.SessionNotFoundException;
import eu.virtualparadox.docassist.exception.UnsupportedFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions to {@code {"error": {"code", "message", "details"}}} responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DocAssistException.class)
    public ResponseEntity<Map<String, Object>> handleDocAssist(final DocAssistException exception) {
        final HttpStatus status = statusOf(exception);
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", exception.getCode(), exception.getMessage(), exception);
        } else {
            log.debug("Request rejected with {}: {}", exception.getCode(), exception.getMessage());
        }
        return body(status, exception.getCode(), exception.getMessage(), Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(final IllegalArgumentException exception) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", exception.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(final MethodArgumentNotValidException exception) {
        final Map<String, Object> details = new LinkedHashMap<>();
        for (final FieldError error : exception.getBindingResult().getFieldErrors()) {
            details.put(error.getField(), error.getDefaultMessage());
        }
        return body(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", details);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<Map<String, Object>> handleMissingPart(final MissingServletRequestPartException exception) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", exception.getMessage(),
                Map.of("part", exception.getRequestPartName()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(final Exception exception) {
        log.error("Unexpected failure", exception);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected failure",
                Map.of("reason", String.valueOf(exception.getMessage())));
    }

    static HttpStatus statusOf(final DocAssistException exception) {
        if (exception instanceof ConfigException || exception instanceof UnsupportedFormatException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (exception instanceof NotReadyException) {
            return HttpStatus.CONFLICT;
        }
        if (exception instanceof SessionNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (exception instanceof GatewayException || exception instanceof EmbeddingException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ResponseEntity<Map<String, Object>> body(final HttpStatus status,
                                                            final String code,
                                                            final String message,
                                                            final Map<String, Object> details) {
        final Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);
        error.put("details", details);
        return ResponseEntity.status(status).body(Map.of("error", error));
    }
}
