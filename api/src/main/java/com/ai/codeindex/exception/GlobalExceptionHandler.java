package com.ai.codeindex.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiError> handleJobNotFound(JobNotFoundException e, WebRequest request) {
        log.warn("[ExceptionHandler] {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND", e.getMessage(), request,
                Map.of("jobId", e.getJobId().toString()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleInvalidRequest(RuntimeException e, WebRequest request) {
        log.warn("[ExceptionHandler] Invalid request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage(), request, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e, WebRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        String message = fields.isEmpty()
                ? "Request validation failed"
                : fields.values().iterator().next().toString();
        log.warn("[ExceptionHandler] Validation failed: {}", fields);
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message, request, fields);
    }

    @ExceptionHandler(SearchUnavailableException.class)
    public ResponseEntity<ApiError> handleSearchUnavailable(SearchUnavailableException e, WebRequest request) {
        log.error("[ExceptionHandler] Search unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "SEARCH_UNAVAILABLE", e.getMessage(), request, null);
    }

    @ExceptionHandler(CredentialUnavailableException.class)
    public ResponseEntity<ApiError> handleCredentialUnavailable(CredentialUnavailableException e, WebRequest request) {
        log.error("[ExceptionHandler] Credential unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "CREDENTIAL_UNAVAILABLE", e.getMessage(), request,
                Map.of("hint", "Check GET /credentials/status for the supervisor state"));
    }

    @ExceptionHandler(EmbeddingProviderException.class)
    public ResponseEntity<ApiError> handleEmbeddingUnavailable(EmbeddingProviderException e, WebRequest request) {
        log.error("[ExceptionHandler] Embedding provider unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "EMBEDDING_UNAVAILABLE",
                "Embedding endpoint is down or not answering", request,
                Map.of("originalError", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler({CheckpointStoreException.class, IndexStorageException.class})
    public ResponseEntity<ApiError> handleStorage(RuntimeException e, WebRequest request) {
        log.error("[ExceptionHandler] Storage failure: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_UNAVAILABLE", e.getMessage(), request, null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException e, WebRequest request) {
        log.error("[ExceptionHandler] ResponseStatusException: status={}, reason={}", e.getStatusCode(), e.getReason());

        ApiError error = new ApiError(
                OffsetDateTime.now(),
                e.getStatusCode().value(),
                HttpStatus.valueOf(e.getStatusCode().value()).getReasonPhrase(),
                "API_ERROR",
                e.getReason() != null ? e.getReason() : e.getMessage(),
                getRequestPath(request),
                null);

        return ResponseEntity.status(e.getStatusCode()).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleNotReadable(HttpMessageNotReadableException e, WebRequest request) {
        log.error("[ExceptionHandler] HttpMessageNotReadableException: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_PAYLOAD", "Invalid request payload", request,
                Map.of("details", String.valueOf(e.getMostSpecificCause().getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception e, WebRequest request) {
        log.error("[ExceptionHandler] Unexpected error: ", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred: " + e.getMessage(), request, null);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String code, String message,
                                             WebRequest request, Map<String, Object> details) {
        ApiError error = new ApiError(
                OffsetDateTime.now(),
                status.value(),
                status.getReasonPhrase(),
                code,
                message,
                getRequestPath(request),
                details);
        return ResponseEntity.status(status).body(error);
    }

    private String getRequestPath(WebRequest request) {
        if (request instanceof ServletWebRequest) {
            return ((ServletWebRequest) request).getRequest().getRequestURI();
        }
        return null;
    }
}
