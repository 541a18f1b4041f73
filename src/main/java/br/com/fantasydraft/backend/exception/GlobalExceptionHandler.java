package br.com.fantasydraft.backend.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String MESSAGE_KEY = "message";

    @ExceptionHandler(DraftException.class)
    public ResponseEntity<Map<String, Object>> handleDraftException(DraftException ex) {
        ErrorCategory category = ex.getCategory();

        Map<String, Object> details = new HashMap<>();
        details.put(MESSAGE_KEY, ex.getMessage());
        details.put("retryable", category.isRetryable());
        if (category == ErrorCategory.CONCURRENCY) {
            details.put("refetch", true);
        }

        Map<String, Object> response = createErrorResponse(
                ex.getCode().getDefaultMessage(),
                category.getHttpStatus().value(),
                details);
        response.put("code", ex.getCode().name());
        response.put("category", category.name());

        if (category == ErrorCategory.UNAVAILABLE) {
            log.error("❌ [Draft] {}: {}", ex.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("⚠️ [Draft] {}: {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(category.getHttpStatus()).body(response);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(
            MethodArgumentNotValidException ex) {

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> response = createErrorResponse(
                "Erro de validação",
                HttpStatus.BAD_REQUEST.value(),
                errors);

        log.warn("Erro de validação: {}", errors);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolationException(
            ConstraintViolationException ex) {

        Map<String, String> errors = new HashMap<>();
        for (ConstraintViolation<?> violation : ex.getConstraintViolations()) {
            errors.put(violation.getPropertyPath().toString(), violation.getMessage());
        }

        Map<String, Object> response = createErrorResponse(
                "Erro de validação de parâmetros",
                HttpStatus.BAD_REQUEST.value(),
                errors);

        log.warn("Erro de validação de constraint: {}", errors);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex) {

        String error = String.format("Parâmetro '%s' deve ser do tipo %s",
                ex.getName(),
                ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "desconhecido");

        Map<String, Object> response = createErrorResponse(
                "Erro de tipo de parâmetro",
                HttpStatus.BAD_REQUEST.value(),
                Map.of("parameter", error));

        log.warn("Erro de tipo de parâmetro: {}", error);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatusException(ResponseStatusException ex) {
        Map<String, Object> response = createErrorResponse(
                "Requisição rejeitada",
                ex.getStatusCode().value(),
                Map.of(MESSAGE_KEY, ex.getReason() != null ? ex.getReason() : ex.getMessage()));

        log.warn("Requisição rejeitada ({}): {}", ex.getStatusCode().value(), ex.getReason());
        return ResponseEntity.status(ex.getStatusCode()).body(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(
            IllegalArgumentException ex) {

        Map<String, Object> response = createErrorResponse(
                "Argumento inválido",
                HttpStatus.BAD_REQUEST.value(),
                Map.of(MESSAGE_KEY, String.valueOf(ex.getMessage())));

        log.warn("Argumento inválido: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {

        Map<String, Object> response = createErrorResponse(
                "Erro interno do servidor",
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                Map.of(MESSAGE_KEY, "Ocorreu um erro inesperado"));

        log.error("Erro não tratado", ex);
        return ResponseEntity.internalServerError().body(response);
    }

    private Map<String, Object> createErrorResponse(String title, int status, Object details) {
        Map<String, Object> response = new HashMap<>();
        response.put("title", title);
        response.put("status", status);
        response.put("timestamp", Instant.now());
        response.put("details", details);
        return response;
    }
}
