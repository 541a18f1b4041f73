package br.com.fantasydraft.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Categorias de erro expostas aos clientes. CONCURRENCY indica que o cliente
 * deve recarregar o estado e tentar de novo.
 */
public enum ErrorCategory {
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    FORBIDDEN(HttpStatus.FORBIDDEN, false),
    PRECONDITION(HttpStatus.CONFLICT, false),
    VALIDATION(HttpStatus.UNPROCESSABLE_ENTITY, false),
    CONCURRENCY(HttpStatus.CONFLICT, true),
    UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true);

    private final HttpStatus httpStatus;
    private final boolean retryable;

    ErrorCategory(HttpStatus httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
