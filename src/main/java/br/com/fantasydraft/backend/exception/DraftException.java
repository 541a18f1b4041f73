package br.com.fantasydraft.backend.exception;

import lombok.Getter;

/**
 * Erro de domínio do draft com código estável. Lançado dentro de métodos
 * transacionais provoca rollback de tudo que foi escrito até ali.
 */
@Getter
public class DraftException extends RuntimeException {

    private final DraftErrorCode code;

    public DraftException(DraftErrorCode code) {
        super(code.getDefaultMessage());
        this.code = code;
    }

    public DraftException(DraftErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public DraftException(DraftErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    public boolean isRetryable() {
        return code.getCategory().isRetryable();
    }

    /**
     * Falhas que o timer trata como no-op: o draft sumiu, não está mais ativo
     * ou outra requisição já avançou o turno.
     */
    public boolean isBenignForTimers() {
        return code == DraftErrorCode.DRAFT_NOT_FOUND
                || code == DraftErrorCode.DRAFT_NOT_ACTIVE
                || code == DraftErrorCode.DRAFT_COMPLETED
                || code == DraftErrorCode.AUCTION_NOT_ACTIVE
                || code == DraftErrorCode.AUCTION_NOT_FOUND
                || code.getCategory() == ErrorCategory.CONCURRENCY;
    }

    public static DraftException of(DraftErrorCode code) {
        return new DraftException(code);
    }
}
