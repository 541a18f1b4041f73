package br.com.fantasydraft.backend.domain.entity;

/**
 * Tipos de ação registrados no histórico do draft.
 */
public enum DraftActionType {
    PICK,
    PROXY_PICK,
    AUTO_PICK,
    SKIP,
    UNDO,
    AUCTION_WON,
    AUCTION_NO_SALE,
    BUDGET_OVERRIDE,
    START,
    PAUSE,
    RESUME,
    COMPLETE,
    RESET,
    SHUFFLE
}
