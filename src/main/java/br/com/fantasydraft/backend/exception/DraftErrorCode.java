package br.com.fantasydraft.backend.exception;

import static br.com.fantasydraft.backend.exception.ErrorCategory.*;

public enum DraftErrorCode {
    // Não encontrado
    DRAFT_NOT_FOUND(NOT_FOUND, "Draft não encontrado"),
    TEAM_NOT_FOUND(NOT_FOUND, "Time não encontrado"),
    PARTICIPANT_NOT_FOUND(NOT_FOUND, "Participante não encontrado"),
    AUCTION_NOT_FOUND(NOT_FOUND, "Leilão não encontrado"),
    PICK_NOT_FOUND(NOT_FOUND, "Pick não encontrado"),

    // Permissão
    NOT_IN_DRAFT(FORBIDDEN, "Participante não pertence a um time deste draft"),
    HOST_ONLY(FORBIDDEN, "Apenas o host pode executar esta ação"),
    NOT_YOUR_TURN(FORBIDDEN, "Não é a vez do seu time"),
    NOT_YOUR_NOMINATION(FORBIDDEN, "Não é a vez do seu time nomear"),

    // Pré-condição de estado
    DRAFT_NOT_ACTIVE(PRECONDITION, "Draft não está ativo"),
    DRAFT_NOT_IN_SETUP(PRECONDITION, "Draft não está em configuração"),
    DRAFT_NOT_PAUSED(PRECONDITION, "Draft não está pausado"),
    DRAFT_COMPLETED(PRECONDITION, "Draft já foi concluído"),
    WRONG_DRAFT_TYPE(PRECONDITION, "Operação não suportada por este tipo de draft"),
    NOT_ENOUGH_TEAMS(PRECONDITION, "São necessários pelo menos 2 times"),
    TEAM_WITHOUT_PARTICIPANT(PRECONDITION, "Existe time sem participante"),
    INVALID_DRAFT_ORDER(PRECONDITION, "Ordem do draft inválida"),
    ORPHANED_PARTICIPANT(PRECONDITION, "Participante vinculado a time inexistente"),
    ACTIVE_AUCTION_EXISTS(PRECONDITION, "Já existe um leilão ativo"),
    AUCTION_NOT_ACTIVE(PRECONDITION, "Leilão não está ativo"),
    AUCTION_EXPIRED(PRECONDITION, "Leilão expirado"),
    UNDO_NOT_ENABLED(PRECONDITION, "Undo não está habilitado"),
    UNDO_NO_PICKS(PRECONDITION, "Não há picks para desfazer"),
    UNDO_NOT_RECENT(PRECONDITION, "Apenas o pick mais recente pode ser desfeito"),
    PROXY_PICKING_DISABLED(PRECONDITION, "Pick por procuração desabilitado"),

    // Validação
    DUPLICATE_TEAM_NAME(VALIDATION, "Nome de time já utilizado"),
    INSUFFICIENT_BUDGET(VALIDATION, "Orçamento insuficiente"),
    MAX_PICKS_REACHED(VALIDATION, "Time já atingiu o limite de picks"),
    ENTITY_ALREADY_PICKED(VALIDATION, "Entidade já escolhida"),
    BID_TOO_LOW(VALIDATION, "Lance deve superar o lance atual"),
    ENTITY_NOT_LEGAL(VALIDATION, "Entidade não é legal neste formato"),
    INVALID_INPUT(VALIDATION, "Entrada inválida"),

    // Concorrência
    CONCURRENCY_CONFLICT(CONCURRENCY, "Estado alterado por outra requisição, recarregue e tente novamente"),

    // Indisponível
    COLLABORATOR_UNAVAILABLE(UNAVAILABLE, "Serviço de validação indisponível");

    private final ErrorCategory category;
    private final String defaultMessage;

    DraftErrorCode(ErrorCategory category, String defaultMessage) {
        this.category = category;
        this.defaultMessage = defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
