package br.com.fantasydraft.backend.dto;

import br.com.fantasydraft.backend.domain.entity.DraftStatus;

public record UndoResult(
        Long pickId,
        Long teamId,
        String entityId,
        int refundedCost,
        int budgetRemaining,
        int currentTurn,
        int currentRound,
        DraftStatus status) {
}
