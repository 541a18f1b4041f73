package br.com.fantasydraft.backend.dto;

public record TurnAdvanceResult(
        Long draftId,
        int previousTurn,
        int currentTurn,
        int currentRound,
        boolean draftCompleted) {
}
