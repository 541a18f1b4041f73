package br.com.fantasydraft.backend.dto;

public record PickResult(
        Long pickId,
        Long teamId,
        String entityId,
        String entityName,
        int cost,
        int pickOrder,
        int roundNumber,
        int budgetRemaining,
        Integer currentTurn,
        Integer currentRound,
        boolean draftCompleted) {
}
