package br.com.fantasydraft.backend.dto;

public record AutoSkipResult(Outcome outcome, Long draftId, Integer turn, Long teamId, String entityId,
        String reason) {

    public enum Outcome {
        AUTO_PICKED,
        SKIPPED,
        NOOP
    }

    public static AutoSkipResult noop(Long draftId, Integer turn, String reason) {
        return new AutoSkipResult(Outcome.NOOP, draftId, turn, null, null, reason);
    }

    public static AutoSkipResult skipped(Long draftId, Integer turn, Long teamId, String reason) {
        return new AutoSkipResult(Outcome.SKIPPED, draftId, turn, teamId, null, reason);
    }

    public static AutoSkipResult autoPicked(Long draftId, Integer turn, Long teamId, String entityId) {
        return new AutoSkipResult(Outcome.AUTO_PICKED, draftId, turn, teamId, entityId, null);
    }
}
