package br.com.fantasydraft.backend.dto;

import br.com.fantasydraft.backend.exception.DraftErrorCode;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Resultado de entrada num draft. O campo {@code outcome} no JSON indica a
 * variante.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "outcome")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JoinResult.Joined.class, name = "joined"),
        @JsonSubTypes.Type(value = JoinResult.JoinedAsSpectator.class, name = "spectator"),
        @JsonSubTypes.Type(value = JoinResult.Rejected.class, name = "rejected")
})
public interface JoinResult {

    Long draftId();

    record Joined(Long draftId, String roomCode, ParticipantDTO participant, TeamDTO team) implements JoinResult {
    }

    record JoinedAsSpectator(Long draftId, String roomCode, ParticipantDTO participant, String reason)
            implements JoinResult {
    }

    record Rejected(Long draftId, DraftErrorCode code, String reason) implements JoinResult {
    }
}
