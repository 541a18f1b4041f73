package br.com.fantasydraft.backend.dto;

import br.com.fantasydraft.backend.domain.entity.DraftActionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftActionLogDTO {
    private Long id;
    private DraftActionType actionType;
    private Long actorParticipantId;
    private Long teamId;
    private String entityId;
    private String entityName;
    private Integer cost;
    private Integer roundNumber;
    private Integer pickNumber;
    private String details;
    private Instant createdAt;
}
