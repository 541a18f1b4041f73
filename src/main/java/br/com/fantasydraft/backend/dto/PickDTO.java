package br.com.fantasydraft.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PickDTO {
    private Long id;
    private Long teamId;
    private String entityId;
    private String entityName;
    private Integer cost;
    private Integer pickOrder;
    private Integer roundNumber;
    private Long pickedByParticipantId;
    private Instant createdAt;
}
