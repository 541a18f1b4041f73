package br.com.fantasydraft.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamDTO {
    private Long id;
    private String name;
    private Long ownerParticipantId;
    private Integer draftOrder;
    private Integer budgetRemaining;
    private Integer pickCount; // preenchido pelo serviço
}
