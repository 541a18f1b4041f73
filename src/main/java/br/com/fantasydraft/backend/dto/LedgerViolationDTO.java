package br.com.fantasydraft.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerViolationDTO {
    private Long teamId;
    private String teamName;
    private Integer budgetRemaining;
    private Long spent;
    private Long overrides;
    private Integer budgetPerTeam;
    private Long expected; // budgetPerTeam + overrides
}
