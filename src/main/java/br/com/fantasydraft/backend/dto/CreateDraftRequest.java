package br.com.fantasydraft.backend.dto;

import br.com.fantasydraft.backend.domain.entity.DraftType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Campos nulos assumem os padrões de {@code draft.*}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDraftRequest {
    @NotBlank(message = "Nome do draft é obrigatório")
    @Size(max = 100)
    private String name;

    @NotBlank(message = "Nome do host é obrigatório")
    @Size(max = 100)
    private String hostDisplayName;

    @Size(max = 100)
    private String hostTeamName; // opcional: host também joga

    private DraftType draftType;
    private String formatId;

    @Min(2)
    private Integer maxTeams;

    @Min(0)
    private Integer budgetPerTeam;

    @Min(1)
    @Max(50)
    private Integer entitiesPerTeam;

    @Min(0)
    private Integer timeLimitSeconds;

    @Min(5)
    private Integer auctionDurationSeconds;

    private Boolean allowUndo;
    private Boolean proxyPickingEnabled;
    private Boolean publicDraft;
}
