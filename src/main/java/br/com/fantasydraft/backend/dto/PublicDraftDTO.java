package br.com.fantasydraft.backend.dto;

import br.com.fantasydraft.backend.domain.entity.DraftStatus;
import br.com.fantasydraft.backend.domain.entity.DraftType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublicDraftDTO {
    private Long id;
    private String roomCode;
    private String name;
    private DraftStatus status;
    private DraftType draftType;
    private Integer teamCount;
    private Integer maxTeams;
}
