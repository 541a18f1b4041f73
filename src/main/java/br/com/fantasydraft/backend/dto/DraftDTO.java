package br.com.fantasydraft.backend.dto;

import br.com.fantasydraft.backend.domain.entity.DraftStatus;
import br.com.fantasydraft.backend.domain.entity.DraftType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftDTO {
    private Long id;
    private String roomCode;
    private String name;
    private DraftStatus status;
    private DraftType draftType;
    private String formatId;
    private Integer currentTurn;
    private Integer currentRound;
    private Integer maxTeams;
    private Integer budgetPerTeam;
    private Integer entitiesPerTeam;
    private Integer timeLimitSeconds;
    private Integer pendingTimeLimitSeconds;
    private Integer auctionDurationSeconds;
    private Boolean allowUndo;
    private Boolean proxyPickingEnabled;
    private Boolean publicDraft;
    private Boolean archived;
    private Long activeAuctionId;
    private Instant turnStartedAt;
    private Instant createdAt;
}
