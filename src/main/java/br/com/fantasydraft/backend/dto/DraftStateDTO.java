package br.com.fantasydraft.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot completo do draft para (re)sincronizar clientes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftStateDTO {
    private DraftDTO draft;
    private List<TeamDTO> teams;
    private List<ParticipantDTO> participants;
    private List<PickDTO> picks;
    private Long currentTeamId;
    private Long nominatingTeamId;
    private AuctionDTO activeAuction;
    private Long secondsRemaining;
    private Integer totalTurns;
    private Instant serverTime;
}
