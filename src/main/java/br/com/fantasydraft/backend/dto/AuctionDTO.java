package br.com.fantasydraft.backend.dto;

import br.com.fantasydraft.backend.domain.entity.AuctionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuctionDTO {
    private Long id;
    private String entityId;
    private String entityName;
    private Long nominatingTeamId;
    private Integer currentBid;
    private Long currentBidderTeamId;
    private Instant auctionEnd;
    private AuctionStatus status;
    private Long secondsRemaining; // preenchido pelo serviço
}
