package br.com.fantasydraft.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuctionStatsDTO {
    private Long draftId;
    private Integer totalAuctions;
    private Integer totalBids;
    private Double averageBidsPerAuction;
    private Integer highestBid;
    private String highestBidEntityName;
    private Long mostActiveTeamId;
    private String mostActiveTeamName;
}
