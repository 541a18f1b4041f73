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
public class BidDTO {
    private Long id;
    private Long auctionId;
    private Long teamId;
    private String teamName;
    private Integer amount;
    private Instant createdAt;
}
