package br.com.fantasydraft.backend.dto;

import java.time.Instant;

public record BidResult(Long auctionId, Long teamId, int amount, Instant auctionEnd) {
}
