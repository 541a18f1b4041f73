package br.com.fantasydraft.backend.domain.entity;

public enum AuctionStatus {
    ACTIVE,
    COMPLETED,
    CANCELLED
}
