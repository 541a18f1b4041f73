package br.com.fantasydraft.backend.domain.entity;

public enum DraftType {
    SNAKE,
    AUCTION
}
