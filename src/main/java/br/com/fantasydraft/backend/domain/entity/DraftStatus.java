package br.com.fantasydraft.backend.domain.entity;

public enum DraftStatus {
    SETUP,
    ACTIVE,
    PAUSED,
    COMPLETED
}
