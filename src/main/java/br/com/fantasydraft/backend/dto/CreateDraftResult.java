package br.com.fantasydraft.backend.dto;

public record CreateDraftResult(DraftDTO draft, ParticipantDTO host, TeamDTO hostTeam) {
}
