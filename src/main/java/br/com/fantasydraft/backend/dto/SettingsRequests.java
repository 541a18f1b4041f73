package br.com.fantasydraft.backend.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Corpos das requisições administrativas do host.
 */
public final class SettingsRequests {

    private SettingsRequests() {
        throw new UnsupportedOperationException("Utility class");
    }

    public record TurnTimer(@NotNull @Min(0) Integer seconds) {
    }

    public record AuctionDuration(@NotNull @Min(5) Integer seconds) {
    }

    public record Toggle(@NotNull Boolean enabled) {
    }

    public record BudgetOverride(@NotNull Long teamId, @NotNull @Min(0) Integer newBudget, String reason) {
    }

    public record ExtendAuction(@NotNull @Positive Integer seconds) {
    }

    public record SkipTurn(@NotNull @Min(1) Integer expectedTurn) {
    }

    public record Undo(Long expectedPickId) {
    }
}
