package br.com.fantasydraft.backend.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public final class WishlistRequests {

    private WishlistRequests() {
        throw new UnsupportedOperationException("Utility class");
    }

    public record Add(@NotBlank String entityId, String entityName, @NotNull @Min(0) Integer cost) {
    }

    public record Reorder(@NotEmpty List<Long> itemIds) {
    }
}
