package br.com.fantasydraft.backend.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PickRequest {
    @NotBlank(message = "entityId é obrigatório")
    private String entityId;

    private Integer cost; // sugerido pelo cliente; o validador tem a palavra final

    @NotNull(message = "expectedTurn é obrigatório")
    @Min(1)
    private Integer expectedTurn;
}
