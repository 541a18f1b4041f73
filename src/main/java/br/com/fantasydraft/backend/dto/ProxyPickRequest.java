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
public class ProxyPickRequest {
    @NotNull(message = "teamId é obrigatório")
    private Long teamId;

    @NotBlank(message = "entityId é obrigatório")
    private String entityId;

    private Integer cost;

    @NotNull(message = "expectedTurn é obrigatório")
    @Min(1)
    private Integer expectedTurn;
}
