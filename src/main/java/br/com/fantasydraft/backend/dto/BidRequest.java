package br.com.fantasydraft.backend.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BidRequest {
    @NotNull(message = "Valor do lance é obrigatório")
    @Positive
    private Integer amount;
}
