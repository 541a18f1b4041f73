package br.com.fantasydraft.backend.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NominateRequest {
    @NotBlank(message = "entityId é obrigatório")
    private String entityId;

    @Min(0)
    private Integer startingBid;
}
