package br.com.fantasydraft.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JoinDraftRequest {
    @NotBlank(message = "Código da sala é obrigatório")
    private String roomCode;

    @NotBlank(message = "Nome é obrigatório")
    @Size(max = 100)
    private String displayName;

    @Size(max = 100)
    private String teamName; // nulo = entra como espectador
}
