package br.com.fantasydraft.backend.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Utilitário para extrair o header X-Participant-Id das requisições HTTP.
 * A identidade do participante é atribuída no create/join do draft.
 */
public class ParticipantAuthUtil {

    public static final String HEADER_NAME = "X-Participant-Id";

    // Construtor privado para classe utilitária
    private ParticipantAuthUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Extrai o id do participante do header.
     *
     * @throws ResponseStatusException 401 se ausente, 400 se não numérico
     */
    public static Long getParticipantIdFromRequest(HttpServletRequest request) {
        String raw = request.getHeader(HEADER_NAME);

        if (raw == null || raw.trim().isEmpty()) {
            throw new ResponseStatusException(
                    HttpStatus.UNAUTHORIZED,
                    "Header X-Participant-Id é obrigatório para identificar o participante");
        }

        try {
            return Long.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new ResponseStatusException(
                    HttpStatus.BAD_REQUEST,
                    "Header X-Participant-Id inválido: " + raw, e);
        }
    }
}
