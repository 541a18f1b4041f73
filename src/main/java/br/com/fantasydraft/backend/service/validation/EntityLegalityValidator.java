package br.com.fantasydraft.backend.service.validation;

import br.com.fantasydraft.backend.dto.LegalityResult;

/**
 * Decide se uma entidade pode ser escolhida num formato e qual o custo
 * autoritativo. Não depende do estado do draft.
 *
 * Implementações lançam {@code DraftException(COLLABORATOR_UNAVAILABLE)}
 * quando não conseguem responder.
 */
public interface EntityLegalityValidator {

    LegalityResult validate(String entityId, String formatId);
}
