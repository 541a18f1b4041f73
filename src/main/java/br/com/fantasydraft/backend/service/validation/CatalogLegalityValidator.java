package br.com.fantasydraft.backend.service.validation;

import br.com.fantasydraft.backend.config.CacheConfig;
import br.com.fantasydraft.backend.dto.LegalityResult;
import br.com.fantasydraft.backend.exception.DraftErrorCode;
import br.com.fantasydraft.backend.exception.DraftException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogLegalityValidator implements EntityLegalityValidator {

    private final CatalogApiClient catalogApiClient;

    // exceções não são cacheadas: uma falha de rede não vira veredito
    @Override
    @Cacheable(cacheNames = CacheConfig.ENTITY_LEGALITY_CACHE, key = "#formatId + ':' + #entityId")
    public LegalityResult validate(String entityId, String formatId) {
        if (entityId == null || entityId.isBlank()) {
            return LegalityResult.illegal("entityId vazio");
        }

        try {
            return catalogApiClient.fetchEntity(formatId, entityId)
                    .map(this::toResult)
                    .orElseGet(() -> LegalityResult.illegal("Entidade " + entityId + " não existe no formato"));
        } catch (RestClientException e) {
            log.error("❌ [Catalog] Catálogo indisponível ao validar {} ({})", entityId, formatId, e);
            throw new DraftException(DraftErrorCode.COLLABORATOR_UNAVAILABLE,
                    "Catálogo indisponível: " + e.getMessage(), e);
        }
    }

    private LegalityResult toResult(CatalogApiClient.CatalogEntity entity) {
        if (!Boolean.TRUE.equals(entity.getLegal())) {
            String reason = entity.getReason() != null ? entity.getReason() : "Entidade banida neste formato";
            return LegalityResult.illegal(reason);
        }
        int cost = entity.getCost() != null ? entity.getCost() : 0;
        if (cost < 0) {
            return LegalityResult.illegal("Custo inválido no catálogo: " + cost);
        }
        return LegalityResult.legal(cost, entity.getName());
    }
}
