package br.com.fantasydraft.backend.service.validation;

import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

/**
 * Cliente HTTP do catálogo de entidades. Falhas de I/O e 5xx são repetidas
 * com backoff exponencial; 404 significa entidade fora do formato.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogApiClient {

    private final RestTemplate catalogRestTemplate;

    @Data
    public static class CatalogEntity {
        private String id;
        private String name;
        private Integer cost;
        private Boolean legal;
        private String reason;
    }

    @Retryable(retryFor = { ResourceAccessException.class, HttpServerErrorException.class },
            maxAttempts = 3, backoff = @Backoff(delay = 200, multiplier = 2.0))
    public Optional<CatalogEntity> fetchEntity(String formatId, String entityId) {
        String format = formatId == null || formatId.isBlank() ? "default" : formatId;
        log.debug("🔍 [Catalog] GET entidade {} no formato {}", entityId, format);
        try {
            CatalogEntity entity = catalogRestTemplate.getForObject(
                    "/formats/{formatId}/entities/{entityId}", CatalogEntity.class, format, entityId);
            return Optional.ofNullable(entity);
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }
}
