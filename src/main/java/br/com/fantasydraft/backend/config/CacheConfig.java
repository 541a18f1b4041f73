package br.com.fantasydraft.backend.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;
import java.util.List;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String ENTITY_LEGALITY_CACHE = "entity-legality";

    @Bean
    @Primary
    public CacheManager cacheManager(AppProperties appProperties) {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();

        // vereditos do catálogo mudam raramente; falhas não são cacheadas
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(5000)
                .expireAfterWrite(Duration.ofMinutes(appProperties.getCatalog().getCacheTtlMinutes()))
                .recordStats());

        cacheManager.setCacheNames(List.of(ENTITY_LEGALITY_CACHE));

        return cacheManager;
    }
}
