package br.com.fantasydraft.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Slf4j
@Configuration
public class RestClientConfig {

    @Bean
    public RestTemplate catalogRestTemplate(RestTemplateBuilder builder, AppProperties appProperties) {
        AppProperties.Catalog catalog = appProperties.getCatalog();
        log.info("🔧 Catálogo de entidades em {}", catalog.getBaseUrl());
        return builder
                .rootUri(catalog.getBaseUrl())
                .setConnectTimeout(Duration.ofMillis(catalog.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(catalog.getReadTimeoutMs()))
                .build();
    }
}
