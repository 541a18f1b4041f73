package br.com.fantasydraft.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Catalog catalog = new Catalog();

    /**
     * Serviço externo que informa se uma entidade é legal num formato e qual o
     * seu custo.
     */
    @Data
    public static class Catalog {
        private String baseUrl = "http://localhost:8090";
        private int connectTimeoutMs = 2000;
        private int readTimeoutMs = 3000;
        private int cacheTtlMinutes = 10;
    }
}
