package br.com.fantasydraft.backend.config;

import br.com.fantasydraft.backend.websocket.DraftWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

        private final DraftWebSocketHandler draftWebSocketHandler;

        public WebSocketConfig(DraftWebSocketHandler draftWebSocketHandler) {
                this.draftWebSocketHandler = draftWebSocketHandler;
        }

        @Override
        public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
                registry.addHandler(draftWebSocketHandler, "/ws/drafts")
                                .setAllowedOriginPatterns("*");

                log.info("🔌 WebSocket registrado em: /ws/drafts");
        }

        @Bean
        public ServletServerContainerFactoryBean createWebSocketContainer() {
                ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
                container.setMaxTextMessageBufferSize(65536);
                container.setMaxBinaryMessageBufferSize(65536);
                // clientes mandam heartbeat a cada 30s
                container.setMaxSessionIdleTimeout(300000L);
                log.info("🔧 WebSocket container configurado: buffers 64KB, timeout 5min");
                return container;
        }
}
