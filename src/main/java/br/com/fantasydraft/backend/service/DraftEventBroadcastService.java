package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.config.RedisPubSubConfig;
import br.com.fantasydraft.backend.dto.events.DraftChangedEvent;
import br.com.fantasydraft.backend.websocket.DraftSubscriptionRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * ✅ Broadcasting dos eventos de draft via Redis Pub/Sub
 *
 * FLUXO:
 * 1. Serviço publica {@link DraftChangedEvent} dentro da transação
 * 2. Após o commit o evento vai para o canal draft:{draftId}
 * 3. TODAS as instâncias recebem e entregam aos assinantes locais (WebSocket)
 *
 * Entrega é at-least-once e sem ordem garantida: o cliente recarrega o estado
 * a cada sinal. Se o Redis estiver fora, entrega só aos assinantes locais.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftEventBroadcastService {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final DraftSubscriptionRegistry subscriptionRegistry;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onDraftChanged(DraftChangedEvent event) {
        publish(event);
    }

    public void publish(DraftChangedEvent event) {
        String channel = RedisPubSubConfig.DRAFT_CHANNEL_PREFIX + event.getDraftId();
        try {
            String json = objectMapper.writeValueAsString(event);
            stringRedisTemplate.convertAndSend(channel, json);
            log.info("📢 [Pub/Sub] {} publicado em {} (turno {})", event.getEventType(), channel,
                    event.getCurrentTurn());
        } catch (JsonProcessingException e) {
            log.error("❌ [Pub/Sub] Erro ao serializar DraftChangedEvent", e);
        } catch (Exception e) {
            log.error("❌ [Pub/Sub] Erro ao publicar {} em {}, entregando localmente", event.getEventType(),
                    channel, e);
            subscriptionRegistry.dispatch(event);
        }
    }

    /**
     * Chamado pelo listener do Redis para cada mensagem em draft:*.
     */
    public void handleDraftEvent(String message, String channel) {
        try {
            DraftChangedEvent event = objectMapper.readValue(message, DraftChangedEvent.class);
            int delivered = subscriptionRegistry.dispatch(event);
            log.debug("📥 [Pub/Sub] {} recebido em {} -> {} assinante(s)", event.getEventType(), channel,
                    delivered);
        } catch (JsonProcessingException e) {
            log.error("❌ [Pub/Sub] Erro ao parsear evento de draft do canal {}", channel, e);
        }
    }
}
