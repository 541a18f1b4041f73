package br.com.fantasydraft.backend.websocket;

import br.com.fantasydraft.backend.dto.events.DraftChangedEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket /ws/drafts.
 *
 * Protocolo do cliente:
 * - {"type":"subscribe","draftId":N}
 * - {"type":"unsubscribe","draftId":N}
 * - {"type":"ping"}
 *
 * O servidor empurra {"type":"draft_event","data":{...DraftChangedEvent}}.
 * O evento só sinaliza mudança; o cliente busca o estado via REST.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DraftWebSocketHandler extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 5000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final DraftSubscriptionRegistry subscriptionRegistry;
    private final ObjectMapper objectMapper;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    // sessionId -> (draftId -> assinatura)
    private final Map<String, Map<Long, DraftSubscriptionRegistry.Subscription>> sessionSubscriptions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        log.info("🔌 [WS] Cliente conectado: {} (Total: {})", session.getId(), sessions.size());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        String sessionId = session.getId();
        try {
            JsonNode json = objectMapper.readTree(message.getPayload());
            String type = json.path("type").asText("");

            switch (type) {
                case "subscribe" -> subscribe(sessionId, requireDraftId(json));
                case "unsubscribe" -> unsubscribe(sessionId, requireDraftId(json));
                case "ping" -> send(sessionId, "pong", Map.of("ts", System.currentTimeMillis()));
                default -> {
                    log.warn("⚠️ [WS] Tipo de mensagem desconhecido: {}", type);
                    sendError(sessionId, "UNKNOWN_TYPE", "Tipo de mensagem desconhecido: " + type);
                }
            }
        } catch (Exception e) {
            log.warn("⚠️ [WS] Mensagem inválida da sessão {}: {}", sessionId, e.getMessage());
            sendError(sessionId, "INVALID_MESSAGE", "Mensagem inválida");
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        String sessionId = session.getId();
        sessions.remove(sessionId);
        Map<Long, DraftSubscriptionRegistry.Subscription> subs = sessionSubscriptions.remove(sessionId);
        if (subs != null) {
            subs.values().forEach(DraftSubscriptionRegistry.Subscription::close);
        }
        log.info("🔌 [WS] Cliente desconectado: {} (Status: {})", sessionId, status);
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.error("❌ [WS] Erro de transporte na sessão {}", session.getId(), exception);
        afterConnectionClosed(session, CloseStatus.SERVER_ERROR);
    }

    public int sessionCount() {
        return sessions.size();
    }

    void subscribe(String sessionId, Long draftId) {
        Map<Long, DraftSubscriptionRegistry.Subscription> subs = sessionSubscriptions
                .computeIfAbsent(sessionId, id -> new ConcurrentHashMap<>());
        subs.computeIfAbsent(draftId,
                id -> subscriptionRegistry.subscribe(id, event -> forward(sessionId, event)));
        log.debug("🔔 [WS] Sessão {} assinou o draft {}", sessionId, draftId);
        send(sessionId, "subscribed", Map.of("draftId", draftId));
    }

    void unsubscribe(String sessionId, Long draftId) {
        Map<Long, DraftSubscriptionRegistry.Subscription> subs = sessionSubscriptions.get(sessionId);
        if (subs != null) {
            DraftSubscriptionRegistry.Subscription subscription = subs.remove(draftId);
            if (subscription != null) {
                subscription.close();
            }
        }
        send(sessionId, "unsubscribed", Map.of("draftId", draftId));
    }

    private void forward(String sessionId, DraftChangedEvent event) {
        send(sessionId, "draft_event", event);
    }

    private void send(String sessionId, String type, Object data) {
        WebSocketSession session = sessions.get(sessionId);
        if (session == null || !session.isOpen()) {
            return;
        }
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("type", type);
            envelope.put("data", data);
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(envelope)));
        } catch (IOException e) {
            log.warn("⚠️ [WS] Falha ao enviar {} para {}: {}", type, sessionId, e.getMessage());
        }
    }

    private void sendError(String sessionId, String code, String message) {
        send(sessionId, "error", Map.of("code", code, "message", message));
    }

    private static Long requireDraftId(JsonNode json) {
        JsonNode node = json.get("draftId");
        if (node == null || !node.canConvertToLong()) {
            throw new IllegalArgumentException("draftId é obrigatório");
        }
        return node.asLong();
    }
}
