package br.com.fantasydraft.backend.dto.events;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * ✅ Evento de mudança de estado do draft
 *
 * Publicado pelos serviços dentro da transação e entregue aos clientes só
 * depois do commit.
 *
 * CANAL REDIS:
 * - draft:{draftId}
 *
 * TIPOS:
 * - pick_made, turn_skipped, pick_undone
 * - draft_started, draft_paused, draft_resumed, draft_completed, draft_reset
 * - auction_started, bid_placed, auction_resolved, auction_cancelled, auction_extended
 * - participant_joined, participant_left, order_shuffled, settings_changed, budget_overridden
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DraftChangedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private String eventType;

    private Long draftId;

    private Integer currentTurn;

    private Instant timestamp;

    private Map<String, Object> payload = new HashMap<>();

    public DraftChangedEvent(String eventType, Long draftId, Integer currentTurn) {
        this.eventType = eventType;
        this.draftId = draftId;
        this.currentTurn = currentTurn;
        this.timestamp = Instant.now();
    }

    public DraftChangedEvent with(String key, Object value) {
        payload.put(key, value);
        return this;
    }
}
