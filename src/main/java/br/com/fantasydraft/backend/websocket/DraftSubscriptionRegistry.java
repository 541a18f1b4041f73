package br.com.fantasydraft.backend.websocket;

import br.com.fantasydraft.backend.dto.events.DraftChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Assinantes locais (desta instância) dos eventos de cada draft.
 *
 * Quem assina recebe um {@link Subscription} e é responsável por fechá-lo;
 * fechar duas vezes é seguro.
 */
@Slf4j
@Component
public class DraftSubscriptionRegistry {

    private final Map<Long, Set<Subscription>> subscriptions = new ConcurrentHashMap<>();

    public Subscription subscribe(Long draftId, Consumer<DraftChangedEvent> listener) {
        Subscription subscription = new Subscription(draftId, listener);
        subscriptions.computeIfAbsent(draftId, id -> ConcurrentHashMap.newKeySet()).add(subscription);
        log.debug("🔔 [Subscriptions] +1 assinante no draft {}", draftId);
        return subscription;
    }

    /**
     * Entrega o evento a todos os assinantes do draft. Falha de um assinante
     * não impede a entrega aos demais.
     */
    public int dispatch(DraftChangedEvent event) {
        Set<Subscription> targets = subscriptions.get(event.getDraftId());
        if (targets == null || targets.isEmpty()) {
            return 0;
        }

        int delivered = 0;
        for (Subscription subscription : targets) {
            try {
                subscription.listener.accept(event);
                delivered++;
            } catch (Exception e) {
                log.warn("⚠️ [Subscriptions] Falha ao entregar {} do draft {}: {}",
                        event.getEventType(), event.getDraftId(), e.getMessage());
            }
        }
        return delivered;
    }

    public int subscriberCount(Long draftId) {
        Set<Subscription> set = subscriptions.get(draftId);
        return set == null ? 0 : set.size();
    }

    private void remove(Subscription subscription) {
        subscriptions.computeIfPresent(subscription.draftId, (id, set) -> {
            set.remove(subscription);
            return set.isEmpty() ? null : set;
        });
        log.debug("🔕 [Subscriptions] -1 assinante no draft {}", subscription.draftId);
    }

    public final class Subscription implements AutoCloseable {
        private final Long draftId;
        private final Consumer<DraftChangedEvent> listener;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Subscription(Long draftId, Consumer<DraftChangedEvent> listener) {
            this.draftId = draftId;
            this.listener = listener;
        }

        public Long getDraftId() {
            return draftId;
        }

        public boolean isClosed() {
            return closed.get();
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                remove(this);
            }
        }
    }
}
