package br.com.fantasydraft.backend.websocket;

import br.com.fantasydraft.backend.dto.events.DraftChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DraftSubscriptionRegistryTest {

    private DraftSubscriptionRegistry registry;

    @BeforeEach
    void setup() {
        registry = new DraftSubscriptionRegistry();
    }

    @Test
    void testDispatchReachesOnlySameDraft() {
        // given
        List<String> draftOne = new ArrayList<>();
        List<String> draftTwo = new ArrayList<>();
        registry.subscribe(1L, e -> draftOne.add(e.getEventType()));
        registry.subscribe(2L, e -> draftTwo.add(e.getEventType()));

        // act
        int delivered = registry.dispatch(new DraftChangedEvent("pick_made", 1L, 2));

        // assert
        assertThat(delivered).isEqualTo(1);
        assertThat(draftOne).containsExactly("pick_made");
        assertThat(draftTwo).isEmpty();
    }

    @Test
    void testClosedSubscriptionStopsReceiving() {
        // given
        List<String> received = new ArrayList<>();
        DraftSubscriptionRegistry.Subscription subscription = registry.subscribe(1L,
                e -> received.add(e.getEventType()));

        // act
        subscription.close();
        subscription.close();
        registry.dispatch(new DraftChangedEvent("pick_made", 1L, 2));

        // assert
        assertThat(subscription.isClosed()).isTrue();
        assertThat(received).isEmpty();
        assertThat(registry.subscriberCount(1L)).isZero();
    }

    @Test
    void testFailingListenerDoesNotBlockOthers() {
        // given
        List<String> received = new ArrayList<>();
        registry.subscribe(1L, e -> {
            throw new IllegalStateException("sessão fechada");
        });
        registry.subscribe(1L, e -> received.add(e.getEventType()));

        // act
        int delivered = registry.dispatch(new DraftChangedEvent("bid_placed", 1L, 1));

        // assert
        assertThat(delivered).isEqualTo(1);
        assertThat(received).containsExactly("bid_placed");
        assertThat(registry.subscriberCount(1L)).isEqualTo(2);
    }

    @Test
    void testDispatchWithoutSubscribers() {
        assertThat(registry.dispatch(new DraftChangedEvent("pick_made", 9L, 1))).isZero();
    }
}
