package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.domain.entity.DraftActionType;
import br.com.fantasydraft.backend.domain.entity.DraftStatus;
import br.com.fantasydraft.backend.domain.entity.DraftType;
import br.com.fantasydraft.backend.domain.entity.Participant;
import br.com.fantasydraft.backend.dto.LegalityResult;
import br.com.fantasydraft.backend.dto.PickResult;
import br.com.fantasydraft.backend.dto.events.DraftChangedEvent;
import br.com.fantasydraft.backend.exception.DraftErrorCode;
import br.com.fantasydraft.backend.exception.DraftException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class PickCommitServiceTest {

    private DraftTestFixture fx;
    private PickCommitService service;

    @BeforeEach
    void setup() {
        fx = new DraftTestFixture().activeDraft(DraftType.SNAKE, 2, 2, 10);
        service = new PickCommitService(fx.draftRepository, fx.teamRepository, fx.pickRepository,
                fx.wishlistItemRepository, fx.guard, fx.budgetLedger, fx.validator, fx.actionLogService,
                fx.eventPublisher, fx.clock);
    }

    @Test
    void testPickAdvancesTurnAndDebitsBudget() {
        // given
        fx.withEntity("garchomp", 4);

        // act
        PickResult result = service.makePick(1L, fx.ownerOf(1), "garchomp", null, 1);

        // assert
        assertThat(result.pickOrder()).isEqualTo(1);
        assertThat(result.roundNumber()).isEqualTo(1);
        assertThat(result.cost()).isEqualTo(4);
        assertThat(result.budgetRemaining()).isEqualTo(6);
        assertThat(result.currentTurn()).isEqualTo(2);
        assertThat(result.draftCompleted()).isFalse();
        assertThat(fx.draft.getCurrentTurn()).isEqualTo(2);
        assertThat(fx.team(1).getBudgetRemaining()).isEqualTo(6);
        assertThat(fx.picks).hasSize(1);
        assertThat(fx.loggedActions()).containsExactly(DraftActionType.PICK);
        verify(fx.eventPublisher).publishEvent(any(DraftChangedEvent.class));
    }

    @Test
    void testValidatorCostOverridesProposedCost() {
        // given
        fx.withEntity("garchomp", 4);

        // act
        PickResult result = service.makePick(1L, fx.ownerOf(1), "garchomp", 1, 1);

        // assert
        assertThat(result.cost()).isEqualTo(4);
        assertThat(fx.team(1).getBudgetRemaining()).isEqualTo(6);
    }

    @Test
    void testNotYourTurn() {
        // given
        fx.withEntity("garchomp", 4);

        // act & assert
        assertThatThrownBy(() -> service.makePick(1L, fx.ownerOf(2), "garchomp", null, 1))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.NOT_YOUR_TURN);
        assertThat(fx.draft.getCurrentTurn()).isEqualTo(1);
        assertThat(fx.picks).isEmpty();
    }

    @Test
    void testStaleExpectedTurnIsConflict() {
        // given
        fx.withEntity("garchomp", 4);

        // act & assert
        assertThatThrownBy(() -> service.makePick(1L, fx.ownerOf(1), "garchomp", null, 3))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.CONCURRENCY_CONFLICT);
        verify(fx.draftRepository, never()).advanceTurn(any(), any(), any(), any(), any(), any(), any());
    }

    @Test
    void testIllegalEntityRejected() {
        // act & assert
        assertThatThrownBy(() -> service.makePick(1L, fx.ownerOf(1), "missingno", null, 1))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.ENTITY_NOT_LEGAL);
        assertThat(fx.team(1).getBudgetRemaining()).isEqualTo(10);
    }

    @Test
    void testSpectatorCannotPick() {
        // given
        fx.withEntity("garchomp", 4);
        fx.participants.add(Participant.builder().id(900L).draftId(1L).displayName("Espectador").host(false)
                .build());

        // act & assert
        assertThatThrownBy(() -> service.makePick(1L, 900L, "garchomp", null, 1))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.NOT_IN_DRAFT);
    }

    @Test
    void testBudgetExhaustedRejectsNextPick() {
        // given: orçamento 10, ordem [1,2,2,1]
        fx.withEntity("garchomp", 10).withEntity("rotom", 0).withEntity("ferrothorn", 2).withEntity("pikachu", 1);
        service.makePick(1L, fx.ownerOf(1), "garchomp", null, 1);
        service.makePick(1L, fx.ownerOf(2), "rotom", null, 2);
        service.makePick(1L, fx.ownerOf(2), "ferrothorn", null, 3);

        // act & assert
        assertThatThrownBy(() -> service.makePick(1L, fx.ownerOf(1), "pikachu", null, 4))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.INSUFFICIENT_BUDGET);
        assertThat(fx.team(1).getBudgetRemaining()).isZero();
        assertThat(fx.draft.getCurrentTurn()).isEqualTo(4);
    }

    @Test
    void testZeroCostPickAllowedWithEmptyBudget() {
        // given
        fx.withEntity("garchomp", 10).withEntity("rotom", 0).withEntity("ferrothorn", 2).withEntity("magikarp", 0);
        service.makePick(1L, fx.ownerOf(1), "garchomp", null, 1);
        service.makePick(1L, fx.ownerOf(2), "rotom", null, 2);
        service.makePick(1L, fx.ownerOf(2), "ferrothorn", null, 3);

        // act
        PickResult result = service.makePick(1L, fx.ownerOf(1), "magikarp", null, 4);

        // assert
        assertThat(result.budgetRemaining()).isZero();
        assertThat(result.draftCompleted()).isTrue();
    }

    @Test
    void testLastPickCompletesDraft() {
        // given
        fx.withEntity("a", 1).withEntity("b", 1).withEntity("c", 1).withEntity("d", 1);
        service.makePick(1L, fx.ownerOf(1), "a", null, 1);
        service.makePick(1L, fx.ownerOf(2), "b", null, 2);
        service.makePick(1L, fx.ownerOf(2), "c", null, 3);

        // act
        PickResult result = service.makePick(1L, fx.ownerOf(1), "d", null, 4);

        // assert
        assertThat(result.draftCompleted()).isTrue();
        assertThat(result.currentTurn()).isNull();
        assertThat(fx.draft.getStatus()).isEqualTo(DraftStatus.COMPLETED);
        assertThat(fx.draft.getCurrentTurn()).isEqualTo(5);
        assertThat(fx.draft.getCurrentRound()).isEqualTo(2);
        assertThat(fx.loggedActions()).endsWith(DraftActionType.PICK, DraftActionType.COMPLETE);
        assertThat(fx.budgetLedger.verifyLedger(1L)).isEmpty();
    }

    @Test
    void testPickAfterCompletionRejected() {
        // given
        fx.draft.setStatus(DraftStatus.COMPLETED);
        fx.withEntity("a", 1);

        // act & assert
        assertThatThrownBy(() -> service.makePick(1L, fx.ownerOf(1), "a", null, 1))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.DRAFT_COMPLETED);
    }

    @Test
    void testPausedDraftRejectsPick() {
        // given
        fx.draft.setStatus(DraftStatus.PAUSED);
        fx.withEntity("a", 1);

        // act & assert
        assertThatThrownBy(() -> service.makePick(1L, fx.ownerOf(1), "a", null, 1))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.DRAFT_NOT_ACTIVE);
    }

    @Test
    void testAuctionDraftRejectsDirectPick() {
        // given
        fx.draft.setDraftType(DraftType.AUCTION);
        fx.withEntity("a", 1);

        // act & assert
        assertThatThrownBy(() -> service.makePick(1L, fx.ownerOf(1), "a", null, 1))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.WRONG_DRAFT_TYPE);
    }

    @Test
    void testProxyPickForAnotherTeamAdvancesTurnOnce() {
        // given: turno 1 é do time 1, o host escolhe para o time 2
        fx.withEntity("garchomp", 3);
        Long teamB = fx.team(2).getId();

        // act
        PickResult result = service.makeProxyPick(1L, DraftTestFixture.HOST_ID, teamB, "garchomp", null, 1);

        // assert
        assertThat(result.teamId()).isEqualTo(teamB);
        assertThat(fx.picks.get(0).getPickedByParticipantId()).isEqualTo(DraftTestFixture.HOST_ID);
        assertThat(fx.team(2).getBudgetRemaining()).isEqualTo(7);
        assertThat(fx.team(1).getBudgetRemaining()).isEqualTo(10);
        assertThat(fx.draft.getCurrentTurn()).isEqualTo(2);
        assertThat(fx.loggedActions()).containsExactly(DraftActionType.PROXY_PICK);
    }

    @Test
    void testProxyPickDisabled() {
        // given
        fx.draft.setProxyPickingEnabled(false);
        fx.withEntity("garchomp", 3);

        // act & assert
        assertThatThrownBy(() -> service.makeProxyPick(1L, DraftTestFixture.HOST_ID, fx.team(1).getId(),
                "garchomp", null, 1))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.PROXY_PICKING_DISABLED);
    }

    @Test
    void testProxyPickRequiresHost() {
        // given
        fx.withEntity("garchomp", 3);

        // act & assert
        assertThatThrownBy(() -> service.makeProxyPick(1L, fx.ownerOf(2), fx.team(1).getId(), "garchomp", null,
                1))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.HOST_ONLY);
    }

    @Test
    void testPickMarksWishlistUnavailable() {
        // given
        fx.withEntity("garchomp", 3);
        fx.addWishlist(fx.ownerOf(2), "garchomp", 3);

        // act
        service.makePick(1L, fx.ownerOf(1), "garchomp", null, 1);

        // assert
        assertThat(fx.wishlist.get(0).getAvailable()).isFalse();
    }

    @Test
    void testConcurrentPicksOnSameTurnOnlyOneWins() throws Exception {
        // given: dois donos do time 1 confirmam o turno 1 ao mesmo tempo
        fx.participants.add(Participant.builder().id(101L).draftId(1L).displayName("Co-dono").teamId(10L)
                .host(false).build());
        CountDownLatch bothValidated = new CountDownLatch(2);
        when(fx.validator.validate(anyString(), any())).thenAnswer(inv -> {
            bothValidated.countDown();
            bothValidated.await(5, TimeUnit.SECONDS);
            return LegalityResult.legal(3, inv.getArgument(0));
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Future<PickResult>> futures = new ArrayList<>();
        try {
            // act
            futures.add(pool.submit(() -> service.makePick(1L, 100L, "garchomp", null, 1)));
            futures.add(pool.submit(() -> service.makePick(1L, 101L, "dragonite", null, 1)));

            int successes = 0;
            List<DraftErrorCode> failures = new ArrayList<>();
            for (Future<PickResult> future : futures) {
                try {
                    future.get(10, TimeUnit.SECONDS);
                    successes++;
                } catch (ExecutionException e) {
                    failures.add(((DraftException) e.getCause()).getCode());
                }
            }

            // assert
            assertThat(successes).isEqualTo(1);
            assertThat(failures).containsExactly(DraftErrorCode.CONCURRENCY_CONFLICT);
            assertThat(fx.picks).hasSize(1);
            assertThat(fx.draft.getCurrentTurn()).isEqualTo(2);
            assertThat(fx.team(1).getBudgetRemaining()).isEqualTo(7);
            verify(fx.teamRepository, times(1)).debitIfAffordable(anyLong(), anyInt());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testAutoPickRecordsAutoAction() {
        // given
        fx.withEntity("garchomp", 3);

        // act
        PickResult result = service.makeAutoPick(1L, fx.team(1).getId(), fx.ownerOf(1), "garchomp", 1);

        // assert
        assertThat(result.teamId()).isEqualTo(fx.team(1).getId());
        assertThat(fx.loggedActions()).containsExactly(DraftActionType.AUTO_PICK);
    }
}
