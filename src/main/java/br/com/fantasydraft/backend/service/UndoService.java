package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.domain.entity.*;
import br.com.fantasydraft.backend.domain.repository.DraftRepository;
import br.com.fantasydraft.backend.domain.repository.PickRepository;
import br.com.fantasydraft.backend.domain.repository.TeamRepository;
import br.com.fantasydraft.backend.domain.repository.WishlistItemRepository;
import br.com.fantasydraft.backend.dto.UndoResult;
import br.com.fantasydraft.backend.dto.events.DraftChangedEvent;
import br.com.fantasydraft.backend.exception.DraftErrorCode;
import br.com.fantasydraft.backend.exception.DraftException;
import br.com.fantasydraft.backend.util.SnakeOrderGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Desfaz o último pick. Inverso exato do commit: remove o pick, devolve o
 * custo ao time e recua o turno em 1; se aquele pick concluiu o draft, o
 * draft volta a ACTIVE.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UndoService {

    private final DraftRepository draftRepository;
    private final TeamRepository teamRepository;
    private final PickRepository pickRepository;
    private final WishlistItemRepository wishlistItemRepository;
    private final DraftGuard draftGuard;
    private final BudgetLedger budgetLedger;
    private final DraftActionLogService actionLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * @param expectedPickId pick que o host viu como último; nulo aceita o
     *                       último atual
     */
    @Transactional
    public UndoResult undoLastPick(Long draftId, Long hostParticipantId, Long expectedPickId) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant host = draftGuard.requireHost(draftId, hostParticipantId);

        if (!Boolean.TRUE.equals(draft.getAllowUndo())) {
            throw new DraftException(DraftErrorCode.UNDO_NOT_ENABLED);
        }
        if (draft.getStatus() == DraftStatus.SETUP) {
            throw new DraftException(DraftErrorCode.DRAFT_NOT_ACTIVE, "Draft ainda em setup");
        }
        if (draft.getActiveAuctionId() != null) {
            throw new DraftException(DraftErrorCode.ACTIVE_AUCTION_EXISTS,
                    "Encerre o leilão " + draft.getActiveAuctionId() + " antes de desfazer");
        }

        Pick last = pickRepository.findFirstByDraftIdOrderByPickOrderDesc(draftId)
                .orElseThrow(() -> new DraftException(DraftErrorCode.UNDO_NO_PICKS));
        if (expectedPickId != null && !expectedPickId.equals(last.getId())) {
            throw new DraftException(DraftErrorCode.UNDO_NOT_RECENT,
                    "Pick " + expectedPickId + " não é o mais recente (" + last.getId() + ")");
        }

        int teamCount = (int) teamRepository.countByDraftId(draftId);
        int currentTurn = draft.getCurrentTurn() != null ? draft.getCurrentTurn() : 1;
        int newTurn = Math.max(1, currentTurn - 1);
        int newRound = SnakeOrderGenerator.roundForTurn(newTurn, teamCount);
        DraftStatus newStatus = draft.getStatus() == DraftStatus.COMPLETED ? DraftStatus.ACTIVE : draft.getStatus();

        int rolledBack = draftRepository.rollbackTurn(draftId, currentTurn, draft.getStatus(), newTurn, newRound,
                newStatus, Instant.now(clock));
        if (rolledBack == 0) {
            throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                    "Turno do draft " + draftId + " mudou durante o undo");
        }

        int deleted = pickRepository.deletePick(draftId, last.getId());
        if (deleted == 0) {
            throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                    "Pick " + last.getId() + " já foi removido");
        }
        budgetLedger.credit(last.getTeamId(), last.getCost());
        wishlistItemRepository.markAvailability(draftId, last.getEntityId(), true);

        actionLogService.record(DraftActionLog.builder()
                .draftId(draftId)
                .actionType(DraftActionType.UNDO)
                .actorParticipantId(host.getId())
                .teamId(last.getTeamId())
                .entityId(last.getEntityId())
                .entityName(last.getEntityName())
                .cost(last.getCost())
                .roundNumber(last.getRoundNumber())
                .pickNumber(last.getPickOrder())
                .build());

        int budgetRemaining = budgetLedger.currentBudget(last.getTeamId());
        log.info("↩️ [Undo] Draft {}: pick {} ({}) desfeito, {} devolvido ao time {}", draftId,
                last.getPickOrder(), last.getEntityId(), last.getCost(), last.getTeamId());

        eventPublisher.publishEvent(new DraftChangedEvent("pick_undone", draftId, newTurn)
                .with("pickId", last.getId())
                .with("teamId", last.getTeamId())
                .with("entityId", last.getEntityId()));

        return new UndoResult(last.getId(), last.getTeamId(), last.getEntityId(), last.getCost(), budgetRemaining,
                newTurn, newRound, newStatus);
    }
}
