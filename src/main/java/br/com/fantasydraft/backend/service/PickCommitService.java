package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.domain.entity.*;
import br.com.fantasydraft.backend.domain.repository.DraftRepository;
import br.com.fantasydraft.backend.domain.repository.PickRepository;
import br.com.fantasydraft.backend.domain.repository.TeamRepository;
import br.com.fantasydraft.backend.domain.repository.WishlistItemRepository;
import br.com.fantasydraft.backend.dto.LegalityResult;
import br.com.fantasydraft.backend.dto.PickResult;
import br.com.fantasydraft.backend.dto.events.DraftChangedEvent;
import br.com.fantasydraft.backend.exception.DraftErrorCode;
import br.com.fantasydraft.backend.exception.DraftException;
import br.com.fantasydraft.backend.service.validation.EntityLegalityValidator;
import br.com.fantasydraft.backend.util.SnakeOrderGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * ✅ Commit atômico de pick (draft snake)
 *
 * PROBLEMA RESOLVIDO:
 * - Dois participantes confirmando o mesmo turno ao mesmo tempo
 * - Checar saldo numa chamada e debitar em outra deixa janela de corrida
 *
 * SOLUÇÃO:
 * - Tudo numa única transação: claim do turno (CAS em currentTurn), débito
 * condicional do saldo, recheck de limite/duplicata e insert do pick
 * - Só um chamador vê o CAS do turno afetar 1 linha; o outro recebe
 * CONCURRENCY_CONFLICT e nada é gravado
 * - Constraints únicas em picks seguram qualquer corrida que escape
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PickCommitService {

    private final DraftRepository draftRepository;
    private final TeamRepository teamRepository;
    private final PickRepository pickRepository;
    private final WishlistItemRepository wishlistItemRepository;
    private final DraftGuard draftGuard;
    private final BudgetLedger budgetLedger;
    private final EntityLegalityValidator legalityValidator;
    private final DraftActionLogService actionLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Pick normal: o participante escolhe para o próprio time, que precisa ser
     * o time da vez.
     */
    @Transactional
    public PickResult makePick(Long draftId, Long participantId, String entityId, Integer proposedCost,
            int expectedTurn) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant participant = draftGuard.requireParticipant(draftId, participantId);
        Team team = draftGuard.requireTeamOf(participant);

        return commit(draft, team, participant.getId(), entityId, proposedCost, expectedTurn, true,
                DraftActionType.PICK);
    }

    /**
     * Pick por procuração: o host escolhe em nome de qualquer time. O turno
     * avança uma vez, como num pick normal.
     */
    @Transactional
    public PickResult makeProxyPick(Long draftId, Long hostParticipantId, Long targetTeamId, String entityId,
            Integer proposedCost, int expectedTurn) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant host = draftGuard.requireHost(draftId, hostParticipantId);
        if (!Boolean.TRUE.equals(draft.getProxyPickingEnabled())) {
            throw new DraftException(DraftErrorCode.PROXY_PICKING_DISABLED);
        }
        Team team = draftGuard.requireTeam(draftId, targetTeamId);

        log.info("🧑‍⚖️ [PickCommit] Host {} fazendo pick por procuração para o time {} no draft {}",
                host.getId(), team.getName(), draftId);
        return commit(draft, team, host.getId(), entityId, proposedCost, expectedTurn, false,
                DraftActionType.PROXY_PICK);
    }

    /**
     * Pick automático disparado pelo timeout, em nome do dono do time da vez.
     */
    @Transactional
    public PickResult makeAutoPick(Long draftId, Long teamId, Long actorParticipantId, String entityId,
            int expectedTurn) {
        Draft draft = draftGuard.requireDraft(draftId);
        Team team = draftGuard.requireTeam(draftId, teamId);
        return commit(draft, team, actorParticipantId, entityId, null, expectedTurn, true,
                DraftActionType.AUTO_PICK);
    }

    private PickResult commit(Draft draft, Team team, Long actorParticipantId, String entityId,
            Integer proposedCost, int expectedTurn, boolean requireDueTeam, DraftActionType actionType) {
        Long draftId = draft.getId();

        if (!draft.isSnake()) {
            throw new DraftException(DraftErrorCode.WRONG_DRAFT_TYPE,
                    "Draft de leilão: picks acontecem pela resolução dos leilões");
        }
        requireActive(draft);
        if (draft.getCurrentTurn() == null || draft.getCurrentTurn() != expectedTurn) {
            throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                    "Turno esperado " + expectedTurn + ", atual " + draft.getCurrentTurn());
        }

        int teamCount = (int) teamRepository.countByDraftId(draftId);
        if (requireDueTeam) {
            int dueOrder = SnakeOrderGenerator.teamOrderForTurn(expectedTurn, teamCount);
            if (team.getDraftOrder() != dueOrder) {
                throw new DraftException(DraftErrorCode.NOT_YOUR_TURN,
                        "Turno " + expectedTurn + " pertence à posição " + dueOrder);
            }
        }

        // custo do validador é o autoritativo
        LegalityResult verdict = legalityValidator.validate(entityId, draft.getFormatId());
        if (!verdict.legal()) {
            throw new DraftException(DraftErrorCode.ENTITY_NOT_LEGAL, verdict.reason());
        }
        int cost = verdict.cost();
        if (proposedCost != null && proposedCost != cost) {
            log.debug("[PickCommit] Custo sugerido {} ignorado para {}, validador informou {}",
                    proposedCost, entityId, cost);
        }

        // pré-checagens para erros tipados; a decisão final é tomada abaixo
        if (!BudgetLedger.canAfford(team.getBudgetRemaining(), cost)) {
            throw new DraftException(DraftErrorCode.INSUFFICIENT_BUDGET,
                    "Saldo " + team.getBudgetRemaining() + ", custo " + cost);
        }
        requireBelowCap(draftId, team.getId(), draft.getEntitiesPerTeam());
        requireNotOwned(draftId, team.getId(), entityId);

        // --- seção atômica ---
        int totalTurns = draft.totalTurns(teamCount);
        int nextTurn = expectedTurn + 1;
        boolean completed = nextTurn > totalTurns;
        int nextRound = SnakeOrderGenerator.roundForTurn(Math.min(nextTurn, totalTurns), teamCount);
        Instant now = Instant.now(clock);

        int claimed = draftRepository.advanceTurn(draftId, expectedTurn, nextTurn, nextRound,
                completed ? DraftStatus.COMPLETED : DraftStatus.ACTIVE, DraftStatus.ACTIVE, now);
        if (claimed == 0) {
            log.warn("⚠️ [PickCommit] Turno {} do draft {} já foi consumido por outra requisição",
                    expectedTurn, draftId);
            throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                    "Turno " + expectedTurn + " já foi consumido");
        }

        budgetLedger.debit(team.getId(), cost);

        // recheck depois do claim: a linha do draft está travada até o commit
        requireBelowCap(draftId, team.getId(), draft.getEntitiesPerTeam());
        requireNotOwned(draftId, team.getId(), entityId);

        int pickOrder = (int) pickRepository.countByDraftId(draftId) + 1;
        Pick pick = Pick.builder()
                .draftId(draftId)
                .teamId(team.getId())
                .entityId(entityId)
                .entityName(verdict.entityName())
                .cost(cost)
                .pickOrder(pickOrder)
                .roundNumber(SnakeOrderGenerator.roundForTurn(pickOrder, teamCount))
                .pickedByParticipantId(actorParticipantId)
                .build();
        try {
            pick = pickRepository.saveAndFlush(pick);
        } catch (DataIntegrityViolationException e) {
            throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                    "Pick concorrente gravado para o mesmo slot", e);
        }

        wishlistItemRepository.markAvailability(draftId, entityId, false);

        actionLogService.record(DraftActionLog.builder()
                .draftId(draftId)
                .actionType(actionType)
                .actorParticipantId(actorParticipantId)
                .teamId(team.getId())
                .entityId(entityId)
                .entityName(verdict.entityName())
                .cost(cost)
                .roundNumber(pick.getRoundNumber())
                .pickNumber(pickOrder)
                .build());
        if (completed) {
            actionLogService.record(draftId, DraftActionType.COMPLETE, actorParticipantId,
                    "Todos os " + totalTurns + " turnos concluídos");
        }

        int budgetRemaining = budgetLedger.currentBudget(team.getId());

        log.info("✅ [PickCommit] Draft {} turno {}: {} escolheu {} por {} (saldo {})",
                draftId, expectedTurn, team.getName(), entityId, cost, budgetRemaining);
        if (completed) {
            log.info("🏁 [PickCommit] Draft {} concluído", draftId);
        }

        eventPublisher.publishEvent(new DraftChangedEvent(completed ? "draft_completed" : "pick_made", draftId,
                completed ? null : nextTurn)
                .with("pickId", pick.getId())
                .with("teamId", team.getId())
                .with("entityId", entityId)
                .with("action", actionType.name()));

        return new PickResult(pick.getId(), team.getId(), entityId, verdict.entityName(), cost, pickOrder,
                pick.getRoundNumber(), budgetRemaining, completed ? null : nextTurn,
                completed ? null : nextRound, completed);
    }

    private void requireActive(Draft draft) {
        if (draft.getStatus() == DraftStatus.COMPLETED) {
            throw new DraftException(DraftErrorCode.DRAFT_COMPLETED);
        }
        if (draft.getStatus() != DraftStatus.ACTIVE) {
            throw new DraftException(DraftErrorCode.DRAFT_NOT_ACTIVE,
                    "Draft " + draft.getId() + " está " + draft.getStatus());
        }
    }

    private void requireBelowCap(Long draftId, Long teamId, int cap) {
        if (pickRepository.countByDraftIdAndTeamId(draftId, teamId) >= cap) {
            throw new DraftException(DraftErrorCode.MAX_PICKS_REACHED,
                    "Time " + teamId + " já tem " + cap + " picks");
        }
    }

    private void requireNotOwned(Long draftId, Long teamId, String entityId) {
        if (pickRepository.existsByDraftIdAndTeamIdAndEntityId(draftId, teamId, entityId)) {
            throw new DraftException(DraftErrorCode.ENTITY_ALREADY_PICKED,
                    "Time " + teamId + " já possui " + entityId);
        }
    }
}
