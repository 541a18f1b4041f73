package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.domain.entity.Draft;
import br.com.fantasydraft.backend.domain.entity.DraftStatus;
import br.com.fantasydraft.backend.domain.entity.Team;
import br.com.fantasydraft.backend.domain.entity.WishlistItem;
import br.com.fantasydraft.backend.domain.repository.DraftRepository;
import br.com.fantasydraft.backend.domain.repository.PickRepository;
import br.com.fantasydraft.backend.domain.repository.TeamRepository;
import br.com.fantasydraft.backend.domain.repository.WishlistItemRepository;
import br.com.fantasydraft.backend.dto.AutoSkipResult;
import br.com.fantasydraft.backend.exception.DraftErrorCode;
import br.com.fantasydraft.backend.exception.DraftException;
import br.com.fantasydraft.backend.util.SnakeOrderGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * ✅ Timeout de turno (draft snake)
 *
 * Quando o tempo do turno acaba, tenta o primeiro item viável da wishlist do
 * dono do time da vez; sem item viável, avança o turno sem pick.
 *
 * Cada tentativa roda na sua própria transação (PickCommitService /
 * DraftLifecycleService). Draft sumido, fora de ACTIVE ou turno já consumido
 * viram no-op.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutoSkipService {

    // falhas de um item específico: tenta o próximo da lista
    private static final Set<DraftErrorCode> SKIPPABLE_ITEM_ERRORS = EnumSet.of(
            DraftErrorCode.INSUFFICIENT_BUDGET,
            DraftErrorCode.ENTITY_NOT_LEGAL,
            DraftErrorCode.ENTITY_ALREADY_PICKED);

    private final DraftRepository draftRepository;
    private final TeamRepository teamRepository;
    private final PickRepository pickRepository;
    private final WishlistItemRepository wishlistItemRepository;
    private final PickCommitService pickCommitService;
    private final DraftLifecycleService lifecycleService;
    private final Clock clock;

    public AutoSkipResult handleTurnTimeout(Long draftId, int expectedTurn) {
        try {
            return doHandleTurnTimeout(draftId, expectedTurn);
        } catch (DraftException e) {
            if (e.isBenignForTimers()) {
                log.debug("[AutoSkip] Draft {} turno {} ignorado: {} ({})", draftId, expectedTurn, e.getCode(),
                        e.getMessage());
                return AutoSkipResult.noop(draftId, expectedTurn, e.getCode().name());
            }
            throw e;
        }
    }

    /**
     * Drafts snake ativos com limite de tempo cujo turno atual já estourou.
     */
    public List<Draft> findDraftsWithExpiredTurn(Instant now) {
        return draftRepository.findByStatusAndArchivedFalse(DraftStatus.ACTIVE).stream()
                .filter(Draft::isSnake)
                .filter(d -> d.getTimeLimitSeconds() != null && d.getTimeLimitSeconds() > 0)
                .filter(d -> d.getTurnStartedAt() != null && d.getCurrentTurn() != null)
                .filter(d -> !d.getTurnStartedAt().plusSeconds(d.getTimeLimitSeconds()).isAfter(now))
                .collect(Collectors.toList());
    }

    private AutoSkipResult doHandleTurnTimeout(Long draftId, int expectedTurn) {
        Draft draft = draftRepository.findById(draftId)
                .orElseThrow(() -> new DraftException(DraftErrorCode.DRAFT_NOT_FOUND));
        if (!draft.isSnake()) {
            return AutoSkipResult.noop(draftId, expectedTurn, "Draft de leilão");
        }
        if (draft.getStatus() != DraftStatus.ACTIVE) {
            return AutoSkipResult.noop(draftId, expectedTurn, "Draft " + draft.getStatus());
        }
        if (draft.getCurrentTurn() == null || draft.getCurrentTurn() != expectedTurn) {
            return AutoSkipResult.noop(draftId, expectedTurn, "Turno já avançou para " + draft.getCurrentTurn());
        }
        if (isTurnStillRunning(draft)) {
            return AutoSkipResult.noop(draftId, expectedTurn, "Turno ainda dentro do prazo");
        }

        List<Team> teams = teamRepository.findByDraftIdOrderByDraftOrderAsc(draftId);
        int dueOrder = SnakeOrderGenerator.teamOrderForTurn(expectedTurn, teams.size());
        Team team = teams.stream()
                .filter(t -> t.getDraftOrder() == dueOrder)
                .findFirst()
                .orElseThrow(() -> new DraftException(DraftErrorCode.INVALID_DRAFT_ORDER,
                        "Nenhum time na posição " + dueOrder));

        if (pickRepository.countByDraftIdAndTeamId(draftId, team.getId()) >= draft.getEntitiesPerTeam()) {
            lifecycleService.advanceWithoutPick(draftId, expectedTurn, null, "Elenco completo");
            return AutoSkipResult.skipped(draftId, expectedTurn, team.getId(), "Elenco completo");
        }

        for (WishlistItem item : wishlistFor(draftId, team)) {
            if (pickRepository.existsByDraftIdAndEntityId(draftId, item.getEntityId())) {
                continue;
            }
            if (!BudgetLedger.canAfford(team.getBudgetRemaining(), item.getCost())) {
                continue;
            }
            try {
                pickCommitService.makeAutoPick(draftId, team.getId(), team.getOwnerParticipantId(),
                        item.getEntityId(), expectedTurn);
                log.info("🤖 [AutoSkip] Draft {} turno {}: pick automático de {} para {}", draftId, expectedTurn,
                        item.getEntityId(), team.getName());
                return AutoSkipResult.autoPicked(draftId, expectedTurn, team.getId(), item.getEntityId());
            } catch (DraftException e) {
                if (!SKIPPABLE_ITEM_ERRORS.contains(e.getCode())) {
                    throw e;
                }
                log.debug("[AutoSkip] {} descartado para {}: {}", item.getEntityId(), team.getName(), e.getCode());
            }
        }

        lifecycleService.advanceWithoutPick(draftId, expectedTurn, null, "Tempo esgotado sem item viável");
        log.info("⏭️ [AutoSkip] Draft {} turno {}: {} sem item viável, turno pulado", draftId, expectedTurn,
                team.getName());
        return AutoSkipResult.skipped(draftId, expectedTurn, team.getId(), "Nenhum item viável na wishlist");
    }

    private List<WishlistItem> wishlistFor(Long draftId, Team team) {
        if (team.getOwnerParticipantId() == null) {
            return Collections.emptyList();
        }
        return wishlistItemRepository.findByDraftIdAndParticipantIdAndAvailableTrueOrderByPriorityAsc(draftId,
                team.getOwnerParticipantId());
    }

    private boolean isTurnStillRunning(Draft draft) {
        if (draft.getTimeLimitSeconds() == null || draft.getTimeLimitSeconds() <= 0
                || draft.getTurnStartedAt() == null) {
            return false;
        }
        return draft.getTurnStartedAt().plusSeconds(draft.getTimeLimitSeconds()).isAfter(Instant.now(clock));
    }
}
