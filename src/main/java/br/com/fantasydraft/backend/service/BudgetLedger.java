package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.domain.entity.AuctionStatus;
import br.com.fantasydraft.backend.domain.entity.Draft;
import br.com.fantasydraft.backend.domain.entity.DraftActionLog;
import br.com.fantasydraft.backend.domain.entity.DraftActionType;
import br.com.fantasydraft.backend.domain.entity.Participant;
import br.com.fantasydraft.backend.domain.entity.Team;
import br.com.fantasydraft.backend.domain.repository.AuctionRepository;
import br.com.fantasydraft.backend.domain.repository.PickRepository;
import br.com.fantasydraft.backend.domain.repository.TeamRepository;
import br.com.fantasydraft.backend.dto.LedgerViolationDTO;
import br.com.fantasydraft.backend.dto.events.DraftChangedEvent;
import br.com.fantasydraft.backend.exception.DraftErrorCode;
import br.com.fantasydraft.backend.exception.DraftException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Orçamento dos times.
 *
 * Todo movimento de saldo é um UPDATE condicional: débito só com saldo
 * suficiente, débito de leilão só se o saldo não mudou desde a leitura. Fora
 * de pick, leilão e undo, a única escrita permitida é o override do host, que
 * sempre fica registrado no histórico.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BudgetLedger {

    private final TeamRepository teamRepository;
    private final PickRepository pickRepository;
    private final AuctionRepository auctionRepository;
    private final DraftGuard draftGuard;
    private final DraftActionLogService actionLogService;
    private final ApplicationEventPublisher eventPublisher;

    public static boolean canAfford(int budgetRemaining, int cost) {
        return cost >= 0 && budgetRemaining >= cost;
    }

    public void debit(Long teamId, int amount) {
        requireNonNegative(amount);
        int updated = teamRepository.debitIfAffordable(teamId, amount);
        if (updated == 0) {
            throw new DraftException(DraftErrorCode.INSUFFICIENT_BUDGET,
                    "Time " + teamId + " sem saldo para " + amount);
        }
    }

    /**
     * Débito condicionado ao saldo lido anteriormente. Se outro débito entrou
     * no meio, falha como conflito de concorrência.
     */
    public void debitIfUnchanged(Long teamId, int expectedBudget, int amount) {
        requireNonNegative(amount);
        if (!canAfford(expectedBudget, amount)) {
            throw new DraftException(DraftErrorCode.INSUFFICIENT_BUDGET,
                    "Time " + teamId + " sem saldo para " + amount);
        }
        int updated = teamRepository.debitIfUnchanged(teamId, expectedBudget, amount);
        if (updated == 0) {
            throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                    "Saldo do time " + teamId + " mudou durante a operação");
        }
    }

    public void credit(Long teamId, int amount) {
        requireNonNegative(amount);
        int updated = teamRepository.credit(teamId, amount);
        if (updated == 0) {
            throw new DraftException(DraftErrorCode.TEAM_NOT_FOUND, "Time " + teamId + " não encontrado");
        }
    }

    public int currentBudget(Long teamId) {
        return teamRepository.findBudgetRemaining(teamId)
                .orElseThrow(() -> new DraftException(DraftErrorCode.TEAM_NOT_FOUND));
    }

    /**
     * Correção administrativa do saldo. CAS sobre o saldo lido; o delta fica
     * no histórico como BUDGET_OVERRIDE. O time que lidera o leilão aberto não
     * pode ficar com saldo abaixo do próprio lance.
     */
    @Transactional
    public int overrideBudget(Long draftId, Long hostParticipantId, Long teamId, int newBudget, String reason) {
        Participant host = draftGuard.requireHost(draftId, hostParticipantId);
        if (newBudget < 0) {
            throw new DraftException(DraftErrorCode.INVALID_INPUT, "Orçamento não pode ser negativo");
        }
        Team team = draftGuard.requireTeam(draftId, teamId);
        int previous = team.getBudgetRemaining();

        auctionRepository.findFirstByDraftIdAndStatus(draftId, AuctionStatus.ACTIVE)
                .filter(auction -> teamId.equals(auction.getCurrentBidderTeamId()))
                .filter(auction -> newBudget < auction.getCurrentBid())
                .ifPresent(auction -> {
                    throw new DraftException(DraftErrorCode.INVALID_INPUT,
                            "Time " + teamId + " lidera o leilão " + auction.getId() + " com lance "
                                    + auction.getCurrentBid() + "; orçamento " + newBudget + " não cobre o lance");
                });

        int updated = teamRepository.overrideBudget(teamId, previous, newBudget);
        if (updated == 0) {
            throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                    "Saldo do time " + teamId + " mudou durante o override");
        }

        actionLogService.record(DraftActionLog.builder()
                .draftId(draftId)
                .actionType(DraftActionType.BUDGET_OVERRIDE)
                .actorParticipantId(host.getId())
                .teamId(teamId)
                .cost(newBudget - previous)
                .details("Orçamento " + previous + " -> " + newBudget
                        + (reason != null && !reason.isBlank() ? " | motivo: " + reason : ""))
                .build());

        log.warn("💰 [Admin] Override de orçamento no draft {}: time {} {} -> {} ({})",
                draftId, teamId, previous, newBudget, reason);

        eventPublisher.publishEvent(new DraftChangedEvent("budget_overridden", draftId, null)
                .with("teamId", teamId)
                .with("budgetRemaining", newBudget));
        return newBudget;
    }

    /**
     * Times que violam: soma dos picks + saldo == orçamento inicial + overrides.
     */
    @Transactional(readOnly = true)
    public List<LedgerViolationDTO> verifyLedger(Long draftId) {
        Draft draft = draftGuard.requireDraft(draftId);
        List<LedgerViolationDTO> violations = new ArrayList<>();

        for (Team team : teamRepository.findByDraftIdOrderByDraftOrderAsc(draftId)) {
            long spent = pickRepository.sumCostByTeam(draftId, team.getId());
            long overrides = actionLogService.sumBudgetOverridesSinceReset(draftId, team.getId());
            long expected = draft.getBudgetPerTeam() + overrides;

            if (spent + team.getBudgetRemaining() != expected) {
                violations.add(LedgerViolationDTO.builder()
                        .teamId(team.getId())
                        .teamName(team.getName())
                        .budgetRemaining(team.getBudgetRemaining())
                        .spent(spent)
                        .overrides(overrides)
                        .budgetPerTeam(draft.getBudgetPerTeam())
                        .expected(expected)
                        .build());
            }
        }

        if (!violations.isEmpty()) {
            log.error("❌ [Ledger] Draft {} com {} time(s) fora do invariante de orçamento", draftId,
                    violations.size());
        }
        return violations;
    }

    private static void requireNonNegative(int amount) {
        if (amount < 0) {
            throw new DraftException(DraftErrorCode.INVALID_INPUT, "Valor não pode ser negativo: " + amount);
        }
    }
}
