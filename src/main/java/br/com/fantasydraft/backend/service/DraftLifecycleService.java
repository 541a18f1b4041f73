package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.domain.entity.*;
import br.com.fantasydraft.backend.domain.repository.*;
import br.com.fantasydraft.backend.dto.DraftDTO;
import br.com.fantasydraft.backend.dto.TeamDTO;
import br.com.fantasydraft.backend.dto.TurnAdvanceResult;
import br.com.fantasydraft.backend.dto.events.DraftChangedEvent;
import br.com.fantasydraft.backend.exception.DraftErrorCode;
import br.com.fantasydraft.backend.exception.DraftException;
import br.com.fantasydraft.backend.mapper.DraftMapper;
import br.com.fantasydraft.backend.util.SnakeOrderGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Máquina de estados do draft: setup → active ⇄ paused → completed.
 *
 * Cada transição é um CAS sobre status/currentTurn; chamadas concorrentes
 * para a mesma transição têm um único vencedor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftLifecycleService {

    private final DraftRepository draftRepository;
    private final TeamRepository teamRepository;
    private final ParticipantRepository participantRepository;
    private final PickRepository pickRepository;
    private final AuctionRepository auctionRepository;
    private final BidHistoryRepository bidHistoryRepository;
    private final WishlistItemRepository wishlistItemRepository;
    private final DraftGuard draftGuard;
    private final DraftActionLogService actionLogService;
    private final DraftMapper draftMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // ========================================
    // START / PAUSE / RESUME / END
    // ========================================

    /**
     * Inicia o draft. Chamar de novo num draft já ativo não tem efeito.
     */
    @Transactional
    public DraftDTO startDraft(Long draftId, Long hostParticipantId) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant host = draftGuard.requireHost(draftId, hostParticipantId);

        if (draft.getStatus() == DraftStatus.ACTIVE) {
            log.info("[Lifecycle] Draft {} já está ativo, start ignorado", draftId);
            return draftMapper.toDTO(draft);
        }
        if (draft.getStatus() != DraftStatus.SETUP) {
            throw new DraftException(DraftErrorCode.DRAFT_NOT_IN_SETUP,
                    "Draft " + draftId + " está " + draft.getStatus());
        }

        List<Team> teams = teamRepository.findByDraftIdOrderByDraftOrderAsc(draftId);
        List<Participant> participants = participantRepository.findByDraftId(draftId);
        validateReadyToStart(teams, participants);

        if (!Boolean.TRUE.equals(draft.getOrderShuffled())) {
            log.info("🔀 [Lifecycle] Draft {} sem shuffle manual, sorteando ordem antes de iniciar", draftId);
            applyRandomOrder(teams);
            actionLogService.record(draftId, DraftActionType.SHUFFLE, null, "Shuffle automático no início");
        }

        List<Integer> orders = teams.stream().map(Team::getDraftOrder).collect(Collectors.toList());
        if (!SnakeOrderGenerator.isValidPermutation(orders)) {
            throw new DraftException(DraftErrorCode.INVALID_DRAFT_ORDER,
                    "Ordem " + orders + " não é uma permutação de 1.." + teams.size());
        }

        int updated = draftRepository.activate(draftId, Instant.now(clock));
        if (updated == 0) {
            throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                    "Draft " + draftId + " mudou de status durante o start");
        }

        actionLogService.record(draftId, DraftActionType.START, host.getId(),
                teams.size() + " times, " + draft.getEntitiesPerTeam() + " rodadas");
        log.info("🚀 [Lifecycle] Draft {} iniciado com {} times", draftId, teams.size());

        eventPublisher.publishEvent(new DraftChangedEvent("draft_started", draftId, 1));
        return draftMapper.toDTO(draftGuard.requireDraft(draftId));
    }

    @Transactional
    public DraftDTO pauseDraft(Long draftId, Long hostParticipantId) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant host = draftGuard.requireHost(draftId, hostParticipantId);

        int updated = draftRepository.pause(draftId, Instant.now(clock));
        if (updated == 0) {
            throw new DraftException(DraftErrorCode.DRAFT_NOT_ACTIVE,
                    "Draft " + draftId + " está " + draft.getStatus());
        }

        actionLogService.record(draftId, DraftActionType.PAUSE, host.getId(), null);
        log.info("⏸️ [Lifecycle] Draft {} pausado no turno {}", draftId, draft.getCurrentTurn());

        eventPublisher.publishEvent(new DraftChangedEvent("draft_paused", draftId, draft.getCurrentTurn()));
        return draftMapper.toDTO(draftGuard.requireDraft(draftId));
    }

    /**
     * Retoma o draft. O leilão aberto durante a pausa ganha de volta o tempo
     * pausado, no mesmo commit da retomada.
     */
    @Transactional
    public DraftDTO resumeDraft(Long draftId, Long hostParticipantId) {
        Draft paused = draftGuard.requireDraft(draftId);
        Participant host = draftGuard.requireHost(draftId, hostParticipantId);
        Instant pausedAt = paused.getPausedAt();
        Long activeAuctionId = paused.getActiveAuctionId();
        Instant now = Instant.now(clock);

        int updated = draftRepository.resume(draftId, now);
        if (updated == 0) {
            throw new DraftException(DraftErrorCode.DRAFT_NOT_PAUSED);
        }
        if (activeAuctionId != null && pausedAt != null && pausedAt.isBefore(now)) {
            shiftAuctionEnd(draftId, activeAuctionId, Duration.between(pausedAt, now), now);
        }

        Draft draft = draftGuard.requireDraft(draftId);
        actionLogService.record(draftId, DraftActionType.RESUME, host.getId(), null);
        log.info("▶️ [Lifecycle] Draft {} retomado no turno {}", draftId, draft.getCurrentTurn());

        eventPublisher.publishEvent(new DraftChangedEvent("draft_resumed", draftId, draft.getCurrentTurn()));
        return draftMapper.toDTO(draft);
    }

    /**
     * Encerra o draft antes do fim natural. Um leilão em andamento é cancelado.
     */
    @Transactional
    public DraftDTO endDraft(Long draftId, Long hostParticipantId) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant host = draftGuard.requireHost(draftId, hostParticipantId);
        Instant now = Instant.now(clock);

        if (draft.getStatus() == DraftStatus.COMPLETED) {
            throw new DraftException(DraftErrorCode.DRAFT_COMPLETED);
        }

        cancelRunningAuction(draft, now);

        int updated = draftRepository.complete(draftId, now);
        if (updated == 0) {
            throw new DraftException(DraftErrorCode.DRAFT_NOT_ACTIVE,
                    "Draft " + draftId + " está " + draft.getStatus());
        }

        actionLogService.record(draftId, DraftActionType.COMPLETE, host.getId(), "Encerrado pelo host");
        log.info("🏁 [Lifecycle] Draft {} encerrado pelo host", draftId);

        eventPublisher.publishEvent(new DraftChangedEvent("draft_completed", draftId, null));
        return draftMapper.toDTO(draftGuard.requireDraft(draftId));
    }

    /**
     * Volta o draft para setup: apaga picks, leilões e lances e devolve o
     * orçamento integral a todos os times.
     */
    @Transactional
    public DraftDTO resetDraft(Long draftId, Long hostParticipantId) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant host = draftGuard.requireHost(draftId, hostParticipantId);
        Instant now = Instant.now(clock);

        int bids = bidHistoryRepository.deleteAllByDraftId(draftId);
        int auctions = auctionRepository.deleteAllByDraftId(draftId);
        int picks = pickRepository.deleteAllByDraftId(draftId);
        teamRepository.resetBudgets(draftId, draft.getBudgetPerTeam());
        wishlistItemRepository.markAllAvailable(draftId);
        draftRepository.resetToSetup(draftId, now);

        actionLogService.record(draftId, DraftActionType.RESET, host.getId(),
                picks + " picks, " + auctions + " leilões, " + bids + " lances removidos");
        log.warn("🔄 [Admin] Draft {} resetado: {} picks, {} leilões, {} lances removidos",
                draftId, picks, auctions, bids);

        eventPublisher.publishEvent(new DraftChangedEvent("draft_reset", draftId, null));
        return draftMapper.toDTO(draftGuard.requireDraft(draftId));
    }

    // ========================================
    // ORDEM
    // ========================================

    @Transactional
    public List<TeamDTO> shuffleOrder(Long draftId, Long hostParticipantId) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant host = draftGuard.requireHost(draftId, hostParticipantId);
        if (draft.getStatus() != DraftStatus.SETUP) {
            throw new DraftException(DraftErrorCode.DRAFT_NOT_IN_SETUP);
        }

        List<Team> teams = teamRepository.findByDraftIdOrderByDraftOrderAsc(draftId);
        applyRandomOrder(teams);
        draft.setOrderShuffled(true);
        draftRepository.save(draft);

        actionLogService.record(draftId, DraftActionType.SHUFFLE, host.getId(), null);
        log.info("🔀 [Admin] Ordem do draft {} sorteada: {}", draftId,
                teams.stream().sorted(Comparator.comparing(Team::getDraftOrder)).map(Team::getName)
                        .collect(Collectors.toList()));

        eventPublisher.publishEvent(new DraftChangedEvent("order_shuffled", draftId, null));
        return teams.stream()
                .sorted(Comparator.comparing(Team::getDraftOrder))
                .map(draftMapper::toDTO)
                .collect(Collectors.toList());
    }

    // ========================================
    // AVANÇO SEM PICK
    // ========================================

    /**
     * Skip administrativo do turno atual.
     */
    @Transactional
    public TurnAdvanceResult skipTurn(Long draftId, Long hostParticipantId, int expectedTurn) {
        draftGuard.requireDraft(draftId);
        Participant host = draftGuard.requireHost(draftId, hostParticipantId);
        return advanceWithoutPick(draftId, expectedTurn, host.getId(), "Turno pulado pelo host");
    }

    /**
     * Avança o turno sem pick (timeout ou skip). CAS sobre o turno esperado.
     */
    @Transactional
    public TurnAdvanceResult advanceWithoutPick(Long draftId, int expectedTurn, Long actorParticipantId,
            String reason) {
        Draft draft = draftGuard.requireDraft(draftId);
        if (!draft.isSnake()) {
            throw new DraftException(DraftErrorCode.WRONG_DRAFT_TYPE,
                    "Draft de leilão avança pela resolução dos leilões");
        }
        if (draft.getStatus() != DraftStatus.ACTIVE) {
            throw new DraftException(DraftErrorCode.DRAFT_NOT_ACTIVE,
                    "Draft " + draftId + " está " + draft.getStatus());
        }
        if (draft.getCurrentTurn() == null || draft.getCurrentTurn() != expectedTurn) {
            throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                    "Turno esperado " + expectedTurn + ", atual " + draft.getCurrentTurn());
        }

        List<Team> teams = teamRepository.findByDraftIdOrderByDraftOrderAsc(draftId);
        int teamCount = teams.size();
        int totalTurns = draft.totalTurns(teamCount);
        int nextTurn = expectedTurn + 1;
        boolean completed = nextTurn > totalTurns;
        int nextRound = SnakeOrderGenerator.roundForTurn(Math.min(nextTurn, totalTurns), teamCount);

        int updated = draftRepository.advanceTurn(draftId, expectedTurn, nextTurn, nextRound,
                completed ? DraftStatus.COMPLETED : DraftStatus.ACTIVE, DraftStatus.ACTIVE, Instant.now(clock));
        if (updated == 0) {
            throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                    "Turno " + expectedTurn + " já foi consumido");
        }

        int dueOrder = SnakeOrderGenerator.teamOrderForTurn(expectedTurn, teamCount);
        Long skippedTeamId = teams.stream()
                .filter(t -> t.getDraftOrder() == dueOrder)
                .map(Team::getId)
                .findFirst()
                .orElse(null);

        actionLogService.record(DraftActionLog.builder()
                .draftId(draftId)
                .actionType(DraftActionType.SKIP)
                .actorParticipantId(actorParticipantId)
                .teamId(skippedTeamId)
                .roundNumber(SnakeOrderGenerator.roundForTurn(expectedTurn, teamCount))
                .details(reason)
                .build());
        if (completed) {
            actionLogService.record(draftId, DraftActionType.COMPLETE, actorParticipantId,
                    "Todos os " + totalTurns + " turnos concluídos");
        }

        log.info("⏭️ [Lifecycle] Draft {} turno {} pulado (time {}): {}", draftId, expectedTurn, skippedTeamId,
                reason);

        eventPublisher.publishEvent(new DraftChangedEvent(completed ? "draft_completed" : "turn_skipped",
                draftId, completed ? null : nextTurn)
                .with("skippedTeamId", skippedTeamId)
                .with("skippedTurn", expectedTurn));

        return new TurnAdvanceResult(draftId, expectedTurn, nextTurn, nextRound, completed);
    }

    // ========================================
    // CONFIGURAÇÕES
    // ========================================

    /**
     * Em setup o timer muda na hora; com o draft rodando a mudança fica
     * pendente e é aplicada no próximo avanço de turno.
     */
    @Transactional
    public DraftDTO setTurnTimer(Long draftId, Long hostParticipantId, int seconds) {
        Draft draft = draftGuard.requireDraft(draftId);
        draftGuard.requireHost(draftId, hostParticipantId);
        if (seconds < 0) {
            throw new DraftException(DraftErrorCode.INVALID_INPUT, "Timer não pode ser negativo");
        }

        switch (draft.getStatus()) {
            case SETUP -> {
                draft.setTimeLimitSeconds(seconds);
                draft.setPendingTimeLimitSeconds(null);
            }
            case ACTIVE, PAUSED -> draft.setPendingTimeLimitSeconds(seconds);
            case COMPLETED -> throw new DraftException(DraftErrorCode.DRAFT_COMPLETED);
        }
        draftRepository.save(draft);

        log.info("⏱️ [Admin] Timer do draft {} {} para {}s", draftId,
                draft.getStatus() == DraftStatus.SETUP ? "definido" : "agendado", seconds);
        return settingsChanged(draft, "timeLimitSeconds", seconds);
    }

    @Transactional
    public DraftDTO setAuctionDuration(Long draftId, Long hostParticipantId, int seconds) {
        Draft draft = draftGuard.requireDraft(draftId);
        draftGuard.requireHost(draftId, hostParticipantId);
        if (seconds < 5) {
            throw new DraftException(DraftErrorCode.INVALID_INPUT, "Duração mínima do leilão é 5s");
        }
        draft.setAuctionDurationSeconds(seconds);
        draftRepository.save(draft);
        return settingsChanged(draft, "auctionDurationSeconds", seconds);
    }

    @Transactional
    public DraftDTO setProxyPicking(Long draftId, Long hostParticipantId, boolean enabled) {
        Draft draft = draftGuard.requireDraft(draftId);
        draftGuard.requireHost(draftId, hostParticipantId);
        draft.setProxyPickingEnabled(enabled);
        draftRepository.save(draft);
        return settingsChanged(draft, "proxyPickingEnabled", enabled);
    }

    @Transactional
    public DraftDTO setAllowUndo(Long draftId, Long hostParticipantId, boolean enabled) {
        Draft draft = draftGuard.requireDraft(draftId);
        draftGuard.requireHost(draftId, hostParticipantId);
        draft.setAllowUndo(enabled);
        draftRepository.save(draft);
        return settingsChanged(draft, "allowUndo", enabled);
    }

    /**
     * Aposenta o draft: some das listagens e não é mais varrido pelo timer.
     * Um draft em andamento é encerrado antes.
     */
    @Transactional
    public DraftDTO archiveDraft(Long draftId, Long hostParticipantId) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant host = draftGuard.requireHost(draftId, hostParticipantId);
        Instant now = Instant.now(clock);

        if (draft.getStatus() == DraftStatus.ACTIVE || draft.getStatus() == DraftStatus.PAUSED) {
            cancelRunningAuction(draft, now);
            draftRepository.complete(draftId, now);
            actionLogService.record(draftId, DraftActionType.COMPLETE, host.getId(), "Encerrado ao arquivar");
            draft = draftGuard.requireDraft(draftId);
        }
        draft.setArchived(true);
        draftRepository.save(draft);

        log.info("📦 [Admin] Draft {} arquivado", draftId);
        return settingsChanged(draft, "archived", true);
    }

    // ========================================
    // HELPERS
    // ========================================

    private void validateReadyToStart(List<Team> teams, List<Participant> participants) {
        if (teams.size() < 2) {
            throw new DraftException(DraftErrorCode.NOT_ENOUGH_TEAMS,
                    "Draft tem " + teams.size() + " time(s)");
        }

        Set<Long> teamIds = teams.stream().map(Team::getId).collect(Collectors.toSet());
        Set<Long> staffedTeams = new HashSet<>();
        for (Participant participant : participants) {
            if (participant.getTeamId() == null) {
                continue;
            }
            if (!teamIds.contains(participant.getTeamId())) {
                throw new DraftException(DraftErrorCode.ORPHANED_PARTICIPANT,
                        "Participante " + participant.getId() + " aponta para time inexistente");
            }
            staffedTeams.add(participant.getTeamId());
        }

        for (Team team : teams) {
            if (!staffedTeams.contains(team.getId())) {
                throw new DraftException(DraftErrorCode.TEAM_WITHOUT_PARTICIPANT,
                        "Time " + team.getName() + " não tem participante");
            }
        }
    }

    /**
     * Fisher-Yates sobre as posições 1..N.
     */
    private void applyRandomOrder(List<Team> teams) {
        List<Integer> orders = IntStream.rangeClosed(1, teams.size()).boxed().collect(Collectors.toList());
        Collections.shuffle(orders, ThreadLocalRandom.current());
        for (int i = 0; i < teams.size(); i++) {
            teams.get(i).setDraftOrder(orders.get(i));
        }
        teamRepository.saveAll(teams);
    }

    private void cancelRunningAuction(Draft draft, Instant now) {
        Long auctionId = draft.getActiveAuctionId();
        if (auctionId == null) {
            return;
        }
        auctionRepository.finishIfActive(auctionId, AuctionStatus.CANCELLED, now);
        draftRepository.releaseAuctionSlot(draft.getId(), auctionId, draft.getCurrentTurn(),
                draft.getCurrentRound(), now);
        log.info("🛑 [Lifecycle] Leilão {} cancelado junto com o encerramento do draft {}", auctionId,
                draft.getId());
    }

    private DraftDTO settingsChanged(Draft draft, String setting, Object value) {
        eventPublisher.publishEvent(new DraftChangedEvent("settings_changed", draft.getId(), draft.getCurrentTurn())
                .with("setting", setting)
                .with("value", value));
        return draftMapper.toDTO(draft);
    }

    private void shiftAuctionEnd(Long draftId, Long auctionId, Duration pausedFor, Instant now) {
        auctionRepository.findByIdAndDraftId(auctionId, draftId)
                .filter(auction -> auction.getStatus() == AuctionStatus.ACTIVE)
                .ifPresent(auction -> {
                    Instant newEnd = auction.getAuctionEnd().plus(pausedFor);
                    int shifted = auctionRepository.extend(auctionId, auction.getAuctionEnd(), newEnd, now);
                    if (shifted == 0) {
                        throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                                "Leilão " + auctionId + " mudou durante a retomada");
                    }
                    log.info("⏱️ [Lifecycle] Leilão {} deslocado em {}s pela pausa (novo fim {})", auctionId,
                            pausedFor.getSeconds(), newEnd);
                });
    }
}
