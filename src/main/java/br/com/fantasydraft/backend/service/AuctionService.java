package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.config.properties.DraftProperties;
import br.com.fantasydraft.backend.domain.entity.*;
import br.com.fantasydraft.backend.domain.repository.*;
import br.com.fantasydraft.backend.dto.*;
import br.com.fantasydraft.backend.dto.events.DraftChangedEvent;
import br.com.fantasydraft.backend.exception.DraftErrorCode;
import br.com.fantasydraft.backend.exception.DraftException;
import br.com.fantasydraft.backend.mapper.DraftMapper;
import br.com.fantasydraft.backend.service.validation.EntityLegalityValidator;
import br.com.fantasydraft.backend.util.SnakeOrderGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * ✅ Leilão (draftType = AUCTION)
 *
 * - Nomeação em rodízio pela ordem do draft: índice = picks feitos % times
 * - Só um leilão ativo por draft (CAS em drafts.active_auction_id)
 * - Lance é um UPDATE condicional: supera o atual, leilão no prazo e saldo
 * suficiente, tudo na mesma instrução
 * - Resolução debita o vencedor com CAS sobre o saldo lido, grava o pick e
 * recalcula o turno a partir do total de picks
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuctionService {

    private final DraftRepository draftRepository;
    private final TeamRepository teamRepository;
    private final PickRepository pickRepository;
    private final AuctionRepository auctionRepository;
    private final BidHistoryRepository bidHistoryRepository;
    private final WishlistItemRepository wishlistItemRepository;
    private final DraftGuard draftGuard;
    private final BudgetLedger budgetLedger;
    private final EntityLegalityValidator legalityValidator;
    private final DraftActionLogService actionLogService;
    private final DraftMapper draftMapper;
    private final DraftProperties draftProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // ========================================
    // NOMEAÇÃO
    // ========================================

    @Transactional
    public AuctionDTO nominate(Long draftId, Long participantId, String entityId, Integer startingBid) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant participant = draftGuard.requireParticipant(draftId, participantId);
        Team team = draftGuard.requireTeamOf(participant);

        requireAuctionDraft(draft);
        requireActive(draft);
        if (draft.getActiveAuctionId() != null) {
            throw new DraftException(DraftErrorCode.ACTIVE_AUCTION_EXISTS,
                    "Leilão " + draft.getActiveAuctionId() + " ainda está aberto");
        }

        List<Team> teams = teamRepository.findByDraftIdOrderByDraftOrderAsc(draftId);
        Team nominator = resolveNominator(draft, teams)
                .orElseThrow(() -> new DraftException(DraftErrorCode.MAX_PICKS_REACHED,
                        "Todos os times completaram o elenco"));
        if (!nominator.getId().equals(team.getId())) {
            throw new DraftException(DraftErrorCode.NOT_YOUR_NOMINATION,
                    "Nomeação atual pertence ao time " + nominator.getName());
        }

        if (pickRepository.existsByDraftIdAndEntityId(draftId, entityId)) {
            throw new DraftException(DraftErrorCode.ENTITY_ALREADY_PICKED, entityId + " já foi escolhido");
        }

        LegalityResult verdict = legalityValidator.validate(entityId, draft.getFormatId());
        if (!verdict.legal()) {
            throw new DraftException(DraftErrorCode.ENTITY_NOT_LEGAL, verdict.reason());
        }

        int openingBid = startingBid != null ? startingBid : draftProperties.getDefaultStartingBid();
        if (openingBid < 0) {
            throw new DraftException(DraftErrorCode.INVALID_INPUT, "Lance inicial não pode ser negativo");
        }
        if (openingBid > team.getBudgetRemaining()) {
            throw new DraftException(DraftErrorCode.INSUFFICIENT_BUDGET,
                    "Lance inicial " + openingBid + " acima do saldo " + team.getBudgetRemaining());
        }

        Instant now = Instant.now(clock);
        Auction auction = auctionRepository.saveAndFlush(Auction.builder()
                .draftId(draftId)
                .entityId(entityId)
                .entityName(verdict.entityName())
                .nominatingTeamId(team.getId())
                .currentBid(openingBid)
                .auctionEnd(now.plusSeconds(draft.getAuctionDurationSeconds()))
                .status(AuctionStatus.ACTIVE)
                .build());

        int claimed = draftRepository.claimAuctionSlot(draftId, auction.getId(), draft.getCurrentTurn(), now);
        if (claimed == 0) {
            log.warn("⚠️ [Auction] Nomeação concorrente no draft {}, leilão {} descartado", draftId,
                    auction.getId());
            throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                    "Outro leilão foi aberto no draft " + draftId);
        }

        log.info("🔨 [Auction] Draft {}: {} nomeou {} (lance inicial {}, termina {})", draftId, team.getName(),
                entityId, openingBid, auction.getAuctionEnd());

        eventPublisher.publishEvent(new DraftChangedEvent("auction_started", draftId, draft.getCurrentTurn())
                .with("auctionId", auction.getId())
                .with("entityId", entityId)
                .with("nominatingTeamId", team.getId()));
        return toDTO(auction, now);
    }

    // ========================================
    // LANCES
    // ========================================

    @Transactional
    public BidResult placeBid(Long draftId, Long auctionId, Long participantId, int amount) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant participant = draftGuard.requireParticipant(draftId, participantId);
        Team team = draftGuard.requireTeamOf(participant);
        Auction auction = requireAuction(draftId, auctionId);
        Instant now = Instant.now(clock);

        requireActive(draft);
        requireOpen(auction, now);
        if (amount <= auction.getCurrentBid()) {
            throw new DraftException(DraftErrorCode.BID_TOO_LOW,
                    "Lance " + amount + " precisa superar " + auction.getCurrentBid());
        }
        if (!BudgetLedger.canAfford(team.getBudgetRemaining(), amount)) {
            throw new DraftException(DraftErrorCode.INSUFFICIENT_BUDGET,
                    "Saldo " + team.getBudgetRemaining() + ", lance " + amount);
        }
        if (pickRepository.countByDraftIdAndTeamId(draftId, team.getId()) >= draft.getEntitiesPerTeam()) {
            throw new DraftException(DraftErrorCode.MAX_PICKS_REACHED,
                    "Time " + team.getName() + " já completou o elenco");
        }

        int accepted = auctionRepository.placeBid(auctionId, team.getId(), amount, now);
        if (accepted == 0) {
            throw explainRejectedBid(draftId, auctionId, team.getId(), amount, now);
        }

        bidHistoryRepository.save(BidHistory.builder()
                .auctionId(auctionId)
                .draftId(draftId)
                .teamId(team.getId())
                .teamName(team.getName())
                .amount(amount)
                .createdAt(now)
                .build());

        log.info("💸 [Auction] Leilão {}: {} deu lance de {}", auctionId, team.getName(), amount);

        eventPublisher.publishEvent(new DraftChangedEvent("bid_placed", draftId, draft.getCurrentTurn())
                .with("auctionId", auctionId)
                .with("teamId", team.getId())
                .with("amount", amount));
        return new BidResult(auctionId, team.getId(), amount, auction.getAuctionEnd());
    }

    // ========================================
    // RESOLUÇÃO
    // ========================================

    /**
     * Encerramento manual. O host encerra a qualquer momento; os demais só
     * depois do prazo.
     */
    @Transactional
    public AuctionResolution resolveAuction(Long draftId, Long auctionId, Long participantId) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant participant = draftGuard.requireParticipant(draftId, participantId);
        Auction auction = requireAuction(draftId, auctionId);
        Instant now = Instant.now(clock);

        if (!participant.isHostParticipant() && now.isBefore(auction.getAuctionEnd())) {
            throw new DraftException(DraftErrorCode.HOST_ONLY, "Leilão ainda não expirou");
        }
        return resolve(draft, auction, now);
    }

    /**
     * Chamado pela varredura. Drafts pausados esperam a retomada.
     */
    @Transactional
    public AuctionResolution resolveExpiredAuction(Long draftId, Long auctionId) {
        Draft draft = draftGuard.requireDraft(draftId);
        Auction auction = requireAuction(draftId, auctionId);
        Instant now = Instant.now(clock);

        requireActive(draft);
        if (now.isBefore(auction.getAuctionEnd())) {
            throw new DraftException(DraftErrorCode.AUCTION_NOT_ACTIVE,
                    "Leilão " + auctionId + " termina em " + auction.getAuctionEnd());
        }
        return resolve(draft, auction, now);
    }

    @Transactional(readOnly = true)
    public List<Auction> findExpiredAuctions(Instant now) {
        return auctionRepository.findByStatusAndAuctionEndLessThanEqual(AuctionStatus.ACTIVE, now);
    }

    private AuctionResolution resolve(Draft draft, Auction auction, Instant now) {
        Long draftId = draft.getId();
        Long auctionId = auction.getId();

        int finished = auctionRepository.finishIfActive(auctionId, AuctionStatus.COMPLETED, now);
        if (finished == 0) {
            throw new DraftException(DraftErrorCode.AUCTION_NOT_ACTIVE,
                    "Leilão " + auctionId + " já foi encerrado");
        }

        int teamCount = (int) teamRepository.countByDraftId(draftId);
        long picksBefore = pickRepository.countByDraftId(draftId);
        Long winnerTeamId = null;
        Integer price = null;
        Long pickId = null;

        Team winner = auction.hasBidder() ? draftGuard.requireTeam(draftId, auction.getCurrentBidderTeamId()) : null;
        if (winner != null && !BudgetLedger.canAfford(winner.getBudgetRemaining(), auction.getCurrentBid())) {
            // saldo reduzido depois do lance (override do host): encerra sem venda
            log.warn("⚠️ [Auction] Leilão {}: {} não cobre mais o lance {} (saldo {}), encerrado sem venda",
                    auctionId, winner.getName(), auction.getCurrentBid(), winner.getBudgetRemaining());
            actionLogService.record(draftId, DraftActionType.AUCTION_NO_SALE, null,
                    "Leilão " + auctionId + ": vencedor sem saldo para " + auction.getCurrentBid());
            winner = null;
        }

        if (winner != null) {
            price = auction.getCurrentBid();

            if (pickRepository.countByDraftIdAndTeamId(draftId, winner.getId()) >= draft.getEntitiesPerTeam()) {
                throw new DraftException(DraftErrorCode.MAX_PICKS_REACHED,
                        "Time " + winner.getName() + " já completou o elenco");
            }

            // CAS sobre o saldo lido: um débito concorrente derruba a resolução inteira
            budgetLedger.debitIfUnchanged(winner.getId(), winner.getBudgetRemaining(), price);

            int pickOrder = (int) picksBefore + 1;
            Pick pick = Pick.builder()
                    .draftId(draftId)
                    .teamId(winner.getId())
                    .entityId(auction.getEntityId())
                    .entityName(auction.getEntityName())
                    .cost(price)
                    .pickOrder(pickOrder)
                    .roundNumber(SnakeOrderGenerator.roundForTurn(pickOrder, teamCount))
                    .pickedByParticipantId(winner.getOwnerParticipantId())
                    .build();
            try {
                pick = pickRepository.saveAndFlush(pick);
            } catch (DataIntegrityViolationException e) {
                throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                        "Pick concorrente gravado para o mesmo slot", e);
            }

            wishlistItemRepository.markAvailability(draftId, auction.getEntityId(), false);
            actionLogService.record(DraftActionLog.builder()
                    .draftId(draftId)
                    .actionType(DraftActionType.AUCTION_WON)
                    .actorParticipantId(winner.getOwnerParticipantId())
                    .teamId(winner.getId())
                    .entityId(auction.getEntityId())
                    .entityName(auction.getEntityName())
                    .cost(price)
                    .roundNumber(pick.getRoundNumber())
                    .pickNumber(pickOrder)
                    .details("Leilão " + auctionId)
                    .build());

            winnerTeamId = winner.getId();
            pickId = pick.getId();
            log.info("🏆 [Auction] Leilão {}: {} arrematou {} por {}", auctionId, winner.getName(),
                    auction.getEntityId(), price);
        } else {
            log.info("🚫 [Auction] Leilão {} encerrado sem lances para {}", auctionId, auction.getEntityId());
        }

        long picksAfter = picksBefore + (winnerTeamId != null ? 1 : 0);
        int totalTurns = draft.totalTurns(teamCount);
        boolean completed = picksAfter >= totalTurns;
        int nextTurn = (int) picksAfter + 1;
        int nextRound = SnakeOrderGenerator.roundForTurn(Math.min(nextTurn, totalTurns), teamCount);

        int released = draftRepository.releaseAuctionSlot(draftId, auctionId, nextTurn, nextRound, now);
        if (released == 0) {
            throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                    "Slot de leilão do draft " + draftId + " já foi liberado");
        }
        if (completed) {
            draftRepository.complete(draftId, now);
            actionLogService.record(draftId, DraftActionType.COMPLETE, null,
                    "Todos os " + totalTurns + " picks concluídos");
            log.info("🏁 [Auction] Draft {} concluído", draftId);
        }

        eventPublisher.publishEvent(new DraftChangedEvent(completed ? "draft_completed" : "auction_resolved",
                draftId, completed ? null : nextTurn)
                .with("auctionId", auctionId)
                .with("winnerTeamId", winnerTeamId)
                .with("price", price));

        return new AuctionResolution(auctionId, winnerTeamId, price, pickId, nextTurn, completed);
    }

    // ========================================
    // ADMIN
    // ========================================

    @Transactional
    public AuctionDTO cancelAuction(Long draftId, Long auctionId, Long hostParticipantId) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant host = draftGuard.requireHost(draftId, hostParticipantId);
        Auction auction = requireAuction(draftId, auctionId);
        Instant now = Instant.now(clock);

        int finished = auctionRepository.finishIfActive(auctionId, AuctionStatus.CANCELLED, now);
        if (finished == 0) {
            throw new DraftException(DraftErrorCode.AUCTION_NOT_ACTIVE);
        }
        draftRepository.releaseAuctionSlot(draftId, auctionId, draft.getCurrentTurn(), draft.getCurrentRound(),
                now);

        log.info("🛑 [Admin] Host {} cancelou o leilão {} ({})", host.getId(), auctionId, auction.getEntityId());
        eventPublisher.publishEvent(new DraftChangedEvent("auction_cancelled", draftId, draft.getCurrentTurn())
                .with("auctionId", auctionId));

        auction.setStatus(AuctionStatus.CANCELLED);
        return toDTO(auction, now);
    }

    /**
     * Empurra o fim do leilão. Leilão já vencido ganha o prazo a partir de agora.
     */
    @Transactional
    public AuctionDTO extendAuction(Long draftId, Long auctionId, Long hostParticipantId, int seconds) {
        draftGuard.requireDraft(draftId);
        draftGuard.requireHost(draftId, hostParticipantId);
        if (seconds <= 0) {
            throw new DraftException(DraftErrorCode.INVALID_INPUT, "Extensão precisa ser positiva");
        }
        Auction auction = requireAuction(draftId, auctionId);
        if (auction.getStatus() != AuctionStatus.ACTIVE) {
            throw new DraftException(DraftErrorCode.AUCTION_NOT_ACTIVE);
        }

        Instant now = Instant.now(clock);
        Instant base = auction.getAuctionEnd().isAfter(now) ? auction.getAuctionEnd() : now;
        Instant newEnd = base.plusSeconds(seconds);

        int updated = auctionRepository.extend(auctionId, auction.getAuctionEnd(), newEnd, now);
        if (updated == 0) {
            throw new DraftException(DraftErrorCode.CONCURRENCY_CONFLICT,
                    "Leilão " + auctionId + " mudou durante a extensão");
        }

        log.info("⏱️ [Admin] Leilão {} estendido em {}s (novo fim {})", auctionId, seconds, newEnd);
        eventPublisher.publishEvent(new DraftChangedEvent("auction_extended", draftId, null)
                .with("auctionId", auctionId)
                .with("auctionEnd", newEnd.toString()));

        auction.setAuctionEnd(newEnd);
        return toDTO(auction, now);
    }

    // ========================================
    // CONSULTAS
    // ========================================

    @Transactional(readOnly = true)
    public Optional<AuctionDTO> getCurrentAuction(Long draftId) {
        draftGuard.requireDraft(draftId);
        Instant now = Instant.now(clock);
        return auctionRepository.findFirstByDraftIdAndStatus(draftId, AuctionStatus.ACTIVE)
                .map(auction -> toDTO(auction, now));
    }

    @Transactional(readOnly = true)
    public List<BidDTO> getBidHistory(Long draftId, Long auctionId) {
        requireAuction(draftId, auctionId);
        return draftMapper.toBidDTOs(bidHistoryRepository.findByAuctionIdOrderByCreatedAtAscIdAsc(auctionId));
    }

    @Transactional(readOnly = true)
    public AuctionStatsDTO getAuctionStats(Long draftId) {
        draftGuard.requireDraft(draftId);
        List<Auction> auctions = auctionRepository.findByDraftIdOrderByCreatedAtAsc(draftId);
        List<BidHistory> bids = bidHistoryRepository.findByDraftId(draftId);

        AuctionStatsDTO.AuctionStatsDTOBuilder stats = AuctionStatsDTO.builder()
                .draftId(draftId)
                .totalAuctions(auctions.size())
                .totalBids(bids.size())
                .averageBidsPerAuction(auctions.isEmpty() ? 0.0 : (double) bids.size() / auctions.size());

        Map<Long, Auction> auctionsById = auctions.stream()
                .collect(Collectors.toMap(Auction::getId, Function.identity()));
        bids.stream()
                .max(Comparator.comparing(BidHistory::getAmount))
                .ifPresent(top -> stats
                        .highestBid(top.getAmount())
                        .highestBidEntityName(Optional.ofNullable(auctionsById.get(top.getAuctionId()))
                                .map(Auction::getEntityName)
                                .orElse(null)));

        Map<Long, Long> bidsPerTeam = bids.stream()
                .collect(Collectors.groupingBy(BidHistory::getTeamId, Collectors.counting()));
        bidsPerTeam.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .ifPresent(entry -> {
                    stats.mostActiveTeamId(entry.getKey());
                    stats.mostActiveTeamName(bids.stream()
                            .filter(b -> b.getTeamId().equals(entry.getKey()))
                            .map(BidHistory::getTeamName)
                            .findFirst()
                            .orElse(null));
                });

        return stats.build();
    }

    /**
     * Time com direito de nomear: rodízio por picks % times, pulando quem já
     * completou o elenco.
     */
    public Optional<Team> resolveNominator(Draft draft, List<Team> teamsInOrder) {
        if (teamsInOrder.isEmpty()) {
            return Optional.empty();
        }
        long picks = pickRepository.countByDraftId(draft.getId());
        int start = (int) (picks % teamsInOrder.size());
        for (int i = 0; i < teamsInOrder.size(); i++) {
            Team candidate = teamsInOrder.get((start + i) % teamsInOrder.size());
            if (pickRepository.countByDraftIdAndTeamId(draft.getId(), candidate.getId()) < draft
                    .getEntitiesPerTeam()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public AuctionDTO toDTO(Auction auction, Instant now) {
        AuctionDTO dto = draftMapper.toDTO(auction);
        long remaining = Duration.between(now, auction.getAuctionEnd()).getSeconds();
        dto.setSecondsRemaining(Math.max(0L, remaining));
        return dto;
    }

    // ========================================
    // HELPERS
    // ========================================

    private DraftException explainRejectedBid(Long draftId, Long auctionId, Long teamId, int amount, Instant now) {
        Auction fresh = requireAuction(draftId, auctionId);
        if (fresh.getStatus() != AuctionStatus.ACTIVE) {
            return new DraftException(DraftErrorCode.AUCTION_NOT_ACTIVE);
        }
        if (!now.isBefore(fresh.getAuctionEnd())) {
            return new DraftException(DraftErrorCode.AUCTION_EXPIRED);
        }
        if (amount <= fresh.getCurrentBid()) {
            log.debug("[Auction] Lance {} do time {} superado por {} no leilão {}", amount, teamId,
                    fresh.getCurrentBid(), auctionId);
            return new DraftException(DraftErrorCode.BID_TOO_LOW,
                    "Lance " + amount + " precisa superar " + fresh.getCurrentBid());
        }
        return new DraftException(DraftErrorCode.INSUFFICIENT_BUDGET, "Saldo insuficiente para " + amount);
    }

    private Auction requireAuction(Long draftId, Long auctionId) {
        return auctionRepository.findByIdAndDraftId(auctionId, draftId)
                .orElseThrow(() -> new DraftException(DraftErrorCode.AUCTION_NOT_FOUND,
                        "Leilão " + auctionId + " não encontrado no draft " + draftId));
    }

    private void requireAuctionDraft(Draft draft) {
        if (!draft.isAuction()) {
            throw new DraftException(DraftErrorCode.WRONG_DRAFT_TYPE, "Draft snake não tem leilões");
        }
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

    private void requireOpen(Auction auction, Instant now) {
        if (auction.getStatus() != AuctionStatus.ACTIVE) {
            throw new DraftException(DraftErrorCode.AUCTION_NOT_ACTIVE);
        }
        if (!now.isBefore(auction.getAuctionEnd())) {
            throw new DraftException(DraftErrorCode.AUCTION_EXPIRED);
        }
    }
}
