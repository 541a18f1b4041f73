package br.com.fantasydraft.backend.scheduled;

import br.com.fantasydraft.backend.domain.entity.Auction;
import br.com.fantasydraft.backend.domain.entity.Draft;
import br.com.fantasydraft.backend.dto.AuctionResolution;
import br.com.fantasydraft.backend.dto.AutoSkipResult;
import br.com.fantasydraft.backend.exception.DraftException;
import br.com.fantasydraft.backend.service.AuctionService;
import br.com.fantasydraft.backend.service.AutoSkipService;
import br.com.fantasydraft.backend.service.lock.DraftSweepLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * ✅ Varredura de timers: turnos estourados (snake) e leilões vencidos
 *
 * Cada draft é tratado isoladamente: erro em um não interrompe os outros nem
 * derruba a thread do scheduler.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "draft.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DraftTimerScheduledTask {

    private final AutoSkipService autoSkipService;
    private final AuctionService auctionService;
    private final DraftSweepLockService sweepLockService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${draft.sweep.interval-ms:1000}")
    public void sweep() {
        if (!sweepLockService.acquireSweepLock()) {
            return;
        }
        try {
            Instant now = Instant.now(clock);
            sweepExpiredTurns(now);
            sweepExpiredAuctions(now);
        } catch (Exception e) {
            log.error("❌ [Sweep] Erro na varredura de timers", e);
        } finally {
            sweepLockService.releaseSweepLock();
        }
    }

    void sweepExpiredTurns(Instant now) {
        for (Draft draft : autoSkipService.findDraftsWithExpiredTurn(now)) {
            try {
                AutoSkipResult result = autoSkipService.handleTurnTimeout(draft.getId(), draft.getCurrentTurn());
                if (result.outcome() != AutoSkipResult.Outcome.NOOP) {
                    log.info("⏰ [Sweep] Draft {} turno {}: {}", draft.getId(), draft.getCurrentTurn(),
                            result.outcome());
                }
            } catch (Exception e) {
                log.error("❌ [Sweep] Falha no timeout do draft {} turno {}", draft.getId(),
                        draft.getCurrentTurn(), e);
            }
        }
    }

    void sweepExpiredAuctions(Instant now) {
        for (Auction auction : auctionService.findExpiredAuctions(now)) {
            try {
                AuctionResolution resolution = auctionService.resolveExpiredAuction(auction.getDraftId(),
                        auction.getId());
                log.info("⏰ [Sweep] Leilão {} resolvido (vendido: {})", auction.getId(), resolution.sold());
            } catch (DraftException e) {
                if (e.isBenignForTimers()) {
                    log.debug("[Sweep] Leilão {} ignorado: {}", auction.getId(), e.getCode());
                } else {
                    log.error("❌ [Sweep] Falha ao resolver leilão {}: {}", auction.getId(), e.getCode(), e);
                }
            } catch (Exception e) {
                log.error("❌ [Sweep] Falha ao resolver leilão {}", auction.getId(), e);
            }
        }
    }
}
