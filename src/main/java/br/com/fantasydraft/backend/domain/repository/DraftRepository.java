package br.com.fantasydraft.backend.domain.repository;

import br.com.fantasydraft.backend.domain.entity.Draft;
import br.com.fantasydraft.backend.domain.entity.DraftStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Todas as transições de turno/status são UPDATEs condicionais (compare-and-swap).
 * O retorno é o número de linhas afetadas: 0 significa que outra requisição
 * chegou antes e o chamador deve tratar como conflito.
 */
@Repository
public interface DraftRepository extends JpaRepository<Draft, Long> {

    Optional<Draft> findByRoomCode(String roomCode);

    boolean existsByRoomCode(String roomCode);

    List<Draft> findByStatusAndArchivedFalse(DraftStatus status);

    List<Draft> findByPublicDraftTrueAndArchivedFalseAndStatusInOrderByCreatedAtDesc(List<DraftStatus> statuses);

    /**
     * Avança o turno de {@code expectedTurn} para {@code nextTurn} somente se o
     * draft ainda estiver no status e turno esperados. Aplica o timer pendente.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Draft d SET d.currentTurn = :nextTurn, d.currentRound = :nextRound, d.status = :nextStatus, " +
            "d.timeLimitSeconds = COALESCE(d.pendingTimeLimitSeconds, d.timeLimitSeconds), " +
            "d.pendingTimeLimitSeconds = NULL, d.turnStartedAt = :now, d.updatedAt = :now " +
            "WHERE d.id = :draftId AND d.status = :requiredStatus AND d.currentTurn = :expectedTurn")
    int advanceTurn(@Param("draftId") Long draftId,
            @Param("expectedTurn") Integer expectedTurn,
            @Param("nextTurn") Integer nextTurn,
            @Param("nextRound") Integer nextRound,
            @Param("nextStatus") DraftStatus nextStatus,
            @Param("requiredStatus") DraftStatus requiredStatus,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Draft d SET d.currentTurn = :newTurn, d.currentRound = :newRound, d.status = :newStatus, " +
            "d.turnStartedAt = :now, d.updatedAt = :now " +
            "WHERE d.id = :draftId AND d.currentTurn = :expectedTurn AND d.status = :expectedStatus " +
            "AND d.activeAuctionId IS NULL")
    int rollbackTurn(@Param("draftId") Long draftId,
            @Param("expectedTurn") Integer expectedTurn,
            @Param("expectedStatus") DraftStatus expectedStatus,
            @Param("newTurn") Integer newTurn,
            @Param("newRound") Integer newRound,
            @Param("newStatus") DraftStatus newStatus,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Draft d SET d.status = br.com.fantasydraft.backend.domain.entity.DraftStatus.ACTIVE, " +
            "d.currentTurn = 1, d.currentRound = 1, d.orderShuffled = true, d.turnStartedAt = :now, d.updatedAt = :now " +
            "WHERE d.id = :draftId AND d.status = br.com.fantasydraft.backend.domain.entity.DraftStatus.SETUP")
    int activate(@Param("draftId") Long draftId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Draft d SET d.status = br.com.fantasydraft.backend.domain.entity.DraftStatus.PAUSED, " +
            "d.pausedAt = :now, d.updatedAt = :now " +
            "WHERE d.id = :draftId AND d.status = br.com.fantasydraft.backend.domain.entity.DraftStatus.ACTIVE")
    int pause(@Param("draftId") Long draftId, @Param("now") Instant now);

    // retomar reinicia o relógio do turno para não penalizar o tempo pausado
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Draft d SET d.status = br.com.fantasydraft.backend.domain.entity.DraftStatus.ACTIVE, " +
            "d.turnStartedAt = :now, d.pausedAt = NULL, d.updatedAt = :now " +
            "WHERE d.id = :draftId AND d.status = br.com.fantasydraft.backend.domain.entity.DraftStatus.PAUSED")
    int resume(@Param("draftId") Long draftId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Draft d SET d.status = br.com.fantasydraft.backend.domain.entity.DraftStatus.COMPLETED, " +
            "d.updatedAt = :now WHERE d.id = :draftId " +
            "AND d.status IN (br.com.fantasydraft.backend.domain.entity.DraftStatus.ACTIVE, " +
            "br.com.fantasydraft.backend.domain.entity.DraftStatus.PAUSED)")
    int complete(@Param("draftId") Long draftId, @Param("now") Instant now);

    /**
     * Reserva o slot de leilão do draft. Só um leilão ativo por draft: quem
     * gravar primeiro o activeAuctionId vence.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Draft d SET d.activeAuctionId = :auctionId, d.updatedAt = :now " +
            "WHERE d.id = :draftId AND d.activeAuctionId IS NULL AND d.currentTurn = :expectedTurn " +
            "AND d.status = br.com.fantasydraft.backend.domain.entity.DraftStatus.ACTIVE")
    int claimAuctionSlot(@Param("draftId") Long draftId,
            @Param("auctionId") Long auctionId,
            @Param("expectedTurn") Integer expectedTurn,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Draft d SET d.activeAuctionId = NULL, d.currentTurn = :nextTurn, d.currentRound = :nextRound, " +
            "d.turnStartedAt = :now, d.updatedAt = :now " +
            "WHERE d.id = :draftId AND d.activeAuctionId = :auctionId")
    int releaseAuctionSlot(@Param("draftId") Long draftId,
            @Param("auctionId") Long auctionId,
            @Param("nextTurn") Integer nextTurn,
            @Param("nextRound") Integer nextRound,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Draft d SET d.status = br.com.fantasydraft.backend.domain.entity.DraftStatus.SETUP, " +
            "d.currentTurn = NULL, d.currentRound = 1, d.activeAuctionId = NULL, d.turnStartedAt = NULL, " +
            "d.pausedAt = NULL, " +
            "d.orderShuffled = false, d.updatedAt = :now WHERE d.id = :draftId")
    int resetToSetup(@Param("draftId") Long draftId, @Param("now") Instant now);
}
