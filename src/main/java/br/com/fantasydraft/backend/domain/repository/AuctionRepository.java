package br.com.fantasydraft.backend.domain.repository;

import br.com.fantasydraft.backend.domain.entity.Auction;
import br.com.fantasydraft.backend.domain.entity.AuctionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AuctionRepository extends JpaRepository<Auction, Long> {

    Optional<Auction> findByIdAndDraftId(Long id, Long draftId);

    Optional<Auction> findFirstByDraftIdAndStatus(Long draftId, AuctionStatus status);

    List<Auction> findByDraftIdOrderByCreatedAtAsc(Long draftId);

    List<Auction> findByStatusAndAuctionEndLessThanEqual(AuctionStatus status, Instant now);

    long countByDraftIdAndStatus(Long draftId, AuctionStatus status);

    /**
     * Aceita o lance somente se ele supera o atual, o leilão não expirou e o
     * time ainda tem orçamento para cobri-lo. Tudo avaliado na mesma instrução.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Auction a SET a.currentBid = :amount, a.currentBidderTeamId = :teamId, a.updatedAt = :now " +
            "WHERE a.id = :auctionId " +
            "AND a.status = br.com.fantasydraft.backend.domain.entity.AuctionStatus.ACTIVE " +
            "AND a.currentBid < :amount AND a.auctionEnd > :now " +
            "AND EXISTS (SELECT t.id FROM Team t WHERE t.id = :teamId AND t.budgetRemaining >= :amount)")
    int placeBid(@Param("auctionId") Long auctionId,
            @Param("teamId") Long teamId,
            @Param("amount") int amount,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Auction a SET a.status = :finalStatus, a.updatedAt = :now WHERE a.id = :auctionId " +
            "AND a.status = br.com.fantasydraft.backend.domain.entity.AuctionStatus.ACTIVE")
    int finishIfActive(@Param("auctionId") Long auctionId,
            @Param("finalStatus") AuctionStatus finalStatus,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Auction a SET a.auctionEnd = :newEnd, a.updatedAt = :now WHERE a.id = :auctionId " +
            "AND a.status = br.com.fantasydraft.backend.domain.entity.AuctionStatus.ACTIVE " +
            "AND a.auctionEnd = :expectedEnd")
    int extend(@Param("auctionId") Long auctionId,
            @Param("expectedEnd") Instant expectedEnd,
            @Param("newEnd") Instant newEnd,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Auction a WHERE a.draftId = :draftId")
    int deleteAllByDraftId(@Param("draftId") Long draftId);
}
