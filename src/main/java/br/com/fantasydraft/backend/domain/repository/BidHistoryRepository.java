package br.com.fantasydraft.backend.domain.repository;

import br.com.fantasydraft.backend.domain.entity.BidHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BidHistoryRepository extends JpaRepository<BidHistory, Long> {

    List<BidHistory> findByAuctionIdOrderByCreatedAtAscIdAsc(Long auctionId);

    List<BidHistory> findByDraftId(Long draftId);

    long countByDraftId(Long draftId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM BidHistory b WHERE b.draftId = :draftId")
    int deleteAllByDraftId(@Param("draftId") Long draftId);
}
