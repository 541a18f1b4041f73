package br.com.fantasydraft.backend.domain.repository;

import br.com.fantasydraft.backend.domain.entity.WishlistItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WishlistItemRepository extends JpaRepository<WishlistItem, Long> {

    List<WishlistItem> findByDraftIdAndParticipantIdOrderByPriorityAsc(Long draftId, Long participantId);

    List<WishlistItem> findByDraftIdAndParticipantIdAndAvailableTrueOrderByPriorityAsc(Long draftId,
            Long participantId);

    Optional<WishlistItem> findByDraftIdAndParticipantIdAndEntityId(Long draftId, Long participantId,
            String entityId);

    boolean existsByParticipantIdAndEntityId(Long participantId, String entityId);

    @Query("SELECT COALESCE(MAX(w.priority), 0) FROM WishlistItem w WHERE w.participantId = :participantId")
    int findMaxPriority(@Param("participantId") Long participantId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WishlistItem w SET w.available = :available WHERE w.draftId = :draftId AND w.entityId = :entityId")
    int markAvailability(@Param("draftId") Long draftId,
            @Param("entityId") String entityId,
            @Param("available") boolean available);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WishlistItem w SET w.available = true WHERE w.draftId = :draftId")
    int markAllAvailable(@Param("draftId") Long draftId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM WishlistItem w WHERE w.participantId = :participantId")
    int deleteAllByParticipantId(@Param("participantId") Long participantId);
}
