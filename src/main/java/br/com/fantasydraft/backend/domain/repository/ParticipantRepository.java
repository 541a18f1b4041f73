package br.com.fantasydraft.backend.domain.repository;

import br.com.fantasydraft.backend.domain.entity.Participant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ParticipantRepository extends JpaRepository<Participant, Long> {

    List<Participant> findByDraftId(Long draftId);

    Optional<Participant> findByIdAndDraftId(Long id, Long draftId);

    List<Participant> findByDraftIdAndTeamId(Long draftId, Long teamId);

    long countByDraftIdAndTeamId(Long draftId, Long teamId);

    @Modifying
    @Query("UPDATE Participant p SET p.lastSeenAt = :now WHERE p.id = :participantId AND p.draftId = :draftId")
    int touchLastSeen(@Param("draftId") Long draftId,
            @Param("participantId") Long participantId,
            @Param("now") Instant now);
}
