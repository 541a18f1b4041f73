package br.com.fantasydraft.backend.domain.repository;

import br.com.fantasydraft.backend.domain.entity.Pick;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PickRepository extends JpaRepository<Pick, Long> {

    List<Pick> findByDraftIdOrderByPickOrderAsc(Long draftId);

    List<Pick> findByDraftIdAndTeamIdOrderByPickOrderAsc(Long draftId, Long teamId);

    Optional<Pick> findFirstByDraftIdOrderByPickOrderDesc(Long draftId);

    long countByDraftId(Long draftId);

    long countByDraftIdAndTeamId(Long draftId, Long teamId);

    boolean existsByDraftIdAndTeamIdAndEntityId(Long draftId, Long teamId, String entityId);

    boolean existsByDraftIdAndEntityId(Long draftId, String entityId);

    @Query("SELECT p.entityId FROM Pick p WHERE p.draftId = :draftId")
    List<String> findEntityIdsByDraftId(@Param("draftId") Long draftId);

    @Query("SELECT COALESCE(SUM(p.cost), 0) FROM Pick p WHERE p.draftId = :draftId AND p.teamId = :teamId")
    long sumCostByTeam(@Param("draftId") Long draftId, @Param("teamId") Long teamId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Pick p WHERE p.id = :pickId AND p.draftId = :draftId")
    int deletePick(@Param("draftId") Long draftId, @Param("pickId") Long pickId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Pick p WHERE p.draftId = :draftId")
    int deleteAllByDraftId(@Param("draftId") Long draftId);
}
