package br.com.fantasydraft.backend.domain.repository;

import br.com.fantasydraft.backend.domain.entity.DraftActionLog;
import br.com.fantasydraft.backend.domain.entity.DraftActionType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DraftActionLogRepository extends JpaRepository<DraftActionLog, Long> {

    List<DraftActionLog> findByDraftIdOrderByIdDesc(Long draftId, Pageable pageable);

    Optional<DraftActionLog> findFirstByDraftIdAndActionTypeOrderByIdDesc(Long draftId, DraftActionType actionType);

    /**
     * Soma dos deltas de override de orçamento aplicados a um time depois do
     * último reset do draft.
     */
    @Query("SELECT COALESCE(SUM(a.cost), 0) FROM DraftActionLog a WHERE a.draftId = :draftId " +
            "AND a.teamId = :teamId AND a.id > :sinceId " +
            "AND a.actionType = br.com.fantasydraft.backend.domain.entity.DraftActionType.BUDGET_OVERRIDE")
    long sumBudgetOverrides(@Param("draftId") Long draftId,
            @Param("teamId") Long teamId,
            @Param("sinceId") Long sinceId);
}
