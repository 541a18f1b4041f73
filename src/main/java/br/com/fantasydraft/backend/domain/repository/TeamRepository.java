package br.com.fantasydraft.backend.domain.repository;

import br.com.fantasydraft.backend.domain.entity.Team;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TeamRepository extends JpaRepository<Team, Long> {

    List<Team> findByDraftIdOrderByDraftOrderAsc(Long draftId);

    Optional<Team> findByIdAndDraftId(Long id, Long draftId);

    long countByDraftId(Long draftId);

    boolean existsByDraftIdAndNameIgnoreCase(Long draftId, String name);

    @Query("SELECT t.budgetRemaining FROM Team t WHERE t.id = :teamId")
    Optional<Integer> findBudgetRemaining(@Param("teamId") Long teamId);

    // débito só acontece se houver saldo; 0 linhas = saldo insuficiente
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Team t SET t.budgetRemaining = t.budgetRemaining - :amount " +
            "WHERE t.id = :teamId AND t.budgetRemaining >= :amount")
    int debitIfAffordable(@Param("teamId") Long teamId, @Param("amount") int amount);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Team t SET t.budgetRemaining = t.budgetRemaining - :amount " +
            "WHERE t.id = :teamId AND t.budgetRemaining = :expectedBudget AND t.budgetRemaining >= :amount")
    int debitIfUnchanged(@Param("teamId") Long teamId,
            @Param("expectedBudget") int expectedBudget,
            @Param("amount") int amount);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Team t SET t.budgetRemaining = t.budgetRemaining + :amount WHERE t.id = :teamId")
    int credit(@Param("teamId") Long teamId, @Param("amount") int amount);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Team t SET t.budgetRemaining = :newBudget " +
            "WHERE t.id = :teamId AND t.budgetRemaining = :expectedBudget")
    int overrideBudget(@Param("teamId") Long teamId,
            @Param("expectedBudget") int expectedBudget,
            @Param("newBudget") int newBudget);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Team t SET t.budgetRemaining = :budget WHERE t.draftId = :draftId")
    int resetBudgets(@Param("draftId") Long draftId, @Param("budget") int budget);
}
