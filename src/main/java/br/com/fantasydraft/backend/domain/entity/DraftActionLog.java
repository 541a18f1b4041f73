package br.com.fantasydraft.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Histórico append-only das ações do draft. Para BUDGET_OVERRIDE o campo
 * {@code cost} guarda o delta aplicado ao orçamento (pode ser negativo).
 */
@Entity
@Table(name = "draft_action_logs", indexes = @Index(name = "idx_action_logs_draft", columnList = "draft_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DraftActionLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "draft_id", nullable = false, updatable = false)
    private Long draftId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", length = 30, nullable = false, updatable = false)
    private DraftActionType actionType;

    @Column(name = "actor_participant_id", updatable = false)
    private Long actorParticipantId;

    @Column(name = "team_id", updatable = false)
    private Long teamId;

    @Column(name = "entity_id", length = 100, updatable = false)
    private String entityId;

    @Column(name = "entity_name", length = 150, updatable = false)
    private String entityName;

    @Column(updatable = false)
    private Integer cost;

    @Column(name = "round_number", updatable = false)
    private Integer roundNumber;

    @Column(name = "pick_number", updatable = false)
    private Integer pickNumber;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String details;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null)
            createdAt = Instant.now();
    }
}
