package br.com.fantasydraft.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Pick confirmado. As constraints únicas garantem, no banco, ordem de pick
 * única por draft e nenhuma entidade repetida no mesmo time.
 */
@Entity
@Table(name = "picks", uniqueConstraints = {
        @UniqueConstraint(name = "uk_picks_draft_order", columnNames = { "draft_id", "pick_order" }),
        @UniqueConstraint(name = "uk_picks_draft_team_entity", columnNames = { "draft_id", "team_id", "entity_id" })
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Pick {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "draft_id", nullable = false)
    private Long draftId;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    @Column(name = "entity_id", nullable = false, length = 100)
    private String entityId;

    @Column(name = "entity_name", length = 150)
    private String entityName;

    @Column(nullable = false)
    private Integer cost;

    @Column(name = "pick_order", nullable = false)
    private Integer pickOrder;

    @Column(name = "round_number", nullable = false)
    private Integer roundNumber;

    @Column(name = "picked_by_participant_id")
    private Long pickedByParticipantId;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        createdAt = Instant.now();
    }
}
