package br.com.fantasydraft.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

@Entity
@DynamicUpdate
@Table(name = "teams", uniqueConstraints = @UniqueConstraint(name = "uk_teams_draft_name", columnNames = { "draft_id",
        "name" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Team {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "draft_id", nullable = false)
    private Long draftId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "owner_participant_id")
    private Long ownerParticipantId;

    // posição 1..N na ordem do draft
    @Column(name = "draft_order", nullable = false)
    private Integer draftOrder;

    @Column(name = "budget_remaining", nullable = false)
    private Integer budgetRemaining;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }
}
