package br.com.fantasydraft.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Registro imutável de lance aceito.
 */
@Entity
@Table(name = "bid_history")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BidHistory {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "auction_id", nullable = false, updatable = false)
    private Long auctionId;

    @Column(name = "draft_id", nullable = false, updatable = false)
    private Long draftId;

    @Column(name = "team_id", nullable = false, updatable = false)
    private Long teamId;

    @Column(name = "team_name", length = 100, updatable = false)
    private String teamName;

    @Column(nullable = false, updatable = false)
    private Integer amount;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null)
            createdAt = Instant.now();
    }
}
