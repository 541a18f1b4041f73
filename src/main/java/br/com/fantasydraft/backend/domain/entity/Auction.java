package br.com.fantasydraft.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "auctions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Auction {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "draft_id", nullable = false)
    private Long draftId;

    @Column(name = "entity_id", nullable = false, length = 100)
    private String entityId;

    @Column(name = "entity_name", length = 150)
    private String entityName;

    @Column(name = "nominating_team_id", nullable = false)
    private Long nominatingTeamId;

    @Column(name = "current_bid", nullable = false)
    private Integer currentBid;

    @Column(name = "current_bidder_team_id")
    private Long currentBidderTeamId;

    @Column(name = "auction_end", nullable = false)
    private Instant auctionEnd;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private AuctionStatus status;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
        if (status == null)
            status = AuctionStatus.ACTIVE;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }

    public boolean hasBidder() {
        return currentBidderTeamId != null;
    }
}
