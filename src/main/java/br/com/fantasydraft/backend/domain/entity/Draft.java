package br.com.fantasydraft.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

/**
 * Sala de draft. O estado de turno (currentTurn/currentRound/status) só é
 * alterado por UPDATEs condicionais do {@code DraftRepository}, nunca por
 * save() de uma cópia carregada.
 */
@Entity
@DynamicUpdate
@Table(name = "drafts", uniqueConstraints = @UniqueConstraint(name = "uk_drafts_room_code", columnNames = "room_code"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Draft {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_code", length = 6, nullable = false)
    private String roomCode;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private DraftStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "draft_type", length = 20, nullable = false)
    private DraftType draftType;

    @Column(name = "format_id", length = 50)
    private String formatId;

    @Column(name = "current_turn")
    private Integer currentTurn;

    @Column(name = "current_round")
    private Integer currentRound;

    @Column(name = "max_teams")
    private Integer maxTeams;

    @Column(name = "budget_per_team")
    private Integer budgetPerTeam;

    @Column(name = "entities_per_team")
    private Integer entitiesPerTeam;

    // 0 = sem limite
    @Column(name = "time_limit_seconds")
    private Integer timeLimitSeconds;

    @Column(name = "pending_time_limit_seconds")
    private Integer pendingTimeLimitSeconds;

    @Column(name = "auction_duration_seconds")
    private Integer auctionDurationSeconds;

    @Column(name = "allow_undo")
    private Boolean allowUndo;

    @Column(name = "proxy_picking_enabled")
    private Boolean proxyPickingEnabled;

    @Column(name = "order_shuffled")
    private Boolean orderShuffled;

    @Column(name = "is_public")
    private Boolean publicDraft;

    @Column(name = "archived")
    private Boolean archived;

    @Column(name = "active_auction_id")
    private Long activeAuctionId;

    @Column(name = "turn_started_at")
    private Instant turnStartedAt;

    // preenchido enquanto PAUSED; a retomada desloca o leilão aberto por (agora - pausedAt)
    @Column(name = "paused_at")
    private Instant pausedAt;

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
            status = DraftStatus.SETUP;
        if (draftType == null)
            draftType = DraftType.SNAKE;
        if (currentRound == null)
            currentRound = 1;
        if (timeLimitSeconds == null)
            timeLimitSeconds = 0;
        if (allowUndo == null)
            allowUndo = false;
        if (proxyPickingEnabled == null)
            proxyPickingEnabled = false;
        if (orderShuffled == null)
            orderShuffled = false;
        if (publicDraft == null)
            publicDraft = false;
        if (archived == null)
            archived = false;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isSnake() {
        return draftType == DraftType.SNAKE;
    }

    public boolean isAuction() {
        return draftType == DraftType.AUCTION;
    }

    public int totalTurns(int teamCount) {
        return teamCount * entitiesPerTeam;
    }
}
