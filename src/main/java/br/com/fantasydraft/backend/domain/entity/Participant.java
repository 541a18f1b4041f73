package br.com.fantasydraft.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "participants")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Participant {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "draft_id", nullable = false)
    private Long draftId;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    // null = espectador
    @Column(name = "team_id")
    private Long teamId;

    @Column(name = "is_host")
    private Boolean host;

    @Column(name = "last_seen_at")
    private Instant lastSeenAt;

    @Column(name = "created_at")
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        createdAt = now;
        if (lastSeenAt == null)
            lastSeenAt = now;
        if (host == null)
            host = false;
    }

    public boolean isSpectator() {
        return teamId == null;
    }

    public boolean isHostParticipant() {
        return Boolean.TRUE.equals(host);
    }
}
