package br.com.fantasydraft.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantDTO {
    private Long id;
    private String displayName;
    private Long teamId;
    private Boolean host;
    private Boolean online; // derivado de lastSeenAt
    private Instant lastSeenAt;
}
