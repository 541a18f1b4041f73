package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.config.properties.DraftProperties;
import br.com.fantasydraft.backend.domain.entity.*;
import br.com.fantasydraft.backend.domain.repository.DraftRepository;
import br.com.fantasydraft.backend.domain.repository.ParticipantRepository;
import br.com.fantasydraft.backend.domain.repository.TeamRepository;
import br.com.fantasydraft.backend.domain.repository.WishlistItemRepository;
import br.com.fantasydraft.backend.dto.CreateDraftRequest;
import br.com.fantasydraft.backend.dto.CreateDraftResult;
import br.com.fantasydraft.backend.dto.JoinDraftRequest;
import br.com.fantasydraft.backend.dto.JoinResult;
import br.com.fantasydraft.backend.dto.TeamDTO;
import br.com.fantasydraft.backend.dto.events.DraftChangedEvent;
import br.com.fantasydraft.backend.exception.DraftErrorCode;
import br.com.fantasydraft.backend.exception.DraftException;
import br.com.fantasydraft.backend.mapper.DraftMapper;
import br.com.fantasydraft.backend.util.RoomCodeGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Criação de sala, entrada de times e espectadores, saída e presença.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftSessionService {

    private static final int ROOM_CODE_ATTEMPTS = 10;

    private final DraftRepository draftRepository;
    private final TeamRepository teamRepository;
    private final ParticipantRepository participantRepository;
    private final WishlistItemRepository wishlistItemRepository;
    private final DraftGuard draftGuard;
    private final DraftMapper draftMapper;
    private final DraftProperties draftProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public CreateDraftResult createDraft(CreateDraftRequest request) {
        int maxTeams = valueOr(request.getMaxTeams(), draftProperties.getDefaultMaxTeams());
        if (maxTeams < 2 || maxTeams > draftProperties.getMaxTeamsLimit()) {
            throw new DraftException(DraftErrorCode.INVALID_INPUT,
                    "maxTeams deve estar entre 2 e " + draftProperties.getMaxTeamsLimit());
        }

        Draft draft = draftRepository.save(Draft.builder()
                .roomCode(generateUniqueRoomCode())
                .name(request.getName().trim())
                .status(DraftStatus.SETUP)
                .draftType(request.getDraftType() != null ? request.getDraftType() : DraftType.SNAKE)
                .formatId(request.getFormatId())
                .currentRound(1)
                .maxTeams(maxTeams)
                .budgetPerTeam(valueOr(request.getBudgetPerTeam(), draftProperties.getDefaultBudgetPerTeam()))
                .entitiesPerTeam(valueOr(request.getEntitiesPerTeam(), draftProperties.getDefaultEntitiesPerTeam()))
                .timeLimitSeconds(valueOr(request.getTimeLimitSeconds(), draftProperties.getDefaultTimeLimitSeconds()))
                .auctionDurationSeconds(valueOr(request.getAuctionDurationSeconds(),
                        draftProperties.getDefaultAuctionDurationSeconds()))
                .allowUndo(Boolean.TRUE.equals(request.getAllowUndo()))
                .proxyPickingEnabled(Boolean.TRUE.equals(request.getProxyPickingEnabled()))
                .publicDraft(Boolean.TRUE.equals(request.getPublicDraft()))
                .orderShuffled(false)
                .archived(false)
                .build());

        Participant host = participantRepository.save(Participant.builder()
                .draftId(draft.getId())
                .displayName(request.getHostDisplayName().trim())
                .host(true)
                .lastSeenAt(Instant.now(clock))
                .build());

        TeamDTO hostTeam = null;
        if (request.getHostTeamName() != null && !request.getHostTeamName().isBlank()) {
            Team team = createTeam(draft, host, request.getHostTeamName().trim(), 1);
            hostTeam = draftMapper.toDTO(team);
        }

        log.info("🆕 [Session] Draft {} criado ({}), sala {} host {}", draft.getId(), draft.getDraftType(),
                draft.getRoomCode(), host.getDisplayName());
        return new CreateDraftResult(draftMapper.toDTO(draft), draftMapper.toDTO(host), hostTeam);
    }

    /**
     * Entrada com time. Draft cheio ou já iniciado vira espectador; nome de
     * time repetido é rejeitado.
     */
    @Transactional
    public JoinResult joinDraft(JoinDraftRequest request) {
        Draft draft = requireByRoomCode(request.getRoomCode());
        String displayName = request.getDisplayName().trim();

        if (Boolean.TRUE.equals(draft.getArchived())) {
            return new JoinResult.Rejected(draft.getId(), DraftErrorCode.DRAFT_COMPLETED, "Draft arquivado");
        }

        String teamName = request.getTeamName() == null ? null : request.getTeamName().trim();
        if (teamName == null || teamName.isEmpty()) {
            return addSpectator(draft, displayName, "Nenhum time informado");
        }
        if (draft.getStatus() != DraftStatus.SETUP) {
            return addSpectator(draft, displayName, "Draft já iniciado");
        }

        long teamCount = teamRepository.countByDraftId(draft.getId());
        if (teamCount >= draft.getMaxTeams()) {
            return addSpectator(draft, displayName, "Draft cheio (" + teamCount + "/" + draft.getMaxTeams() + ")");
        }
        if (teamRepository.existsByDraftIdAndNameIgnoreCase(draft.getId(), teamName)) {
            return new JoinResult.Rejected(draft.getId(), DraftErrorCode.DUPLICATE_TEAM_NAME,
                    "Já existe um time chamado " + teamName);
        }

        Participant participant = participantRepository.save(Participant.builder()
                .draftId(draft.getId())
                .displayName(displayName)
                .host(false)
                .lastSeenAt(Instant.now(clock))
                .build());
        Team team = createTeam(draft, participant, teamName, (int) teamCount + 1);

        log.info("👥 [Session] {} entrou no draft {} com o time {} (posição {})", displayName, draft.getId(),
                teamName, team.getDraftOrder());
        eventPublisher.publishEvent(new DraftChangedEvent("participant_joined", draft.getId(), null)
                .with("participantId", participant.getId())
                .with("teamId", team.getId()));

        return new JoinResult.Joined(draft.getId(), draft.getRoomCode(), draftMapper.toDTO(participant),
                draftMapper.toDTO(team));
    }

    @Transactional
    public JoinResult joinAsSpectator(String roomCode, String displayName) {
        Draft draft = requireByRoomCode(roomCode);
        if (Boolean.TRUE.equals(draft.getArchived())) {
            return new JoinResult.Rejected(draft.getId(), DraftErrorCode.DRAFT_COMPLETED, "Draft arquivado");
        }
        return addSpectator(draft, displayName.trim(), "Entrada como espectador");
    }

    /**
     * Saída durante o setup. O time fica sem dono e é removido quando não
     * sobra ninguém; as posições restantes são compactadas para 1..N.
     */
    @Transactional
    public void leaveDraft(Long draftId, Long participantId) {
        Draft draft = draftGuard.requireDraft(draftId);
        Participant participant = draftGuard.requireParticipant(draftId, participantId);

        if (draft.getStatus() != DraftStatus.SETUP) {
            throw new DraftException(DraftErrorCode.DRAFT_NOT_IN_SETUP, "Só é possível sair durante o setup");
        }
        if (participant.isHostParticipant()) {
            throw new DraftException(DraftErrorCode.INVALID_INPUT, "O host não pode sair do próprio draft");
        }

        Long teamId = participant.getTeamId();
        wishlistItemRepository.deleteAllByParticipantId(participantId);
        participantRepository.delete(participant);
        participantRepository.flush();

        if (teamId != null) {
            List<Participant> teammates = participantRepository.findByDraftIdAndTeamId(draftId, teamId);
            if (teammates.isEmpty()) {
                teamRepository.deleteById(teamId);
                teamRepository.flush();
                compactOrder(draftId);
                log.info("🚪 [Session] Time {} removido do draft {} após saída do último participante", teamId,
                        draftId);
            } else {
                Team team = draftGuard.requireTeam(draftId, teamId);
                if (participantId.equals(team.getOwnerParticipantId())) {
                    team.setOwnerParticipantId(teammates.get(0).getId());
                    teamRepository.save(team);
                }
            }
        }

        log.info("🚪 [Session] Participante {} saiu do draft {}", participantId, draftId);
        eventPublisher.publishEvent(new DraftChangedEvent("participant_left", draftId, null)
                .with("participantId", participantId));
    }

    @Transactional
    public void heartbeat(Long draftId, Long participantId) {
        int updated = participantRepository.touchLastSeen(draftId, participantId, Instant.now(clock));
        if (updated == 0) {
            throw new DraftException(DraftErrorCode.PARTICIPANT_NOT_FOUND,
                    "Participante " + participantId + " não pertence ao draft " + draftId);
        }
    }

    private JoinResult addSpectator(Draft draft, String displayName, String reason) {
        Participant spectator = participantRepository.save(Participant.builder()
                .draftId(draft.getId())
                .displayName(displayName)
                .host(false)
                .lastSeenAt(Instant.now(clock))
                .build());

        log.info("👀 [Session] {} entrou como espectador no draft {}: {}", displayName, draft.getId(), reason);
        eventPublisher.publishEvent(new DraftChangedEvent("participant_joined", draft.getId(), null)
                .with("participantId", spectator.getId())
                .with("spectator", true));

        return new JoinResult.JoinedAsSpectator(draft.getId(), draft.getRoomCode(), draftMapper.toDTO(spectator),
                reason);
    }

    private Team createTeam(Draft draft, Participant owner, String name, int draftOrder) {
        Team team = teamRepository.save(Team.builder()
                .draftId(draft.getId())
                .name(name)
                .ownerParticipantId(owner.getId())
                .draftOrder(draftOrder)
                .budgetRemaining(draft.getBudgetPerTeam())
                .build());
        owner.setTeamId(team.getId());
        participantRepository.save(owner);
        return team;
    }

    private void compactOrder(Long draftId) {
        List<Team> remaining = teamRepository.findByDraftIdOrderByDraftOrderAsc(draftId);
        for (int i = 0; i < remaining.size(); i++) {
            remaining.get(i).setDraftOrder(i + 1);
        }
        teamRepository.saveAll(remaining);
    }

    private Draft requireByRoomCode(String roomCode) {
        return draftRepository.findByRoomCode(RoomCodeGenerator.normalize(roomCode))
                .orElseThrow(() -> new DraftException(DraftErrorCode.DRAFT_NOT_FOUND,
                        "Sala " + roomCode + " não encontrada"));
    }

    private String generateUniqueRoomCode() {
        for (int attempt = 0; attempt < ROOM_CODE_ATTEMPTS; attempt++) {
            String code = RoomCodeGenerator.generate();
            if (!draftRepository.existsByRoomCode(code)) {
                return code;
            }
        }
        throw new IllegalStateException("Não foi possível gerar código de sala único");
    }

    private static int valueOr(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
