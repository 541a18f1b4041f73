package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.config.properties.DraftProperties;
import br.com.fantasydraft.backend.domain.entity.*;
import br.com.fantasydraft.backend.domain.repository.*;
import br.com.fantasydraft.backend.dto.*;
import br.com.fantasydraft.backend.mapper.DraftMapper;
import br.com.fantasydraft.backend.util.SnakeOrderGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Leituras do draft. Clientes chamam isto a cada evento recebido.
 */
@Service
@RequiredArgsConstructor
public class DraftQueryService {

    private final DraftRepository draftRepository;
    private final TeamRepository teamRepository;
    private final ParticipantRepository participantRepository;
    private final PickRepository pickRepository;
    private final AuctionRepository auctionRepository;
    private final DraftGuard draftGuard;
    private final AuctionService auctionService;
    private final DraftActionLogService actionLogService;
    private final DraftMapper draftMapper;
    private final DraftProperties draftProperties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DraftStateDTO getDraftState(Long draftId) {
        Draft draft = draftGuard.requireDraft(draftId);
        Instant now = Instant.now(clock);

        List<Team> teams = teamRepository.findByDraftIdOrderByDraftOrderAsc(draftId);
        List<Pick> picks = pickRepository.findByDraftIdOrderByPickOrderAsc(draftId);
        Map<Long, Long> picksPerTeam = picks.stream()
                .collect(Collectors.groupingBy(Pick::getTeamId, Collectors.counting()));

        List<TeamDTO> teamDTOs = teams.stream()
                .map(team -> {
                    TeamDTO dto = draftMapper.toDTO(team);
                    dto.setPickCount(picksPerTeam.getOrDefault(team.getId(), 0L).intValue());
                    return dto;
                })
                .collect(Collectors.toList());

        List<ParticipantDTO> participantDTOs = participantRepository.findByDraftId(draftId).stream()
                .map(p -> {
                    ParticipantDTO dto = draftMapper.toDTO(p);
                    dto.setOnline(isOnline(p, now));
                    return dto;
                })
                .collect(Collectors.toList());

        DraftStateDTO.DraftStateDTOBuilder state = DraftStateDTO.builder()
                .draft(draftMapper.toDTO(draft))
                .teams(teamDTOs)
                .participants(participantDTOs)
                .picks(draftMapper.toPickDTOs(picks))
                .totalTurns(draft.totalTurns(teams.size()))
                .serverTime(now);

        if (draft.getStatus() == DraftStatus.ACTIVE || draft.getStatus() == DraftStatus.PAUSED) {
            if (draft.isSnake()) {
                state.currentTeamId(currentSnakeTeam(draft, teams));
                state.secondsRemaining(secondsRemaining(draft, now));
            } else {
                auctionService.resolveNominator(draft, teams).ifPresent(t -> state.nominatingTeamId(t.getId()));
                auctionRepository.findFirstByDraftIdAndStatus(draftId, AuctionStatus.ACTIVE)
                        .ifPresent(a -> state.activeAuction(auctionService.toDTO(a, now)));
            }
        }
        return state.build();
    }

    @Transactional(readOnly = true)
    public List<Integer> getSnakeOrder(Long draftId) {
        Draft draft = draftGuard.requireDraft(draftId);
        int teamCount = (int) teamRepository.countByDraftId(draftId);
        return SnakeOrderGenerator.generate(teamCount, draft.getEntitiesPerTeam());
    }

    @Transactional(readOnly = true)
    public List<DraftActionLogDTO> getHistory(Long draftId, int limit) {
        draftGuard.requireDraft(draftId);
        return actionLogService.getHistory(draftId, limit);
    }

    @Transactional(readOnly = true)
    public List<PublicDraftDTO> listPublicDrafts() {
        return draftRepository
                .findByPublicDraftTrueAndArchivedFalseAndStatusInOrderByCreatedAtDesc(List.of(DraftStatus.SETUP))
                .stream()
                .map(d -> PublicDraftDTO.builder()
                        .id(d.getId())
                        .roomCode(d.getRoomCode())
                        .name(d.getName())
                        .status(d.getStatus())
                        .draftType(d.getDraftType())
                        .teamCount((int) teamRepository.countByDraftId(d.getId()))
                        .maxTeams(d.getMaxTeams())
                        .build())
                .collect(Collectors.toList());
    }

    boolean isOnline(Participant participant, Instant now) {
        return participant.getLastSeenAt() != null
                && !participant.getLastSeenAt()
                        .plusSeconds(draftProperties.getPresenceTimeoutSeconds())
                        .isBefore(now);
    }

    private Long currentSnakeTeam(Draft draft, List<Team> teams) {
        if (draft.getCurrentTurn() == null || teams.isEmpty()
                || draft.getCurrentTurn() > draft.totalTurns(teams.size())) {
            return null;
        }
        int dueOrder = SnakeOrderGenerator.teamOrderForTurn(draft.getCurrentTurn(), teams.size());
        return teams.stream()
                .filter(t -> t.getDraftOrder() == dueOrder)
                .map(Team::getId)
                .findFirst()
                .orElse(null);
    }

    // nulo sem limite de tempo ou com o draft pausado
    private Long secondsRemaining(Draft draft, Instant now) {
        if (draft.getStatus() != DraftStatus.ACTIVE || draft.getTimeLimitSeconds() == null
                || draft.getTimeLimitSeconds() <= 0 || draft.getTurnStartedAt() == null) {
            return null;
        }
        Instant deadline = draft.getTurnStartedAt().plusSeconds(draft.getTimeLimitSeconds());
        return Math.max(0L, Duration.between(now, deadline).getSeconds());
    }
}
