package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.domain.entity.*;
import br.com.fantasydraft.backend.dto.CreateDraftRequest;
import br.com.fantasydraft.backend.dto.CreateDraftResult;
import br.com.fantasydraft.backend.dto.JoinDraftRequest;
import br.com.fantasydraft.backend.dto.JoinResult;
import br.com.fantasydraft.backend.exception.DraftErrorCode;
import br.com.fantasydraft.backend.exception.DraftException;
import br.com.fantasydraft.backend.util.RoomCodeGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class DraftSessionServiceTest {

    private DraftTestFixture fx;
    private DraftSessionService service;
    private final AtomicLong ids = new AtomicLong(5000);

    @BeforeEach
    void setup() {
        fx = new DraftTestFixture().activeDraft(DraftType.SNAKE, 2, 2, 10).inSetup();

        when(fx.draftRepository.findByRoomCode(anyString())).thenAnswer(inv -> Optional.ofNullable(fx.draft)
                .filter(d -> d.getRoomCode().equals(inv.getArgument(0))));
        when(fx.draftRepository.existsByRoomCode(anyString())).thenReturn(false);
        when(fx.draftRepository.save(any(Draft.class))).thenAnswer(inv -> {
            Draft draft = inv.getArgument(0);
            if (draft.getId() == null) {
                draft.setId(ids.incrementAndGet());
            }
            return draft;
        });
        when(fx.participantRepository.save(any(Participant.class))).thenAnswer(inv -> {
            Participant participant = inv.getArgument(0);
            if (participant.getId() == null) {
                participant.setId(ids.incrementAndGet());
                fx.participants.add(participant);
            }
            return participant;
        });
        when(fx.teamRepository.save(any(Team.class))).thenAnswer(inv -> {
            Team team = inv.getArgument(0);
            if (team.getId() == null) {
                team.setId(ids.incrementAndGet());
                fx.teams.add(team);
            }
            return team;
        });
        when(fx.teamRepository.existsByDraftIdAndNameIgnoreCase(anyLong(), anyString())).thenAnswer(inv -> fx.teams
                .stream()
                .anyMatch(t -> t.getName().equalsIgnoreCase(inv.getArgument(1))));
        when(fx.participantRepository.touchLastSeen(anyLong(), anyLong(), any())).thenAnswer(inv -> fx.participants
                .stream()
                .anyMatch(p -> p.getId().equals(inv.getArgument(1))) ? 1 : 0);
        doAnswer(inv -> fx.participants.remove(inv.<Participant>getArgument(0)))
                .when(fx.participantRepository).delete(any(Participant.class));
        doAnswer(inv -> fx.teams.removeIf(t -> t.getId().equals(inv.getArgument(0))))
                .when(fx.teamRepository).deleteById(anyLong());

        service = new DraftSessionService(fx.draftRepository, fx.teamRepository, fx.participantRepository,
                fx.wishlistItemRepository, fx.guard, fx.mapper, fx.properties, fx.eventPublisher, fx.clock);
    }

    private JoinResult join(String roomCode, String name, String teamName) {
        return service.joinDraft(new JoinDraftRequest(roomCode, name, teamName));
    }

    // ========================================
    // CRIAÇÃO
    // ========================================

    @Test
    void testCreateDraftWithHostTeam() {
        // given
        CreateDraftRequest request = CreateDraftRequest.builder()
                .name(" Liga de Verão ")
                .hostDisplayName("Ana")
                .hostTeamName("Dragões")
                .formatId("gen9ou")
                .build();

        // act
        CreateDraftResult result = service.createDraft(request);

        // assert
        assertThat(result.draft().getName()).isEqualTo("Liga de Verão");
        assertThat(result.draft().getStatus()).isEqualTo(DraftStatus.SETUP);
        assertThat(result.draft().getDraftType()).isEqualTo(DraftType.SNAKE);
        assertThat(result.draft().getRoomCode()).hasSize(RoomCodeGenerator.CODE_LENGTH);
        assertThat(result.draft().getBudgetPerTeam()).isEqualTo(fx.properties.getDefaultBudgetPerTeam());
        assertThat(result.draft().getEntitiesPerTeam()).isEqualTo(fx.properties.getDefaultEntitiesPerTeam());
        assertThat(result.host().getHost()).isTrue();
        assertThat(result.hostTeam().getDraftOrder()).isEqualTo(1);
        assertThat(result.hostTeam().getBudgetRemaining()).isEqualTo(fx.properties.getDefaultBudgetPerTeam());
        assertThat(result.host().getTeamId()).isEqualTo(result.hostTeam().getId());
    }

    @Test
    void testCreateDraftHostAsSpectator() {
        // given
        CreateDraftRequest request = CreateDraftRequest.builder()
                .name("Liga")
                .hostDisplayName("Ana")
                .draftType(DraftType.AUCTION)
                .build();

        // act
        CreateDraftResult result = service.createDraft(request);

        // assert
        assertThat(result.hostTeam()).isNull();
        assertThat(result.host().getTeamId()).isNull();
        assertThat(result.draft().getDraftType()).isEqualTo(DraftType.AUCTION);
    }

    @Test
    void testCreateDraftRejectsTooFewTeams() {
        // given
        CreateDraftRequest request = CreateDraftRequest.builder()
                .name("Liga")
                .hostDisplayName("Ana")
                .maxTeams(1)
                .build();

        // act & assert
        assertThatThrownBy(() -> service.createDraft(request))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.INVALID_INPUT);
    }

    // ========================================
    // ENTRADA
    // ========================================

    @Test
    void testJoinCreatesTeamAtNextPosition() {
        // act
        JoinResult result = join("ABC234", "Bia", "Tubarões");

        // assert
        assertThat(result).isInstanceOf(JoinResult.Joined.class);
        JoinResult.Joined joined = (JoinResult.Joined) result;
        assertThat(joined.team().getDraftOrder()).isEqualTo(3);
        assertThat(joined.team().getBudgetRemaining()).isEqualTo(10);
        assertThat(joined.participant().getTeamId()).isEqualTo(joined.team().getId());
        assertThat(fx.teams).hasSize(3);
    }

    @Test
    void testJoinNormalizesRoomCode() {
        // act
        JoinResult result = join(" abc234 ", "Bia", "Tubarões");

        // assert
        assertThat(result).isInstanceOf(JoinResult.Joined.class);
    }

    @Test
    void testJoinDuplicateTeamNameRejected() {
        // act
        JoinResult result = join("ABC234", "Bia", "TIME 1");

        // assert
        assertThat(result).isInstanceOf(JoinResult.Rejected.class);
        assertThat(((JoinResult.Rejected) result).code()).isEqualTo(DraftErrorCode.DUPLICATE_TEAM_NAME);
        assertThat(fx.teams).hasSize(2);
    }

    @Test
    void testJoinFullDraftBecomesSpectator() {
        // given
        fx.draft.setMaxTeams(2);

        // act
        JoinResult result = join("ABC234", "Bia", "Tubarões");

        // assert
        assertThat(result).isInstanceOf(JoinResult.JoinedAsSpectator.class);
        assertThat(((JoinResult.JoinedAsSpectator) result).participant().getTeamId()).isNull();
        assertThat(fx.teams).hasSize(2);
    }

    @Test
    void testJoinStartedDraftBecomesSpectator() {
        // given
        fx.draft.setStatus(DraftStatus.ACTIVE);

        // act
        JoinResult result = join("ABC234", "Bia", "Tubarões");

        // assert
        assertThat(result).isInstanceOf(JoinResult.JoinedAsSpectator.class);
    }

    @Test
    void testJoinWithoutTeamNameIsSpectator() {
        // act
        JoinResult result = join("ABC234", "Bia", "  ");

        // assert
        assertThat(result).isInstanceOf(JoinResult.JoinedAsSpectator.class);
    }

    @Test
    void testJoinArchivedDraftRejected() {
        // given
        fx.draft.setArchived(true);

        // act
        JoinResult result = service.joinAsSpectator("ABC234", "Bia");

        // assert
        assertThat(result).isInstanceOf(JoinResult.Rejected.class);
        assertThat(((JoinResult.Rejected) result).code()).isEqualTo(DraftErrorCode.DRAFT_COMPLETED);
    }

    @Test
    void testJoinUnknownRoom() {
        // act & assert
        assertThatThrownBy(() -> join("ZZZZZZ", "Bia", "Tubarões"))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.DRAFT_NOT_FOUND);
    }

    // ========================================
    // SAÍDA / PRESENÇA
    // ========================================

    @Test
    void testLeaveRemovesEmptyTeamAndCompactsOrder() {
        // given
        join("ABC234", "Bia", "Tubarões");

        // act
        service.leaveDraft(1L, fx.ownerOf(1));

        // assert
        assertThat(fx.teams).hasSize(2);
        assertThat(fx.teams.stream().map(Team::getDraftOrder).sorted().collect(Collectors.toList()))
                .containsExactly(1, 2);
        assertThat(fx.teams.stream().map(Team::getName).collect(Collectors.toList()))
                .containsExactlyInAnyOrder("Time 2", "Tubarões");
        verify(fx.wishlistItemRepository).deleteAllByParticipantId(100L);
    }

    @Test
    void testLeaveTransfersOwnershipToTeammate() {
        // given
        fx.participants.add(Participant.builder().id(101L).draftId(1L).displayName("Co-dono")
                .teamId(fx.team(1).getId()).host(false).build());

        // act
        service.leaveDraft(1L, fx.ownerOf(1));

        // assert
        assertThat(fx.teams).hasSize(2);
        assertThat(fx.team(1).getOwnerParticipantId()).isEqualTo(101L);
    }

    @Test
    void testHostCannotLeave() {
        // act & assert
        assertThatThrownBy(() -> service.leaveDraft(1L, DraftTestFixture.HOST_ID))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.INVALID_INPUT);
    }

    @Test
    void testLeaveAfterStartRejected() {
        // given
        fx.draft.setStatus(DraftStatus.ACTIVE);

        // act & assert
        assertThatThrownBy(() -> service.leaveDraft(1L, fx.ownerOf(1)))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.DRAFT_NOT_IN_SETUP);
    }

    @Test
    void testHeartbeatUnknownParticipant() {
        // act
        service.heartbeat(1L, fx.ownerOf(1));

        // assert
        assertThatThrownBy(() -> service.heartbeat(1L, 12345L))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.PARTICIPANT_NOT_FOUND);
    }
}
