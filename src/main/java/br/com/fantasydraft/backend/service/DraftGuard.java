package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.domain.entity.Draft;
import br.com.fantasydraft.backend.domain.entity.Participant;
import br.com.fantasydraft.backend.domain.entity.Team;
import br.com.fantasydraft.backend.domain.repository.DraftRepository;
import br.com.fantasydraft.backend.domain.repository.ParticipantRepository;
import br.com.fantasydraft.backend.domain.repository.TeamRepository;
import br.com.fantasydraft.backend.exception.DraftErrorCode;
import br.com.fantasydraft.backend.exception.DraftException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Leituras com verificação usadas por todos os serviços de draft.
 */
@Component
@RequiredArgsConstructor
public class DraftGuard {

    private final DraftRepository draftRepository;
    private final ParticipantRepository participantRepository;
    private final TeamRepository teamRepository;

    public Draft requireDraft(Long draftId) {
        return draftRepository.findById(draftId)
                .orElseThrow(() -> new DraftException(DraftErrorCode.DRAFT_NOT_FOUND,
                        "Draft " + draftId + " não encontrado"));
    }

    public Participant requireParticipant(Long draftId, Long participantId) {
        if (participantId == null) {
            throw new DraftException(DraftErrorCode.PARTICIPANT_NOT_FOUND);
        }
        return participantRepository.findByIdAndDraftId(participantId, draftId)
                .orElseThrow(() -> new DraftException(DraftErrorCode.PARTICIPANT_NOT_FOUND,
                        "Participante " + participantId + " não pertence ao draft " + draftId));
    }

    public Participant requireHost(Long draftId, Long participantId) {
        Participant participant = requireParticipant(draftId, participantId);
        if (!participant.isHostParticipant()) {
            throw new DraftException(DraftErrorCode.HOST_ONLY);
        }
        return participant;
    }

    public Team requireTeam(Long draftId, Long teamId) {
        return teamRepository.findByIdAndDraftId(teamId, draftId)
                .orElseThrow(() -> new DraftException(DraftErrorCode.TEAM_NOT_FOUND,
                        "Time " + teamId + " não pertence ao draft " + draftId));
    }

    /**
     * Time do participante; espectadores não podem agir.
     */
    public Team requireTeamOf(Participant participant) {
        if (participant.getTeamId() == null) {
            throw new DraftException(DraftErrorCode.NOT_IN_DRAFT,
                    "Participante " + participant.getId() + " é espectador");
        }
        return teamRepository.findByIdAndDraftId(participant.getTeamId(), participant.getDraftId())
                .orElseThrow(() -> new DraftException(DraftErrorCode.NOT_IN_DRAFT));
    }
}
