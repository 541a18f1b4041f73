package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.domain.entity.DraftActionLog;
import br.com.fantasydraft.backend.domain.entity.DraftActionType;
import br.com.fantasydraft.backend.domain.repository.DraftActionLogRepository;
import br.com.fantasydraft.backend.dto.DraftActionLogDTO;
import br.com.fantasydraft.backend.mapper.DraftMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Histórico append-only do draft. Gravado na mesma transação da ação, então
 * uma ação que sofre rollback não deixa rastro.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftActionLogService {

    private static final int MAX_HISTORY = 500;

    private final DraftActionLogRepository actionLogRepository;
    private final DraftMapper draftMapper;

    public DraftActionLog record(DraftActionLog entry) {
        DraftActionLog saved = actionLogRepository.save(entry);
        log.debug("📝 [History] draft {} {} team={} entity={}", entry.getDraftId(), entry.getActionType(),
                entry.getTeamId(), entry.getEntityId());
        return saved;
    }

    public DraftActionLog record(Long draftId, DraftActionType type, Long actorParticipantId, String details) {
        return record(DraftActionLog.builder()
                .draftId(draftId)
                .actionType(type)
                .actorParticipantId(actorParticipantId)
                .details(details)
                .build());
    }

    @Transactional(readOnly = true)
    public List<DraftActionLogDTO> getHistory(Long draftId, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_HISTORY));
        return draftMapper.toActionLogDTOs(
                actionLogRepository.findByDraftIdOrderByIdDesc(draftId, PageRequest.of(0, size)));
    }

    /**
     * Soma dos deltas de override aplicados ao time desde o último reset.
     */
    public long sumBudgetOverridesSinceReset(Long draftId, Long teamId) {
        long sinceId = actionLogRepository
                .findFirstByDraftIdAndActionTypeOrderByIdDesc(draftId, DraftActionType.RESET)
                .map(DraftActionLog::getId)
                .orElse(0L);
        return actionLogRepository.sumBudgetOverrides(draftId, teamId, sinceId);
    }
}
